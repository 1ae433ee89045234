package org.dongguk.discrecovery.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.dongguk.discrecovery.core.annotation.UserId;
import org.dongguk.discrecovery.dto.request.DeclineMeetupRequest;
import org.dongguk.discrecovery.dto.response.MeetupProposalDto;
import org.dongguk.discrecovery.service.MeetupNegotiationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/meetups")
public class MeetupController {
    private final MeetupNegotiationService meetupNegotiationService;

    /**
     * 만남 제안 수락
     */
    @PostMapping("/{proposalId}/accept")
    public ResponseEntity<MeetupProposalDto> accept(
            @UserId Long userId,
            @PathVariable Long proposalId
    ) {
        return ResponseEntity.ok(meetupNegotiationService.accept(proposalId, userId));
    }

    /**
     * 만남 제안 거절
     */
    @PostMapping("/{proposalId}/decline")
    public ResponseEntity<MeetupProposalDto> decline(
            @UserId Long userId,
            @PathVariable Long proposalId,
            @Valid @RequestBody(required = false) DeclineMeetupRequest request
    ) {
        String reason = request == null ? null : request.reason();
        return ResponseEntity.ok(meetupNegotiationService.decline(proposalId, userId, reason));
    }
}
