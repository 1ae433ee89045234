package org.dongguk.discrecovery.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.dongguk.discrecovery.core.annotation.UserId;
import org.dongguk.discrecovery.dto.request.ProposeMeetupRequest;
import org.dongguk.discrecovery.dto.request.RecordDropOffRequest;
import org.dongguk.discrecovery.dto.response.DropOffDto;
import org.dongguk.discrecovery.dto.response.MeetupProposalDto;
import org.dongguk.discrecovery.dto.response.RecoveryDetailsDto;
import org.dongguk.discrecovery.dto.response.RecoveryEventDto;
import org.dongguk.discrecovery.dto.response.RewardPaidDto;
import org.dongguk.discrecovery.dto.response.SurrenderResultDto;
import org.dongguk.discrecovery.service.DropOffService;
import org.dongguk.discrecovery.service.MeetupNegotiationService;
import org.dongguk.discrecovery.service.RecoveryLifecycleService;
import org.dongguk.discrecovery.service.RewardService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/recoveries")
public class RecoveryController {
    private final RecoveryLifecycleService recoveryLifecycleService;
    private final MeetupNegotiationService meetupNegotiationService;
    private final DropOffService dropOffService;
    private final RewardService rewardService;

    /**
     * 회수 상세 조회
     */
    @GetMapping("/{id}")
    public ResponseEntity<RecoveryDetailsDto> getDetails(
            @UserId Long userId,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(recoveryLifecycleService.getDetails(id, userId));
    }

    /**
     * 소유권 양도
     */
    @PostMapping("/{id}/surrender")
    public ResponseEntity<SurrenderResultDto> surrender(
            @UserId Long userId,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(recoveryLifecycleService.surrender(id, userId));
    }

    /**
     * 드롭오프된 디스크 포기 후 습득자에게 양도
     */
    @PostMapping("/{id}/relinquish")
    public ResponseEntity<SurrenderResultDto> relinquish(
            @UserId Long userId,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(recoveryLifecycleService.relinquish(id, userId));
    }

    /**
     * 드롭오프된 디스크 포기 (클레임 가능 상태로)
     */
    @PostMapping("/{id}/abandon")
    public ResponseEntity<RecoveryEventDto> abandon(
            @UserId Long userId,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(recoveryLifecycleService.abandon(id, userId));
    }

    /**
     * 만남 후 반환 완료
     */
    @PostMapping("/{id}/complete")
    public ResponseEntity<RecoveryEventDto> complete(
            @UserId Long userId,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(recoveryLifecycleService.completeRecovery(id, userId));
    }

    /**
     * 드롭오프된 디스크 회수 확인
     */
    @PostMapping("/{id}/retrieved")
    public ResponseEntity<Map<String, Boolean>> markRetrieved(
            @UserId Long userId,
            @PathVariable Long id
    ) {
        recoveryLifecycleService.markRetrieved(id, userId);
        return ResponseEntity.ok(Map.of("success", true));
    }

    /**
     * 보상금 수령 확인
     */
    @PostMapping("/{id}/reward-paid")
    public ResponseEntity<RewardPaidDto> markRewardPaid(
            @UserId Long userId,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(rewardService.markPaid(id, userId));
    }

    /**
     * 만남 제안
     */
    @PostMapping("/{id}/meetups")
    public ResponseEntity<MeetupProposalDto> proposeMeetup(
            @UserId Long userId,
            @PathVariable Long id,
            @Valid @RequestBody ProposeMeetupRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(meetupNegotiationService.propose(id, userId, request));
    }

    /**
     * 만남 제안 목록
     */
    @GetMapping("/{id}/meetups")
    public ResponseEntity<List<MeetupProposalDto>> listMeetups(
            @UserId Long userId,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(meetupNegotiationService.listProposals(id, userId));
    }

    /**
     * 드롭오프 기록 (사진 + 위치)
     */
    @PostMapping(value = "/{id}/drop-off", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DropOffDto> recordDropOff(
            @UserId Long userId,
            @PathVariable Long id,
            @RequestParam(required = false) MultipartFile photo,
            @RequestParam(required = false) Double latitude,
            @RequestParam(required = false) Double longitude,
            @RequestParam(name = "location_notes", required = false) String locationNotes
    ) {
        RecordDropOffRequest request = new RecordDropOffRequest(photo, latitude, longitude, locationNotes);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(dropOffService.recordDropOff(id, userId, request));
    }
}
