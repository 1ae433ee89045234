package org.dongguk.discrecovery.dto.response;

import lombok.Builder;
import org.dongguk.discrecovery.domain.meetup.MeetupProposal;
import org.dongguk.discrecovery.domain.type.MeetupStatus;

import java.time.LocalDateTime;

@Builder
public record MeetupProposalDto(
        Long id,
        Long recoveryEventId,
        Long proposedBy,
        String locationName,
        Double latitude,
        Double longitude,
        LocalDateTime proposedDatetime,
        MeetupStatus status,
        String message,
        LocalDateTime createdAt
) {
    public static MeetupProposalDto from(MeetupProposal proposal) {
        return MeetupProposalDto.builder()
                .id(proposal.getId())
                .recoveryEventId(proposal.getRecoveryEventId())
                .proposedBy(proposal.getProposedById())
                .locationName(proposal.getLocationName())
                .latitude(proposal.getLatitude())
                .longitude(proposal.getLongitude())
                .proposedDatetime(proposal.getProposedDatetime())
                .status(proposal.getStatus())
                .message(proposal.getMessage())
                .createdAt(proposal.getCreatedAt())
                .build();
    }
}
