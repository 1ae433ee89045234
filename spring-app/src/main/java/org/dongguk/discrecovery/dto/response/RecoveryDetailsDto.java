package org.dongguk.discrecovery.dto.response;

import lombok.Builder;

import java.util.List;

@Builder
public record RecoveryDetailsDto(
        RecoveryEventDto recoveryEvent,
        DiscSummaryDto disc,
        UserSummaryDto owner,
        UserSummaryDto finder,
        String userRole,
        List<MeetupProposalDto> proposals,
        DropOffDto dropOff
) {
}
