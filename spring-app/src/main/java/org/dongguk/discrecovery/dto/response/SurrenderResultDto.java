package org.dongguk.discrecovery.dto.response;

import lombok.Builder;

@Builder
public record SurrenderResultDto(
        RecoveryEventDto recoveryEvent,
        Long newOwnerId
) {
}
