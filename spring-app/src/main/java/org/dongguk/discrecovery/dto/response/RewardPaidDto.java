package org.dongguk.discrecovery.dto.response;

import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record RewardPaidDto(
        boolean success,
        Long recoveryEventId,
        LocalDateTime rewardPaidAt
) {
}
