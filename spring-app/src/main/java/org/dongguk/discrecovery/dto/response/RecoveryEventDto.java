package org.dongguk.discrecovery.dto.response;

import lombok.Builder;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;

import java.time.LocalDateTime;

@Builder
public record RecoveryEventDto(
        Long id,
        Long discId,
        Long finderId,
        RecoveryStatus status,
        LocalDateTime foundAt,
        LocalDateTime surrenderedAt,
        LocalDateTime recoveredAt,
        Long originalOwnerId,
        LocalDateTime rewardPaidAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static RecoveryEventDto from(RecoveryEvent recoveryEvent) {
        return RecoveryEventDto.builder()
                .id(recoveryEvent.getId())
                .discId(recoveryEvent.getDiscId())
                .finderId(recoveryEvent.getFinderId())
                .status(recoveryEvent.getStatus())
                .foundAt(recoveryEvent.getFoundAt())
                .surrenderedAt(recoveryEvent.getSurrenderedAt())
                .recoveredAt(recoveryEvent.getRecoveredAt())
                .originalOwnerId(recoveryEvent.getOriginalOwnerId())
                .rewardPaidAt(recoveryEvent.getRewardPaidAt())
                .createdAt(recoveryEvent.getCreatedAt())
                .updatedAt(recoveryEvent.getUpdatedAt())
                .build();
    }
}
