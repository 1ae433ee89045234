package org.dongguk.discrecovery.dto.response;

import lombok.Builder;
import org.dongguk.discrecovery.domain.notification.Notification;
import org.dongguk.discrecovery.domain.notification.NotificationPayload;
import org.dongguk.discrecovery.domain.type.NotificationStatus;
import org.dongguk.discrecovery.domain.type.NotificationType;

import java.time.LocalDateTime;

@Builder
public record NotificationDto(
        Long id,
        NotificationType type,
        NotificationStatus status,
        String title,
        String body,
        Long recoveryEventId,
        Long discId,
        Long proposalId,
        Long dropOffId,
        LocalDateTime timestamp
) {
    public static NotificationDto from(Notification notification) {
        // 모든 payload 컬럼이 null 이면 Hibernate 는 임베디드 값을 null 로 읽는다
        NotificationPayload payload = notification.getPayload() == null
                ? NotificationPayload.empty()
                : notification.getPayload();

        return NotificationDto.builder()
                .id(notification.getId())
                .type(notification.getType())
                .status(notification.getStatus())
                .title(notification.getTitle())
                .body(notification.getBody())
                .recoveryEventId(payload.getRecoveryEventId())
                .discId(payload.getDiscId())
                .proposalId(payload.getProposalId())
                .dropOffId(payload.getDropOffId())
                .timestamp(notification.getCreatedAt())
                .build();
    }
}
