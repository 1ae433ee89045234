package org.dongguk.discrecovery.event;

import lombok.Builder;
import org.dongguk.discrecovery.domain.notification.NotificationPayload;
import org.dongguk.discrecovery.domain.type.NotificationType;

/**
 * 트랜잭션 커밋 후 NotificationDispatcher 가 처리하는 알림 요청
 */
@Builder
public record NotificationEvent(
        Long recipientId,
        NotificationType type,
        String title,
        String body,
        NotificationPayload payload
) {
}
