package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.domain.notification.Notification;
import org.dongguk.discrecovery.domain.notification.NotificationPayload;
import org.dongguk.discrecovery.domain.user.User;
import org.dongguk.discrecovery.event.NotificationEvent;
import org.dongguk.discrecovery.repository.NotificationRepository;
import org.dongguk.discrecovery.repository.UserRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * 상태 전이 트랜잭션이 커밋된 뒤 인앱 알림을 저장하고 푸시를 보낸다.
 * 여기서 발생한 오류는 로그만 남기고 호출자에게 전파하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {
    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final ExpoPushService expoPushService;
    private final Clock clock;

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void dispatch(NotificationEvent event) {
        if (event.recipientId() == null) {
            log.debug("수신자 없음, 알림 생략: type={}", event.type());
            return;
        }

        Optional<User> recipient;
        try {
            recipient = userRepository.findById(event.recipientId());
        } catch (DataAccessException e) {
            log.warn("알림 수신자 조회 실패: userId={}, type={}", event.recipientId(), event.type(), e);
            return;
        }
        if (recipient.isEmpty()) {
            log.warn("알림 수신자가 존재하지 않습니다: userId={}, type={}", event.recipientId(), event.type());
            return;
        }

        NotificationPayload payload = event.payload() == null ? NotificationPayload.empty() : event.payload();
        try {
            notificationRepository.save(Notification.create(
                    event.type(),
                    event.title(),
                    event.body(),
                    recipient.get(),
                    payload,
                    LocalDateTime.now(clock)
            ));
            log.info("알림 저장: userId={}, type={}", event.recipientId(), event.type());
        } catch (DataAccessException e) {
            log.warn("알림 저장 실패: userId={}, type={}", event.recipientId(), event.type(), e);
        }

        Map<String, Object> data = payload.toPushData();
        data.put("type", event.type().name());
        expoPushService.send(recipient.get(), event.title(), event.body(), data);
    }
}
