package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.core.exception.GlobalErrorCode;
import org.dongguk.discrecovery.domain.notification.Notification;
import org.dongguk.discrecovery.domain.type.NotificationStatus;
import org.dongguk.discrecovery.domain.type.NotificationType;
import org.dongguk.discrecovery.dto.response.NotificationDto;
import org.dongguk.discrecovery.repository.NotificationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NotificationService {
    private final NotificationRepository notificationRepository;

    /**
     * 사용자의 모든 알림 조회 (아카이브 제외)
     */
    public List<NotificationDto> getNotifications(Long userId, NotificationType type) {
        List<Notification> notifications = type == null
                ? notificationRepository.findByUserIdAndStatusNotOrderByCreatedAtDesc(userId, NotificationStatus.ARCHIVED)
                : notificationRepository.findByUserIdAndTypeAndStatusNotOrderByCreatedAtDesc(userId, type, NotificationStatus.ARCHIVED);

        return notifications.stream()
                .map(NotificationDto::from)
                .toList();
    }

    public Long getUnreadCount(Long userId) {
        return notificationRepository.countByUserIdAndStatus(userId, NotificationStatus.UNREAD);
    }

    @Transactional
    public void markAsRead(Long userId, Long notificationId) {
        getOwnNotification(userId, notificationId).markAsRead();
    }

    @Transactional
    public void markAllAsRead(Long userId) {
        notificationRepository
                .findByUserIdAndStatusNotOrderByCreatedAtDesc(userId, NotificationStatus.ARCHIVED)
                .forEach(Notification::markAsRead);
    }

    @Transactional
    public void archiveNotification(Long userId, Long notificationId) {
        getOwnNotification(userId, notificationId).archive();
    }

    @Transactional
    public void deleteNotification(Long userId, Long notificationId) {
        notificationRepository.delete(getOwnNotification(userId, notificationId));
        log.info("알림 삭제: userId={}, notificationId={}", userId, notificationId);
    }

    private Notification getOwnNotification(Long userId, Long notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> CustomException.type(GlobalErrorCode.NOT_FOUND));

        // 본인의 알림인지 확인
        if (!notification.isOwnedBy(userId)) {
            throw CustomException.type(GlobalErrorCode.FORBIDDEN);
        }
        return notification;
    }
}
