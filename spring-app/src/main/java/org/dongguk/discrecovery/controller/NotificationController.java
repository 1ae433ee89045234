package org.dongguk.discrecovery.controller;

import lombok.RequiredArgsConstructor;
import org.dongguk.discrecovery.core.annotation.UserId;
import org.dongguk.discrecovery.domain.type.NotificationType;
import org.dongguk.discrecovery.dto.response.NotificationDto;
import org.dongguk.discrecovery.service.NotificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 회수 흐름에서 쌓인 알림함 (만남 제안, 드롭오프, 양도 등)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/notifications")
public class NotificationController {
    private final NotificationService notificationService;

    /**
     * 보관되지 않은 알림을 최신순으로 조회. type 을 주면 해당 종류만
     */
    @GetMapping
    public ResponseEntity<List<NotificationDto>> listInbox(
            @UserId Long userId,
            @RequestParam(required = false) NotificationType type
    ) {
        return ResponseEntity.ok(notificationService.getNotifications(userId, type));
    }

    /**
     * 앱 배지용 읽지 않은 알림 수
     */
    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Long>> countUnread(@UserId Long userId) {
        return ResponseEntity.ok(Map.of("count", notificationService.getUnreadCount(userId)));
    }

    /**
     * 알림 하나를 읽음으로 표시 (본인 알림만)
     */
    @PutMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(
            @UserId Long userId,
            @PathVariable Long notificationId
    ) {
        notificationService.markAsRead(userId, notificationId);
        return ResponseEntity.ok().build();
    }

    /**
     * 읽지 않은 알림 전체를 읽음으로 표시
     */
    @PutMapping("/read-all")
    public ResponseEntity<Void> markAllRead(@UserId Long userId) {
        notificationService.markAllAsRead(userId);
        return ResponseEntity.ok().build();
    }

    /**
     * 목록에서 숨긴다. 행은 남는다
     */
    @PutMapping("/{notificationId}/archive")
    public ResponseEntity<Void> archive(
            @UserId Long userId,
            @PathVariable Long notificationId
    ) {
        notificationService.archiveNotification(userId, notificationId);
        return ResponseEntity.ok().build();
    }

    /**
     * 알림 삭제 (본인 알림만)
     */
    @DeleteMapping("/{notificationId}")
    public ResponseEntity<Void> delete(
            @UserId Long userId,
            @PathVariable Long notificationId
    ) {
        notificationService.deleteNotification(userId, notificationId);
        return ResponseEntity.ok().build();
    }
}
