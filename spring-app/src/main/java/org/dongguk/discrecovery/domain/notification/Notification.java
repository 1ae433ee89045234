package org.dongguk.discrecovery.domain.notification;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.dongguk.discrecovery.domain.type.NotificationStatus;
import org.dongguk.discrecovery.domain.type.NotificationType;
import org.dongguk.discrecovery.domain.user.User;

import java.time.LocalDateTime;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "notifications")
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 50)
    private NotificationType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 50)
    private NotificationStatus status;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "body", nullable = false, length = 1000)
    private String body;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Embedded
    private NotificationPayload payload;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Builder(access = AccessLevel.PRIVATE)
    private Notification(NotificationType type,
                         NotificationStatus status,
                         String title,
                         String body,
                         User user,
                         NotificationPayload payload,
                         LocalDateTime createdAt) {
        this.type = type;
        this.status = status;
        this.title = title;
        this.body = body;
        this.user = user;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    public static Notification create(NotificationType type,
                                      String title,
                                      String body,
                                      User user,
                                      NotificationPayload payload,
                                      LocalDateTime createdAt) {
        return Notification.builder()
                .type(type)
                .status(NotificationStatus.UNREAD)
                .title(title)
                .body(body)
                .user(user)
                .payload(payload == null ? NotificationPayload.empty() : payload)
                .createdAt(createdAt)
                .build();
    }

    public boolean isOwnedBy(Long userId) {
        return userId != null && userId.equals(user.getId());
    }

    public void markAsRead() {
        this.status = NotificationStatus.READ;
    }

    public void archive() {
        this.status = NotificationStatus.ARCHIVED;
    }
}
