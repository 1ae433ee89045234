package org.dongguk.discrecovery.domain.type;

/**
 * 알림 상태
 */
public enum NotificationStatus {
    UNREAD,     // 읽지 않음
    READ,       // 읽음
    ARCHIVED    // 보관됨
}
