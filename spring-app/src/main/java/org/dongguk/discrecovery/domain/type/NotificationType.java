package org.dongguk.discrecovery.domain.type;

/**
 * 알림 타입
 */
public enum NotificationType {
    DISC_SURRENDERED,   // 소유권 양도
    DISC_RELINQUISHED,  // 드롭오프 후 소유권 포기 (습득자에게 양도)
    DISC_RETRIEVED,     // 소유자가 드롭오프된 디스크를 회수
    DISC_DROPPED_OFF,   // 습득자가 디스크를 두고 감
    DISC_RECOVERED,     // 만남으로 반환 완료
    DISC_ABANDONED,     // 소유자가 디스크를 포기
    MEETUP_PROPOSED,    // 만남 제안
    MEETUP_COUNTERED,   // 내 제안이 상대의 새 제안으로 대체됨
    MEETUP_ACCEPTED,    // 만남 수락
    MEETUP_DECLINED     // 만남 거절
}
