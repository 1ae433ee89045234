package org.dongguk.discrecovery.domain.type;

import java.util.EnumSet;
import java.util.Set;

/**
 * 회수 이벤트 상태
 */
public enum RecoveryStatus {
    FOUND,              // 습득 신고됨 (초기 상태)
    MEETUP_PROPOSED,    // 만남 제안 대기 중
    MEETUP_CONFIRMED,   // 만남 확정
    DROPPED_OFF,        // 습득자가 지정 장소에 두고 감
    RECOVERED,          // 소유자에게 반환 완료
    SURRENDERED,        // 소유자가 소유권을 습득자에게 넘김
    CANCELLED,          // 취소 (예약)
    ABANDONED,          // 소유자가 포기, 다른 사용자가 클레임 가능
    CLOSED_ON_RECLAIM;  // 포기된 디스크가 다시 클레임되어 종료

    public static final Set<RecoveryStatus> ACTIVE = EnumSet.of(FOUND, MEETUP_PROPOSED, MEETUP_CONFIRMED);

    public static final Set<RecoveryStatus> SURRENDERABLE = ACTIVE;

    // 종료되지 않은 모든 상태. ABANDONED 디스크는 소유자가 없으므로 제외
    public static final Set<RecoveryStatus> PROPOSABLE = EnumSet.of(FOUND, MEETUP_PROPOSED, MEETUP_CONFIRMED, DROPPED_OFF);

    public static final Set<RecoveryStatus> TERMINAL = EnumSet.of(RECOVERED, SURRENDERED, CANCELLED, CLOSED_ON_RECLAIM);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
