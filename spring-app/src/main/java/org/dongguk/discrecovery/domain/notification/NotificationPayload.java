package org.dongguk.discrecovery.domain.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 알림이 가리키는 대상 id 들. 앱에서 화면 이동에 사용한다.
 */
@Getter
@Embeddable
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationPayload {

    @Column(name = "recovery_event_id")
    private Long recoveryEventId;

    @Column(name = "disc_id")
    private Long discId;

    @Column(name = "proposal_id")
    private Long proposalId;

    @Column(name = "drop_off_id")
    private Long dropOffId;

    @Builder
    private NotificationPayload(Long recoveryEventId, Long discId, Long proposalId, Long dropOffId) {
        this.recoveryEventId = recoveryEventId;
        this.discId = discId;
        this.proposalId = proposalId;
        this.dropOffId = dropOffId;
    }

    public static NotificationPayload empty() {
        return new NotificationPayload(null, null, null, null);
    }

    public static NotificationPayload ofRecovery(Long recoveryEventId, Long discId) {
        return NotificationPayload.builder()
                .recoveryEventId(recoveryEventId)
                .discId(discId)
                .build();
    }

    // 푸시 data 필드 (null 제외)
    public Map<String, Object> toPushData() {
        Map<String, Object> data = new LinkedHashMap<>();
        if (recoveryEventId != null) data.put("recovery_event_id", recoveryEventId);
        if (discId != null) data.put("disc_id", discId);
        if (proposalId != null) data.put("proposal_id", proposalId);
        if (dropOffId != null) data.put("drop_off_id", dropOffId);
        return data;
    }
}
