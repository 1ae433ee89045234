package org.dongguk.discrecovery.domain.recovery;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.domain.user.User;

import java.time.LocalDateTime;

/**
 * 습득된 디스크 한 건의 회수 과정.
 * 상태 변경은 모두 RecoveryEventRepository 의 조건부 UPDATE 로만 일어난다.
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "recovery_events", indexes = {
        @Index(name = "idx_recovery_events_disc_status", columnList = "disc_id, status")
})
public class RecoveryEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "disc_id", nullable = false)
    private Disc disc;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "finder_id", nullable = false)
    private User finder;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private RecoveryStatus status;

    @Column(name = "found_at", nullable = false)
    private LocalDateTime foundAt;

    @Column(name = "surrendered_at")
    private LocalDateTime surrenderedAt;

    @Column(name = "recovered_at")
    private LocalDateTime recoveredAt;

    // 양도 이후에도 상세 조회를 허용하기 위한 이전 소유자
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "original_owner_id")
    private User originalOwner;

    @Column(name = "reward_paid_at")
    private LocalDateTime rewardPaidAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Builder(access = AccessLevel.PRIVATE)
    private RecoveryEvent(Disc disc,
                          User finder,
                          RecoveryStatus status,
                          LocalDateTime foundAt,
                          LocalDateTime createdAt) {
        this.disc = disc;
        this.finder = finder;
        this.status = status;
        this.foundAt = foundAt;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public static RecoveryEvent create(Disc disc, User finder, LocalDateTime foundAt) {
        return RecoveryEvent.builder()
                .disc(disc)
                .finder(finder)
                .status(RecoveryStatus.FOUND)
                .foundAt(foundAt)
                .createdAt(foundAt)
                .build();
    }

    public Long getDiscId() {
        return disc.getId();
    }

    public Long getFinderId() {
        return finder.getId();
    }

    public Long getOriginalOwnerId() {
        return originalOwner == null ? null : originalOwner.getId();
    }

    public boolean isFinder(Long userId) {
        return userId != null && userId.equals(getFinderId());
    }
}
