package org.dongguk.discrecovery.repository;

import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.domain.user.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * 회수 이벤트 상태 전이는 "where id = ? and status in (...)" 조건부 UPDATE 하나로만 수행한다.
 */
public interface RecoveryEventRepository extends JpaRepository<RecoveryEvent, Long> {

    @Query("select r from RecoveryEvent r " +
            "join fetch r.disc d " +
            "left join fetch d.owner " +
            "left join fetch d.qrCode " +
            "join fetch r.finder " +
            "left join fetch r.originalOwner " +
            "where r.id = :id")
    Optional<RecoveryEvent> findDetailById(@Param("id") Long id);

    @Query("select count(r) > 0 from RecoveryEvent r where r.disc.id = :discId and r.status in :statuses")
    boolean existsByDiscIdAndStatusIn(@Param("discId") Long discId,
                                      @Param("statuses") Collection<RecoveryStatus> statuses);

    @Query("select count(r) from RecoveryEvent r where r.disc.id = :discId and r.status = :status")
    long countByDiscIdAndStatus(@Param("discId") Long discId, @Param("status") RecoveryStatus status);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RecoveryEvent r set r.status = :next, r.updatedAt = :now " +
            "where r.id = :id and r.status in :expected")
    int transition(@Param("id") Long id,
                   @Param("expected") Collection<RecoveryStatus> expected,
                   @Param("next") RecoveryStatus next,
                   @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RecoveryEvent r set r.status = :surrendered, r.surrenderedAt = :now, " +
            "r.originalOwner = :originalOwner, r.updatedAt = :now " +
            "where r.id = :id and r.status in :expected")
    int surrender(@Param("id") Long id,
                  @Param("expected") Collection<RecoveryStatus> expected,
                  @Param("surrendered") RecoveryStatus surrendered,
                  @Param("originalOwner") User originalOwner,
                  @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RecoveryEvent r set r.status = :recovered, r.recoveredAt = :now, r.updatedAt = :now " +
            "where r.id = :id and r.status = :expected")
    int markRecovered(@Param("id") Long id,
                      @Param("expected") RecoveryStatus expected,
                      @Param("recovered") RecoveryStatus recovered,
                      @Param("now") LocalDateTime now);

    // 클레임 시 같은 디스크의 ABANDONED 이벤트를 모두 닫는다
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RecoveryEvent r set r.status = :closure, r.recoveredAt = :now, r.updatedAt = :now " +
            "where r.disc.id = :discId and r.status = :abandoned")
    int closeAbandoned(@Param("discId") Long discId,
                       @Param("abandoned") RecoveryStatus abandoned,
                       @Param("closure") RecoveryStatus closure,
                       @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RecoveryEvent r set r.rewardPaidAt = :now, r.updatedAt = :now " +
            "where r.id = :id and r.status = :recovered and r.rewardPaidAt is null")
    int markRewardPaid(@Param("id") Long id,
                       @Param("recovered") RecoveryStatus recovered,
                       @Param("now") LocalDateTime now);
}
