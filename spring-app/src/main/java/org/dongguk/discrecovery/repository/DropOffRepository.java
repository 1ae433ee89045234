package org.dongguk.discrecovery.repository;

import org.dongguk.discrecovery.domain.dropoff.DropOff;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

public interface DropOffRepository extends JpaRepository<DropOff, Long> {
    Optional<DropOff> findByRecoveryEventId(Long recoveryEventId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update DropOff o set o.retrievedAt = :now where o.id = :id and o.retrievedAt is null")
    int markRetrieved(@Param("id") Long id, @Param("now") LocalDateTime now);
}
