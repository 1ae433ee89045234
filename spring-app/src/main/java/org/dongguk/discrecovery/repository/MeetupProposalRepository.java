package org.dongguk.discrecovery.repository;

import jakarta.persistence.LockModeType;
import org.dongguk.discrecovery.domain.meetup.MeetupProposal;
import org.dongguk.discrecovery.domain.type.MeetupStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

public interface MeetupProposalRepository extends JpaRepository<MeetupProposal, Long> {

    @Query("select p from MeetupProposal p " +
            "join fetch p.recoveryEvent r " +
            "join fetch r.disc d " +
            "left join fetch d.owner " +
            "join fetch r.finder " +
            "join fetch p.proposedBy " +
            "where p.id = :id")
    Optional<MeetupProposal> findDetailById(@Param("id") Long id);

    // 최신 커밋된 PENDING 제안을 잠금 읽기로 가져온다
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from MeetupProposal p where p.recoveryEvent.id = :recoveryEventId and p.status = :status")
    List<MeetupProposal> findForUpdate(@Param("recoveryEventId") Long recoveryEventId,
                                       @Param("status") MeetupStatus status);

    @Query("select p from MeetupProposal p join fetch p.proposedBy " +
            "where p.recoveryEvent.id = :recoveryEventId order by p.createdAt desc, p.id desc")
    List<MeetupProposal> findAllByRecoveryEventId(@Param("recoveryEventId") Long recoveryEventId);

    @Query("select count(p) from MeetupProposal p where p.recoveryEvent.id = :recoveryEventId and p.status = :status")
    long countByRecoveryEventIdAndStatus(@Param("recoveryEventId") Long recoveryEventId,
                                         @Param("status") MeetupStatus status);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update MeetupProposal p set p.status = :declined " +
            "where p.recoveryEvent.id = :recoveryEventId and p.status = :pending")
    int declineAllPending(@Param("recoveryEventId") Long recoveryEventId,
                          @Param("pending") MeetupStatus pending,
                          @Param("declined") MeetupStatus declined);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update MeetupProposal p set p.status = :next where p.id = :id and p.status = :expected")
    int respond(@Param("id") Long id,
                @Param("expected") MeetupStatus expected,
                @Param("next") MeetupStatus next);
}
