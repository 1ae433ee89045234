package org.dongguk.discrecovery.repository;

import org.dongguk.discrecovery.domain.qrcode.QrCode;
import org.dongguk.discrecovery.domain.type.QrCodeStatus;
import org.dongguk.discrecovery.domain.user.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

public interface QrCodeRepository extends JpaRepository<QrCode, Long> {

    @Query("select q from QrCode q left join fetch q.assignedTo where upper(q.shortCode) = upper(:shortCode)")
    Optional<QrCode> findByShortCodeIgnoreCase(@Param("shortCode") String shortCode);

    // 소유권 이전 후 QR 을 새 소유자에게 넘긴다
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update QrCode q set q.assignedTo = :newOwner, q.status = :active, q.updatedAt = :now where q.id = :qrCodeId")
    int reassign(@Param("qrCodeId") Long qrCodeId,
                 @Param("newOwner") User newOwner,
                 @Param("active") QrCodeStatus active,
                 @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update QrCode q set q.assignedTo = :assignee, q.status = :next, q.updatedAt = :now " +
            "where q.id = :qrCodeId and q.status = :expected")
    int assign(@Param("qrCodeId") Long qrCodeId,
               @Param("assignee") User assignee,
               @Param("expected") QrCodeStatus expected,
               @Param("next") QrCodeStatus next,
               @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update QrCode q set q.status = :next, q.updatedAt = :now " +
            "where q.id = :qrCodeId and q.status = :expected and q.assignedTo.id = :assigneeId")
    int transition(@Param("qrCodeId") Long qrCodeId,
                   @Param("assigneeId") Long assigneeId,
                   @Param("expected") QrCodeStatus expected,
                   @Param("next") QrCodeStatus next,
                   @Param("now") LocalDateTime now);
}
