package org.dongguk.discrecovery.repository;

import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.qrcode.QrCode;
import org.dongguk.discrecovery.domain.user.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 소유자, QR 연결 변경은 모두 조건부 UPDATE 이며 반환값(영향받은 행 수)이 0 이면 경합에서 진 것이다.
 */
public interface DiscRepository extends JpaRepository<Disc, Long> {

    @Query("select d from Disc d left join fetch d.owner left join fetch d.qrCode where d.id = :id")
    Optional<Disc> findDetailById(@Param("id") Long id);

    @Query("select d from Disc d left join fetch d.owner where d.qrCode.id = :qrCodeId")
    Optional<Disc> findByQrCodeId(@Param("qrCodeId") Long qrCodeId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Disc d set d.owner = :claimant, d.updatedAt = :now where d.id = :discId and d.owner is null")
    int claimOwnership(@Param("discId") Long discId,
                       @Param("claimant") User claimant,
                       @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Disc d set d.owner = :newOwner, d.updatedAt = :now " +
            "where d.id = :discId and d.owner.id = :expectedOwnerId")
    int transferOwnership(@Param("discId") Long discId,
                          @Param("expectedOwnerId") Long expectedOwnerId,
                          @Param("newOwner") User newOwner,
                          @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Disc d set d.owner = null, d.updatedAt = :now " +
            "where d.id = :discId and d.owner.id = :expectedOwnerId")
    int releaseOwnership(@Param("discId") Long discId,
                         @Param("expectedOwnerId") Long expectedOwnerId,
                         @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Disc d set d.qrCode = null, d.updatedAt = :now " +
            "where d.id = :discId and d.qrCode.id = :qrCodeId")
    int unbindQrCode(@Param("discId") Long discId,
                     @Param("qrCodeId") Long qrCodeId,
                     @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Disc d set d.qrCode = :qrCode, d.updatedAt = :now " +
            "where d.id = :discId and d.qrCode is null")
    int bindQrCode(@Param("discId") Long discId,
                   @Param("qrCode") QrCode qrCode,
                   @Param("now") LocalDateTime now);
}
