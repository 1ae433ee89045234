package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.core.exception.GlobalErrorCode;
import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.disc.DiscErrorCode;
import org.dongguk.discrecovery.domain.qrcode.QrCode;
import org.dongguk.discrecovery.domain.qrcode.QrCodeErrorCode;
import org.dongguk.discrecovery.domain.type.QrCodeStatus;
import org.dongguk.discrecovery.dto.response.DiscDto;
import org.dongguk.discrecovery.event.OwnershipTransferredEvent;
import org.dongguk.discrecovery.repository.DiscRepository;
import org.dongguk.discrecovery.repository.QrCodeRepository;
import org.dongguk.discrecovery.repository.UserRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 디스크 소유권과 QR 연결을 옮긴다.
 * unlink/link 는 단계마다 별도 트랜잭션으로 커밋하고, 뒷단계가 실패하면 앞단계를 되돌린다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OwnershipTransferService {
    private final DiscRepository discRepository;
    private final QrCodeRepository qrCodeRepository;
    private final UserRepository userRepository;
    private final QrCodeService qrCodeService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 현재 소유자 id (없으면 null). 회수 이벤트에 캐시하지 않고 항상 디스크에서 읽는다.
     */
    @Transactional(readOnly = true)
    public Long ownerOf(Long discId) {
        return discRepository.findById(discId)
                .map(Disc::getOwnerId)
                .orElseThrow(() -> CustomException.type(DiscErrorCode.DISC_NOT_FOUND));
    }

    /**
     * expectedOwnerId → newOwnerId 소유권 이전. 호출자의 트랜잭션에 참여한다.
     * QR 재할당은 커밋 이후 별도로 처리되며 실패해도 소유권 변경은 유지된다.
     */
    @Transactional
    public void transfer(Long discId, Long expectedOwnerId, Long newOwnerId) {
        Disc disc = discRepository.findById(discId)
                .orElseThrow(() -> CustomException.type(DiscErrorCode.DISC_NOT_FOUND));
        Long qrCodeId = disc.getQrCodeId();

        int updated = discRepository.transferOwnership(
                discId,
                expectedOwnerId,
                userRepository.getReferenceById(newOwnerId),
                now()
        );
        if (updated == 0) {
            log.warn("소유권 이전 경합 실패: discId={}, expectedOwnerId={}", discId, expectedOwnerId);
            throw CustomException.type(GlobalErrorCode.CONFLICT);
        }

        log.info("소유권 이전: discId={}, {} -> {}", discId, expectedOwnerId, newOwnerId);
        if (qrCodeId != null) {
            eventPublisher.publishEvent(new OwnershipTransferredEvent(discId, qrCodeId, newOwnerId));
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOwnershipTransferred(OwnershipTransferredEvent event) {
        try {
            qrCodeService.reassign(event.qrCodeId(), event.newOwnerId());
        } catch (RuntimeException e) {
            log.warn("QR 재할당 실패 (소유권 이전은 유지): discId={}, qrCodeId={}",
                    event.discId(), event.qrCodeId(), e);
        }
    }

    /**
     * QR 연결 해제 후 QR 삭제. 삭제에 실패하면 연결을 복구하고 DEPENDENCY_FAILURE.
     */
    public DiscDto unlinkQrCode(Long discId, Long userId) {
        Disc disc = discRepository.findDetailById(discId)
                .orElseThrow(() -> CustomException.type(DiscErrorCode.DISC_NOT_FOUND));
        if (!disc.isOwnedBy(userId)) {
            throw CustomException.type(DiscErrorCode.NOT_DISC_OWNER);
        }
        if (disc.getQrCode() == null) {
            throw CustomException.type(DiscErrorCode.QR_CODE_NOT_LINKED);
        }

        QrCode qrCode = disc.getQrCode();
        int cleared = discRepository.unbindQrCode(discId, qrCode.getId(), now());
        if (cleared == 0) {
            throw CustomException.type(DiscErrorCode.QR_CODE_NOT_LINKED);
        }

        try {
            qrCodeRepository.deleteById(qrCode.getId());
        } catch (DataAccessException e) {
            log.error("QR 삭제 실패, 디스크 연결 복구 시도: discId={}, qrCodeId={}", discId, qrCode.getId(), e);
            restoreQrCode(disc, qrCode);
            throw CustomException.type(GlobalErrorCode.DEPENDENCY_FAILURE, e);
        }

        log.info("QR 연결 해제 및 삭제: discId={}, qrCodeId={}", discId, qrCode.getId());
        return reload(discId);
    }

    /**
     * 할당받은 QR 을 디스크에 연결하고 ACTIVE 로 전환. 전환에 실패하면 연결을 되돌린다.
     */
    public DiscDto linkQrCode(Long discId, Long userId, String shortCode) {
        Disc disc = discRepository.findDetailById(discId)
                .orElseThrow(() -> CustomException.type(DiscErrorCode.DISC_NOT_FOUND));
        if (!disc.isOwnedBy(userId)) {
            throw CustomException.type(DiscErrorCode.NOT_DISC_OWNER);
        }
        if (disc.getQrCode() != null) {
            throw CustomException.type(DiscErrorCode.QR_CODE_ALREADY_LINKED);
        }

        QrCode qrCode = qrCodeRepository.findByShortCodeIgnoreCase(QrCode.normalize(shortCode))
                .orElseThrow(() -> CustomException.type(QrCodeErrorCode.QR_CODE_NOT_FOUND));
        if (!qrCode.isAssignedTo(userId)) {
            throw CustomException.type(QrCodeErrorCode.NOT_ASSIGNEE);
        }
        if (qrCode.getStatus() != QrCodeStatus.ASSIGNED) {
            throw CustomException.type(QrCodeErrorCode.INVALID_QR_STATUS, qrCode.getStatus());
        }

        int bound;
        try {
            bound = discRepository.bindQrCode(discId, qrCode, now());
        } catch (DataIntegrityViolationException e) {
            // 같은 QR 이 동시에 다른 디스크에 연결됨
            throw CustomException.type(GlobalErrorCode.CONFLICT, e);
        }
        if (bound == 0) {
            throw CustomException.type(DiscErrorCode.QR_CODE_ALREADY_LINKED);
        }

        int activated;
        try {
            activated = qrCodeRepository.transition(
                    qrCode.getId(), userId, QrCodeStatus.ASSIGNED, QrCodeStatus.ACTIVE, now());
        } catch (DataAccessException e) {
            log.error("QR 활성화 실패, 디스크 연결 되돌림: discId={}, qrCodeId={}", discId, qrCode.getId(), e);
            unbindQrCode(discId, qrCode.getId());
            throw CustomException.type(GlobalErrorCode.DEPENDENCY_FAILURE, e);
        }
        if (activated == 0) {
            log.warn("QR 상태가 변경되어 연결을 되돌림: discId={}, qrCodeId={}", discId, qrCode.getId());
            unbindQrCode(discId, qrCode.getId());
            throw CustomException.type(QrCodeErrorCode.INVALID_QR_STATUS);
        }

        log.info("QR 연결: discId={}, qrCodeId={}", discId, qrCode.getId());
        return reload(discId);
    }

    private void restoreQrCode(Disc disc, QrCode qrCode) {
        try {
            int restored = discRepository.bindQrCode(disc.getId(), qrCode, now());
            if (restored == 0) {
                log.error("QR 연결 복구 실패 (다른 QR 이 연결됨): discId={}, qrCodeId={}", disc.getId(), qrCode.getId());
            }
        } catch (DataAccessException e) {
            log.error("QR 연결 복구 실패: discId={}, qrCodeId={}", disc.getId(), qrCode.getId(), e);
        }
    }

    private void unbindQrCode(Long discId, Long qrCodeId) {
        try {
            int cleared = discRepository.unbindQrCode(discId, qrCodeId, now());
            if (cleared == 0) {
                log.error("QR 연결 되돌림 실패 (이미 변경됨): discId={}, qrCodeId={}", discId, qrCodeId);
            }
        } catch (DataAccessException e) {
            log.error("QR 연결 되돌림 실패: discId={}, qrCodeId={}", discId, qrCodeId, e);
        }
    }

    private DiscDto reload(Long discId) {
        return discRepository.findById(discId)
                .map(DiscDto::from)
                .orElseThrow(() -> CustomException.type(DiscErrorCode.DISC_NOT_FOUND));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
