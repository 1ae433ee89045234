package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.qrcode.QrCode;
import org.dongguk.discrecovery.domain.qrcode.QrCodeErrorCode;
import org.dongguk.discrecovery.domain.type.QrCodeStatus;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.dto.response.DiscSummaryDto;
import org.dongguk.discrecovery.dto.response.QrCodeDto;
import org.dongguk.discrecovery.dto.response.QrLookupDto;
import org.dongguk.discrecovery.repository.DiscRepository;
import org.dongguk.discrecovery.repository.QrCodeRepository;
import org.dongguk.discrecovery.repository.RecoveryEventRepository;
import org.dongguk.discrecovery.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class QrCodeService {
    static final String NO_OWNER_DISPLAY_NAME = "No Owner - Available to Claim";
    static final String UNKNOWN_OWNER_DISPLAY_NAME = "Unknown";

    private final QrCodeRepository qrCodeRepository;
    private final DiscRepository discRepository;
    private final RecoveryEventRepository recoveryEventRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    /**
     * QR 공개 조회 (인증 불필요). 소유자 식별 정보는 표시 이름만 노출한다.
     */
    public QrLookupDto lookup(String shortCode, Long callerId) {
        Optional<QrCode> found = qrCodeRepository.findByShortCodeIgnoreCase(QrCode.normalize(shortCode));
        if (found.isEmpty()) {
            return QrLookupDto.notFound();
        }

        QrCode qrCode = found.get();
        switch (qrCode.getStatus()) {
            case DEACTIVATED:
                return QrLookupDto.builder()
                        .found(false)
                        .qrExists(true)
                        .qrStatus(QrCodeStatus.DEACTIVATED)
                        .build();
            case GENERATED:
                return QrLookupDto.builder()
                        .found(false)
                        .qrExists(true)
                        .qrStatus(QrCodeStatus.GENERATED)
                        .qrCode(qrCode.getShortCode())
                        .build();
            case ASSIGNED:
                boolean isAssignee = qrCode.isAssignedTo(callerId);
                return QrLookupDto.builder()
                        .found(false)
                        .qrExists(true)
                        .qrStatus(QrCodeStatus.ASSIGNED)
                        .qrCode(qrCode.getShortCode())
                        .qrCodeId(isAssignee ? qrCode.getId() : null)
                        .isAssignee(isAssignee)
                        .build();
            default:
                return lookupActive(qrCode, callerId);
        }
    }

    private QrLookupDto lookupActive(QrCode qrCode, Long callerId) {
        Optional<Disc> linked = discRepository.findByQrCodeId(qrCode.getId());
        if (linked.isEmpty()) {
            log.warn("ACTIVE 상태지만 연결된 디스크가 없는 QR: qrCodeId={}", qrCode.getId());
            return QrLookupDto.builder()
                    .found(false)
                    .qrExists(true)
                    .qrStatus(qrCode.getStatus())
                    .build();
        }

        Disc disc = linked.get();
        boolean isClaimable = disc.getOwner() == null;
        String ownerDisplayName = isClaimable
                ? NO_OWNER_DISPLAY_NAME
                : disc.getOwner().getDisplayName(UNKNOWN_OWNER_DISPLAY_NAME);

        return QrLookupDto.builder()
                .found(true)
                .qrExists(true)
                .qrStatus(qrCode.getStatus())
                .qrCode(qrCode.getShortCode())
                .disc(DiscSummaryDto.of(disc, ownerDisplayName))
                .hasActiveRecovery(recoveryEventRepository.existsByDiscIdAndStatusIn(disc.getId(), RecoveryStatus.ACTIVE))
                .isOwner(disc.isOwnedBy(callerId))
                .isClaimable(isClaimable)
                .build();
    }

    /**
     * 발급된 QR 을 호출자에게 할당 (GENERATED → ASSIGNED)
     */
    @Transactional
    public QrCodeDto assign(String shortCode, Long userId) {
        QrCode qrCode = qrCodeRepository.findByShortCodeIgnoreCase(QrCode.normalize(shortCode))
                .orElseThrow(() -> CustomException.type(QrCodeErrorCode.QR_CODE_NOT_FOUND));

        if (qrCode.getStatus() != QrCodeStatus.GENERATED) {
            throw CustomException.type(QrCodeErrorCode.INVALID_QR_STATUS, qrCode.getStatus());
        }

        int updated = qrCodeRepository.assign(
                qrCode.getId(),
                userRepository.getReferenceById(userId),
                QrCodeStatus.GENERATED,
                QrCodeStatus.ASSIGNED,
                LocalDateTime.now(clock)
        );
        if (updated == 0) {
            QrCodeStatus current = qrCodeRepository.findById(qrCode.getId())
                    .map(QrCode::getStatus)
                    .orElse(null);
            throw CustomException.type(QrCodeErrorCode.INVALID_QR_STATUS, current);
        }

        log.info("QR 할당: qrCodeId={}, userId={}", qrCode.getId(), userId);
        return qrCodeRepository.findById(qrCode.getId())
                .map(QrCodeDto::from)
                .orElseThrow(() -> CustomException.type(QrCodeErrorCode.QR_CODE_NOT_FOUND));
    }

    /**
     * 소유권 이전 커밋 후 QR 을 새 소유자에게 넘긴다. 호출자 트랜잭션과 분리된 별도 트랜잭션.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void reassign(Long qrCodeId, Long newOwnerId) {
        int updated = qrCodeRepository.reassign(
                qrCodeId,
                userRepository.getReferenceById(newOwnerId),
                QrCodeStatus.ACTIVE,
                LocalDateTime.now(clock)
        );
        if (updated == 0) {
            log.warn("QR 재할당 대상 없음: qrCodeId={}, newOwnerId={}", qrCodeId, newOwnerId);
            return;
        }
        log.info("QR 재할당: qrCodeId={}, newOwnerId={}", qrCodeId, newOwnerId);
    }
}
