package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.core.exception.GlobalErrorCode;
import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.dropoff.DropOff;
import org.dongguk.discrecovery.domain.dropoff.DropOffErrorCode;
import org.dongguk.discrecovery.domain.notification.NotificationPayload;
import org.dongguk.discrecovery.domain.recovery.RecoveryErrorCode;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.NotificationType;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.dto.request.RecordDropOffRequest;
import org.dongguk.discrecovery.dto.response.DropOffDto;
import org.dongguk.discrecovery.event.NotificationEvent;
import org.dongguk.discrecovery.repository.DropOffRepository;
import org.dongguk.discrecovery.repository.RecoveryEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DropOffService {
    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", "jpg",
            "image/jpg", "jpg",
            "image/png", "png",
            "image/webp", "webp",
            "image/heic", "heic"
    );

    private final RecoveryEventRepository recoveryEventRepository;
    private final DropOffRepository dropOffRepository;
    private final PhotoStorage photoStorage;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${recovery.drop-off.max-photo-bytes:5242880}")
    private long maxPhotoBytes;

    /**
     * 습득자가 디스크를 지정 장소에 두고 사진을 남긴다 (FOUND → DROPPED_OFF).
     * DB 기록이 실패하면 업로드한 사진을 지운다.
     */
    @Transactional
    public DropOffDto recordDropOff(Long recoveryEventId, Long userId, RecordDropOffRequest request) {
        RecoveryEvent recoveryEvent = recoveryEventRepository.findDetailById(recoveryEventId)
                .orElseThrow(() -> CustomException.type(RecoveryErrorCode.RECOVERY_NOT_FOUND));
        if (!recoveryEvent.isFinder(userId)) {
            throw CustomException.type(RecoveryErrorCode.NOT_FINDER);
        }
        if (recoveryEvent.getStatus() != RecoveryStatus.FOUND) {
            throw CustomException.type(RecoveryErrorCode.INVALID_STATE, recoveryEvent.getStatus());
        }
        if (request.latitude() == null || request.longitude() == null) {
            throw CustomException.type(GlobalErrorCode.MISSING_PARAMETER, "latitude, longitude");
        }

        MultipartFile photo = request.photo();
        String extension = validatePhoto(photo);

        Disc disc = recoveryEvent.getDisc();
        Long discId = disc.getId();
        Long ownerId = disc.getOwnerId();
        String finderName = recoveryEvent.getFinder().getDisplayName(RecoveryLifecycleService.FINDER_FALLBACK);
        String discLabel = disc.getLabel();

        String storagePath = String.format("drop-offs/%d/%s.%s", recoveryEventId, UUID.randomUUID(), extension);
        PhotoStorage.StoredPhoto stored = upload(storagePath, photo);

        DropOff dropOff;
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            // 이벤트 행을 먼저 갱신해 동시 드롭오프 중 하나만 통과시킨다
            int moved = recoveryEventRepository.transition(
                    recoveryEventId, EnumSet.of(RecoveryStatus.FOUND), RecoveryStatus.DROPPED_OFF, now);
            if (moved == 0) {
                RecoveryStatus current = recoveryEventRepository.findById(recoveryEventId)
                        .map(RecoveryEvent::getStatus)
                        .orElse(null);
                throw CustomException.type(RecoveryErrorCode.INVALID_STATE, current);
            }

            dropOff = dropOffRepository.save(DropOff.create(
                    recoveryEventRepository.getReferenceById(recoveryEventId),
                    stored.url(),
                    stored.storagePath(),
                    request.latitude(),
                    request.longitude(),
                    request.locationNotes(),
                    now
            ));
        } catch (DataIntegrityViolationException e) {
            deletePhotoQuietly(storagePath);
            throw CustomException.type(GlobalErrorCode.CONFLICT, e);
        } catch (RuntimeException e) {
            deletePhotoQuietly(storagePath);
            throw e;
        }

        eventPublisher.publishEvent(NotificationEvent.builder()
                .recipientId(ownerId)
                .type(NotificationType.DISC_DROPPED_OFF)
                .title("디스크가 드롭오프되었습니다")
                .body(String.format("%s님이 %s 디스크를 두고 갔습니다. 사진과 위치를 확인하세요.", finderName, discLabel))
                .payload(NotificationPayload.builder()
                        .recoveryEventId(recoveryEventId)
                        .discId(discId)
                        .dropOffId(dropOff.getId())
                        .build())
                .build());
        log.info("드롭오프 기록: recoveryEventId={}, dropOffId={}, path={}", recoveryEventId, dropOff.getId(), storagePath);

        return DropOffDto.from(dropOff);
    }

    private String validatePhoto(MultipartFile photo) {
        if (photo == null || photo.isEmpty()) {
            throw CustomException.type(DropOffErrorCode.INVALID_PHOTO, "empty");
        }
        String contentType = photo.getContentType() == null
                ? ""
                : photo.getContentType().toLowerCase(Locale.ROOT);
        String extension = EXTENSIONS.get(contentType);
        if (extension == null) {
            throw CustomException.type(DropOffErrorCode.INVALID_PHOTO, contentType);
        }
        if (photo.getSize() > maxPhotoBytes) {
            throw CustomException.type(DropOffErrorCode.INVALID_PHOTO, photo.getSize() + " bytes");
        }
        return extension;
    }

    private PhotoStorage.StoredPhoto upload(String storagePath, MultipartFile photo) {
        try {
            return photoStorage.upload(storagePath, photo.getBytes(), photo.getContentType());
        } catch (IOException | RuntimeException e) {
            log.error("드롭오프 사진 업로드 실패: path={}", storagePath, e);
            throw CustomException.type(GlobalErrorCode.DEPENDENCY_FAILURE, e);
        }
    }

    private void deletePhotoQuietly(String storagePath) {
        try {
            photoStorage.delete(storagePath);
            log.info("실패한 드롭오프의 사진 삭제: path={}", storagePath);
        } catch (RuntimeException e) {
            log.warn("드롭오프 사진 정리 실패: path={}", storagePath, e);
        }
    }
}
