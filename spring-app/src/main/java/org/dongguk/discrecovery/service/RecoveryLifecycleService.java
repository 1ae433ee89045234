package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.core.exception.GlobalErrorCode;
import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.dropoff.DropOff;
import org.dongguk.discrecovery.domain.notification.NotificationPayload;
import org.dongguk.discrecovery.domain.recovery.RecoveryErrorCode;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.NotificationType;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.dto.response.DiscSummaryDto;
import org.dongguk.discrecovery.dto.response.DropOffDto;
import org.dongguk.discrecovery.dto.response.MeetupProposalDto;
import org.dongguk.discrecovery.dto.response.RecoveryDetailsDto;
import org.dongguk.discrecovery.dto.response.RecoveryEventDto;
import org.dongguk.discrecovery.dto.response.SurrenderResultDto;
import org.dongguk.discrecovery.dto.response.UserSummaryDto;
import org.dongguk.discrecovery.event.NotificationEvent;
import org.dongguk.discrecovery.repository.DiscRepository;
import org.dongguk.discrecovery.repository.DropOffRepository;
import org.dongguk.discrecovery.repository.MeetupProposalRepository;
import org.dongguk.discrecovery.repository.RecoveryEventRepository;
import org.dongguk.discrecovery.repository.UserRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 회수 이벤트 상태 머신.
 * 조회 → 권한 확인 → 상태 확인 → 조건부 UPDATE(0건이면 실패) → 커밋 후 알림 순서로 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecoveryLifecycleService {
    static final String OWNER_FALLBACK = "소유자";
    static final String FINDER_FALLBACK = "습득자";

    private final RecoveryEventRepository recoveryEventRepository;
    private final DropOffRepository dropOffRepository;
    private final MeetupProposalRepository meetupProposalRepository;
    private final DiscRepository discRepository;
    private final UserRepository userRepository;
    private final OwnershipTransferService ownershipTransferService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${recovery.lifecycle.reclaim-closure-status:RECOVERED}")
    private RecoveryStatus reclaimClosureStatus;

    /**
     * 소유자가 습득자에게 소유권을 넘긴다 (FOUND / MEETUP_PROPOSED / MEETUP_CONFIRMED)
     */
    @Transactional
    public SurrenderResultDto surrender(Long recoveryEventId, Long userId) {
        return surrenderToFinder(
                recoveryEventId,
                userId,
                RecoveryStatus.SURRENDERABLE,
                NotificationType.DISC_SURRENDERED,
                "디스크 소유권이 양도되었습니다",
                "%s님이 %s 디스크의 소유권을 양도했습니다. 이제 당신의 디스크입니다!"
        );
    }

    /**
     * 드롭오프된 디스크를 회수하지 않고 습득자에게 넘긴다 (DROPPED_OFF)
     */
    @Transactional
    public SurrenderResultDto relinquish(Long recoveryEventId, Long userId) {
        return surrenderToFinder(
                recoveryEventId,
                userId,
                EnumSet.of(RecoveryStatus.DROPPED_OFF),
                NotificationType.DISC_RELINQUISHED,
                "소유자가 디스크를 포기했습니다",
                "%s님이 드롭오프된 %s 디스크를 회수하지 않고 넘겼습니다. 이제 당신의 디스크입니다!"
        );
    }

    private SurrenderResultDto surrenderToFinder(Long recoveryEventId,
                                                 Long userId,
                                                 Set<RecoveryStatus> allowed,
                                                 NotificationType notificationType,
                                                 String title,
                                                 String bodyFormat) {
        RecoveryEvent recoveryEvent = getRecoveryEvent(recoveryEventId);
        // 이미 양도한 원래 소유자의 재시도는 소유권이 넘어갔어도 상태 오류로 응답한다
        if (recoveryEvent.getStatus() == RecoveryStatus.SURRENDERED
                && userId.equals(recoveryEvent.getOriginalOwnerId())) {
            throw CustomException.type(RecoveryErrorCode.INVALID_STATE, recoveryEvent.getStatus());
        }
        Disc disc = recoveryEvent.getDisc();
        if (!disc.isOwnedBy(userId)) {
            throw CustomException.type(RecoveryErrorCode.NOT_DISC_OWNER);
        }
        requireStatus(recoveryEvent, allowed);

        Long discId = disc.getId();
        Long finderId = recoveryEvent.getFinderId();
        String ownerName = disc.getOwner().getDisplayName(OWNER_FALLBACK);
        String discLabel = disc.getLabel();

        int updated = recoveryEventRepository.surrender(
                recoveryEventId,
                allowed,
                RecoveryStatus.SURRENDERED,
                userRepository.getReferenceById(userId),
                now()
        );
        if (updated == 0) {
            throw invalidState(recoveryEventId);
        }
        ownershipTransferService.transfer(discId, userId, finderId);

        publish(finderId, notificationType, title, String.format(bodyFormat, ownerName, discLabel),
                NotificationPayload.ofRecovery(recoveryEventId, discId));
        log.info("소유권 양도: recoveryEventId={}, discId={}, {} -> {}", recoveryEventId, discId, userId, finderId);

        return SurrenderResultDto.builder()
                .recoveryEvent(reload(recoveryEventId))
                .newOwnerId(finderId)
                .build();
    }

    /**
     * 소유자가 드롭오프된 디스크를 회수했음을 확인 (DROPPED_OFF → RECOVERED)
     */
    @Transactional
    public void markRetrieved(Long recoveryEventId, Long userId) {
        RecoveryEvent recoveryEvent = getRecoveryEvent(recoveryEventId);
        Disc disc = recoveryEvent.getDisc();
        if (!disc.isOwnedBy(userId)) {
            throw CustomException.type(RecoveryErrorCode.NOT_DISC_OWNER);
        }
        requireStatus(recoveryEvent, EnumSet.of(RecoveryStatus.DROPPED_OFF));

        DropOff dropOff = dropOffRepository.findByRecoveryEventId(recoveryEventId)
                .orElseThrow(() -> CustomException.type(RecoveryErrorCode.DROP_OFF_MISSING));

        Long discId = disc.getId();
        Long finderId = recoveryEvent.getFinderId();
        Long dropOffId = dropOff.getId();
        String ownerName = disc.getOwner().getDisplayName(OWNER_FALLBACK);
        String discLabel = disc.getLabel();

        LocalDateTime now = now();
        if (dropOffRepository.markRetrieved(dropOffId, now) == 0) {
            throw invalidState(recoveryEventId);
        }
        if (recoveryEventRepository.markRecovered(recoveryEventId, RecoveryStatus.DROPPED_OFF, RecoveryStatus.RECOVERED, now) == 0) {
            throw invalidState(recoveryEventId);
        }

        publish(finderId, NotificationType.DISC_RETRIEVED,
                "디스크를 회수했습니다",
                String.format("%s님이 드롭오프한 %s 디스크를 찾아갔습니다. 감사합니다!", ownerName, discLabel),
                NotificationPayload.builder()
                        .recoveryEventId(recoveryEventId)
                        .discId(discId)
                        .dropOffId(dropOffId)
                        .build());
        log.info("드롭오프 회수 확인: recoveryEventId={}, dropOffId={}", recoveryEventId, dropOffId);
    }

    /**
     * 만남이 확정된 회수를 완료 처리 (MEETUP_CONFIRMED → RECOVERED)
     */
    @Transactional
    public RecoveryEventDto completeRecovery(Long recoveryEventId, Long userId) {
        RecoveryEvent recoveryEvent = getRecoveryEvent(recoveryEventId);
        Disc disc = recoveryEvent.getDisc();
        boolean isOwner = disc.isOwnedBy(userId);
        if (!isOwner && !recoveryEvent.isFinder(userId)) {
            throw CustomException.type(RecoveryErrorCode.NOT_PARTICIPANT);
        }
        requireStatus(recoveryEvent, EnumSet.of(RecoveryStatus.MEETUP_CONFIRMED));

        Long discId = disc.getId();
        Long otherId = isOwner ? recoveryEvent.getFinderId() : disc.getOwnerId();
        String callerName = isOwner
                ? disc.getOwner().getDisplayName(OWNER_FALLBACK)
                : recoveryEvent.getFinder().getDisplayName(FINDER_FALLBACK);
        String discLabel = disc.getLabel();

        if (recoveryEventRepository.markRecovered(recoveryEventId, RecoveryStatus.MEETUP_CONFIRMED, RecoveryStatus.RECOVERED, now()) == 0) {
            throw invalidState(recoveryEventId);
        }

        publish(otherId, NotificationType.DISC_RECOVERED,
                "디스크 반환이 완료되었습니다",
                String.format("%s님이 %s 디스크 반환을 완료 처리했습니다.", callerName, discLabel),
                NotificationPayload.ofRecovery(recoveryEventId, discId));
        log.info("회수 완료: recoveryEventId={}, by={}", recoveryEventId, userId);
        return reload(recoveryEventId);
    }

    /**
     * 소유자가 드롭오프된 디스크를 포기. 디스크는 주인 없는 상태가 되어 클레임할 수 있다.
     */
    @Transactional
    public RecoveryEventDto abandon(Long recoveryEventId, Long userId) {
        RecoveryEvent recoveryEvent = getRecoveryEvent(recoveryEventId);
        Disc disc = recoveryEvent.getDisc();
        if (!disc.isOwnedBy(userId)) {
            throw CustomException.type(RecoveryErrorCode.NOT_DISC_OWNER);
        }
        requireStatus(recoveryEvent, EnumSet.of(RecoveryStatus.DROPPED_OFF));

        Long discId = disc.getId();
        Long finderId = recoveryEvent.getFinderId();
        String ownerName = disc.getOwner().getDisplayName(OWNER_FALLBACK);
        String discLabel = disc.getLabel();

        LocalDateTime now = now();
        if (recoveryEventRepository.transition(recoveryEventId, EnumSet.of(RecoveryStatus.DROPPED_OFF), RecoveryStatus.ABANDONED, now) == 0) {
            throw invalidState(recoveryEventId);
        }
        if (discRepository.releaseOwnership(discId, userId, now) == 0) {
            log.warn("소유권 해제 경합 실패: discId={}, ownerId={}", discId, userId);
            throw CustomException.type(GlobalErrorCode.CONFLICT);
        }

        publish(finderId, NotificationType.DISC_ABANDONED,
                "소유자가 디스크를 포기했습니다",
                String.format("%s님이 %s 디스크를 포기했습니다. 이제 누구나 클레임할 수 있습니다.", ownerName, discLabel),
                NotificationPayload.ofRecovery(recoveryEventId, discId));
        log.info("디스크 포기: recoveryEventId={}, discId={}", recoveryEventId, discId);
        return reload(recoveryEventId);
    }

    /**
     * 포기된 디스크가 클레임되면 해당 디스크의 ABANDONED 이벤트를 모두 종료한다.
     * 종료 상태는 recovery.lifecycle.reclaim-closure-status 로 정한다.
     */
    @Transactional
    public int closeAbandoned(Long discId) {
        int closed = recoveryEventRepository.closeAbandoned(discId, RecoveryStatus.ABANDONED, reclaimClosureStatus, now());
        if (closed > 0) {
            log.info("포기된 회수 이벤트 종료: discId={}, count={}, status={}", discId, closed, reclaimClosureStatus);
        }
        return closed;
    }

    /**
     * 회수 상세. 소유자, 습득자, 이전 소유자만 볼 수 있고 그 외에는 존재 여부도 알리지 않는다.
     */
    @Transactional(readOnly = true)
    public RecoveryDetailsDto getDetails(Long recoveryEventId, Long userId) {
        RecoveryEvent recoveryEvent = getRecoveryEvent(recoveryEventId);
        Disc disc = recoveryEvent.getDisc();

        String userRole;
        if (disc.isOwnedBy(userId)) {
            userRole = "owner";
        } else if (recoveryEvent.isFinder(userId)) {
            userRole = "finder";
        } else if (userId != null && userId.equals(recoveryEvent.getOriginalOwnerId())) {
            userRole = "original_owner";
        } else {
            throw CustomException.type(RecoveryErrorCode.RECOVERY_NOT_FOUND);
        }

        UserSummaryDto owner = UserSummaryDto.from(disc.getOwner(), OWNER_FALLBACK);
        List<MeetupProposalDto> proposals = meetupProposalRepository.findAllByRecoveryEventId(recoveryEventId)
                .stream()
                .map(MeetupProposalDto::from)
                .toList();
        DropOffDto dropOff = dropOffRepository.findByRecoveryEventId(recoveryEventId)
                .map(DropOffDto::from)
                .orElse(null);

        return RecoveryDetailsDto.builder()
                .recoveryEvent(RecoveryEventDto.from(recoveryEvent))
                .disc(DiscSummaryDto.of(disc, owner == null ? null : owner.displayName()))
                .owner(owner)
                .finder(UserSummaryDto.from(recoveryEvent.getFinder(), FINDER_FALLBACK))
                .userRole(userRole)
                .proposals(proposals)
                .dropOff(dropOff)
                .build();
    }

    private RecoveryEvent getRecoveryEvent(Long recoveryEventId) {
        return recoveryEventRepository.findDetailById(recoveryEventId)
                .orElseThrow(() -> CustomException.type(RecoveryErrorCode.RECOVERY_NOT_FOUND));
    }

    private void requireStatus(RecoveryEvent recoveryEvent, Set<RecoveryStatus> allowed) {
        if (!allowed.contains(recoveryEvent.getStatus())) {
            throw CustomException.type(RecoveryErrorCode.INVALID_STATE, recoveryEvent.getStatus());
        }
    }

    // 조건부 UPDATE 가 0건일 때 현재 상태를 다시 읽어 응답에 싣는다
    private CustomException invalidState(Long recoveryEventId) {
        RecoveryStatus current = recoveryEventRepository.findById(recoveryEventId)
                .map(RecoveryEvent::getStatus)
                .orElse(null);
        log.info("회수 상태 전이 경합 실패: recoveryEventId={}, current={}", recoveryEventId, current);
        return CustomException.type(RecoveryErrorCode.INVALID_STATE, current);
    }

    private RecoveryEventDto reload(Long recoveryEventId) {
        return recoveryEventRepository.findById(recoveryEventId)
                .map(RecoveryEventDto::from)
                .orElseThrow(() -> CustomException.type(RecoveryErrorCode.RECOVERY_NOT_FOUND));
    }

    private void publish(Long recipientId, NotificationType type, String title, String body, NotificationPayload payload) {
        eventPublisher.publishEvent(NotificationEvent.builder()
                .recipientId(recipientId)
                .type(type)
                .title(title)
                .body(body)
                .payload(payload)
                .build());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
