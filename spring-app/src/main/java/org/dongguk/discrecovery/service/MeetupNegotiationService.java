package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.meetup.MeetupErrorCode;
import org.dongguk.discrecovery.domain.meetup.MeetupProposal;
import org.dongguk.discrecovery.domain.notification.NotificationPayload;
import org.dongguk.discrecovery.domain.recovery.RecoveryErrorCode;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.MeetupStatus;
import org.dongguk.discrecovery.domain.type.NotificationType;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.domain.user.User;
import org.dongguk.discrecovery.dto.request.ProposeMeetupRequest;
import org.dongguk.discrecovery.dto.response.MeetupProposalDto;
import org.dongguk.discrecovery.event.NotificationEvent;
import org.dongguk.discrecovery.repository.MeetupProposalRepository;
import org.dongguk.discrecovery.repository.RecoveryEventRepository;
import org.dongguk.discrecovery.repository.UserRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * 만남 제안 협상. 새 제안이 들어오면 대기 중인 제안은 모두 거절 처리되어
 * 이벤트당 PENDING 제안은 최대 하나만 남는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeetupNegotiationService {
    private static final String SOMEONE = "상대방";

    private final RecoveryEventRepository recoveryEventRepository;
    private final MeetupProposalRepository meetupProposalRepository;
    private final UserRepository userRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public MeetupProposalDto propose(Long recoveryEventId, Long userId, ProposeMeetupRequest request) {
        RecoveryEvent recoveryEvent = recoveryEventRepository.findDetailById(recoveryEventId)
                .orElseThrow(() -> CustomException.type(RecoveryErrorCode.RECOVERY_NOT_FOUND));
        Disc disc = recoveryEvent.getDisc();

        boolean isOwner = disc.isOwnedBy(userId);
        if (!isOwner && !recoveryEvent.isFinder(userId)) {
            throw CustomException.type(RecoveryErrorCode.NOT_PARTICIPANT);
        }
        if (!RecoveryStatus.PROPOSABLE.contains(recoveryEvent.getStatus())) {
            throw CustomException.type(RecoveryErrorCode.INVALID_STATE, recoveryEvent.getStatus());
        }

        Long discId = disc.getId();
        Long recipientId = isOwner ? recoveryEvent.getFinderId() : disc.getOwnerId();
        User proposer = isOwner ? disc.getOwner() : recoveryEvent.getFinder();
        String proposerName = proposer.getDisplayName(SOMEONE);
        String discLabel = disc.getLabel();
        LocalDateTime now = now();

        // 이벤트 행을 먼저 갱신해 같은 이벤트에 대한 동시 제안을 직렬화한다
        int moved = recoveryEventRepository.transition(
                recoveryEventId, RecoveryStatus.PROPOSABLE, RecoveryStatus.MEETUP_PROPOSED, now);
        if (moved == 0) {
            throw invalidState(recoveryEventId);
        }

        List<MeetupProposal> pending = meetupProposalRepository.findForUpdate(recoveryEventId, MeetupStatus.PENDING);
        List<Long> counteredAuthors = pending.stream()
                .map(MeetupProposal::getProposedById)
                .filter(authorId -> !authorId.equals(userId))
                .distinct()
                .toList();
        if (!pending.isEmpty()) {
            int declined = meetupProposalRepository.declineAllPending(recoveryEventId, MeetupStatus.PENDING, MeetupStatus.DECLINED);
            log.info("기존 만남 제안 거절 처리: recoveryEventId={}, count={}", recoveryEventId, declined);
        }

        MeetupProposal proposal = meetupProposalRepository.save(MeetupProposal.create(
                recoveryEventRepository.getReferenceById(recoveryEventId),
                userRepository.getReferenceById(userId),
                request.locationName(),
                request.latitude(),
                request.longitude(),
                request.proposedDatetime(),
                request.message(),
                now
        ));

        for (Long authorId : counteredAuthors) {
            publish(authorId, NotificationType.MEETUP_COUNTERED,
                    "새로운 만남 제안이 도착했습니다",
                    String.format("%s님이 %s 디스크에 대해 다른 만남을 제안했습니다: %s", proposerName, discLabel, request.locationName()),
                    payload(recoveryEventId, discId, proposal.getId()));
        }
        publish(recipientId, NotificationType.MEETUP_PROPOSED,
                "만남 제안이 도착했습니다",
                String.format("%s님이 %s 디스크 반환을 위해 만남을 제안했습니다: %s", proposerName, discLabel, request.locationName()),
                payload(recoveryEventId, discId, proposal.getId()));

        log.info("만남 제안: recoveryEventId={}, proposalId={}, by={}, countered={}",
                recoveryEventId, proposal.getId(), userId, counteredAuthors);
        return MeetupProposalDto.from(proposal);
    }

    @Transactional
    public MeetupProposalDto accept(Long proposalId, Long userId) {
        return respond(proposalId, userId, MeetupStatus.ACCEPTED, RecoveryStatus.MEETUP_CONFIRMED, null);
    }

    @Transactional
    public MeetupProposalDto decline(Long proposalId, Long userId, String reason) {
        return respond(proposalId, userId, MeetupStatus.DECLINED, RecoveryStatus.FOUND, reason);
    }

    /**
     * 제안을 받은 쪽(작성자가 아닌 참여자)만 응답할 수 있다.
     */
    private MeetupProposalDto respond(Long proposalId, Long userId, MeetupStatus answer,
                                      RecoveryStatus nextStatus, String reason) {
        MeetupProposal proposal = meetupProposalRepository.findDetailById(proposalId)
                .orElseThrow(() -> CustomException.type(MeetupErrorCode.PROPOSAL_NOT_FOUND));
        RecoveryEvent recoveryEvent = proposal.getRecoveryEvent();
        Disc disc = recoveryEvent.getDisc();

        boolean isOwner = disc.isOwnedBy(userId);
        if (!isOwner && !recoveryEvent.isFinder(userId)) {
            throw CustomException.type(RecoveryErrorCode.NOT_PARTICIPANT);
        }
        if (proposal.getProposedById().equals(userId)) {
            throw CustomException.type(MeetupErrorCode.CANNOT_RESPOND_OWN_PROPOSAL);
        }
        if (proposal.getStatus() != MeetupStatus.PENDING) {
            throw CustomException.type(MeetupErrorCode.PROPOSAL_NOT_PENDING, proposal.getStatus());
        }

        Long recoveryEventId = recoveryEvent.getId();
        Long discId = disc.getId();
        Long authorId = proposal.getProposedById();
        String responderName = (isOwner ? disc.getOwner() : recoveryEvent.getFinder()).getDisplayName(SOMEONE);
        String locationName = proposal.getLocationName();
        String discLabel = disc.getLabel();

        if (meetupProposalRepository.respond(proposalId, MeetupStatus.PENDING, answer) == 0) {
            throw CustomException.type(MeetupErrorCode.PROPOSAL_NOT_PENDING);
        }
        int moved = recoveryEventRepository.transition(
                recoveryEventId, EnumSet.of(RecoveryStatus.MEETUP_PROPOSED), nextStatus, now());
        if (moved == 0) {
            throw invalidState(recoveryEventId);
        }

        if (answer == MeetupStatus.ACCEPTED) {
            publish(authorId, NotificationType.MEETUP_ACCEPTED,
                    "만남 제안이 수락되었습니다",
                    String.format("%s님이 %s 디스크 만남 제안(%s)을 수락했습니다.", responderName, discLabel, locationName),
                    payload(recoveryEventId, discId, proposalId));
        } else {
            String body = String.format("%s님이 %s 디스크 만남 제안(%s)을 거절했습니다.", responderName, discLabel, locationName);
            if (reason != null && !reason.isBlank()) {
                body = body + " 사유: " + reason;
            }
            publish(authorId, NotificationType.MEETUP_DECLINED, "만남 제안이 거절되었습니다", body,
                    payload(recoveryEventId, discId, proposalId));
        }

        log.info("만남 제안 응답: proposalId={}, answer={}, by={}", proposalId, answer, userId);
        return meetupProposalRepository.findById(proposalId)
                .map(MeetupProposalDto::from)
                .orElseThrow(() -> CustomException.type(MeetupErrorCode.PROPOSAL_NOT_FOUND));
    }

    @Transactional(readOnly = true)
    public List<MeetupProposalDto> listProposals(Long recoveryEventId, Long userId) {
        RecoveryEvent recoveryEvent = recoveryEventRepository.findDetailById(recoveryEventId)
                .orElseThrow(() -> CustomException.type(RecoveryErrorCode.RECOVERY_NOT_FOUND));
        if (!recoveryEvent.getDisc().isOwnedBy(userId) && !recoveryEvent.isFinder(userId)) {
            throw CustomException.type(RecoveryErrorCode.NOT_PARTICIPANT);
        }

        return meetupProposalRepository.findAllByRecoveryEventId(recoveryEventId)
                .stream()
                .map(MeetupProposalDto::from)
                .toList();
    }

    private CustomException invalidState(Long recoveryEventId) {
        RecoveryStatus current = recoveryEventRepository.findById(recoveryEventId)
                .map(RecoveryEvent::getStatus)
                .orElse(null);
        return CustomException.type(RecoveryErrorCode.INVALID_STATE, current);
    }

    private NotificationPayload payload(Long recoveryEventId, Long discId, Long proposalId) {
        return NotificationPayload.builder()
                .recoveryEventId(recoveryEventId)
                .discId(discId)
                .proposalId(proposalId)
                .build();
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
