package org.dongguk.discrecovery.service;

import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.meetup.MeetupErrorCode;
import org.dongguk.discrecovery.domain.meetup.MeetupProposal;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.dongguk.discrecovery.support.TestFixtures.CLOCK;
import static org.dongguk.discrecovery.support.TestFixtures.NOW;
import static org.dongguk.discrecovery.support.TestFixtures.disc;
import static org.dongguk.discrecovery.support.TestFixtures.proposal;
import static org.dongguk.discrecovery.support.TestFixtures.recoveryEvent;
import static org.dongguk.discrecovery.support.TestFixtures.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MeetupNegotiationServiceTest {
    private RecoveryEventRepository recoveryEventRepository;
    private MeetupProposalRepository meetupProposalRepository;
    private UserRepository userRepository;
    private ApplicationEventPublisher eventPublisher;
    private MeetupNegotiationService service;

    private User owner;
    private User finder;
    private RecoveryEvent event;

    @BeforeEach
    void setUp() {
        recoveryEventRepository = mock(RecoveryEventRepository.class);
        meetupProposalRepository = mock(MeetupProposalRepository.class);
        userRepository = mock(UserRepository.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        service = new MeetupNegotiationService(
                recoveryEventRepository, meetupProposalRepository, userRepository, eventPublisher, CLOCK);

        owner = user(1L, "owner");
        finder = user(2L, "finder");
        Disc disc = disc(10L, owner, null, null);
        event = recoveryEvent(100L, disc, finder, RecoveryStatus.FOUND);

        when(recoveryEventRepository.findDetailById(100L)).thenReturn(Optional.of(event));
        when(recoveryEventRepository.getReferenceById(100L)).thenReturn(event);
        when(userRepository.getReferenceById(1L)).thenReturn(owner);
        when(userRepository.getReferenceById(2L)).thenReturn(finder);
        when(recoveryEventRepository.transition(eq(100L), any(), eq(RecoveryStatus.MEETUP_PROPOSED), eq(NOW)))
                .thenReturn(1);
        when(meetupProposalRepository.save(any(MeetupProposal.class))).thenAnswer(invocation -> {
            MeetupProposal saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 700L);
            return saved;
        });
    }

    private ProposeMeetupRequest request(String location) {
        return new ProposeMeetupRequest(location, 42.1, -71.2, NOW.plusDays(2), "see you there");
    }

    private List<NotificationEvent> publishedNotifications(int expected) {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(expected)).publishEvent(captor.capture());
        return captor.getAllValues().stream()
                .map(NotificationEvent.class::cast)
                .toList();
    }

    @Test
    void ownerProposalMovesEventToProposedAndNotifiesFinder() {
        when(meetupProposalRepository.findForUpdate(100L, MeetupStatus.PENDING)).thenReturn(List.of());

        MeetupProposalDto result = service.propose(100L, 1L, request("Maple Hill"));

        assertEquals(700L, result.id());
        assertEquals(1L, result.proposedBy());
        assertEquals(MeetupStatus.PENDING, result.status());
        verify(meetupProposalRepository, never()).declineAllPending(anyLong(), any(), any());

        List<NotificationEvent> notifications = publishedNotifications(1);
        assertEquals(2L, notifications.get(0).recipientId());
        assertEquals(NotificationType.MEETUP_PROPOSED, notifications.get(0).type());
        assertEquals(700L, notifications.get(0).payload().getProposalId());
    }

    @Test
    void finderCounterDeclinesOwnerProposalAndNotifiesOwner() {
        MeetupProposal ownerProposal = proposal(600L, event, owner, MeetupStatus.PENDING);
        when(meetupProposalRepository.findForUpdate(100L, MeetupStatus.PENDING)).thenReturn(List.of(ownerProposal));
        when(meetupProposalRepository.declineAllPending(100L, MeetupStatus.PENDING, MeetupStatus.DECLINED)).thenReturn(1);

        MeetupProposalDto result = service.propose(100L, 2L, request("Borderland"));

        assertEquals(2L, result.proposedBy());
        verify(meetupProposalRepository).declineAllPending(100L, MeetupStatus.PENDING, MeetupStatus.DECLINED);

        List<NotificationEvent> notifications = publishedNotifications(2);
        assertTrue(notifications.stream().allMatch(n -> n.recipientId().equals(1L)));
        assertTrue(notifications.stream().anyMatch(n -> n.type() == NotificationType.MEETUP_COUNTERED));
        assertTrue(notifications.stream().anyMatch(n -> n.type() == NotificationType.MEETUP_PROPOSED));
    }

    @Test
    void replacingOwnPendingProposalSendsNoCounterNotification() {
        MeetupProposal ownProposal = proposal(600L, event, owner, MeetupStatus.PENDING);
        when(meetupProposalRepository.findForUpdate(100L, MeetupStatus.PENDING)).thenReturn(List.of(ownProposal));

        service.propose(100L, 1L, request("Maple Hill, hole 9"));

        verify(meetupProposalRepository).declineAllPending(100L, MeetupStatus.PENDING, MeetupStatus.DECLINED);
        List<NotificationEvent> notifications = publishedNotifications(1);
        assertEquals(NotificationType.MEETUP_PROPOSED, notifications.get(0).type());
    }

    @Test
    void finderCanProposeAfterDropOff() {
        ReflectionTestUtils.setField(event, "status", RecoveryStatus.DROPPED_OFF);
        when(meetupProposalRepository.findForUpdate(100L, MeetupStatus.PENDING)).thenReturn(List.of());

        MeetupProposalDto result = service.propose(100L, 2L, request("Maple Hill"));

        assertEquals(MeetupStatus.PENDING, result.status());
        verify(recoveryEventRepository).transition(
                eq(100L), eq(RecoveryStatus.PROPOSABLE), eq(RecoveryStatus.MEETUP_PROPOSED), eq(NOW));
        assertTrue(RecoveryStatus.PROPOSABLE.contains(RecoveryStatus.DROPPED_OFF));
        List<NotificationEvent> notifications = publishedNotifications(1);
        assertEquals(1L, notifications.get(0).recipientId());
    }

    @Test
    void proposeOnSurrenderedEventIsInvalidState() {
        ReflectionTestUtils.setField(event, "status", RecoveryStatus.SURRENDERED);

        CustomException e = assertThrows(CustomException.class, () -> service.propose(100L, 2L, request("x")));

        assertEquals(RecoveryErrorCode.INVALID_STATE, e.getErrorCode());
        assertEquals("SURRENDERED", e.getDetail());
        verify(meetupProposalRepository, never()).save(any());
    }

    @Test
    void strangerCannotPropose() {
        CustomException e = assertThrows(CustomException.class, () -> service.propose(100L, 3L, request("x")));

        assertEquals(RecoveryErrorCode.NOT_PARTICIPANT, e.getErrorCode());
    }

    @Test
    void acceptConfirmsMeetupAndNotifiesAuthor() {
        MeetupProposal ownerProposal = proposal(600L, event, owner, MeetupStatus.PENDING);
        when(meetupProposalRepository.findDetailById(600L)).thenReturn(Optional.of(ownerProposal));
        when(meetupProposalRepository.findById(600L)).thenReturn(Optional.of(ownerProposal));
        when(meetupProposalRepository.respond(600L, MeetupStatus.PENDING, MeetupStatus.ACCEPTED)).thenReturn(1);
        when(recoveryEventRepository.transition(eq(100L), any(), eq(RecoveryStatus.MEETUP_CONFIRMED), eq(NOW)))
                .thenReturn(1);

        service.accept(600L, 2L);

        verify(recoveryEventRepository).transition(eq(100L), any(), eq(RecoveryStatus.MEETUP_CONFIRMED), eq(NOW));
        List<NotificationEvent> notifications = publishedNotifications(1);
        assertEquals(1L, notifications.get(0).recipientId());
        assertEquals(NotificationType.MEETUP_ACCEPTED, notifications.get(0).type());
    }

    @Test
    void authorCannotRespondToOwnProposal() {
        MeetupProposal ownerProposal = proposal(600L, event, owner, MeetupStatus.PENDING);
        when(meetupProposalRepository.findDetailById(600L)).thenReturn(Optional.of(ownerProposal));

        CustomException e = assertThrows(CustomException.class, () -> service.accept(600L, 1L));

        assertEquals(MeetupErrorCode.CANNOT_RESPOND_OWN_PROPOSAL, e.getErrorCode());
        verify(meetupProposalRepository, never()).respond(anyLong(), any(), any());
    }

    @Test
    void declineReturnsEventToFoundAndCarriesReason() {
        MeetupProposal finderProposal = proposal(601L, event, finder, MeetupStatus.PENDING);
        when(meetupProposalRepository.findDetailById(601L)).thenReturn(Optional.of(finderProposal));
        when(meetupProposalRepository.findById(601L)).thenReturn(Optional.of(finderProposal));
        when(meetupProposalRepository.respond(601L, MeetupStatus.PENDING, MeetupStatus.DECLINED)).thenReturn(1);
        when(recoveryEventRepository.transition(eq(100L), any(), eq(RecoveryStatus.FOUND), eq(NOW))).thenReturn(1);

        service.decline(601L, 1L, "too far");

        verify(recoveryEventRepository).transition(eq(100L), any(), eq(RecoveryStatus.FOUND), eq(NOW));
        List<NotificationEvent> notifications = publishedNotifications(1);
        assertEquals(2L, notifications.get(0).recipientId());
        assertEquals(NotificationType.MEETUP_DECLINED, notifications.get(0).type());
        assertTrue(notifications.get(0).body().endsWith("too far"));
    }

    @Test
    void respondingToAnsweredProposalFails() {
        MeetupProposal declined = proposal(600L, event, owner, MeetupStatus.DECLINED);
        when(meetupProposalRepository.findDetailById(600L)).thenReturn(Optional.of(declined));

        CustomException e = assertThrows(CustomException.class, () -> service.accept(600L, 2L));

        assertEquals(MeetupErrorCode.PROPOSAL_NOT_PENDING, e.getErrorCode());
    }
}
