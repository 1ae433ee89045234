package org.dongguk.discrecovery.repository;

import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.meetup.MeetupProposal;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.DisplayPreference;
import org.dongguk.discrecovery.domain.type.MeetupStatus;
import org.dongguk.discrecovery.domain.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.util.List;

import static org.dongguk.discrecovery.support.TestFixtures.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DataJpaTest
class MeetupProposalRepositoryTest {
    @Autowired
    private TestEntityManager em;

    @Autowired
    private MeetupProposalRepository meetupProposalRepository;

    private User owner;
    private User finder;
    private RecoveryEvent event;

    @BeforeEach
    void setUp() {
        owner = em.persist(User.create("owner", null, "owner@example.com", DisplayPreference.USERNAME, NOW));
        finder = em.persist(User.create("finder", null, "finder@example.com", DisplayPreference.USERNAME, NOW));
        Disc disc = em.persist(Disc.create(owner, null, null, "Innova", "Destroyer", "Star", "blue", null, NOW));
        event = em.persist(RecoveryEvent.create(disc, finder, NOW));
        em.flush();
    }

    private MeetupProposal propose(User by, String location, int minutesLater) {
        return em.persistAndFlush(MeetupProposal.create(
                event, by, location, null, null, NOW.plusDays(1), null, NOW.plusMinutes(minutesLater)));
    }

    @Test
    void declineAllPendingLeavesAnsweredProposals() {
        MeetupProposal first = propose(owner, "Maple Hill", 0);
        MeetupProposal second = propose(finder, "Borderland", 5);
        meetupProposalRepository.respond(first.getId(), MeetupStatus.PENDING, MeetupStatus.DECLINED);

        int declined = meetupProposalRepository.declineAllPending(event.getId(), MeetupStatus.PENDING, MeetupStatus.DECLINED);

        assertEquals(1, declined);
        assertEquals(MeetupStatus.DECLINED, meetupProposalRepository.findById(second.getId()).orElseThrow().getStatus());
        assertEquals(0, meetupProposalRepository.countByRecoveryEventIdAndStatus(event.getId(), MeetupStatus.PENDING));
    }

    @Test
    void respondOnlyWhilePending() {
        MeetupProposal proposal = propose(owner, "Maple Hill", 0);

        assertEquals(1, meetupProposalRepository.respond(proposal.getId(), MeetupStatus.PENDING, MeetupStatus.ACCEPTED));
        assertEquals(0, meetupProposalRepository.respond(proposal.getId(), MeetupStatus.PENDING, MeetupStatus.DECLINED));

        assertEquals(MeetupStatus.ACCEPTED, meetupProposalRepository.findById(proposal.getId()).orElseThrow().getStatus());
    }

    @Test
    void proposalsAreListedNewestFirst() {
        propose(owner, "Maple Hill", 0);
        propose(finder, "Borderland", 5);
        propose(owner, "Pier Park", 10);

        List<MeetupProposal> proposals = meetupProposalRepository.findAllByRecoveryEventId(event.getId());

        assertEquals(List.of("Pier Park", "Borderland", "Maple Hill"),
                proposals.stream().map(MeetupProposal::getLocationName).toList());
    }

    @Test
    void lockedReadReturnsPendingOnly() {
        MeetupProposal first = propose(owner, "Maple Hill", 0);
        propose(finder, "Borderland", 5);
        meetupProposalRepository.respond(first.getId(), MeetupStatus.PENDING, MeetupStatus.DECLINED);

        List<MeetupProposal> pending = meetupProposalRepository.findForUpdate(event.getId(), MeetupStatus.PENDING);

        assertEquals(1, pending.size());
        assertEquals(finder.getId(), pending.get(0).getProposedById());
    }
}
