package org.dongguk.discrecovery.repository;

import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.DisplayPreference;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.domain.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.util.EnumSet;

import static org.dongguk.discrecovery.support.TestFixtures.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class RecoveryEventRepositoryTest {
    @Autowired
    private TestEntityManager em;

    @Autowired
    private RecoveryEventRepository recoveryEventRepository;

    private User owner;
    private User finder;
    private Disc disc;

    @BeforeEach
    void setUp() {
        owner = em.persist(User.create("owner", null, "owner@example.com", DisplayPreference.USERNAME, NOW));
        finder = em.persist(User.create("finder", null, "finder@example.com", DisplayPreference.USERNAME, NOW));
        disc = em.persist(Disc.create(owner, null, null, "Innova", "Destroyer", "Star", "blue", null, NOW));
        em.flush();
    }

    private RecoveryEvent event(RecoveryStatus status) {
        RecoveryEvent event = em.persistAndFlush(RecoveryEvent.create(disc, finder, NOW));
        if (status != RecoveryStatus.FOUND) {
            recoveryEventRepository.transition(event.getId(), EnumSet.of(RecoveryStatus.FOUND), status, NOW);
        }
        return event;
    }

    private RecoveryStatus statusOf(RecoveryEvent event) {
        return recoveryEventRepository.findById(event.getId()).orElseThrow().getStatus();
    }

    @Test
    void transitionOnlyFromExpectedStatus() {
        RecoveryEvent event = event(RecoveryStatus.FOUND);

        assertEquals(0, recoveryEventRepository.transition(
                event.getId(), EnumSet.of(RecoveryStatus.DROPPED_OFF), RecoveryStatus.ABANDONED, NOW));
        assertEquals(1, recoveryEventRepository.transition(
                event.getId(), RecoveryStatus.PROPOSABLE, RecoveryStatus.MEETUP_PROPOSED, NOW));

        assertEquals(RecoveryStatus.MEETUP_PROPOSED, statusOf(event));
    }

    @Test
    void surrenderRecordsOriginalOwner() {
        RecoveryEvent event = event(RecoveryStatus.MEETUP_CONFIRMED);

        assertEquals(1, recoveryEventRepository.surrender(
                event.getId(), RecoveryStatus.SURRENDERABLE, RecoveryStatus.SURRENDERED, owner, NOW));
        assertEquals(0, recoveryEventRepository.surrender(
                event.getId(), RecoveryStatus.SURRENDERABLE, RecoveryStatus.SURRENDERED, owner, NOW));

        RecoveryEvent reloaded = recoveryEventRepository.findDetailById(event.getId()).orElseThrow();
        assertEquals(RecoveryStatus.SURRENDERED, reloaded.getStatus());
        assertEquals(owner.getId(), reloaded.getOriginalOwnerId());
        assertEquals(NOW, reloaded.getSurrenderedAt());
    }

    @Test
    void closeAbandonedTouchesOnlyAbandonedEvents() {
        RecoveryEvent abandoned = event(RecoveryStatus.ABANDONED);
        RecoveryEvent active = event(RecoveryStatus.FOUND);

        int closed = recoveryEventRepository.closeAbandoned(
                disc.getId(), RecoveryStatus.ABANDONED, RecoveryStatus.RECOVERED, NOW.plusHours(1));

        assertEquals(1, closed);
        assertEquals(RecoveryStatus.RECOVERED, statusOf(abandoned));
        assertEquals(RecoveryStatus.FOUND, statusOf(active));
        assertEquals(0, recoveryEventRepository.countByDiscIdAndStatus(disc.getId(), RecoveryStatus.ABANDONED));
    }

    @Test
    void rewardIsMarkedPaidOnce() {
        RecoveryEvent event = event(RecoveryStatus.MEETUP_CONFIRMED);
        assertEquals(0, recoveryEventRepository.markRewardPaid(event.getId(), RecoveryStatus.RECOVERED, NOW));

        recoveryEventRepository.markRecovered(event.getId(), RecoveryStatus.MEETUP_CONFIRMED, RecoveryStatus.RECOVERED, NOW);
        assertEquals(1, recoveryEventRepository.markRewardPaid(event.getId(), RecoveryStatus.RECOVERED, NOW));
        assertEquals(0, recoveryEventRepository.markRewardPaid(event.getId(), RecoveryStatus.RECOVERED, NOW.plusDays(1)));

        assertEquals(NOW, recoveryEventRepository.findById(event.getId()).orElseThrow().getRewardPaidAt());
    }

    @Test
    void activeRecoveryLookup() {
        RecoveryEvent event = event(RecoveryStatus.FOUND);
        assertTrue(recoveryEventRepository.existsByDiscIdAndStatusIn(disc.getId(), RecoveryStatus.ACTIVE));

        recoveryEventRepository.transition(event.getId(), RecoveryStatus.ACTIVE, RecoveryStatus.CANCELLED, NOW);
        assertFalse(recoveryEventRepository.existsByDiscIdAndStatusIn(disc.getId(), RecoveryStatus.ACTIVE));
    }
}
