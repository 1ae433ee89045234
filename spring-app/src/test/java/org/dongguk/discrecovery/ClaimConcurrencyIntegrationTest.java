package org.dongguk.discrecovery;

import com.google.cloud.storage.Storage;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.disc.DiscErrorCode;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.DisplayPreference;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.domain.user.User;
import org.dongguk.discrecovery.dto.response.DiscDto;
import org.dongguk.discrecovery.repository.DiscRepository;
import org.dongguk.discrecovery.repository.NotificationRepository;
import org.dongguk.discrecovery.repository.RecoveryEventRepository;
import org.dongguk.discrecovery.repository.UserRepository;
import org.dongguk.discrecovery.service.ClaimService;
import org.dongguk.discrecovery.service.RecoveryLifecycleService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * 주인 없는 디스크에 여러 사용자가 실제 트랜잭션으로 동시에 클레임한다.
 */
@SpringBootTest
class ClaimConcurrencyIntegrationTest {
    private static final int CLAIMANTS = 8;

    @MockBean
    private Storage storage;

    @SpyBean
    private RecoveryLifecycleService recoveryLifecycleService;

    @Autowired
    private ClaimService claimService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private DiscRepository discRepository;

    @Autowired
    private RecoveryEventRepository recoveryEventRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    private final List<User> claimants = new ArrayList<>();
    private Disc disc;
    private RecoveryEvent abandoned;

    @BeforeEach
    void setUp() {
        LocalDateTime now = LocalDateTime.now();
        User finder = userRepository.save(User.create("finder", null, "finder@example.com", DisplayPreference.USERNAME, now));
        for (int i = 0; i < CLAIMANTS; i++) {
            claimants.add(userRepository.save(User.create(
                    "claimant" + i, null, "claimant" + i + "@example.com", DisplayPreference.USERNAME, now)));
        }

        disc = discRepository.save(Disc.create(null, null, "Orange Buzzz", "Discraft", "Buzzz", "ESP", "orange",
                BigDecimal.ZERO, now));
        abandoned = recoveryEventRepository.save(RecoveryEvent.create(disc, finder, now));
        recoveryEventRepository.transition(
                abandoned.getId(), EnumSet.of(RecoveryStatus.FOUND), RecoveryStatus.ABANDONED, now);
    }

    @AfterEach
    void tearDown() {
        notificationRepository.deleteAllInBatch();
        recoveryEventRepository.deleteAllInBatch();
        discRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }

    @Test
    void onlyOneConcurrentClaimantWins() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(CLAIMANTS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<DiscDto>> futures = new ArrayList<>();
        try {
            for (User claimant : claimants) {
                Long claimantId = claimant.getId();
                Callable<DiscDto> task = () -> {
                    start.await();
                    return claimService.claim(disc.getId(), claimantId);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            List<DiscDto> winners = new ArrayList<>();
            int alreadyOwned = 0;
            for (Future<DiscDto> future : futures) {
                try {
                    winners.add(future.get(10, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    CustomException failure = assertInstanceOf(CustomException.class, e.getCause());
                    assertEquals(DiscErrorCode.ALREADY_OWNED, failure.getErrorCode());
                    alreadyOwned++;
                }
            }

            assertEquals(1, winners.size());
            assertEquals(CLAIMANTS - 1, alreadyOwned);
            assertEquals(winners.get(0).ownerId(), discRepository.findById(disc.getId()).orElseThrow().getOwnerId());

            verify(recoveryLifecycleService, times(1)).closeAbandoned(disc.getId());
            RecoveryEvent closed = recoveryEventRepository.findById(abandoned.getId()).orElseThrow();
            assertEquals(RecoveryStatus.RECOVERED, closed.getStatus());
            assertNotNull(closed.getRecoveredAt());
            assertEquals(0, recoveryEventRepository.countByDiscIdAndStatus(disc.getId(), RecoveryStatus.ABANDONED));
        } finally {
            executor.shutdownNow();
        }
    }
}
