package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.domain.recovery.RecoveryErrorCode;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.RecoveryStatus;
import org.dongguk.discrecovery.dto.response.RewardPaidDto;
import org.dongguk.discrecovery.repository.RecoveryEventRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class RewardService {
    private final RecoveryEventRepository recoveryEventRepository;
    private final Clock clock;

    /**
     * 습득자가 보상금 수령을 확인한다. 여러 번 호출해도 처음 기록된 시각을 돌려준다.
     */
    @Transactional
    public RewardPaidDto markPaid(Long recoveryEventId, Long userId) {
        RecoveryEvent recoveryEvent = recoveryEventRepository.findDetailById(recoveryEventId)
                .orElseThrow(() -> CustomException.type(RecoveryErrorCode.RECOVERY_NOT_FOUND));
        if (!recoveryEvent.isFinder(userId)) {
            throw CustomException.type(RecoveryErrorCode.NOT_FINDER);
        }
        if (recoveryEvent.getStatus() != RecoveryStatus.RECOVERED) {
            throw CustomException.type(RecoveryErrorCode.INVALID_STATE, recoveryEvent.getStatus());
        }

        // 이미 기록되어 있으면 보상금 설정 여부와 관계없이 성공
        if (recoveryEvent.getRewardPaidAt() != null) {
            return paid(recoveryEventId, recoveryEvent.getRewardPaidAt());
        }
        if (!recoveryEvent.getDisc().hasReward()) {
            throw CustomException.type(RecoveryErrorCode.NO_REWARD);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (recoveryEventRepository.markRewardPaid(recoveryEventId, RecoveryStatus.RECOVERED, now) == 1) {
            log.info("보상금 수령 확인: recoveryEventId={}, finderId={}", recoveryEventId, userId);
            return paid(recoveryEventId, now);
        }

        // 동시 호출에 밀린 경우 먼저 기록된 시각을 돌려준다
        RecoveryEvent latest = recoveryEventRepository.findById(recoveryEventId)
                .orElseThrow(() -> CustomException.type(RecoveryErrorCode.RECOVERY_NOT_FOUND));
        if (latest.getRewardPaidAt() == null) {
            throw CustomException.type(RecoveryErrorCode.INVALID_STATE, latest.getStatus());
        }
        return paid(recoveryEventId, latest.getRewardPaidAt());
    }

    private RewardPaidDto paid(Long recoveryEventId, LocalDateTime rewardPaidAt) {
        return RewardPaidDto.builder()
                .success(true)
                .recoveryEventId(recoveryEventId)
                .rewardPaidAt(rewardPaidAt)
                .build();
    }
}
