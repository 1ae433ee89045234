package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.domain.disc.Disc;
import org.dongguk.discrecovery.domain.disc.DiscErrorCode;
import org.dongguk.discrecovery.dto.response.DiscDto;
import org.dongguk.discrecovery.repository.DiscRepository;
import org.dongguk.discrecovery.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimService {
    private final DiscRepository discRepository;
    private final UserRepository userRepository;
    private final RecoveryLifecycleService recoveryLifecycleService;
    private final Clock clock;

    /**
     * 주인 없는 디스크를 클레임한다. 동시에 여러 명이 시도해도 한 명만 성공한다.
     */
    @Transactional
    public DiscDto claim(Long discId, Long userId) {
        Disc disc = discRepository.findById(discId)
                .orElseThrow(() -> CustomException.type(DiscErrorCode.DISC_NOT_FOUND));
        if (disc.getOwnerId() != null) {
            throw CustomException.type(DiscErrorCode.ALREADY_OWNED);
        }

        int claimed = discRepository.claimOwnership(
                discId,
                userRepository.getReferenceById(userId),
                LocalDateTime.now(clock)
        );
        if (claimed == 0) {
            log.info("클레임 경합 실패: discId={}, userId={}", discId, userId);
            throw CustomException.type(DiscErrorCode.ALREADY_OWNED);
        }

        recoveryLifecycleService.closeAbandoned(discId);
        log.info("디스크 클레임: discId={}, userId={}", discId, userId);

        return discRepository.findById(discId)
                .map(DiscDto::from)
                .orElseThrow(() -> CustomException.type(DiscErrorCode.DISC_NOT_FOUND));
    }
}
