package org.dongguk.discrecovery.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.domain.user.User;
import org.dongguk.discrecovery.domain.user.UserErrorCode;
import org.dongguk.discrecovery.dto.response.UserDto;
import org.dongguk.discrecovery.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService {
    private final UserRepository userRepository;

    /**
     * 사용자 정보 조회
     */
    public UserDto getUserInfo(Long userId) {
        return UserDto.from(getUser(userId));
    }

    /**
     * Expo 푸시 토큰 등록 (null 이면 해제)
     */
    @Transactional
    public UserDto updatePushToken(Long userId, String pushToken) {
        User user = getUser(userId);
        user.updatePushToken(pushToken == null || pushToken.isBlank() ? null : pushToken.trim());
        log.info("푸시 토큰 갱신: userId={}, enabled={}", userId, user.getPushToken() != null);
        return UserDto.from(user);
    }

    private User getUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> CustomException.type(UserErrorCode.USER_NOT_FOUND));
    }
}
