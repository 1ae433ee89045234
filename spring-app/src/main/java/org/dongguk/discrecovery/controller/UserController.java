package org.dongguk.discrecovery.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.dongguk.discrecovery.core.annotation.UserId;
import org.dongguk.discrecovery.dto.request.UpdatePushTokenRequest;
import org.dongguk.discrecovery.dto.response.UserDto;
import org.dongguk.discrecovery.service.UserService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/users")
public class UserController {
    private final UserService userService;

    /**
     * 내 정보 조회
     */
    @GetMapping("/me")
    public ResponseEntity<UserDto> getMyInfo(@UserId Long userId) {
        return ResponseEntity.ok(userService.getUserInfo(userId));
    }

    /**
     * 푸시 토큰 등록
     */
    @PutMapping("/me/push-token")
    public ResponseEntity<UserDto> updatePushToken(
            @UserId Long userId,
            @Valid @RequestBody UpdatePushTokenRequest request
    ) {
        return ResponseEntity.ok(userService.updatePushToken(userId, request.pushToken()));
    }
}
