package org.dongguk.discrecovery.service;

import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dongguk.discrecovery.domain.user.User;
import org.dongguk.discrecovery.repository.UserRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExpoPushService {
    static final String DEVICE_NOT_REGISTERED = "DeviceNotRegistered";

    private final RestClient expoPushRestClient;
    private final UserRepository userRepository;

    @Builder
    record ExpoPushMessage(String to, String title, String body, String sound, Map<String, Object> data) {
    }

    /**
     * Expo 푸시 발송. 실패해도 예외를 던지지 않는다.
     */
    public void send(User recipient, String title, String body, Map<String, Object> data) {
        String pushToken = recipient.getPushToken();
        if (pushToken == null || pushToken.isBlank()) {
            log.debug("푸시 토큰 없음, 발송 생략: userId={}", recipient.getId());
            return;
        }

        ExpoPushMessage message = ExpoPushMessage.builder()
                .to(pushToken)
                .title(title)
                .body(body)
                .sound("default")
                .data(data)
                .build();

        try {
            Map<String, Object> response = expoPushRestClient.post()
                    .uri("/send")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(message)
                    .retrieve()
                    .body(Map.class);

            handleTicket(recipient.getId(), pushToken, response);
        } catch (RestClientException | DataAccessException e) {
            log.warn("Expo 푸시 발송 실패: userId={}, error={}", recipient.getId(), e.getMessage());
        }
    }

    private void handleTicket(Long userId, String pushToken, Map<String, Object> response) {
        if (response == null || !(response.get("data") instanceof Map<?, ?> ticket)) {
            log.warn("Expo 푸시 응답 형식 오류: userId={}, response={}", userId, response);
            return;
        }

        if (!"error".equals(ticket.get("status"))) {
            log.info("Expo 푸시 발송 완료: userId={}", userId);
            return;
        }

        Object details = ticket.get("details");
        String error = details instanceof Map<?, ?> map ? String.valueOf(map.get("error")) : null;
        log.warn("Expo 푸시 티켓 오류: userId={}, error={}, message={}", userId, error, ticket.get("message"));

        if (DEVICE_NOT_REGISTERED.equals(error)) {
            int cleared = userRepository.clearPushToken(userId, pushToken);
            log.info("등록 해제된 푸시 토큰 삭제: userId={}, cleared={}", userId, cleared);
        }
    }
}
