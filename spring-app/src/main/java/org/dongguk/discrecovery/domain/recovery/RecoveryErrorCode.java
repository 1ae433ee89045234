package org.dongguk.discrecovery.domain.recovery;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.dongguk.discrecovery.core.exception.ErrorCode;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public enum RecoveryErrorCode implements ErrorCode {
    RECOVERY_NOT_FOUND(HttpStatus.NOT_FOUND, "존재하지 않는 회수 이벤트입니다."),
    NOT_DISC_OWNER(HttpStatus.FORBIDDEN, "디스크 소유자만 처리할 수 있습니다."),
    NOT_FINDER(HttpStatus.FORBIDDEN, "습득자만 처리할 수 있습니다."),
    NOT_PARTICIPANT(HttpStatus.FORBIDDEN, "회수 참여자만 처리할 수 있습니다."),
    INVALID_STATE(HttpStatus.BAD_REQUEST, "현재 회수 상태에서는 처리할 수 없습니다."),
    DROP_OFF_MISSING(HttpStatus.BAD_REQUEST, "드롭오프 기록이 없습니다."),
    NO_REWARD(HttpStatus.BAD_REQUEST, "보상금이 설정되지 않은 디스크입니다.");

    private final HttpStatus status;
    private final String message;
}
