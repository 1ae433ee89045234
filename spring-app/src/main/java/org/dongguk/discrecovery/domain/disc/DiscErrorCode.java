package org.dongguk.discrecovery.domain.disc;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.dongguk.discrecovery.core.exception.ErrorCode;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public enum DiscErrorCode implements ErrorCode {
    DISC_NOT_FOUND(HttpStatus.NOT_FOUND, "존재하지 않는 디스크입니다."),
    NOT_DISC_OWNER(HttpStatus.FORBIDDEN, "디스크 소유자만 처리할 수 있습니다."),
    ALREADY_OWNED(HttpStatus.BAD_REQUEST, "이미 소유자가 있는 디스크입니다."),
    QR_CODE_NOT_LINKED(HttpStatus.BAD_REQUEST, "디스크에 연결된 QR 코드가 없습니다."),
    QR_CODE_ALREADY_LINKED(HttpStatus.BAD_REQUEST, "디스크에 이미 QR 코드가 연결되어 있습니다.");

    private final HttpStatus status;
    private final String message;
}
