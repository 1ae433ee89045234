package org.dongguk.discrecovery.domain.qrcode;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.dongguk.discrecovery.core.exception.ErrorCode;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public enum QrCodeErrorCode implements ErrorCode {
    QR_CODE_NOT_FOUND(HttpStatus.NOT_FOUND, "존재하지 않는 QR 코드입니다."),
    NOT_ASSIGNEE(HttpStatus.FORBIDDEN, "본인에게 할당된 QR 코드가 아닙니다."),
    INVALID_QR_STATUS(HttpStatus.BAD_REQUEST, "현재 QR 코드 상태에서는 처리할 수 없습니다.");

    private final HttpStatus status;
    private final String message;
}
