package org.dongguk.discrecovery.core.exception;

import lombok.Getter;

@Getter
public class CustomException extends RuntimeException {
    private final ErrorCode errorCode;

    /**
     * 클라이언트 디버깅용 부가 정보 (예: 현재 회수 상태)
     */
    private final String detail;

    public CustomException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public CustomException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public static CustomException type(ErrorCode errorCode) {
        return new CustomException(errorCode);
    }

    public static CustomException type(ErrorCode errorCode, Object detail) {
        return new CustomException(errorCode, detail == null ? null : detail.toString(), null);
    }

    public static CustomException type(ErrorCode errorCode, Throwable cause) {
        return new CustomException(errorCode, null, cause);
    }
}
