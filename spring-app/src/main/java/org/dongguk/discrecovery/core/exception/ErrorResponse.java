package org.dongguk.discrecovery.core.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String message,
        String currentStatus
) {
    public static ErrorResponse of(ErrorCode errorCode) {
        return of(errorCode, null);
    }

    public static ErrorResponse of(ErrorCode errorCode, String currentStatus) {
        return ErrorResponse.builder()
                .code(errorCode.getCode())
                .message(errorCode.getMessage())
                .currentStatus(currentStatus)
                .build();
    }
}
