package org.dongguk.discrecovery.domain.dropoff;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.dongguk.discrecovery.core.exception.ErrorCode;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public enum DropOffErrorCode implements ErrorCode {
    INVALID_PHOTO(HttpStatus.BAD_REQUEST, "jpeg, png, webp, heic 형식의 허용 용량 이하 사진만 업로드할 수 있습니다.");

    private final HttpStatus status;
    private final String message;
}
