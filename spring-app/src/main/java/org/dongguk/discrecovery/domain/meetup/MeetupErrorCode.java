package org.dongguk.discrecovery.domain.meetup;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.dongguk.discrecovery.core.exception.ErrorCode;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public enum MeetupErrorCode implements ErrorCode {
    PROPOSAL_NOT_FOUND(HttpStatus.NOT_FOUND, "존재하지 않는 만남 제안입니다."),
    CANNOT_RESPOND_OWN_PROPOSAL(HttpStatus.FORBIDDEN, "본인이 보낸 제안에는 응답할 수 없습니다."),
    PROPOSAL_NOT_PENDING(HttpStatus.BAD_REQUEST, "이미 처리된 만남 제안입니다.");

    private final HttpStatus status;
    private final String message;
}
