package org.dongguk.discrecovery.event;

/**
 * 디스크 소유권 이전이 커밋된 뒤 QR 코드를 새 소유자에게 넘기기 위한 이벤트
 */
public record OwnershipTransferredEvent(
        Long discId,
        Long qrCodeId,
        Long newOwnerId
) {
}
