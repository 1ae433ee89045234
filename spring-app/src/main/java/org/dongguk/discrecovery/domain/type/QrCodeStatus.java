package org.dongguk.discrecovery.domain.type;

/**
 * QR 코드 상태
 */
public enum QrCodeStatus {
    GENERATED,      // 발급만 됨
    ASSIGNED,       // 사용자에게 할당됨
    ACTIVE,         // 디스크에 연결됨
    DEACTIVATED     // 비활성화
}
