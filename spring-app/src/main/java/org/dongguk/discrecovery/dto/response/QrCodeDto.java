package org.dongguk.discrecovery.dto.response;

import lombok.Builder;
import org.dongguk.discrecovery.domain.qrcode.QrCode;
import org.dongguk.discrecovery.domain.type.QrCodeStatus;

import java.time.LocalDateTime;

@Builder
public record QrCodeDto(
        Long id,
        String shortCode,
        QrCodeStatus status,
        Long assignedTo,
        LocalDateTime updatedAt
) {
    public static QrCodeDto from(QrCode qrCode) {
        return QrCodeDto.builder()
                .id(qrCode.getId())
                .shortCode(qrCode.getShortCode())
                .status(qrCode.getStatus())
                .assignedTo(qrCode.getAssignedToId())
                .updatedAt(qrCode.getUpdatedAt())
                .build();
    }
}
