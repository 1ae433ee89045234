package org.dongguk.discrecovery.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import org.dongguk.discrecovery.domain.type.QrCodeStatus;

/**
 * QR 공개 조회 결과. 상태마다 채워지는 필드가 다르다.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QrLookupDto(
        boolean found,
        Boolean qrExists,
        QrCodeStatus qrStatus,
        String qrCode,
        Long qrCodeId,
        Boolean isAssignee,
        DiscSummaryDto disc,
        Boolean hasActiveRecovery,
        Boolean isOwner,
        Boolean isClaimable
) {
    public static QrLookupDto notFound() {
        return QrLookupDto.builder()
                .found(false)
                .qrExists(false)
                .build();
    }
}
