package org.dongguk.discrecovery.dto.request;

import jakarta.validation.constraints.NotBlank;

public record LinkQrCodeRequest(
        @NotBlank String qrCode
) {
}
