package org.dongguk.discrecovery.dto.request;

import jakarta.validation.constraints.Size;

public record UpdatePushTokenRequest(
        @Size(max = 200) String pushToken
) {
}
