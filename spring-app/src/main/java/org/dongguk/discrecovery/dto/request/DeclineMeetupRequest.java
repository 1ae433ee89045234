package org.dongguk.discrecovery.dto.request;

import jakarta.validation.constraints.Size;

public record DeclineMeetupRequest(
        @Size(max = 500) String reason
) {
}
