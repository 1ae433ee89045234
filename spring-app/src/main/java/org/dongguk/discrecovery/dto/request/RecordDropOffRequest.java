package org.dongguk.discrecovery.dto.request;

import org.springframework.web.multipart.MultipartFile;

public record RecordDropOffRequest(
        MultipartFile photo,
        Double latitude,
        Double longitude,
        String locationNotes
) {
}
