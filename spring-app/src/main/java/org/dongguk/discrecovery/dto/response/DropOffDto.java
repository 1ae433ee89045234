package org.dongguk.discrecovery.dto.response;

import lombok.Builder;
import org.dongguk.discrecovery.domain.dropoff.DropOff;

import java.time.LocalDateTime;

@Builder
public record DropOffDto(
        Long id,
        Long recoveryEventId,
        String photoUrl,
        String storagePath,
        Double latitude,
        Double longitude,
        String locationNotes,
        LocalDateTime droppedOffAt,
        LocalDateTime retrievedAt
) {
    public static DropOffDto from(DropOff dropOff) {
        if (dropOff == null) {
            return null;
        }
        return DropOffDto.builder()
                .id(dropOff.getId())
                .recoveryEventId(dropOff.getRecoveryEvent().getId())
                .photoUrl(dropOff.getPhotoUrl())
                .storagePath(dropOff.getStoragePath())
                .latitude(dropOff.getLatitude())
                .longitude(dropOff.getLongitude())
                .locationNotes(dropOff.getLocationNotes())
                .droppedOffAt(dropOff.getDroppedOffAt())
                .retrievedAt(dropOff.getRetrievedAt())
                .build();
    }
}
