package org.dongguk.discrecovery.domain.dropoff;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;

import java.time.LocalDateTime;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "drop_offs")
public class DropOff {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recovery_event_id", nullable = false, unique = true)
    private RecoveryEvent recoveryEvent;

    @Column(name = "photo_url", nullable = false, length = 500)
    private String photoUrl;

    @Column(name = "storage_path", nullable = false, length = 300)
    private String storagePath;

    @Column(name = "latitude", nullable = false)
    private Double latitude;

    @Column(name = "longitude", nullable = false)
    private Double longitude;

    @Column(name = "location_notes", length = 500)
    private String locationNotes;

    @Column(name = "dropped_off_at", nullable = false)
    private LocalDateTime droppedOffAt;

    @Column(name = "retrieved_at")
    private LocalDateTime retrievedAt;

    @Builder(access = AccessLevel.PRIVATE)
    private DropOff(RecoveryEvent recoveryEvent,
                    String photoUrl,
                    String storagePath,
                    Double latitude,
                    Double longitude,
                    String locationNotes,
                    LocalDateTime droppedOffAt) {
        this.recoveryEvent = recoveryEvent;
        this.photoUrl = photoUrl;
        this.storagePath = storagePath;
        this.latitude = latitude;
        this.longitude = longitude;
        this.locationNotes = locationNotes;
        this.droppedOffAt = droppedOffAt;
    }

    public static DropOff create(RecoveryEvent recoveryEvent,
                                 String photoUrl,
                                 String storagePath,
                                 Double latitude,
                                 Double longitude,
                                 String locationNotes,
                                 LocalDateTime droppedOffAt) {
        return DropOff.builder()
                .recoveryEvent(recoveryEvent)
                .photoUrl(photoUrl)
                .storagePath(storagePath)
                .latitude(latitude)
                .longitude(longitude)
                .locationNotes(locationNotes)
                .droppedOffAt(droppedOffAt)
                .build();
    }
}
