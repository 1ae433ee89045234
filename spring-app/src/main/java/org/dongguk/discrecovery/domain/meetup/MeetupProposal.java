package org.dongguk.discrecovery.domain.meetup;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.dongguk.discrecovery.domain.recovery.RecoveryEvent;
import org.dongguk.discrecovery.domain.type.MeetupStatus;
import org.dongguk.discrecovery.domain.user.User;

import java.time.LocalDateTime;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "meetup_proposals", indexes = {
        @Index(name = "idx_meetup_proposals_event_status", columnList = "recovery_event_id, status")
})
public class MeetupProposal {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recovery_event_id", nullable = false)
    private RecoveryEvent recoveryEvent;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "proposed_by", nullable = false)
    private User proposedBy;

    @Column(name = "location_name", nullable = false, length = 200)
    private String locationName;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "proposed_datetime", nullable = false)
    private LocalDateTime proposedDatetime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MeetupStatus status;

    @Column(name = "message", length = 1000)
    private String message;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Builder(access = AccessLevel.PRIVATE)
    private MeetupProposal(RecoveryEvent recoveryEvent,
                           User proposedBy,
                           String locationName,
                           Double latitude,
                           Double longitude,
                           LocalDateTime proposedDatetime,
                           MeetupStatus status,
                           String message,
                           LocalDateTime createdAt) {
        this.recoveryEvent = recoveryEvent;
        this.proposedBy = proposedBy;
        this.locationName = locationName;
        this.latitude = latitude;
        this.longitude = longitude;
        this.proposedDatetime = proposedDatetime;
        this.status = status;
        this.message = message;
        this.createdAt = createdAt;
    }

    public static MeetupProposal create(RecoveryEvent recoveryEvent,
                                        User proposedBy,
                                        String locationName,
                                        Double latitude,
                                        Double longitude,
                                        LocalDateTime proposedDatetime,
                                        String message,
                                        LocalDateTime createdAt) {
        return MeetupProposal.builder()
                .recoveryEvent(recoveryEvent)
                .proposedBy(proposedBy)
                .locationName(locationName)
                .latitude(latitude)
                .longitude(longitude)
                .proposedDatetime(proposedDatetime)
                .status(MeetupStatus.PENDING)
                .message(message)
                .createdAt(createdAt)
                .build();
    }

    public Long getRecoveryEventId() {
        return recoveryEvent.getId();
    }

    public Long getProposedById() {
        return proposedBy.getId();
    }
}
