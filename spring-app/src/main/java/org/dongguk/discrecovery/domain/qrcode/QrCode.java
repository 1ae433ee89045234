package org.dongguk.discrecovery.domain.qrcode;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.dongguk.discrecovery.domain.type.QrCodeStatus;
import org.dongguk.discrecovery.domain.user.User;

import java.time.LocalDateTime;
import java.util.Locale;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "qr_codes")
public class QrCode {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "short_code", nullable = false, unique = true, length = 20)
    private String shortCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private QrCodeStatus status;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_to")
    private User assignedTo;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Builder(access = AccessLevel.PRIVATE)
    private QrCode(String shortCode,
                   QrCodeStatus status,
                   User assignedTo,
                   LocalDateTime createdAt) {
        this.shortCode = shortCode;
        this.status = status;
        this.assignedTo = assignedTo;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public static QrCode create(String shortCode, LocalDateTime createdAt) {
        return QrCode.builder()
                .shortCode(normalize(shortCode))
                .status(QrCodeStatus.GENERATED)
                .createdAt(createdAt)
                .build();
    }

    public static QrCode createAssigned(String shortCode, User assignedTo, LocalDateTime createdAt) {
        return QrCode.builder()
                .shortCode(normalize(shortCode))
                .status(QrCodeStatus.ASSIGNED)
                .assignedTo(assignedTo)
                .createdAt(createdAt)
                .build();
    }

    public static String normalize(String shortCode) {
        return shortCode == null ? null : shortCode.trim().toUpperCase(Locale.ROOT);
    }

    public Long getAssignedToId() {
        return assignedTo == null ? null : assignedTo.getId();
    }

    public boolean isAssignedTo(Long userId) {
        return userId != null && userId.equals(getAssignedToId());
    }
}
