package org.dongguk.discrecovery.domain.disc;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.dongguk.discrecovery.domain.qrcode.QrCode;
import org.dongguk.discrecovery.domain.user.User;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "discs")
public class Disc {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // null 이면 주인 없는 디스크 (클레임 가능)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id")
    private User owner;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "qr_code_id", unique = true)
    private QrCode qrCode;

    @Column(name = "name", length = 100)
    private String name;

    @Column(name = "manufacturer", length = 100)
    private String manufacturer;

    @Column(name = "mold", nullable = false, length = 100)
    private String mold;

    @Column(name = "plastic", length = 100)
    private String plastic;

    @Column(name = "color", length = 50)
    private String color;

    @Column(name = "speed")
    private Double speed;

    @Column(name = "glide")
    private Double glide;

    @Column(name = "turn")
    private Double turn;

    @Column(name = "fade")
    private Double fade;

    @Column(name = "reward_amount", precision = 10, scale = 2)
    private BigDecimal rewardAmount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Builder(access = AccessLevel.PRIVATE)
    private Disc(User owner,
                 QrCode qrCode,
                 String name,
                 String manufacturer,
                 String mold,
                 String plastic,
                 String color,
                 Double speed,
                 Double glide,
                 Double turn,
                 Double fade,
                 BigDecimal rewardAmount,
                 LocalDateTime createdAt) {
        this.owner = owner;
        this.qrCode = qrCode;
        this.name = name;
        this.manufacturer = manufacturer;
        this.mold = mold;
        this.plastic = plastic;
        this.color = color;
        this.speed = speed;
        this.glide = glide;
        this.turn = turn;
        this.fade = fade;
        this.rewardAmount = rewardAmount;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public static Disc create(User owner,
                              QrCode qrCode,
                              String name,
                              String manufacturer,
                              String mold,
                              String plastic,
                              String color,
                              BigDecimal rewardAmount,
                              LocalDateTime createdAt) {
        return Disc.builder()
                .owner(owner)
                .qrCode(qrCode)
                .name(name)
                .manufacturer(manufacturer)
                .mold(mold)
                .plastic(plastic)
                .color(color)
                .rewardAmount(rewardAmount)
                .createdAt(createdAt)
                .build();
    }

    public void updateFlightNumbers(Double speed, Double glide, Double turn, Double fade) {
        this.speed = speed;
        this.glide = glide;
        this.turn = turn;
        this.fade = fade;
    }

    // 프록시 초기화 없이 FK 값만 읽는다
    public Long getOwnerId() {
        return owner == null ? null : owner.getId();
    }

    public Long getQrCodeId() {
        return qrCode == null ? null : qrCode.getId();
    }

    public boolean isOwnedBy(Long userId) {
        return userId != null && userId.equals(getOwnerId());
    }

    // 알림 문구에 쓰는 이름 (이름이 없으면 몰드명)
    public String getLabel() {
        return name != null && !name.isBlank() ? name : mold;
    }

    public boolean hasReward() {
        return rewardAmount != null && rewardAmount.signum() > 0;
    }
}
