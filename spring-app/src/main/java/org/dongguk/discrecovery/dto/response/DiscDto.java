package org.dongguk.discrecovery.dto.response;

import lombok.Builder;
import org.dongguk.discrecovery.domain.disc.Disc;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Builder
public record DiscDto(
        Long id,
        Long ownerId,
        Long qrCodeId,
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
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static DiscDto from(Disc disc) {
        return DiscDto.builder()
                .id(disc.getId())
                .ownerId(disc.getOwnerId())
                .qrCodeId(disc.getQrCodeId())
                .name(disc.getName())
                .manufacturer(disc.getManufacturer())
                .mold(disc.getMold())
                .plastic(disc.getPlastic())
                .color(disc.getColor())
                .speed(disc.getSpeed())
                .glide(disc.getGlide())
                .turn(disc.getTurn())
                .fade(disc.getFade())
                .rewardAmount(disc.getRewardAmount())
                .createdAt(disc.getCreatedAt())
                .updatedAt(disc.getUpdatedAt())
                .build();
    }
}
