package org.dongguk.discrecovery.dto.response;

import lombok.Builder;
import org.dongguk.discrecovery.domain.disc.Disc;

import java.math.BigDecimal;

/**
 * 공개 조회용 디스크 요약. 소유자의 id, 이메일은 담지 않는다.
 */
@Builder
public record DiscSummaryDto(
        Long id,
        String name,
        String manufacturer,
        String mold,
        String plastic,
        String color,
        BigDecimal rewardAmount,
        String ownerDisplayName
) {
    public static DiscSummaryDto of(Disc disc, String ownerDisplayName) {
        return DiscSummaryDto.builder()
                .id(disc.getId())
                .name(disc.getName())
                .manufacturer(disc.getManufacturer())
                .mold(disc.getMold())
                .plastic(disc.getPlastic())
                .color(disc.getColor())
                .rewardAmount(disc.getRewardAmount())
                .ownerDisplayName(ownerDisplayName)
                .build();
    }
}
