package org.dongguk.discrecovery.dto.response;

import lombok.Builder;
import org.dongguk.discrecovery.domain.user.User;

@Builder
public record UserSummaryDto(
        Long id,
        String displayName
) {
    public static UserSummaryDto from(User user, String fallback) {
        if (user == null) {
            return null;
        }
        return UserSummaryDto.builder()
                .id(user.getId())
                .displayName(user.getDisplayName(fallback))
                .build();
    }
}
