package org.dongguk.discrecovery.dto.response;

import lombok.Builder;
import org.dongguk.discrecovery.domain.type.DisplayPreference;
import org.dongguk.discrecovery.domain.user.User;

@Builder
public record UserDto(
        Long id,
        String username,
        String fullName,
        String email,
        DisplayPreference displayPreference,
        String displayName,
        boolean pushEnabled
) {
    public static UserDto from(User user) {
        return UserDto.builder()
                .id(user.getId())
                .username(user.getUsername())
                .fullName(user.getFullName())
                .email(user.getEmail())
                .displayPreference(user.getDisplayPreference())
                .displayName(user.getDisplayName(null))
                .pushEnabled(user.getPushToken() != null)
                .build();
    }
}
