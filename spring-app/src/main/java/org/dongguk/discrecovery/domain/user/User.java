package org.dongguk.discrecovery.domain.user;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.dongguk.discrecovery.domain.type.DisplayPreference;

import java.time.LocalDateTime;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "users")
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "username", nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "full_name", length = 100)
    private String fullName;

    @Column(name = "email", length = 200)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "display_preference", nullable = false, length = 20)
    private DisplayPreference displayPreference;

    @Column(name = "push_token", length = 200)
    private String pushToken;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Builder(access = AccessLevel.PRIVATE)
    private User(String username,
                 String fullName,
                 String email,
                 DisplayPreference displayPreference,
                 String pushToken,
                 LocalDateTime createdAt) {
        this.username = username;
        this.fullName = fullName;
        this.email = email;
        this.displayPreference = displayPreference;
        this.pushToken = pushToken;
        this.createdAt = createdAt;
    }

    public static User create(String username, String fullName, String email,
                              DisplayPreference displayPreference, LocalDateTime createdAt) {
        return User.builder()
                .username(username)
                .fullName(fullName)
                .email(email)
                .displayPreference(displayPreference == null ? DisplayPreference.USERNAME : displayPreference)
                .createdAt(createdAt)
                .build();
    }

    /**
     * 다른 사용자에게 보여줄 이름.
     * FULL_NAME 선호 + 실명 있음 → 실명, 아니면 @username, 그것도 없으면 실명, 마지막으로 fallback
     */
    public String getDisplayName(String fallback) {
        boolean hasFullName = fullName != null && !fullName.isBlank();
        boolean hasUsername = username != null && !username.isBlank();

        if (displayPreference == DisplayPreference.FULL_NAME && hasFullName) {
            return fullName;
        }
        if (hasUsername) {
            return "@" + username;
        }
        if (hasFullName) {
            return fullName;
        }
        return fallback;
    }

    public void updatePushToken(String pushToken) {
        this.pushToken = pushToken;
    }
}
