package org.dongguk.discrecovery.service;

import org.dongguk.discrecovery.core.exception.CustomException;
import org.dongguk.discrecovery.domain.user.User;
import org.dongguk.discrecovery.domain.user.UserErrorCode;
import org.dongguk.discrecovery.dto.response.UserDto;
import org.dongguk.discrecovery.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.dongguk.discrecovery.support.TestFixtures.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UserServiceTest {
    private UserRepository userRepository;
    private UserService service;

    private User finder;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        service = new UserService(userRepository);
        finder = user(2L, "finder");
        when(userRepository.findById(2L)).thenReturn(Optional.of(finder));
    }

    @Test
    void registersTrimmedPushToken() {
        UserDto result = service.updatePushToken(2L, "  ExponentPushToken[abc]  ");

        assertTrue(result.pushEnabled());
        assertEquals("ExponentPushToken[abc]", finder.getPushToken());
    }

    @Test
    void blankTokenClearsRegistration() {
        finder.updatePushToken("ExponentPushToken[abc]");

        UserDto result = service.updatePushToken(2L, " ");

        assertFalse(result.pushEnabled());
        assertNull(finder.getPushToken());
    }

    @Test
    void profileShowsDisplayName() {
        assertEquals("@finder", service.getUserInfo(2L).displayName());
    }

    @Test
    void unknownUserIsNotFound() {
        CustomException e = assertThrows(CustomException.class, () -> service.getUserInfo(9L));

        assertEquals(UserErrorCode.USER_NOT_FOUND, e.getErrorCode());
    }
}
