package com.nosota.mshop.security;

import com.nosota.mshop.api.model.UserRole;
import com.nosota.mshop.error.ForbiddenException;
import com.nosota.mshop.error.UnauthenticatedException;
import com.nosota.mshop.model.User;
import com.nosota.mshop.repository.UserRepository;
import io.jsonwebtoken.MalformedJwtException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AccessControlService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AccessControlService Unit Tests")
class AccessControlServiceTest {

    @Mock
    private JwtTokenService jwtTokenService;

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private AccessControlService accessControlService;

    private User user;

    @BeforeEach
    void setUp() {
        user = new User();
        user.setId(5L);
        user.setUsername("bob");
        user.setRole(UserRole.USER);
        user.setWallet(1000L);
    }

    @Test
    @DisplayName("authenticate - MissingToken: Should fail without parsing")
    void authenticate_MissingToken() {
        assertThatThrownBy(() -> accessControlService.authenticate(null))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("Please authenticate");
        assertThatThrownBy(() -> accessControlService.authenticate("  "))
                .isInstanceOf(UnauthenticatedException.class);

        verifyNoInteractions(jwtTokenService, userRepository);
    }

    @Test
    @DisplayName("authenticate - InvalidToken: Should translate parser errors")
    void authenticate_InvalidToken() {
        when(jwtTokenService.parseUserId("garbage")).thenThrow(new MalformedJwtException("bad token"));

        assertThatThrownBy(() -> accessControlService.authenticate("garbage"))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("Please authenticate")
                .hasCauseInstanceOf(MalformedJwtException.class);

        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("authenticate - UserGone: Should fail when the token's user no longer exists")
    void authenticate_UserGone() {
        when(jwtTokenService.parseUserId("token")).thenReturn(5L);
        when(userRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accessControlService.authenticate("token"))
                .isInstanceOf(UnauthenticatedException.class);
    }

    @Test
    @DisplayName("authenticate - Success: Should return the stored user")
    void authenticate_Success() throws Exception {
        when(jwtTokenService.parseUserId("token")).thenReturn(5L);
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));

        assertThat(accessControlService.authenticate("token")).isSameAs(user);
    }

    @Test
    @DisplayName("requireAdmin - RegularUser: Should be forbidden")
    void requireAdmin_RegularUser() {
        when(jwtTokenService.parseUserId("token")).thenReturn(5L);
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> accessControlService.requireAdmin("token"))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Admin access required");
    }

    @Test
    @DisplayName("requireAdmin - StoredRoleWins: Should accept a user promoted after the token was issued")
    void requireAdmin_StoredRoleWins() throws Exception {
        user.setRole(UserRole.ADMIN);
        when(jwtTokenService.parseUserId("token")).thenReturn(5L);
        when(userRepository.findById(5L)).thenReturn(Optional.of(user));

        assertThat(accessControlService.requireAdmin("token").getId()).isEqualTo(5L);
    }
}
