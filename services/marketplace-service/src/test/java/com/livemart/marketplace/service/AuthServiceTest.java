package com.livemart.marketplace.service;

import com.livemart.marketplace.dto.AuthResponse;
import com.livemart.marketplace.dto.LoginRequest;
import com.livemart.marketplace.dto.RegisterRequest;
import com.livemart.marketplace.entity.User;
import com.livemart.marketplace.entity.UserRole;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.exception.UnauthorizedException;
import com.livemart.marketplace.repository.UserRepository;
import com.livemart.marketplace.security.AuthenticatedUser;
import com.livemart.marketplace.security.JwtTokenProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String SECRET = "unit-test-secret-for-livemart-tokens-0123456789";

    @Mock
    private UserRepository userRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private final JwtTokenProvider tokenProvider = new JwtTokenProvider(SECRET, Duration.ofDays(7));
    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(userRepository, passwordEncoder, tokenProvider);
    }

    @Test
    void shouldRegisterWithHashedPasswordAndIssueToken() {
        when(userRepository.existsByEmail("asha@example.com")).thenReturn(false);
        when(userRepository.insert(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuthResponse response = authService.register(new RegisterRequest(
                "Asha@Example.com", "Asha", "9999999999", UserRole.RETAILER, null, "s3cret"));

        assertThat(response.tokenType()).isEqualTo("bearer");
        assertThat(response.user().email()).isEqualTo("asha@example.com");
        AuthenticatedUser identity = tokenProvider.verify(response.accessToken());
        assertThat(identity.userId()).isEqualTo(response.user().id());
        assertThat(identity.email()).isEqualTo("asha@example.com");
    }

    @Test
    void shouldRejectDuplicateEmail() {
        when(userRepository.existsByEmail("asha@example.com")).thenReturn(true);

        assertThatThrownBy(() -> authService.register(new RegisterRequest(
                "asha@example.com", "Asha", "9999999999", UserRole.CONSUMER, null, "pw")))
                .isInstanceOf(BadRequestException.class);
        verify(userRepository, never()).insert(any(User.class));
    }

    @Test
    void shouldLoginWithMatchingPassword() {
        User user = user("right");
        when(userRepository.findByEmail("asha@example.com")).thenReturn(Optional.of(user));

        AuthResponse response = authService.login(new LoginRequest("asha@example.com", "right"));

        assertThat(tokenProvider.verify(response.accessToken()).userId()).isEqualTo("user-1");
    }

    @Test
    void shouldRejectWrongPassword() {
        when(userRepository.findByEmail("asha@example.com")).thenReturn(Optional.of(user("right")));

        assertThatThrownBy(() -> authService.login(new LoginRequest("asha@example.com", "wrong")))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void shouldRejectUnknownEmail() {
        when(userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login(new LoginRequest("nobody@example.com", "pw")))
                .isInstanceOf(UnauthorizedException.class);
    }

    private User user(String password) {
        return new User("user-1", "asha@example.com", "Asha", "9999999999", UserRole.RETAILER,
                null, passwordEncoder.encode(password), Instant.now());
    }
}
