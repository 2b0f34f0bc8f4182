package com.livemart.marketplace.service;

import com.livemart.marketplace.dto.AuthResponse;
import com.livemart.marketplace.dto.LoginRequest;
import com.livemart.marketplace.dto.RegisterRequest;
import com.livemart.marketplace.dto.UserResponse;
import com.livemart.marketplace.entity.User;
import com.livemart.marketplace.exception.BadRequestException;
import com.livemart.marketplace.exception.UnauthorizedException;
import com.livemart.marketplace.repository.UserRepository;
import com.livemart.marketplace.security.JwtTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;

    public AuthService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       JwtTokenProvider tokenProvider) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenProvider = tokenProvider;
    }

    public AuthResponse register(RegisterRequest request) {
        String email = normalize(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new BadRequestException("Email already registered");
        }

        User user = new User(
                UUID.randomUUID().toString(),
                email,
                request.name(),
                request.phone(),
                request.role(),
                request.address(),
                passwordEncoder.encode(request.password()),
                Instant.now());
        try {
            user = userRepository.insert(user);
        } catch (DuplicateKeyException e) {
            throw new BadRequestException("Email already registered");
        }

        log.info("User registered: id={}, role={}", user.getId(), user.getRole().value());
        return AuthResponse.bearer(tokenProvider.issue(user), UserResponse.from(user));
    }

    public AuthResponse login(LoginRequest request) {
        User user = userRepository.findByEmail(normalize(request.email()))
                .filter(candidate -> passwordEncoder.matches(request.password(), candidate.getPasswordHash()))
                .orElseThrow(() -> new UnauthorizedException("Invalid email or password"));
        log.info("User logged in: id={}", user.getId());
        return AuthResponse.bearer(tokenProvider.issue(user), UserResponse.from(user));
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
