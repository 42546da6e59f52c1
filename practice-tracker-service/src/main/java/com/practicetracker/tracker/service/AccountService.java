package com.practicetracker.tracker.service;

import com.practicetracker.tracker.dto.AuthResponse;
import com.practicetracker.tracker.entity.User;
import com.practicetracker.tracker.exception.ApiException;
import com.practicetracker.tracker.exception.ErrorCode;
import com.practicetracker.tracker.repository.UserRepository;
import com.practicetracker.tracker.security.TokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Registration and login
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final Clock clock;

    public AccountService(UserRepository userRepository,
                          PasswordEncoder passwordEncoder,
                          TokenService tokenService,
                          Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.clock = clock;
    }

    @Transactional
    public AuthResponse register(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            throw ApiException.badRequest("Username and password are required");
        }
        if (userRepository.existsByUsername(username)) {
            throw ApiException.conflict("Username already taken");
        }

        User user = User.builder()
                .username(username)
                .passwordHash(passwordEncoder.encode(password))
                .createTime(clock.instant())
                .build();
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new ApiException(ErrorCode.CONFLICT, "Username already taken", e);
        }

        log.info("Registered user {} ({})", user.getId(), user.getUsername());
        return AuthResponse.builder()
                .token(tokenService.issue(user.getId()))
                .user(user)
                .build();
    }

    @Transactional(readOnly = true)
    public AuthResponse login(String username, String password) {
        if (username == null || password == null) {
            throw ApiException.unauthorized(INVALID_CREDENTIALS);
        }
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> ApiException.unauthorized(INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            throw ApiException.unauthorized(INVALID_CREDENTIALS);
        }

        return AuthResponse.builder()
                .token(tokenService.issue(user.getId()))
                .user(user)
                .build();
    }
}
