package com.webdynamo.contact_manager.service;

import com.webdynamo.contact_manager.dto.user.LoginUserRequest;
import com.webdynamo.contact_manager.dto.user.RegisterUserRequest;
import com.webdynamo.contact_manager.dto.user.UpdateUserRequest;
import com.webdynamo.contact_manager.dto.user.UserResponse;
import com.webdynamo.contact_manager.exception.UnauthorizedException;
import com.webdynamo.contact_manager.exception.ValidationException;
import com.webdynamo.contact_manager.model.Session;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.repo.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    // Same message for unknown username and wrong password
    static final String BAD_CREDENTIALS = "Username or password is wrong";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionService sessionService;
    private final MetricsService metricsService;

    /**
     * Register a new user
     *
     * @param request Registration request with username, password and name
     * @return The created user (without token)
     * @throws ValidationException if the username is already taken
     */
    @Transactional
    public UserResponse register(RegisterUserRequest request) {
        log.info("Registering new user: {}", request.username());

        // Check if user already exists
        if (userRepository.existsByUsername(request.username())) {
            log.warn("Registration failed: Username already exists - {}", request.username());
            throw new ValidationException("Username already exists");
        }

        User user = new User();
        user.setUsername(request.username());
        user.setName(request.name());
        user.setPassword(passwordEncoder.encode(request.password()));

        try {
            // Flush so a concurrent registration trips the unique constraint here
            User savedUser = userRepository.saveAndFlush(user);
            log.info("User registered successfully: {}", savedUser.getUsername());
            return UserResponse.from(savedUser);
        } catch (DataIntegrityViolationException e) {
            log.warn("Registration lost a race for username {}", request.username());
            throw new ValidationException("Username already exists");
        }
    }

    /**
     * Verify credentials and open a session
     *
     * @param request Login request with username and password
     * @return The user with a fresh token
     * @throws UnauthorizedException if the username is unknown or the password does not match
     */
    @Transactional
    public UserResponse login(LoginUserRequest request) {
        log.info("Login attempt for user: {}", request.username());

        Optional<User> found = userRepository.findByUsername(request.username());
        if (found.isEmpty() || !passwordEncoder.matches(request.password(), found.get().getPassword())) {
            log.warn("Login failed for user: {}", request.username());
            metricsService.recordLogin(false);
            throw new UnauthorizedException(BAD_CREDENTIALS);
        }

        User user = found.get();
        Session session = sessionService.issue(user);
        metricsService.recordLogin(true);

        log.info("User authenticated successfully: {}", user.getUsername());
        return UserResponse.from(user, session.getToken());
    }

    public UserResponse get(User user) {
        return UserResponse.from(user);
    }

    /**
     * Update name and/or password. Null fields keep their stored value.
     *
     * @param user Authenticated user
     * @param request Fields to change
     * @return Updated user
     */
    @Transactional
    public UserResponse update(User user, UpdateUserRequest request) {
        log.info("Updating profile for user: {}", user.getUsername());

        User current = userRepository.findByUsername(user.getUsername())
                .orElseThrow(() -> new UnauthorizedException("Unauthorized"));

        if (request.name() != null) {
            current.setName(request.name());
        }

        if (request.password() != null) {
            current.setPassword(passwordEncoder.encode(request.password()));
            log.info("Password changed for user: {}", user.getUsername());
        }

        User updatedUser = userRepository.save(current);
        return UserResponse.from(updatedUser);
    }

    /**
     * Close the session behind the token. A second call with the same token
     * never gets here, the auth filter rejects it first.
     */
    @Transactional
    public boolean logout(User user, String token) {
        sessionService.revoke(token);
        log.info("User logged out: {}", user.getUsername());
        return true;
    }
}
