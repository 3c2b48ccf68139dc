package com.ruian.service;

import com.ruian.entity.User;
import com.ruian.exception.ResourceNotFoundException;
import com.ruian.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates user accounts and changes passwords.
 *
 * There is no sign-up endpoint; accounts are provisioned by operators, for
 * example with the --import-users start option.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UserAccountService {

    static final int MAX_USERNAME_LENGTH = 50;
    static final int MIN_PASSWORD_LENGTH = 6;

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public enum CreateResult {
        CREATED,
        SKIPPED
    }

    /**
     * Create a user account.
     *
     * @param username 1 to 50 characters, trimmed
     * @param password at least 6 characters
     * @param skipExisting when true an existing username is skipped, otherwise it is an error
     * @return CREATED, or SKIPPED when the user exists and skipExisting is set
     * @throws IllegalArgumentException on an invalid username or password, or an
     *         existing username when skipExisting is false
     */
    @Transactional
    public CreateResult createUser(String username, String password, boolean skipExisting) {
        String normalizedUsername = validateUsername(username);
        validatePassword(password);

        if (userRepository.existsByUsername(normalizedUsername)) {
            if (skipExisting) {
                log.info("User already exists, skipped: {}", normalizedUsername);
                return CreateResult.SKIPPED;
            }
            throw new IllegalArgumentException(
                    String.format("User '%s' already exists", normalizedUsername));
        }

        User user = userRepository.save(new User(normalizedUsername, passwordEncoder.encode(password)));
        log.info("User created: {} (ID: {})", user.getUsername(), user.getId());
        return CreateResult.CREATED;
    }

    /**
     * Replace a user's password.
     *
     * @throws ResourceNotFoundException if the user does not exist
     * @throws IllegalArgumentException if the new password is too short
     */
    @Transactional
    public void changePassword(String username, String newPassword) {
        String normalizedUsername = validateUsername(username);
        validatePassword(newPassword);

        User user = userRepository.findByUsername(normalizedUsername)
                .orElseThrow(() -> ResourceNotFoundException.user(normalizedUsername));
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        userRepository.save(user);
        log.info("Password changed for user: {}", normalizedUsername);
    }

    private String validateUsername(String username) {
        if (username == null || username.trim().isEmpty()) {
            throw new IllegalArgumentException("Username cannot be null or empty");
        }
        String trimmed = username.trim();
        if (trimmed.length() > MAX_USERNAME_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("Username must be at most %d characters", MAX_USERNAME_LENGTH));
        }
        return trimmed;
    }

    private void validatePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("Password must be at least %d characters", MIN_PASSWORD_LENGTH));
        }
    }
}
