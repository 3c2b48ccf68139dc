package com.ruian.service;

import com.ruian.dto.response.UserResponse;
import com.ruian.entity.User;
import com.ruian.exception.ResourceNotFoundException;
import com.ruian.repository.UserRepository;
import com.ruian.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for username/password login and JWT issuance.
 *
 * Flow:
 * 1. Client POSTs username and password to /api/auth/login
 * 2. The stored hash (SHA-256 then bcrypt) is checked
 * 3. A JWT with the username as subject and the user id as "uid" is issued
 * 4. JwtAuthenticationFilter validates the token on every later request
 *
 * Unknown users and wrong passwords fail with the same message so the
 * response does not reveal which usernames exist.
 *
 * @see com.ruian.security.JwtTokenProvider
 * @see com.ruian.security.Sha256BcryptPasswordEncoder
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AuthService {

    static final String INVALID_CREDENTIALS = "Invalid username or password";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    /**
     * Verify credentials and generate an access token.
     *
     * @param username the username
     * @param password the plain password
     * @return JWT token string
     * @throws IllegalArgumentException if username or password is blank
     * @throws BadCredentialsException if the user does not exist or the password is wrong
     */
    public String login(String username, String password) {
        if (username == null || username.trim().isEmpty()) {
            log.warn("Attempted login with null or empty username");
            throw new IllegalArgumentException("Username cannot be null or empty");
        }
        if (password == null || password.isEmpty()) {
            log.warn("Attempted login with empty password for user: {}", username);
            throw new IllegalArgumentException("Password cannot be null or empty");
        }

        String normalizedUsername = username.trim();
        User user = userRepository.findByUsername(normalizedUsername)
                .orElseThrow(() -> {
                    log.warn("Login attempt for unknown user: {}", normalizedUsername);
                    return new BadCredentialsException(INVALID_CREDENTIALS);
                });

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            log.warn("Wrong password for user: {}", normalizedUsername);
            throw new BadCredentialsException(INVALID_CREDENTIALS);
        }

        String token = jwtTokenProvider.generateToken(user.getId(), user.getUsername());
        log.info("Authentication successful for user: {} (ID: {})", user.getUsername(), user.getId());
        log.debug("JWT token generated with expiration: {} ms", jwtTokenProvider.getExpirationMs());
        return token;
    }

    /**
     * Resolve the user behind an authenticated principal.
     *
     * @param username the token subject
     * @return the user's public view
     * @throws ResourceNotFoundException if the account was removed after the token was issued
     */
    public UserResponse currentUser(String username) {
        return userRepository.findByUsername(username)
                .map(UserResponse::from)
                .orElseThrow(() -> ResourceNotFoundException.user(username));
    }
}
