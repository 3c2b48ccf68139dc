package com.ruian.controller;

import com.ruian.dto.request.LoginRequest;
import com.ruian.dto.response.TokenResponse;
import com.ruian.dto.response.UserResponse;
import com.ruian.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for authentication endpoints.
 *
 * Endpoints:
 * - POST /api/auth/login: public, exchanges username and password for a JWT
 * - GET /api/auth/me: requires a token, returns the current user
 *
 * Error Responses:
 * - 400 Bad Request: missing username or password
 * - 401 Unauthorized: unknown user, wrong password, or missing token
 *
 * All errors are handled by GlobalExceptionHandler and returned in RFC 7807 format.
 *
 * @see com.ruian.service.AuthService
 * @see com.ruian.config.SecurityConfig
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;

    /**
     * Log in with username and password.
     *
     * Example request:
     * <pre>
     * POST /api/auth/login
     * Content-Type: application/json
     *
     * {
     *   "username": "admin",
     *   "password": "secret123"
     * }
     * </pre>
     *
     * Example response:
     * <pre>
     * {
     *   "accessToken": "eyJhbGciOiJIUzI1NiJ9...",
     *   "tokenType": "bearer"
     * }
     * </pre>
     */
    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest loginRequest) {
        log.info("Login request received for user: {}", loginRequest.getUsername());

        try {
            String token = authService.login(loginRequest.getUsername(), loginRequest.getPassword());
            return ResponseEntity.ok(TokenResponse.bearer(token));

        } catch (BadCredentialsException e) {
            log.warn("Login failed for user: {}", loginRequest.getUsername());
            throw e;

        } catch (IllegalArgumentException e) {
            log.warn("Invalid login request: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Current user's account.
     *
     * @param authentication populated by JwtAuthenticationFilter; the principal is the username
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(Authentication authentication) {
        String username = (String) authentication.getPrincipal();
        log.debug("Current user requested: {}", username);
        return ResponseEntity.ok(authService.currentUser(username));
    }
}
