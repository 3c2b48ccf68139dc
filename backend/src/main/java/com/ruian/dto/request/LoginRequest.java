package com.ruian.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for username/password login.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "username": "admin",
 *   "password": "secret123"
 * }
 * </pre>
 *
 * @see com.ruian.dto.response.TokenResponse
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "Username is required")
    private String username;

    @NotBlank(message = "Password is required")
    private String password;
}
