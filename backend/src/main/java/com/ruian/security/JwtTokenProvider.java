package com.ruian.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Date;

/**
 * JWT Token Provider for generating and validating access tokens.
 *
 * Token structure:
 * - Subject: username
 * - Claim "uid": database id of the user
 * - Issued at / expiration (jwt.expiration, milliseconds)
 * - Signature: HS256 with jwt.secret
 *
 * The secret must be at least 256 bits (32 bytes) for HS256.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String USER_ID_CLAIM = "uid";

    @Value("${jwt.secret}")
    private String jwtSecret;

    @Value("${jwt.expiration}")
    private long jwtExpirationMs;

    private SecretKey secretKey;

    @PostConstruct
    public void init() {
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        log.info("JWT Token Provider initialized with expiration: {} ms", jwtExpirationMs);
    }

    /**
     * Generate a signed access token.
     *
     * @param userId the user's database id
     * @param username the username, used as subject
     * @return compact JWT string
     */
    public String generateToken(Long userId, String username) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        String token = Jwts.builder()
                .subject(username)
                .claim(USER_ID_CLAIM, userId)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();

        log.debug("Generated JWT token for user: {} (id: {})", username, userId);
        return token;
    }

    /**
     * Validate signature, structure and expiration of a token.
     *
     * @param token the JWT
     * @return true if the token can be trusted
     */
    public boolean validateToken(String token) {
        try {
            Claims claims = parseClaims(token);
            return claims.getSubject() != null && !claims.getSubject().isBlank();
        } catch (SignatureException ex) {
            log.error("Invalid JWT signature: {}", ex.getMessage());
        } catch (MalformedJwtException ex) {
            log.error("Invalid JWT token: {}", ex.getMessage());
        } catch (ExpiredJwtException ex) {
            log.warn("Expired JWT token: {}", ex.getMessage());
        } catch (UnsupportedJwtException ex) {
            log.error("Unsupported JWT token: {}", ex.getMessage());
        } catch (JwtException ex) {
            log.error("Rejected JWT token: {}", ex.getMessage());
        } catch (IllegalArgumentException ex) {
            log.error("JWT claims string is empty: {}", ex.getMessage());
        }
        return false;
    }

    public String getUsernameFromToken(String token) {
        return parseClaims(token).getSubject();
    }

    public Long getUserIdFromToken(String token) {
        Number uid = parseClaims(token).get(USER_ID_CLAIM, Number.class);
        return uid == null ? null : uid.longValue();
    }

    /**
     * Build the Spring Security authentication for a validated token.
     * The principal is the username; the user id is kept in the details.
     */
    public Authentication getAuthentication(String token) {
        Claims claims = parseClaims(token);
        Number uid = claims.get(USER_ID_CLAIM, Number.class);

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(
                        claims.getSubject(),
                        null,
                        Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER"))
                );
        authentication.setDetails(uid == null ? null : uid.longValue());
        return authentication;
    }

    /**
     * @param bearerToken value of the Authorization header
     * @return the token, or null when the header is missing or not a bearer header
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = bearerToken.substring(7).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    public long getExpirationMs() {
        return jwtExpirationMs;
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
