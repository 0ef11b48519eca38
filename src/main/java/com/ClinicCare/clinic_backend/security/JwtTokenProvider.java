package com.ClinicCare.clinic_backend.security;

import com.ClinicCare.clinic_backend.config.JwtProperties;
import com.ClinicCare.clinic_backend.enums.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Signs and verifies tenant-scoped access tokens. Claims: subject = email, {@code id}, {@code role}, {@code tenantId}.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String CLAIM_ID = "id";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TENANT = "tenantId";

    private final SecretKey signingKey;
    private final long expirationMs;

    public JwtTokenProvider(JwtProperties properties) {
        this.signingKey = Keys.hmacShaKeyFor(properties.getSecret().getBytes(StandardCharsets.UTF_8));
        this.expirationMs = properties.getExpirationMs();
    }

    public String generateToken(AuthenticatedUser user) {
        Date issuedAt = new Date();
        return Jwts.builder()
                .subject(user.getEmail())
                .claim(CLAIM_ID, user.getId().toString())
                .claim(CLAIM_ROLE, user.getRole().name())
                .claim(CLAIM_TENANT, user.getTenantId().toString())
                .issuedAt(issuedAt)
                .expiration(new Date(issuedAt.getTime() + expirationMs))
                .signWith(signingKey)
                .compact();
    }

    /**
     * Verifies signature and expiry and rebuilds the caller. Empty for any token that fails verification
     * or lacks a usable id, role or tenantId claim.
     */
    public Optional<AuthenticatedUser> parseToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String id = claims.get(CLAIM_ID, String.class);
            String tenantId = claims.get(CLAIM_TENANT, String.class);
            Role role = Role.fromString(claims.get(CLAIM_ROLE, String.class));
            if (id == null || tenantId == null || role == null) {
                log.debug("Token is missing the id, role or tenantId claim");
                return Optional.empty();
            }

            return Optional.of(AuthenticatedUser.builder()
                    .email(claims.getSubject())
                    .id(UUID.fromString(id))
                    .role(role)
                    .tenantId(UUID.fromString(tenantId))
                    .build());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token validation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
