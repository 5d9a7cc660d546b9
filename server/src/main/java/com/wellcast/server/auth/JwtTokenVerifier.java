/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.server.auth;

import com.wellcast.common.exception.AuthenticationException;
import com.wellcast.common.topic.ReadingTopics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Verifies HS256-signed JWTs issued by the platform's identity service.
 *
 * <p>Claims: {@code tenant_id} and {@code sub} are required, {@code role} defaults
 * to {@value #DEFAULT_ROLE}. Signature, {@code exp} and {@code nbf} are checked by
 * Spring Security's {@link NimbusJwtDecoder}. Decoding runs on the supplied
 * executor, never on a socket I/O thread.</p>
 */
public class JwtTokenVerifier implements TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenVerifier.class);

    public static final String TENANT_CLAIM = "tenant_id";
    public static final String ROLE_CLAIM = "role";
    public static final String DEFAULT_ROLE = "viewer";
    public static final int MIN_SECRET_BYTES = 32;

    private final JwtDecoder decoder;
    private final Executor executor;

    public JwtTokenVerifier(JwtDecoder decoder, Executor executor) {
        this.decoder = decoder;
        this.executor = executor;
    }

    /**
     * @throws IllegalArgumentException if the secret is shorter than 256 bits
     */
    public static JwtTokenVerifier hmac(String secret, Executor executor) {
        return new JwtTokenVerifier(NimbusJwtDecoder.withSecretKey(secretKey(secret))
                .macAlgorithm(MacAlgorithm.HS256)
                .build(), executor);
    }

    public static SecretKey secretKey(String secret) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }

    @Override
    public CompletableFuture<AuthenticatedPrincipal> verify(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            return CompletableFuture.failedFuture(new AuthenticationException("Missing bearer token"));
        }
        return CompletableFuture.supplyAsync(() -> decode(bearerToken), executor);
    }

    private AuthenticatedPrincipal decode(String token) {
        Jwt jwt;
        try {
            jwt = decoder.decode(token);
        } catch (JwtException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new AuthenticationException("Invalid token: " + e.getMessage(), e);
        }
        String tenantId = jwt.getClaimAsString(TENANT_CLAIM);
        if (tenantId == null || !ReadingTopics.isValidTenantId(tenantId)) {
            throw new AuthenticationException("Token carries no valid " + TENANT_CLAIM + " claim");
        }
        String userId = jwt.getSubject();
        if (userId == null || userId.isBlank()) {
            throw new AuthenticationException("Token carries no subject");
        }
        String role = jwt.getClaimAsString(ROLE_CLAIM);
        return new AuthenticatedPrincipal(tenantId, userId, role == null || role.isBlank() ? DEFAULT_ROLE : role);
    }
}
