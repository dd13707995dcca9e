package com.claimsledger.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * JWT validation for bearer tokens issued by the identity provider.
 *
 * The claims engine never logs anyone in. It only checks the signature and
 * expiry of incoming tokens and reads who the caller is and what roles they
 * hold. generateToken exists for service-to-service callers and tests that
 * share the signing secret.
 *
 * Token contains:
 *  - subject : actor (user name or service id), stamped on every change
 *  - roles   : role names, e.g. ["UNDERWRITER"]
 *  - iat     : issued-at
 *  - exp     : expiry
 */
@Component
public class JwtTokenProvider {

    static final String ROLES_CLAIM = "roles";

    private final SecretKey secretKey;
    private final long      expiryMs;

    public JwtTokenProvider(
            @Value("${claimsledger.jwt.secret}") String secret,
            @Value("${claimsledger.jwt.expiry-ms:3600000}") long expiryMs) {

        if (secret == null || secret.length() < 32) {
            throw new IllegalStateException(
                "claimsledger.jwt.secret must be at least 32 characters");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiryMs  = expiryMs;
    }

    /** Generate a signed JWT for the given actor and roles. */
    public String generateToken(String actor, Collection<String> roles) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Token subject cannot be blank");
        }
        Date now    = new Date();
        Date expiry = new Date(now.getTime() + expiryMs);

        return Jwts.builder()
                .subject(actor)
                .claim(ROLES_CLAIM, roles == null ? List.of() : List.copyOf(roles))
                .issuedAt(now)
                .expiration(expiry)
                .signWith(secretKey)
                .compact();
    }

    /** Extract the actor (subject) from a valid token. */
    public String extractActor(String token) {
        return parseClaims(token).getSubject();
    }

    /** Extract the role names from a valid token; empty if the claim is absent. */
    public List<String> extractRoles(String token) {
        Object raw = parseClaims(token).get(ROLES_CLAIM);
        if (!(raw instanceof Collection<?>)) {
            return List.of();
        }
        return ((Collection<?>) raw).stream()
                .map(String::valueOf)
                .toList();
    }

    /**
     * Validate token signature and expiry.
     * Returns false instead of throwing; caller decides how to respond.
     */
    public boolean isValid(String token) {
        try {
            parseClaims(token);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
