package com.boilerplate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.boilerplate.backend.global.security.GateDecision;
import com.boilerplate.backend.global.security.GateErrorKind;
import com.boilerplate.backend.global.security.RequestIdentity;
import com.boilerplate.backend.modules.auth.domain.User;
import com.boilerplate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.security.SecurityException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    public static final String CLAIM_NAME = "unique_name";
    public static final String CLAIM_NAME_ID = "nameid";

    private final JwtTokenProvider tokenProvider;
    private final String issuer;
    private final String audience;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.issuer:}") String issuer,
            @Value("${jwt.audience:}") String audience,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.issuer = issuer;
        this.audience = audience;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public boolean isSigningKeyConfigured() {
        return tokenProvider.isConfigured();
    }

    public IssuedToken issueAccessToken(User user) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusMillis(accessTokenTtlMillis);
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .id(tokenId)
                .subject(user.getUsername())
                .issuer(issuer)
                .audience().single(audience)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_NAME, user.getUsername())
                .claim(CLAIM_NAME_ID, String.valueOf(user.getId()))
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, tokenId, expiresAt);
    }

    /**
     * Verifies signature, issuer, audience and lifetime in that order. Lifetime is checked
     * with zero clock skew: a token expiring at T is rejected at T.
     */
    public GateDecision validateAccessToken(String token) {
        try {
            Claims claims = parseVerifiedClaims(token);

            if (issuer == null || issuer.isBlank() || !issuer.equals(claims.getIssuer())) {
                return GateDecision.rejected(GateErrorKind.INVALID_ISSUER);
            }

            Set<String> audiences = claims.getAudience();
            if (audience == null || audience.isBlank() || audiences == null || !audiences.contains(audience)) {
                return GateDecision.rejected(GateErrorKind.INVALID_AUDIENCE);
            }

            Instant now = clock.instant();
            Date expiration = claims.getExpiration();
            if (expiration == null) {
                return GateDecision.rejected(GateErrorKind.INVALID_TOKEN, "Invalid JWT token: token has no expiration");
            }
            if (!now.isBefore(expiration.toInstant())) {
                return GateDecision.rejected(GateErrorKind.TOKEN_EXPIRED);
            }

            Date notBefore = claims.getNotBefore();
            if (notBefore != null && notBefore.toInstant().isAfter(now)) {
                return GateDecision.rejected(GateErrorKind.INVALID_TOKEN, "Invalid JWT token: token is not valid yet");
            }

            return GateDecision.authenticated(toIdentity(claims, expiration.toInstant()));
        } catch (SecurityException e) {
            return GateDecision.rejected(GateErrorKind.INVALID_SIGNATURE);
        } catch (JwtException e) {
            return GateDecision.rejected(GateErrorKind.INVALID_TOKEN, "Invalid JWT token: " + e.getMessage());
        } catch (RuntimeException e) {
            return GateDecision.rejected(GateErrorKind.VALIDATION_FAILED, "Token validation failed: " + e.getMessage());
        }
    }

    private Claims parseVerifiedClaims(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ClaimJwtException e) {
            // Thrown for exp/nbf only after the signature verified; lifetime is re-checked by the caller.
            return e.getClaims();
        }
    }

    private RequestIdentity toIdentity(Claims claims, Instant expiresAt) {
        Object nameId = claims.get(CLAIM_NAME_ID);
        return new RequestIdentity(
                nameId != null ? Objects.toString(nameId) : null,
                claims.getSubject(),
                claims.getId(),
                expiresAt,
                claims
        );
    }

    public record IssuedToken(String token, String tokenId, Instant expiresAt) {
    }
}
