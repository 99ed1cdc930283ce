package com.boilerplate.backend.global.security;

import java.time.Instant;

import io.jsonwebtoken.Claims;

/**
 * Identity established by the request gate for one request. Exposed to handlers as the
 * Spring Security principal and as the {@link #REQUEST_ATTRIBUTE} request attribute.
 *
 * @param userId    value of the {@code nameid} claim, null when absent
 * @param username  value of the {@code sub} claim, null when absent
 * @param tokenId   value of the {@code jti} claim
 * @param expiresAt token expiry
 * @param claims    full verified claim set
 */
public record RequestIdentity(String userId, String username, String tokenId, Instant expiresAt, Claims claims) {

    public static final String REQUEST_ATTRIBUTE = RequestIdentity.class.getName();
}
