package com.boilerplate.backend.global.security;

import org.springframework.http.HttpStatus;

/**
 * Rejection kinds produced by the request gate. Everything except
 * {@link #SERVER_MISCONFIGURED} is a client failure answered with 401.
 */
public enum GateErrorKind {

    MISSING_AUTH_HEADER(HttpStatus.UNAUTHORIZED, "Authorization header is required"),
    EMPTY_TOKEN(HttpStatus.UNAUTHORIZED, "JWT token is empty"),
    MALFORMED_TOKEN(HttpStatus.UNAUTHORIZED, "JWT token is malformed. Token must be in format: header.payload.signature"),
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED, "Invalid JWT token signature"),
    INVALID_ISSUER(HttpStatus.UNAUTHORIZED, "Invalid JWT token issuer"),
    INVALID_AUDIENCE(HttpStatus.UNAUTHORIZED, "Invalid JWT token audience"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "JWT token has expired"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid JWT token"),
    VALIDATION_FAILED(HttpStatus.UNAUTHORIZED, "Token validation failed"),
    SERVER_MISCONFIGURED(HttpStatus.INTERNAL_SERVER_ERROR, "JWT configuration is missing");

    private final HttpStatus status;
    private final String defaultMessage;

    GateErrorKind(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
