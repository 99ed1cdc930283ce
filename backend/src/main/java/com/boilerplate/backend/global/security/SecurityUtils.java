package com.boilerplate.backend.global.security;

import com.boilerplate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Numeric user id carried by the identity's {@code nameid} claim.
     */
    public static Long requireUserId(RequestIdentity identity) {
        if (identity == null || identity.userId() == null) {
            throw unidentified();
        }
        try {
            return Long.valueOf(identity.userId());
        } catch (NumberFormatException ex) {
            throw unidentified();
        }
    }

    private static ProblemException unidentified() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Token does not identify a user");
    }
}
