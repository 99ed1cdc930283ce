package com.boilerplate.backend.global.security;

import java.util.Objects;

/**
 * Outcome of evaluating one request's credentials: either an authenticated identity
 * or a rejection kind with its message.
 */
public interface GateDecision {

    static GateDecision authenticated(RequestIdentity identity) {
        return new Authenticated(identity);
    }

    static GateDecision rejected(GateErrorKind kind) {
        return new Rejected(kind, kind.defaultMessage());
    }

    static GateDecision rejected(GateErrorKind kind, String message) {
        return new Rejected(kind, message);
    }

    record Authenticated(RequestIdentity identity) implements GateDecision {
        public Authenticated {
            Objects.requireNonNull(identity, "identity");
        }
    }

    record Rejected(GateErrorKind kind, String message) implements GateDecision {
        public Rejected {
            Objects.requireNonNull(kind, "kind");
            if (message == null || message.isBlank()) {
                message = kind.defaultMessage();
            }
        }
    }
}
