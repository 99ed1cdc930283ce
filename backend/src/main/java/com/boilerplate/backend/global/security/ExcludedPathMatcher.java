package com.boilerplate.backend.global.security;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable, ordered set of path prefixes that bypass token validation.
 * A path is excluded when it starts with any prefix, ignoring case.
 */
public final class ExcludedPathMatcher {

    public static final List<String> DEFAULT_PREFIXES = List.of(
            "/api/auth/login",
            "/api/auth/register",
            "/swagger",
            "/v3/api-docs",
            "/actuator/health",
            "/error"
    );

    private final List<String> prefixes;

    public ExcludedPathMatcher(List<String> prefixes) {
        Set<String> normalized = new LinkedHashSet<>();
        if (prefixes != null) {
            for (String prefix : prefixes) {
                if (prefix != null && !prefix.isBlank()) {
                    normalized.add(prefix.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.prefixes = List.copyOf(normalized);
    }

    public static ExcludedPathMatcher defaults() {
        return new ExcludedPathMatcher(DEFAULT_PREFIXES);
    }

    public boolean matches(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        String candidate = path.toLowerCase(Locale.ROOT);
        for (String prefix : prefixes) {
            if (candidate.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public List<String> prefixes() {
        return prefixes;
    }
}
