package com.boilerplate.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.boilerplate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Reports token configuration problems once at startup. The process keeps running: the request
 * gate answers every protected request with 500 until {@code jwt.key} is fixed.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    /** Marker carried by sample keys in docs and local setups; such a key is public. */
    static final String PLACEHOLDER_MARKER = "change-me";
    private static final long MIN_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_EXPIRATION_MILLIS = 86_400_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> errors = findErrors();
        List<String> warnings = findWarnings();
        errors.forEach(log::error);
        warnings.forEach(log::warn);
        if (errors.isEmpty() && warnings.isEmpty()) {
            log.info("JWT configuration validated");
        }
    }

    List<String> findErrors() {
        List<String> errors = new ArrayList<>();
        Optional<String> jwtKey = property("jwt.key");
        if (jwtKey.isEmpty()) {
            errors.add("jwt.key is not set; protected endpoints will answer 500 SERVER_MISCONFIGURED");
        } else if (jwtKey.get().getBytes(StandardCharsets.UTF_8).length < JwtTokenProvider.MIN_KEY_BYTES) {
            errors.add("jwt.key must be at least " + JwtTokenProvider.MIN_KEY_BYTES
                    + " bytes for HS256; protected endpoints will answer 500 SERVER_MISCONFIGURED");
        } else if (jwtKey.get().toLowerCase(Locale.ROOT).contains(PLACEHOLDER_MARKER)) {
            errors.add("jwt.key is a sample placeholder; replace it with a random secret (JWT_KEY)");
        }
        return errors;
    }

    List<String> findWarnings() {
        List<String> warnings = new ArrayList<>();
        if (property("jwt.issuer").isEmpty()) {
            warnings.add("jwt.issuer is not set; every token will be rejected as INVALID_ISSUER");
        }
        if (property("jwt.audience").isEmpty()) {
            warnings.add("jwt.audience is not set; every token will be rejected as INVALID_AUDIENCE");
        }
        property("jwt.expiration").ifPresent(value -> {
            try {
                long expiration = Long.parseLong(value);
                if (expiration < MIN_EXPIRATION_MILLIS || expiration > MAX_EXPIRATION_MILLIS) {
                    warnings.add("jwt.expiration should be between 300000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException ex) {
                warnings.add("jwt.expiration must be a number of milliseconds");
            }
        });
        return warnings;
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
