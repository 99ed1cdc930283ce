package com.boilerplate.backend.global.security;

import java.io.IOException;
import java.util.Base64;
import java.util.regex.Pattern;

import com.boilerplate.backend.modules.auth.application.JwtTokenService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decides, for one request, whether its credentials are acceptable.
 * Stateless: holds only the excluded-path matcher, the token service and a JSON reader.
 */
public class RequestGate {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Pattern BASE64URL = Pattern.compile("[A-Za-z0-9_-]*");

    private final ExcludedPathMatcher excludedPaths;
    private final JwtTokenService jwtTokenService;
    private final ObjectMapper objectMapper;

    public RequestGate(ExcludedPathMatcher excludedPaths, JwtTokenService jwtTokenService, ObjectMapper objectMapper) {
        this.excludedPaths = excludedPaths;
        this.jwtTokenService = jwtTokenService;
        this.objectMapper = objectMapper;
    }

    public boolean isExcluded(String path) {
        return excludedPaths.matches(path);
    }

    /**
     * Evaluates the raw {@code Authorization} header of a request whose path is not excluded.
     *
     * @param authorizationHeader header value, null when the header is absent
     */
    public GateDecision authenticate(String authorizationHeader) {
        if (!jwtTokenService.isSigningKeyConfigured()) {
            return GateDecision.rejected(GateErrorKind.SERVER_MISCONFIGURED);
        }
        if (authorizationHeader == null) {
            return GateDecision.rejected(GateErrorKind.MISSING_AUTH_HEADER);
        }

        String token = extractToken(authorizationHeader);
        if (token.isBlank()) {
            return GateDecision.rejected(GateErrorKind.EMPTY_TOKEN);
        }

        String[] segments = token.split("\\.", -1);
        if (segments.length != 3) {
            return GateDecision.rejected(GateErrorKind.MALFORMED_TOKEN);
        }
        if (!isReadable(segments)) {
            return GateDecision.rejected(GateErrorKind.MALFORMED_TOKEN, "Invalid JWT token format");
        }

        return jwtTokenService.validateAccessToken(token);
    }

    /**
     * Strips a case-insensitive {@code "Bearer "} prefix. A header without the scheme is taken as
     * the raw token.
     */
    static String extractToken(String authorizationHeader) {
        String value = authorizationHeader.stripLeading();
        if (value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return value.substring(BEARER_PREFIX.length()).trim();
        }
        return value.trim();
    }

    private boolean isReadable(String[] segments) {
        for (String segment : segments) {
            if (!BASE64URL.matcher(segment).matches()) {
                return false;
            }
        }
        JsonNode header = readJsonObject(segments[0]);
        if (header == null || !header.path("alg").isTextual()) {
            return false;
        }
        return readJsonObject(segments[1]) != null;
    }

    private JsonNode readJsonObject(String segment) {
        if (segment.isEmpty()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(Base64.getUrlDecoder().decode(segment));
            return node != null && node.isObject() ? node : null;
        } catch (IllegalArgumentException | IOException e) {
            return null;
        }
    }
}
