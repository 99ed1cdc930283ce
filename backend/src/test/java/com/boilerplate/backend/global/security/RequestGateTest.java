package com.boilerplate.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import com.boilerplate.backend.global.security.GateDecision.Authenticated;
import com.boilerplate.backend.global.security.GateDecision.Rejected;
import com.boilerplate.backend.modules.auth.application.JwtTokenService;
import com.boilerplate.backend.modules.auth.domain.User;
import com.boilerplate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class RequestGateTest {

    private static final String KEY = "unit-test-signing-key-0123456789abcdef";
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private JwtTokenService tokenService;
    private RequestGate gate;
    private String validToken;

    @BeforeEach
    void setUp() {
        tokenService = tokenService(KEY);
        gate = new RequestGate(ExcludedPathMatcher.defaults(), tokenService, new ObjectMapper());

        User alice = new User();
        ReflectionTestUtils.setField(alice, "id", 7L);
        alice.setUsername("alice");
        validToken = tokenService.issueAccessToken(alice).token();
    }

    @Test
    void missingKeyIsReportedBeforeAnythingElse() {
        RequestGate misconfigured = new RequestGate(
                ExcludedPathMatcher.defaults(), tokenService("too-short"), new ObjectMapper());

        assertRejected(misconfigured.authenticate(null), GateErrorKind.SERVER_MISCONFIGURED);
        assertRejected(misconfigured.authenticate("Bearer " + validToken), GateErrorKind.SERVER_MISCONFIGURED);
        assertThat(GateErrorKind.SERVER_MISCONFIGURED.status().value()).isEqualTo(500);
    }

    @Test
    void absentHeaderIsMissing() {
        Rejected rejected = assertRejected(gate.authenticate(null), GateErrorKind.MISSING_AUTH_HEADER);

        assertThat(rejected.message()).isEqualTo("Authorization header is required");
    }

    @Test
    void blankTokenIsEmpty() {
        assertRejected(gate.authenticate("Bearer "), GateErrorKind.EMPTY_TOKEN);
        assertRejected(gate.authenticate("Bearer    "), GateErrorKind.EMPTY_TOKEN);
        assertRejected(gate.authenticate(""), GateErrorKind.EMPTY_TOKEN);
    }

    @Test
    void tokenMustHaveExactlyThreeSegments() {
        assertRejected(gate.authenticate("Bearer abc.def"), GateErrorKind.MALFORMED_TOKEN);
        assertRejected(gate.authenticate("Bearer a.b.c.d"), GateErrorKind.MALFORMED_TOKEN);
        assertRejected(gate.authenticate("Bearer notajwt"), GateErrorKind.MALFORMED_TOKEN);
    }

    @Test
    void unreadableSegmentsAreMalformed() {
        Rejected rejected = assertRejected(gate.authenticate("Bearer !!.??.##"), GateErrorKind.MALFORMED_TOKEN);

        assertThat(rejected.message()).isEqualTo("Invalid JWT token format");
        assertRejected(gate.authenticate("Bearer " + encode("not json") + ".e30.sig"), GateErrorKind.MALFORMED_TOKEN);
        assertRejected(gate.authenticate("Bearer " + encode("{\"typ\":\"JWT\"}") + ".e30.sig"),
                GateErrorKind.MALFORMED_TOKEN);
    }

    @Test
    void schemeIsMatchedIgnoringCase() {
        assertThat(gate.authenticate("Bearer " + validToken)).isInstanceOf(Authenticated.class);
        assertThat(gate.authenticate("bearer " + validToken)).isInstanceOf(Authenticated.class);
        assertThat(gate.authenticate("  BEARER " + validToken)).isInstanceOf(Authenticated.class);
    }

    @Test
    void headerWithoutSchemeIsTreatedAsRawToken() {
        GateDecision decision = gate.authenticate(validToken);

        assertThat(decision).isInstanceOf(Authenticated.class);
        assertThat(((Authenticated) decision).identity().userId()).isEqualTo("7");
    }

    @Test
    void unsignedTokenIsInvalid() {
        String unsigned = encode("{\"alg\":\"none\"}") + "." + encode("{\"sub\":\"alice\"}") + ".";

        assertRejected(gate.authenticate("Bearer " + unsigned), GateErrorKind.INVALID_TOKEN);
    }

    @Test
    void tamperedPayloadFailsSignature() {
        String[] parts = validToken.split("\\.");
        String forged = parts[0] + "." + encode("{\"sub\":\"mallory\",\"nameid\":\"1\"}") + "." + parts[2];

        assertRejected(gate.authenticate("Bearer " + forged), GateErrorKind.INVALID_SIGNATURE);
    }

    @Test
    void excludedPathsAreDelegatedToMatcher() {
        assertThat(gate.isExcluded("/API/AUTH/LOGIN")).isTrue();
        assertThat(gate.isExcluded("/api/roles")).isFalse();
    }

    @Test
    void extractTokenStripsOnlyTheScheme() {
        assertThat(RequestGate.extractToken("Bearer abc")).isEqualTo("abc");
        assertThat(RequestGate.extractToken("bEaReR  abc ")).isEqualTo("abc");
        assertThat(RequestGate.extractToken("Basic abc")).isEqualTo("Basic abc");
    }

    private static Rejected assertRejected(GateDecision decision, GateErrorKind kind) {
        assertThat(decision).isInstanceOf(Rejected.class);
        Rejected rejected = (Rejected) decision;
        assertThat(rejected.kind()).isEqualTo(kind);
        return rejected;
    }

    private static JwtTokenService tokenService(String key) {
        return new JwtTokenService(new JwtTokenProvider(key), "api-boilerplate", "api-boilerplate-clients",
                3_600_000L, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static String encode(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
