package com.boilerplate.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void missingKeyIsAnError() {
        MockEnvironment environment = completeEnvironment().withProperty("jwt.key", "  ");

        assertThat(new EnvironmentValidator(environment).findErrors())
                .singleElement()
                .asString()
                .startsWith("jwt.key is not set");
    }

    @Test
    void shortKeyIsAnError() {
        MockEnvironment environment = completeEnvironment().withProperty("jwt.key", "short");

        assertThat(new EnvironmentValidator(environment).findErrors())
                .singleElement()
                .asString()
                .contains("at least 32 bytes");
    }

    @Test
    void samplePlaceholderKeyIsAnError() {
        MockEnvironment environment = completeEnvironment()
                .withProperty("jwt.key", "dev-only-signing-key-CHANGE-ME-0123456789abcdef");

        assertThat(new EnvironmentValidator(environment).findErrors())
                .singleElement()
                .asString()
                .contains("placeholder");
    }

    @Test
    void completeConfigurationHasNoFindings() {
        EnvironmentValidator validator = new EnvironmentValidator(completeEnvironment());

        assertThat(validator.findErrors()).isEmpty();
        assertThat(validator.findWarnings()).isEmpty();
    }

    @Test
    void blankIssuerAudienceAndOddExpirationAreWarnings() {
        MockEnvironment environment = completeEnvironment()
                .withProperty("jwt.issuer", "")
                .withProperty("jwt.audience", "")
                .withProperty("jwt.expiration", "1000");

        assertThat(new EnvironmentValidator(environment).findWarnings()).hasSize(3);
    }

    private static MockEnvironment completeEnvironment() {
        return new MockEnvironment()
                .withProperty("jwt.key", "a-random-production-secret-0123456789abcdef")
                .withProperty("jwt.issuer", "api-boilerplate")
                .withProperty("jwt.audience", "api-boilerplate-clients")
                .withProperty("jwt.expiration", "3600000");
    }
}
