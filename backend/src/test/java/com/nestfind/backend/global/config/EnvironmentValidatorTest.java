package com.nestfind.backend.global.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static final String GOOD_SECRET = "0123456789abcdef0123456789abcdef-ok";

    @Test
    void completeConfigurationPasses() {
        assertThatCode(() -> new EnvironmentValidator(validEnvironment()).validateEnvironment())
                .doesNotThrowAnyException();
    }

    @Test
    void placeholderJwtSecretIsRefused() {
        MockEnvironment environment = validEnvironment()
                .withProperty("jwt.secret", EnvironmentValidator.PLACEHOLDER_SECRET);

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.secret");
    }

    @Test
    void shortHashSecretIsRefused() {
        MockEnvironment environment = validEnvironment()
                .withProperty("app.auth.token-hash-secret", "too-short");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .hasMessageContaining("app.auth.token-hash-secret");
    }

    @Test
    void accessTokenLifetimeMustStayWithinAnHour() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.expiration", "7200000");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .hasMessageContaining("jwt.expiration");
    }

    @Test
    void missingDatasourceIsReported() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", GOOD_SECRET)
                .withProperty("jwt.expiration", "900000")
                .withProperty("app.auth.token-hash-secret", GOOD_SECRET);

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .hasMessageContaining("spring.datasource.url: missing");
    }

    private static MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/nestfind")
                .withProperty("jwt.secret", GOOD_SECRET)
                .withProperty("jwt.expiration", "900000")
                .withProperty("app.auth.token-hash-secret", GOOD_SECRET);
    }
}
