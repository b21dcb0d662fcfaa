package com.medclinic.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.convert.ApplicationConversionService;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static final String ACCESS_SECRET = "prod-access-secret-0123456789-abcdefghij";
    private static final String REFRESH_SECRET = "prod-refresh-secret-0123456789-abcdefghij";

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        environment.setConversionService(new ApplicationConversionService());
        environment.setActiveProfiles("prod");
        environment.setProperty("clinic.auth.jwt.access-secret", ACCESS_SECRET);
        environment.setProperty("clinic.auth.jwt.refresh-secret", REFRESH_SECRET);
        environment.setProperty("clinic.auth.cookie.secure", "true");
        environment.setProperty("clinic.seed.enabled", "false");
    }

    @Test
    void soundProductionConfigurationPasses() {
        EnvironmentValidator validator = new EnvironmentValidator(environment);

        assertThat(validator.validate()).isEmpty();
        assertThatCode(validator::validateEnvironment).doesNotThrowAnyException();
    }

    @Test
    void sharedSecretIsReported() {
        environment.setProperty("clinic.auth.jwt.access-secret", REFRESH_SECRET);
        environment.setProperty("clinic.auth.jwt.refresh-secret", REFRESH_SECRET);

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactly("access and refresh secrets must differ");
    }

    @Test
    void shortSecretIsReported() {
        environment.setProperty("clinic.auth.jwt.refresh-secret", "short");

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactly("clinic.auth.jwt.refresh-secret must be at least 32 characters");
    }

    @Test
    void accessTtlMustBeShorterThanRefreshTtl() {
        environment.setProperty("clinic.auth.jwt.access-ttl", "8d");
        environment.setProperty("clinic.auth.jwt.refresh-ttl", "7d");

        assertThat(new EnvironmentValidator(environment).validate())
                .containsExactly("clinic.auth.jwt.access-ttl must be shorter than refresh-ttl");
    }

    @Test
    void insecureSettingsAbortStartup() {
        environment.setProperty("clinic.auth.cookie.secure", "false");
        environment.setProperty("clinic.seed.enabled", "true");

        assertThatThrownBy(new EnvironmentValidator(environment)::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cookie.secure")
                .hasMessageContaining("seed.enabled");
    }

    @Test
    void nonProductionProfilesAreNotChecked() {
        environment.setActiveProfiles("local");
        environment.setProperty("clinic.auth.jwt.access-secret", "");

        assertThatCode(new EnvironmentValidator(environment)::validateEnvironment).doesNotThrowAnyException();
    }
}
