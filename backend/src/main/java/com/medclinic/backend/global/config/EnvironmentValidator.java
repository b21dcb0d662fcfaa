package com.medclinic.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Refuses to finish startup under the {@code prod} profile when the token signing setup is
 * unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_SECRET_LENGTH = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        if (!environment.acceptsProfiles(Profiles.of("prod"))) {
            return;
        }

        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment check failed: {}", problem));
            throw new IllegalStateException("Invalid production configuration: " + String.join("; ", problems));
        }
        log.info("Environment check passed");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String accessSecret = environment.getProperty("clinic.auth.jwt.access-secret", "").trim();
        String refreshSecret = environment.getProperty("clinic.auth.jwt.refresh-secret", "").trim();
        if (accessSecret.isEmpty()) {
            problems.add("clinic.auth.jwt.access-secret is missing");
        } else if (accessSecret.length() < MIN_SECRET_LENGTH) {
            problems.add("clinic.auth.jwt.access-secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        if (refreshSecret.isEmpty()) {
            problems.add("clinic.auth.jwt.refresh-secret is missing");
        } else if (refreshSecret.length() < MIN_SECRET_LENGTH) {
            problems.add("clinic.auth.jwt.refresh-secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        if (!accessSecret.isEmpty() && accessSecret.equals(refreshSecret)) {
            problems.add("access and refresh secrets must differ");
        }

        Duration accessTtl = environment.getProperty("clinic.auth.jwt.access-ttl", Duration.class, Duration.ofMinutes(15));
        Duration refreshTtl = environment.getProperty("clinic.auth.jwt.refresh-ttl", Duration.class, Duration.ofDays(7));
        if (accessTtl.compareTo(refreshTtl) >= 0) {
            problems.add("clinic.auth.jwt.access-ttl must be shorter than refresh-ttl");
        }

        if (!environment.getProperty("clinic.auth.cookie.secure", Boolean.class, Boolean.TRUE)) {
            problems.add("clinic.auth.cookie.secure must be true");
        }
        if (environment.getProperty("clinic.seed.enabled", Boolean.class, Boolean.FALSE)) {
            problems.add("clinic.seed.enabled must be false");
        }
        return problems;
    }
}
