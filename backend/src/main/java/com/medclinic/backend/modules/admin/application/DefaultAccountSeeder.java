package com.medclinic.backend.modules.admin.application;

import com.medclinic.backend.modules.auth.application.CredentialStore;
import com.medclinic.backend.modules.auth.application.PasswordHasher;
import com.medclinic.backend.modules.auth.application.PasswordPolicy;
import com.medclinic.backend.modules.auth.domain.Account;
import com.medclinic.backend.modules.auth.domain.AccountRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the first verified manager so a fresh database can be administered. Existing
 * accounts are never modified.
 */
@Component
@ConditionalOnProperty(value = "clinic.seed.enabled", havingValue = "true")
public class DefaultAccountSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultAccountSeeder.class);

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;

    @Value("${clinic.seed.manager-email:admin@clinic.com}")
    private String managerEmail;

    @Value("${clinic.seed.manager-password:}")
    private String managerPassword;

    @Value("${clinic.seed.manager-first-name:System}")
    private String managerFirstName;

    @Value("${clinic.seed.manager-last-name:Administrator}")
    private String managerLastName;

    public DefaultAccountSeeder(CredentialStore credentialStore, PasswordHasher passwordHasher, PasswordPolicy passwordPolicy) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.passwordPolicy = passwordPolicy;
    }

    @Override
    public void run(ApplicationArguments args) {
        seedManager();
    }

    void seedManager() {
        String email = managerEmail == null ? "" : managerEmail.trim().toLowerCase();
        if (email.isEmpty()) {
            log.warn("Default manager seeding skipped: clinic.seed.manager-email is empty");
            return;
        }
        if (credentialStore.existsByEmail(email)) {
            log.debug("Default manager {} already present", email);
            return;
        }
        if (managerPassword == null || managerPassword.isBlank()) {
            log.warn("Default manager seeding skipped: clinic.seed.manager-password is not set");
            return;
        }
        if (!passwordPolicy.violations(managerPassword).isEmpty()) {
            throw new IllegalStateException("clinic.seed.manager-password does not satisfy the password policy");
        }

        Account manager = new Account();
        manager.setEmail(email);
        manager.setPasswordHash(passwordHasher.hash(managerPassword));
        manager.setFirstName(managerFirstName);
        manager.setLastName(managerLastName);
        manager.setRole(AccountRole.MANAGER);
        manager.setActive(true);
        manager.setVerified(true);
        credentialStore.create(manager);
        log.info("Seeded default manager account {}", email);
    }
}
