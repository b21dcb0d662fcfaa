package com.medclinic.backend.modules.auth.domain;

import java.util.Locale;

public enum AccountRole {
    MANAGER,
    DOCTOR,
    SECRETARY,
    NURSE;

    public String authority() {
        return "ROLE_" + name();
    }

    public static AccountRole from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("role is required");
        }
        return AccountRole.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
