package com.medclinic.backend.modules.auth.domain;

import java.util.Locale;

public enum TokenType {
    ACCESS,
    REFRESH;

    public String claimValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TokenType fromClaim(String claim) {
        if (claim == null) {
            return null;
        }
        for (TokenType type : values()) {
            if (type.claimValue().equals(claim)) {
                return type;
            }
        }
        return null;
    }
}
