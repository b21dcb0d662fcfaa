package com.medclinic.backend.global.ratelimit;

public enum RateLimitScope {
    GLOBAL,
    AUTH,
    ADMIN;

    public String keyPrefix() {
        return name().toLowerCase();
    }
}
