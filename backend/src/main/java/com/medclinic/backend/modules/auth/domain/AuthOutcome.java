package com.medclinic.backend.modules.auth.domain;

public enum AuthOutcome {
    SUCCESS,
    INVALID_CREDENTIALS,
    LOCKED,
    LOCKED_JUST_NOW
}
