package com.medclinic.backend.modules.auth.application;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class PasswordPolicy {

    private static final Pattern LOWERCASE = Pattern.compile("[a-z]");
    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern SPECIAL = Pattern.compile("[@$!%*?&]");

    private final int minLength;

    public PasswordPolicy(@Value("${clinic.auth.password.min-length:8}") int minLength) {
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be >= 1");
        }
        this.minLength = minLength;
    }

    /**
     * @return human readable violations, empty when the password is acceptable
     */
    public List<String> violations(String password) {
        List<String> violations = new ArrayList<>();
        if (password == null || password.length() < minLength) {
            violations.add("must be at least " + minLength + " characters long");
            if (password == null) {
                return violations;
            }
        }
        if (!LOWERCASE.matcher(password).find()) {
            violations.add("must contain a lowercase letter");
        }
        if (!UPPERCASE.matcher(password).find()) {
            violations.add("must contain an uppercase letter");
        }
        if (!DIGIT.matcher(password).find()) {
            violations.add("must contain a digit");
        }
        if (!SPECIAL.matcher(password).find()) {
            violations.add("must contain one of @$!%*?&");
        }
        return violations;
    }
}
