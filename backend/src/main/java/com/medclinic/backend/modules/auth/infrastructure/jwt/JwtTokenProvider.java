package com.medclinic.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.medclinic.backend.modules.auth.domain.TokenType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HMAC keys of the two token classes. Access and refresh tokens are signed with
 * distinct secrets so one class can never be replayed as the other.
 */
@Component
public class JwtTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenProvider.class);

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public JwtTokenProvider(
            @Value("${clinic.auth.jwt.access-secret:}") String accessSecret,
            @Value("${clinic.auth.jwt.refresh-secret:}") String refreshSecret
    ) {
        this.accessKey = toKey("access", accessSecret);
        this.refreshKey = toKey("refresh", refreshSecret);
        if (Arrays.equals(accessKey.getEncoded(), refreshKey.getEncoded())) {
            log.warn("Access and refresh tokens share the same signing secret");
        }
    }

    public SecretKey getSecretKey(TokenType type) {
        return type == TokenType.REFRESH ? refreshKey : accessKey;
    }

    private static SecretKey toKey(String name, String secretString) {
        if (secretString == null || secretString.isBlank()) {
            // Tokens signed with a generated key do not survive a restart.
            log.warn("No {} token secret configured, generating an ephemeral key", name);
            byte[] random = new byte[64];
            new SecureRandom().nextBytes(random);
            return new SecretKeySpec(random, HMAC_SHA_256);
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("The " + name + " token secret must be at least " + MIN_KEY_BYTES + " bytes");
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }
}
