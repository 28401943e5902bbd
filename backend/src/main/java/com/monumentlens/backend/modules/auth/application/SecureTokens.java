package com.monumentlens.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;

import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;

/**
 * Bearer token generation and the digest under which tokens are stored.
 */
public final class SecureTokens {

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final BytesKeyGenerator generator;

    public SecureTokens(int tokenBytes) {
        if (tokenBytes < 16) {
            throw new IllegalArgumentException("Tokens must carry at least 128 bits");
        }
        this.generator = KeyGenerators.secureRandom(tokenBytes);
    }

    public String newToken() {
        return URL_ENCODER.encodeToString(generator.generateKey());
    }

    public static String digest(String token) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
