package com.monumentlens.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import com.monumentlens.backend.global.config.IdentityProperties;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.stereotype.Component;

/**
 * PBKDF2-HMAC-SHA256 password digests. Salts and digests are hex strings so they can be stored as-is.
 */
@Component
public class PasswordHasher {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int KEY_LENGTH_BITS = 256;
    private static final HexFormat HEX = HexFormat.of();
    private static final String DUMMY_SALT = "6d6f6e756d656e746c656e732d64756d";

    private final BytesKeyGenerator saltGenerator;
    private final int defaultIterations;

    @Autowired
    public PasswordHasher(IdentityProperties properties) {
        this(properties.getPassword().getSaltBytes(), properties.getPassword().getIterations());
    }

    public PasswordHasher(int saltBytes, int defaultIterations) {
        if (saltBytes < 16) {
            throw new IllegalArgumentException("Salt must be at least 16 bytes");
        }
        if (defaultIterations < 1) {
            throw new IllegalArgumentException("Iteration count must be positive");
        }
        this.saltGenerator = KeyGenerators.secureRandom(saltBytes);
        this.defaultIterations = defaultIterations;
    }

    public String generateSalt() {
        return HEX.formatHex(saltGenerator.generateKey());
    }

    public int defaultIterations() {
        return defaultIterations;
    }

    public String hash(String password, String salt, int iterations) {
        // some providers reject an empty HMAC key; stored passwords are never empty
        char[] chars = password.isEmpty() ? new char[] {'\0'} : password.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(chars, HEX.parseHex(salt), iterations, KEY_LENGTH_BITS);
        try {
            byte[] derived = SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
            return HEX.formatHex(derived);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException(ALGORITHM + " is not available", ex);
        } finally {
            spec.clearPassword();
        }
    }

    public boolean verify(String password, String salt, int iterations, String digest) {
        byte[] candidate = hash(password, salt, iterations).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(candidate, digest.getBytes(StandardCharsets.US_ASCII));
    }

    public boolean needsRehash(int storedIterations) {
        return storedIterations < defaultIterations;
    }

    /**
     * Spends one full-cost derivation so a lookup miss takes as long as a real verification.
     */
    public void burn(String password) {
        hash(password, DUMMY_SALT, defaultIterations);
    }
}
