package com.lunarview.crypto;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * PBKDF2-HMAC-SHA256 password hashing for session admission.
 *
 * The connection-id doubles as the salt, so the same password registered under
 * two different ids produces two unrelated hashes. Output is lower-case hex.
 */
public class PasswordHasher {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    public static final int DEFAULT_ITERATIONS = 100_000;
    private static final int KEY_LENGTH_BITS = 64 * 8;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final int iterations;

    public PasswordHasher() {
        this(DEFAULT_ITERATIONS);
    }

    public PasswordHasher(int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
    }

    /**
     * Derive the stored hash for {@code password} under {@code connectionId}.
     */
    public String hash(String password, String connectionId) {
        if (password.isEmpty()) {
            // viewers register without a password; nothing to derive
            return "";
        }
        PBEKeySpec spec = new PBEKeySpec(
            password.toCharArray(),
            connectionId.getBytes(StandardCharsets.UTF_8),
            iterations,
            KEY_LENGTH_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(ALGORITHM);
            return toHex(factory.generateSecret(spec).getEncoded());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Constant-time comparison of a candidate password against a stored hash.
     */
    public boolean matches(String password, String connectionId, String storedHash) {
        if (password == null || storedHash == null) {
            return false;
        }
        byte[] candidate = hash(password, connectionId).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(candidate, storedHash.getBytes(StandardCharsets.US_ASCII));
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0x0F];
            out[i * 2 + 1] = HEX[bytes[i] & 0x0F];
        }
        return new String(out);
    }
}
