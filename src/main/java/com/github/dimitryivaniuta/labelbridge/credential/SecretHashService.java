package com.github.dimitryivaniuta.labelbridge.credential;

import com.github.dimitryivaniuta.labelbridge.config.LabelBridgeProperties;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Salted one-way hashing of principal secrets.
 *
 * <p>Stored format: {@code pbkdf2-sha256$<iterations>$<salt-b64>$<hash-b64>}. The pepper is a
 * server-side secret appended before hashing and never stored.
 */
@Service
public class SecretHashService {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final String PREFIX = "pbkdf2-sha256";
    private static final int SALT_BYTES = 16;
    private static final int KEY_BITS = 256;

    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final SecureRandom secureRandom = new SecureRandom();

    private final String pepper;
    private final int iterations;
    private final String dummyHash;

    public SecretHashService(LabelBridgeProperties props) {
        String p = props.getSecrets().getPepper();
        this.pepper = p == null ? "" : p;
        this.iterations = Math.max(1, props.getSecrets().getIterations());
        // used for unknown identifiers, so every verify performs exactly one derivation
        this.dummyHash = hash("dummy-secret-" + secureRandom.nextLong());
    }

    public String hash(String rawSecret) {
        if (rawSecret == null || rawSecret.isEmpty()) {
            throw new IllegalArgumentException("rawSecret must not be empty");
        }
        byte[] salt = new byte[SALT_BYTES];
        secureRandom.nextBytes(salt);
        byte[] derived = derive(rawSecret, salt, iterations);
        Base64.Encoder b64 = Base64.getEncoder().withoutPadding();
        return PREFIX + "$" + iterations + "$" + b64.encodeToString(salt) + "$" + b64.encodeToString(derived);
    }

    /**
     * Constant-time comparison of a raw secret against a stored hash. Malformed hashes never match.
     */
    public boolean matches(String rawSecret, String storedHash) {
        String[] parts = storedHash == null ? new String[0] : storedHash.split("\\$");
        if (parts.length != 4 || !PREFIX.equals(parts[0]) || rawSecret == null) {
            // still burn one derivation so malformed rows are not distinguishable by timing
            matches(rawSecret == null ? "" : rawSecret, dummyHash);
            return false;
        }
        try {
            int iter = Integer.parseInt(parts[1]);
            byte[] salt = Base64.getDecoder().decode(parts[2]);
            byte[] expected = Base64.getDecoder().decode(parts[3]);
            byte[] actual = derive(rawSecret, salt, iter);
            return MessageDigest.isEqual(expected, actual);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /** Burns the same work as a real comparison; result is always false. */
    public boolean matchesNothing(String rawSecret) {
        matches(rawSecret == null ? "" : rawSecret, dummyHash);
        return false;
    }

    /**
     * Password policy carried over from registration: at least 8 characters with an upper-case
     * letter, a lower-case letter and a digit.
     */
    public void checkPolicy(String rawSecret) {
        if (rawSecret == null || rawSecret.length() < 8) {
            throw new WeakSecretException("Secret must be at least 8 characters long");
        }
        if (!UPPER.matcher(rawSecret).find()) {
            throw new WeakSecretException("Secret must contain at least one uppercase letter");
        }
        if (!LOWER.matcher(rawSecret).find()) {
            throw new WeakSecretException("Secret must contain at least one lowercase letter");
        }
        if (!DIGIT.matcher(rawSecret).find()) {
            throw new WeakSecretException("Secret must contain at least one number");
        }
    }

    private byte[] derive(String rawSecret, byte[] salt, int iter) {
        char[] input = (rawSecret + ":" + pepper).toCharArray();
        PBEKeySpec spec = new PBEKeySpec(input, salt, iter, KEY_BITS);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to hash secret", e);
        } finally {
            spec.clearPassword();
        }
    }

}
