package de.bsommerfeld.tutoria.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.config.SecurityConfig;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Salted PBKDF2-HMAC-SHA256 password hashing. Encoded form:
 * {@code pbkdf2$<iterations>$<salt hex>$<hash hex>}, so the iteration count
 * can be raised later without invalidating stored hashes.
 *
 * <p>
 * Hashing is deliberately slow and runs on the caller's thread, never inside
 * a database unit of work.
 */
@Singleton
public class PasswordHasher {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final String PREFIX = "pbkdf2";
    private static final int SALT_BYTES = 16;
    private static final int KEY_BITS = 256;

    private final int iterations;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public PasswordHasher(SecurityConfig config) {
        this(config.getPasswordIterations());
    }

    public PasswordHasher(int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive: " + iterations);
        }
        this.iterations = iterations;
    }

    public String hash(String password) {
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        byte[] derived = derive(password, salt, iterations);
        HexFormat hex = HexFormat.of();
        return PREFIX + "$" + iterations + "$" + hex.formatHex(salt) + "$" + hex.formatHex(derived);
    }

    /**
     * @return {@code false} for a wrong password and for a hash not produced
     *         by this class
     */
    public boolean verify(String password, String encoded) {
        if (password == null || encoded == null) {
            return false;
        }
        String[] parts = encoded.split("\\$");
        if (parts.length != 4 || !PREFIX.equals(parts[0])) {
            return false;
        }
        try {
            int storedIterations = Integer.parseInt(parts[1]);
            byte[] salt = HexFormat.of().parseHex(parts[2]);
            byte[] expected = HexFormat.of().parseHex(parts[3]);
            return MessageDigest.isEqual(expected, derive(password, salt, storedIterations));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static byte[] derive(String password, byte[] salt, int iterations) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, KEY_BITS);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            // Mandatory on every Java SE platform since 8
            throw new AssertionError(ALGORITHM + " not available", e);
        } finally {
            spec.clearPassword();
        }
    }
}
