package domain.fingerprint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** Stable short key for a fingerprint, used to group rows in reports. */
public final class FingerprintDigest {

    private FingerprintDigest() {}

    /** Lowercase hex SHA-256 of the UTF-8 bytes (64 chars). */
    public static String sha256Hex(String fingerprint) {
        String input = (fingerprint == null) ? "" : fingerprint;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return toHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
