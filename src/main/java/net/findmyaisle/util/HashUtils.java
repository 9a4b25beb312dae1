package net.findmyaisle.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content hashing used to build fixed-length, order-independent cache keys.
 */
public final class HashUtils {

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes SHA-256 hash of string data using UTF-8 encoding.
     *
     * @param data String to hash
     * @return SHA-256 hash as byte array
     * @throws NoSuchAlgorithmException If SHA-256 algorithm is not available
     */
    public static byte[] computeSha256(String data) throws NoSuchAlgorithmException {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        return digest.digest(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Computes SHA-256 hash of string and returns as hexadecimal string.
     *
     * @param data String to hash
     * @return SHA-256 hash as lowercase hex string (64 characters)
     * @throws NoSuchAlgorithmException If SHA-256 algorithm is not available
     *
     * @example
     * <pre>{@code
     * String hex = HashUtils.sha256Hex("oat milk");
     * }</pre>
     */
    public static String sha256Hex(String data) throws NoSuchAlgorithmException {
        return bytesToHex(computeSha256(data));
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
