package com.flowbridge.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic identifier generation based on SHA-256 hashes.
 *
 * <p>The same input always yields the same id, so flow ids derived from a workflow name and a
 * seed are stable across runs.
 */
public final class IdGenerator {

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a UUID-shaped id from the components.
     *
     * @param components id components, joined with ':' before hashing
     * @return deterministic id in 8-4-4-4-12 hex form
     * @throws IllegalArgumentException if no component is given
     */
    public static String generateUuidLike(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        String hash = sha256Hex(String.join(":", components));
        return hash.substring(0, 8) + "-" + hash.substring(8, 12) + "-" + hash.substring(12, 16)
            + "-" + hash.substring(16, 20) + "-" + hash.substring(20, 32);
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
