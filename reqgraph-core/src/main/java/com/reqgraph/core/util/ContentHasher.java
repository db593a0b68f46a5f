package com.reqgraph.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes deterministic content digests for change detection.
 *
 * <p>The value is serialized to canonical JSON (map keys sorted) and hashed with SHA-256.
 * Only the first 16 hex characters are kept; the digest is for change detection,
 * not integrity.
 */
public final class ContentHasher {

    private static final int HASH_LENGTH = 16;

    private ContentHasher() {
        // Utility class
    }

    /**
     * Hashes a value by its canonical JSON form.
     *
     * @param value map, list or scalar made of JSON-compatible values
     * @return 16-character lower-case hex digest
     */
    public static String hash(Object value) {
        try {
            return hashText(JsonMappers.compactJson().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized for hashing: " + e.getMessage(), e);
        }
    }

    /**
     * Hashes text directly.
     *
     * @param text text to hash
     * @return 16-character lower-case hex digest
     */
    public static String hashText(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
