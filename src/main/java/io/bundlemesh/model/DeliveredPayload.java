package io.bundlemesh.model;

import java.nio.charset.StandardCharsets;

/**
 * Plaintext handed to a consuming feature, with the metadata of the bundle it
 * arrived in.
 */
public record DeliveredPayload(
        long sequence,
        String bundleId,
        String topic,
        Priority priority,
        Audience audience,
        long createdAtMs,
        long deliveredAtMs,
        byte[] plaintext
) {
    public String plaintextUtf8() {
        return new String(plaintext, StandardCharsets.UTF_8);
    }
}
