package io.bundlemesh.model;

/**
 * Who may relay or hold custody of a bundle. Reading the plaintext is governed
 * separately by the payload encryption.
 */
public enum Audience {
    PUBLIC("public"),
    TRUSTED("trusted"),
    DESTINATION_ONLY("destination-only");

    private final String label;

    Audience(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Audience fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PUBLIC;
        }
        String normalized = raw.trim().replace('_', '-');
        for (Audience value : values()) {
            if (value.label.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown audience: " + raw);
    }
}
