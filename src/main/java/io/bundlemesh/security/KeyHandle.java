package io.bundlemesh.security;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Owner of raw private key bytes.
 *
 * <p>Key material never leaves this package; primitives borrow it for the
 * duration of one operation. {@link KeyEraser#secureErase(KeyHandle)} is the
 * only way to dispose of a handle.
 */
public final class KeyHandle {
    private final String label;
    private final byte[] material;
    private final Path persistedAt;
    private volatile boolean erased;

    KeyHandle(String label, byte[] material, Path persistedAt) {
        this.label = label;
        this.material = material;
        this.persistedAt = persistedAt;
    }

    public static KeyHandle ephemeral(String label, byte[] material) {
        return new KeyHandle(label, material.clone(), null);
    }

    public String label() {
        return label;
    }

    public Optional<Path> persistedAt() {
        return Optional.ofNullable(persistedAt);
    }

    public boolean isErased() {
        return erased;
    }

    byte[] material() {
        if (erased) {
            throw new IllegalStateException("Key has been erased: " + label);
        }
        return material;
    }

    byte[] backingArray() {
        return material;
    }

    void markErased() {
        erased = true;
    }
}
