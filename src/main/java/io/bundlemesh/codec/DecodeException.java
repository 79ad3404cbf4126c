package io.bundlemesh.codec;

/**
 * Wire bytes could not be turned into a {@link io.bundlemesh.model.Bundle}.
 * The frame is dropped; decoding never yields a partial bundle.
 */
public final class DecodeException extends RuntimeException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
