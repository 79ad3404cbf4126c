package io.bundlemesh.security;

public final class KeyErasureException extends RuntimeException {
    public KeyErasureException(String message, Throwable cause) {
        super(message, cause);
    }
}
