package io.bundlemesh.security;

/**
 * Ciphertext failed authentication: wrong key, wrong peer or tampered bytes.
 */
public final class AuthenticationException extends RuntimeException {
    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
