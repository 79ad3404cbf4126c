package io.bundlemesh.storage;

/**
 * The local store failed or is corrupt. Not recoverable by retrying the same call.
 */
public final class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
