package io.bundlemesh.storage;

public enum PutStatus {
    INSERTED,
    DUPLICATE_IGNORED,
    REJECTED
}
