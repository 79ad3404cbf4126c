package io.bundlemesh.model;

public enum RejectReason {
    DECODE_ERROR,
    ID_MISMATCH,
    SIGNATURE_INVALID,
    EXPIRED,
    HOP_LIMIT_EXCEEDED,
    STORAGE_FULL
}
