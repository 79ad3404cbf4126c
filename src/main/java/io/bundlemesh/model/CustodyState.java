package io.bundlemesh.model;

public enum CustodyState {
    /** Custody was not requested. */
    NONE,
    /** Custody requested and held here; destination has not acknowledged yet. */
    PENDING,
    ACKNOWLEDGED
}
