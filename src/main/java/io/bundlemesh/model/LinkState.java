package io.bundlemesh.model;

public enum LinkState {
    DISCOVERED,
    HANDSHAKING,
    EXCHANGING,
    IDLE,
    DISCONNECTED
}
