package com.lunarview.error;

/**
 * Failure categories shared by the server, the client state machine and the transfer protocol.
 */
public enum ErrorKind {
    /** Bad password or source IP locked out. */
    AUTHENTICATION,
    /** Unknown target connection-id. */
    NOT_FOUND,
    /** P2P negotiation or data channel failure; callers fall back to the relay. */
    TRANSPORT,
    /** Per-chunk or whole-file checksum did not match. */
    CHECKSUM_MISMATCH,
    /** Heartbeat or idle session timeout. */
    TIMEOUT,
    /** Request exceeds a configured limit, e.g. file size. */
    CAPACITY
}
