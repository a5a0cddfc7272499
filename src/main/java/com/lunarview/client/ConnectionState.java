package com.lunarview.client;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    /** Registered with the relay, no partner yet. */
    CONNECTED,
    /** Viewer sent {@code connect} and waits for the verdict. */
    AUTHENTICATING,
    SESSION_ACTIVE,
    /** Last request failed; the machine stays usable. */
    ERROR
}
