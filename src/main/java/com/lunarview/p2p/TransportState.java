package com.lunarview.p2p;

public enum TransportState {
    CONNECTING,
    /** Data channel open; payload may flow peer to peer. */
    CONNECTED,
    DISCONNECTED,
    FAILED
}
