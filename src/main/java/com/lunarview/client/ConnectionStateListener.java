package com.lunarview.client;

@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * @param detail human readable reason, may be null
     */
    void onStateChanged(ConnectionState state, String detail);
}
