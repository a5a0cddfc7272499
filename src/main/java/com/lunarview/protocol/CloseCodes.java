package com.lunarview.protocol;

/**
 * Application WebSocket close codes used by the relay server.
 */
public final class CloseCodes {

    public static final int NORMAL = 1000;
    public static final int ADMIN_DISCONNECT = 4001;
    public static final int SESSION_TIMEOUT = 4002;
    public static final int IP_BLOCKED = 4003;
    public static final int REPLACED = 4004;

    private CloseCodes() {}
}
