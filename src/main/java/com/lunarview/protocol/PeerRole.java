package com.lunarview.protocol;

public enum PeerRole {
    HOST,
    VIEWER;

    public static PeerRole fromHostFlag(boolean isHost) {
        return isHost ? HOST : VIEWER;
    }

    public boolean isHost() {
        return this == HOST;
    }
}
