package com.lunarview.p2p;

@FunctionalInterface
public interface TransportStateListener {
    void onTransportStateChanged(TransportState state);
}
