package com.lunarview.p2p;

import java.util.concurrent.CompletableFuture;

/**
 * One peer connection. Asynchronous operations complete their future on the
 * WebRTC signaling thread; failures complete it exceptionally.
 */
public interface RtcPeer {

    interface Observer {
        void onIceCandidate(IceCandidate candidate);

        void onConnectionStateChange(TransportState state);

        /** A data channel opened by the remote side. */
        void onDataChannel(DataChannel channel);
    }

    CompletableFuture<SessionDescription> createOffer();

    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setLocalDescription(SessionDescription description);

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    void addIceCandidate(IceCandidate candidate);

    DataChannel createDataChannel(String label);

    void close();
}
