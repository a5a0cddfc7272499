package com.lunarview.p2p;

import dev.onvoid.webrtc.CreateSessionDescriptionObserver;
import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.PeerConnectionObserver;
import dev.onvoid.webrtc.RTCAnswerOptions;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCDataChannel;
import dev.onvoid.webrtc.RTCDataChannelInit;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCIceServer;
import dev.onvoid.webrtc.RTCIceTransportPolicy;
import dev.onvoid.webrtc.RTCOfferOptions;
import dev.onvoid.webrtc.RTCPeerConnection;
import dev.onvoid.webrtc.RTCPeerConnectionState;
import dev.onvoid.webrtc.RTCSdpType;
import dev.onvoid.webrtc.RTCSessionDescription;
import dev.onvoid.webrtc.SetSessionDescriptionObserver;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * {@link RtcPeer} on webrtc-java. Data channels are ordered with at most
 * three retransmissions per message.
 */
public class WebRtcPeer implements RtcPeer {

    private static final Logger LOGGER = Logger.getLogger(WebRtcPeer.class.getName());

    private static final int MAX_RETRANSMITS = 3;

    private final RTCPeerConnection peerConnection;

    WebRtcPeer(PeerConnectionFactory factory, List<String> stunUrls, Observer observer) {
        List<RTCIceServer> iceServers = new ArrayList<>();
        RTCIceServer stun = new RTCIceServer();
        stun.urls.addAll(stunUrls);
        iceServers.add(stun);

        RTCConfiguration config = new RTCConfiguration();
        config.iceServers = iceServers;
        config.iceTransportPolicy = RTCIceTransportPolicy.ALL;

        LOGGER.fine("[P2P] Configuring peer connection with " + stunUrls.size() + " STUN url(s)");

        this.peerConnection = factory.createPeerConnection(config, new PeerConnectionObserver() {
            @Override
            public void onIceCandidate(RTCIceCandidate candidate) {
                observer.onIceCandidate(new IceCandidate(candidate.sdpMid, candidate.sdpMLineIndex, candidate.sdp));
            }

            @Override
            public void onConnectionChange(RTCPeerConnectionState state) {
                LOGGER.fine("[P2P] Peer connection state: " + state);
                switch (state) {
                    case CONNECTING -> observer.onConnectionStateChange(TransportState.CONNECTING);
                    case DISCONNECTED, CLOSED -> observer.onConnectionStateChange(TransportState.DISCONNECTED);
                    case FAILED -> observer.onConnectionStateChange(TransportState.FAILED);
                    default -> { }
                }
            }

            @Override
            public void onDataChannel(RTCDataChannel channel) {
                observer.onDataChannel(new WebRtcDataChannel(channel));
            }
        });
    }

    /**
     * Factory sharing one {@link PeerConnectionFactory} across peers.
     */
    public static RtcPeerFactory factory(PeerConnectionFactory factory) {
        return (stunUrls, observer) -> new WebRtcPeer(factory, stunUrls, observer);
    }

    @Override
    public CompletableFuture<SessionDescription> createOffer() {
        CompletableFuture<SessionDescription> future = new CompletableFuture<>();
        peerConnection.createOffer(new RTCOfferOptions(), describe(future));
        return future;
    }

    @Override
    public CompletableFuture<SessionDescription> createAnswer() {
        CompletableFuture<SessionDescription> future = new CompletableFuture<>();
        peerConnection.createAnswer(new RTCAnswerOptions(), describe(future));
        return future;
    }

    @Override
    public CompletableFuture<Void> setLocalDescription(SessionDescription description) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        peerConnection.setLocalDescription(toRtc(description), completion(future));
        return future;
    }

    @Override
    public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        peerConnection.setRemoteDescription(toRtc(description), completion(future));
        return future;
    }

    @Override
    public void addIceCandidate(IceCandidate candidate) {
        peerConnection.addIceCandidate(
            new RTCIceCandidate(candidate.getSdpMid(), candidate.getSdpMLineIndex(), candidate.getCandidate()));
    }

    @Override
    public DataChannel createDataChannel(String label) {
        RTCDataChannelInit init = new RTCDataChannelInit();
        init.ordered = true;
        init.maxRetransmits = MAX_RETRANSMITS;
        return new WebRtcDataChannel(peerConnection.createDataChannel(label, init));
    }

    @Override
    public void close() {
        peerConnection.close();
    }

    private static RTCSessionDescription toRtc(SessionDescription description) {
        RTCSdpType type = description.getType() == SessionDescription.Type.OFFER ? RTCSdpType.OFFER : RTCSdpType.ANSWER;
        return new RTCSessionDescription(type, description.getSdp());
    }

    private static CreateSessionDescriptionObserver describe(CompletableFuture<SessionDescription> future) {
        return new CreateSessionDescriptionObserver() {
            @Override
            public void onSuccess(RTCSessionDescription description) {
                SessionDescription.Type type = description.sdpType == RTCSdpType.OFFER
                    ? SessionDescription.Type.OFFER
                    : SessionDescription.Type.ANSWER;
                future.complete(new SessionDescription(type, description.sdp));
            }

            @Override
            public void onFailure(String error) {
                future.completeExceptionally(new IllegalStateException(error));
            }
        };
    }

    private static SetSessionDescriptionObserver completion(CompletableFuture<Void> future) {
        return new SetSessionDescriptionObserver() {
            @Override
            public void onSuccess() {
                future.complete(null);
            }

            @Override
            public void onFailure(String error) {
                future.completeExceptionally(new IllegalStateException(error));
            }
        };
    }
}
