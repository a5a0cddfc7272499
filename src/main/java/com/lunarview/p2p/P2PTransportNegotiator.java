package com.lunarview.p2p;

import com.lunarview.error.TransportException;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.ProtocolException;
import com.lunarview.protocol.SignalMessage;
import com.lunarview.protocol.SignalingChannel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Negotiates the direct data channel between host and viewer.
 *
 * SDP and ICE travel over the signaling channel. The viewer calls
 * {@link #createOffer()}, the host answers in {@link #handleOffer}. ICE
 * candidates that arrive before a remote description is set are buffered
 * and applied once it is. {@link TransportState#CONNECTED} is reported only
 * when the data channel opens; any failure is reported as
 * {@link TransportState#FAILED} and callers keep using the relay.
 */
public class P2PTransportNegotiator {

    private static final Logger LOGGER = Logger.getLogger(P2PTransportNegotiator.class.getName());

    public static final String CHANNEL_LABEL = "remote-desktop";

    private final RtcPeerFactory peerFactory;
    private final List<String> stunUrls;
    private final List<TransportStateListener> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> textListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<byte[]>> binaryListeners = new CopyOnWriteArrayList<>();

    private final List<IceCandidate> pendingCandidates = new ArrayList<>();
    private RtcPeer peer;
    private DataChannel channel;
    private boolean remoteDescriptionSet;
    private boolean initiator;
    private boolean closed;
    private TransportState state;

    private SignalingChannel signaling;

    public P2PTransportNegotiator(RtcPeerFactory peerFactory, List<String> stunUrls) {
        this.peerFactory = peerFactory;
        this.stunUrls = List.copyOf(stunUrls);
    }

    /**
     * Route offers, answers and candidates through {@code signaling}: local
     * candidates and descriptions are sent on it, inbound ones are handled.
     */
    public void bind(SignalingChannel signaling) {
        this.signaling = signaling;
        signaling.dispatcher().on(MessageType.OFFER, this::onOfferMessage);
        signaling.dispatcher().on(MessageType.ANSWER, this::onAnswerMessage);
        signaling.dispatcher().on(MessageType.ICE_CANDIDATE, this::onCandidateMessage);
    }

    public void addStateListener(TransportStateListener listener) {
        stateListeners.add(listener);
    }

    public void addTextListener(Consumer<String> listener) {
        textListeners.add(listener);
    }

    public void addBinaryListener(Consumer<byte[]> listener) {
        binaryListeners.add(listener);
    }

    // ===============================
    // Offer / answer
    // ===============================

    /**
     * Initiator path: open the data channel, then create and apply the local offer.
     */
    public CompletableFuture<SessionDescription> createOffer() {
        RtcPeer current;
        synchronized (this) {
            closed = false;
            initiator = true;
            current = ensurePeer();
            attachChannel(current.createDataChannel(CHANNEL_LABEL));
        }
        updateState(TransportState.CONNECTING);
        return current.createOffer()
            .thenCompose(offer -> current.setLocalDescription(offer).thenApply(v -> offer))
            .whenComplete((offer, error) -> {
                if (error != null) {
                    fail("createOffer", error);
                }
            });
    }

    /**
     * Answerer path: apply the remote offer, create and apply the answer, then
     * drain buffered candidates.
     */
    public CompletableFuture<SessionDescription> handleOffer(SessionDescription offer) {
        RtcPeer current;
        synchronized (this) {
            closed = false;
            initiator = false;
            current = ensurePeer();
        }
        updateState(TransportState.CONNECTING);
        return current.setRemoteDescription(offer)
            .thenCompose(v -> current.createAnswer())
            .thenCompose(answer -> current.setLocalDescription(answer).thenApply(v -> answer))
            .whenComplete((answer, error) -> {
                if (error != null) {
                    fail("handleOffer", error);
                } else {
                    remoteDescriptionApplied(current);
                }
            });
    }

    /**
     * Offerer path: apply the remote answer.
     *
     * @throws TransportException if no offer was created first
     */
    public CompletableFuture<Void> handleAnswer(SessionDescription answer) throws TransportException {
        RtcPeer current;
        synchronized (this) {
            if (peer == null || !initiator) {
                throw new TransportException("No peer connection");
            }
            current = peer;
        }
        return current.setRemoteDescription(answer)
            .whenComplete((v, error) -> {
                if (error != null) {
                    fail("handleAnswer", error);
                } else {
                    remoteDescriptionApplied(current);
                }
            });
    }

    /**
     * Apply a remote candidate now, or buffer it until a remote description exists.
     */
    public void addIceCandidate(IceCandidate candidate) {
        RtcPeer current;
        synchronized (this) {
            if (peer == null || !remoteDescriptionSet) {
                pendingCandidates.add(candidate);
                return;
            }
            current = peer;
        }
        applyCandidate(current, candidate);
    }

    private void remoteDescriptionApplied(RtcPeer current) {
        List<IceCandidate> drained;
        synchronized (this) {
            if (current != peer) {
                return;
            }
            remoteDescriptionSet = true;
            drained = new ArrayList<>(pendingCandidates);
            pendingCandidates.clear();
        }
        if (!drained.isEmpty()) {
            LOGGER.fine("[P2P] Applying " + drained.size() + " buffered ICE candidate(s)");
        }
        for (IceCandidate candidate : drained) {
            applyCandidate(current, candidate);
        }
    }

    private void applyCandidate(RtcPeer current, IceCandidate candidate) {
        try {
            current.addIceCandidate(candidate);
        } catch (RuntimeException e) {
            LOGGER.warning("[P2P] Rejected ICE candidate " + candidate + ": " + e.getMessage());
        }
    }

    // ===============================
    // Data path
    // ===============================

    /**
     * @return false if the data channel is not open; the caller should use the relay
     */
    public boolean send(String text) {
        DataChannel current;
        synchronized (this) {
            current = channel;
        }
        return current != null && current.isOpen() && current.sendText(text);
    }

    /**
     * @return false if the data channel is not open; the caller should use the relay
     */
    public boolean sendBinary(byte[] data) {
        DataChannel current;
        synchronized (this) {
            current = channel;
        }
        return current != null && current.isOpen() && current.sendBinary(data);
    }

    public synchronized boolean isConnected() {
        return state == TransportState.CONNECTED && channel != null && channel.isOpen();
    }

    public synchronized TransportState getState() {
        return state;
    }

    /**
     * Close the data channel, then the peer connection. Safe to call more than once.
     */
    public void disconnect() {
        DataChannel oldChannel;
        RtcPeer oldPeer;
        boolean wasOpen;
        synchronized (this) {
            if (closed && peer == null) {
                return;
            }
            closed = true;
            oldChannel = channel;
            oldPeer = peer;
            wasOpen = state != null && state != TransportState.DISCONNECTED && state != TransportState.FAILED;
            channel = null;
            peer = null;
            remoteDescriptionSet = false;
            pendingCandidates.clear();
        }
        if (oldChannel != null) {
            oldChannel.close();
        }
        if (oldPeer != null) {
            oldPeer.close();
        }
        if (wasOpen) {
            updateState(TransportState.DISCONNECTED);
        }
        LOGGER.fine("[P2P] Transport closed");
    }

    // ===============================
    // Internals
    // ===============================

    private RtcPeer ensurePeer() {
        if (peer == null) {
            remoteDescriptionSet = false;
            peer = peerFactory.create(stunUrls, new PeerObserver());
        }
        return peer;
    }

    private void attachChannel(DataChannel dataChannel) {
        channel = dataChannel;
        dataChannel.setListener(new DataChannel.Listener() {
            @Override
            public void onOpen() {
                LOGGER.info("[P2P] Data channel '" + dataChannel.label() + "' open");
                updateState(TransportState.CONNECTED);
            }

            @Override
            public void onClose() {
                synchronized (P2PTransportNegotiator.this) {
                    if (channel != dataChannel) {
                        return;
                    }
                }
                updateState(TransportState.DISCONNECTED);
            }

            @Override
            public void onText(String text) {
                for (Consumer<String> listener : textListeners) {
                    listener.accept(text);
                }
            }

            @Override
            public void onBinary(byte[] data) {
                for (Consumer<byte[]> listener : binaryListeners) {
                    listener.accept(data);
                }
            }
        });
    }

    private void fail(String step, Throwable error) {
        LOGGER.log(Level.WARNING, "[P2P] " + step + " failed, staying on relay", error);
        updateState(TransportState.FAILED);
    }

    private void updateState(TransportState next) {
        synchronized (this) {
            if (state == next) {
                return;
            }
            state = next;
        }
        LOGGER.fine("[P2P] Transport state: " + next);
        for (TransportStateListener listener : stateListeners) {
            try {
                listener.onTransportStateChanged(next);
            } catch (RuntimeException e) {
                LOGGER.warning("[P2P] Transport listener failed: " + e.getMessage());
            }
        }
    }

    private final class PeerObserver implements RtcPeer.Observer {
        @Override
        public void onIceCandidate(IceCandidate candidate) {
            SignalingChannel out = signaling;
            if (out != null) {
                out.send(SignalMessage.of(MessageType.ICE_CANDIDATE).with("candidate", candidate.toJson()));
            }
        }

        @Override
        public void onConnectionStateChange(TransportState next) {
            // CONNECTED comes from the data channel opening, or from ICE
            // recovering while that channel is still open
            if (next != TransportState.CONNECTED) {
                updateState(next);
                return;
            }
            DataChannel current;
            synchronized (P2PTransportNegotiator.this) {
                current = channel;
            }
            if (current != null && current.isOpen()) {
                updateState(TransportState.CONNECTED);
            }
        }

        @Override
        public void onDataChannel(DataChannel dataChannel) {
            LOGGER.fine("[P2P] Remote data channel '" + dataChannel.label() + "' received");
            synchronized (P2PTransportNegotiator.this) {
                attachChannel(dataChannel);
            }
        }
    }

    // ===============================
    // Signaling handlers
    // ===============================

    /** Viewer entry point: create the offer and ship it to the host. */
    public void start() {
        createOffer().thenAccept(offer -> {
            SignalingChannel out = signaling;
            if (out != null) {
                out.send(SignalMessage.of(MessageType.OFFER).with("offer", offer.toJson()));
            }
        });
    }

    private void onOfferMessage(SignalMessage message) {
        SessionDescription offer;
        try {
            offer = SessionDescription.fromJson(message.get("offer"), SessionDescription.Type.OFFER);
        } catch (ProtocolException e) {
            LOGGER.warning("[P2P] Bad offer: " + e.getMessage());
            return;
        }
        handleOffer(offer).thenAccept(answer -> {
            SignalingChannel out = signaling;
            if (out != null) {
                out.send(SignalMessage.of(MessageType.ANSWER).with("answer", answer.toJson()));
            }
        });
    }

    private void onAnswerMessage(SignalMessage message) {
        try {
            handleAnswer(SessionDescription.fromJson(message.get("answer"), SessionDescription.Type.ANSWER));
        } catch (TransportException e) {
            LOGGER.warning("[P2P] Ignoring answer: " + e.getMessage());
        } catch (ProtocolException e) {
            LOGGER.warning("[P2P] Bad answer: " + e.getMessage());
        }
    }

    private void onCandidateMessage(SignalMessage message) {
        try {
            addIceCandidate(IceCandidate.fromJson(message.get("candidate")));
        } catch (ProtocolException e) {
            LOGGER.warning("[P2P] Bad ICE candidate: " + e.getMessage());
        }
    }
}
