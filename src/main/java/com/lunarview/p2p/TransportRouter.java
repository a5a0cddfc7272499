package com.lunarview.p2p;

import com.lunarview.protocol.MessageCodec;
import com.lunarview.protocol.MessageDispatcher;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.ProtocolException;
import com.lunarview.protocol.SignalMessage;
import com.lunarview.protocol.SignalingChannel;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Payload path to the partner: the P2P data channel while it is connected,
 * the relay server otherwise.
 *
 * Negotiation messages (offer, answer, candidates, key exchange) and
 * {@code relay} envelopes always go over the server. Payload arriving on the
 * data channel is decoded and dispatched on the relay's dispatcher, so
 * consumers see one inbound stream whichever transport carried it.
 */
public class TransportRouter implements SignalingChannel {

    private static final Logger LOGGER = Logger.getLogger(TransportRouter.class.getName());

    private final SignalingChannel relay;
    private final P2PTransportNegotiator negotiator;

    private volatile boolean p2pActive;
    private final AtomicLong p2pSends = new AtomicLong();
    private final AtomicLong relaySends = new AtomicLong();

    public TransportRouter(SignalingChannel relay, P2PTransportNegotiator negotiator) {
        this.relay = relay;
        this.negotiator = negotiator;

        negotiator.addStateListener(this::onTransportState);
        negotiator.addTextListener(this::onPeerText);
    }

    @Override
    public boolean send(SignalMessage message) {
        if (p2pActive && isPayload(message.type())) {
            if (negotiator.send(MessageCodec.encode(message))) {
                p2pSends.incrementAndGet();
                return true;
            }
            LOGGER.fine("[Router] Data channel refused " + message.type() + ", using relay");
        }
        relaySends.incrementAndGet();
        return relay.send(message);
    }

    @Override
    public MessageDispatcher dispatcher() {
        return relay.dispatcher();
    }

    public boolean isP2PActive() {
        return p2pActive;
    }

    public long getP2PSends() {
        return p2pSends.get();
    }

    public long getRelaySends() {
        return relaySends.get();
    }

    private void onTransportState(TransportState state) {
        boolean active = state == TransportState.CONNECTED;
        if (active != p2pActive) {
            LOGGER.info(active ? "[Router] Switched to P2P data channel" : "[Router] Using relay (P2P " + state + ")");
        }
        p2pActive = active;
    }

    private void onPeerText(String text) {
        try {
            relay.dispatcher().dispatch(MessageCodec.decode(text));
        } catch (ProtocolException e) {
            LOGGER.warning("[Router] Ignoring data channel frame: " + e.getMessage());
        }
    }

    static boolean isPayload(MessageType type) {
        return switch (type) {
            case SCREEN_FRAME, MOUSE_EVENT, KEYBOARD_EVENT, CLIPBOARD_SYNC,
                 FILE_START, FILE_READY, FILE_CHUNK, FILE_CHUNK_ACK, FILE_CHUNK_RETRY,
                 FILE_COMPLETE, FILE_CANCEL -> true;
            default -> false;
        };
    }
}
