package com.lunarview.p2p;

import dev.onvoid.webrtc.RTCDataChannel;
import dev.onvoid.webrtc.RTCDataChannelBuffer;
import dev.onvoid.webrtc.RTCDataChannelObserver;
import dev.onvoid.webrtc.RTCDataChannelState;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * {@link DataChannel} over a webrtc-java {@link RTCDataChannel}.
 */
final class WebRtcDataChannel implements DataChannel {

    private static final Logger LOGGER = Logger.getLogger(WebRtcDataChannel.class.getName());

    private final RTCDataChannel channel;
    private volatile Listener listener;

    WebRtcDataChannel(RTCDataChannel channel) {
        this.channel = channel;
        channel.registerObserver(new RTCDataChannelObserver() {
            @Override
            public void onBufferedAmountChange(long previousAmount) {}

            @Override
            public void onStateChange() {
                RTCDataChannelState state = channel.getState();
                LOGGER.fine("[P2P] Data channel " + channel.getLabel() + " state: " + state);
                Listener l = listener;
                if (l == null) {
                    return;
                }
                if (state == RTCDataChannelState.OPEN) {
                    l.onOpen();
                } else if (state == RTCDataChannelState.CLOSED) {
                    l.onClose();
                }
            }

            @Override
            public void onMessage(RTCDataChannelBuffer buffer) {
                Listener l = listener;
                if (l == null) {
                    return;
                }
                ByteBuffer src = buffer.data.duplicate();
                byte[] bytes = new byte[src.remaining()];
                src.get(bytes);
                if (buffer.binary) {
                    l.onBinary(bytes);
                } else {
                    l.onText(new String(bytes, StandardCharsets.UTF_8));
                }
            }
        });
    }

    @Override
    public String label() {
        return channel.getLabel();
    }

    @Override
    public boolean isOpen() {
        return channel.getState() == RTCDataChannelState.OPEN;
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
        if (listener != null && isOpen()) {
            listener.onOpen();
        }
    }

    @Override
    public boolean sendText(String text) {
        return send(text.getBytes(StandardCharsets.UTF_8), false);
    }

    @Override
    public boolean sendBinary(byte[] data) {
        return send(data, true);
    }

    private boolean send(byte[] payload, boolean binary) {
        if (!isOpen()) {
            return false;
        }
        ByteBuffer direct = ByteBuffer.allocateDirect(payload.length);
        direct.put(payload);
        direct.flip();
        try {
            channel.send(new RTCDataChannelBuffer(direct, binary));
            return true;
        } catch (Exception e) {
            LOGGER.warning("[P2P] Data channel send failed: " + e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            channel.unregisterObserver();
            channel.close();
            channel.dispose();
        } catch (RuntimeException e) {
            LOGGER.fine("[P2P] Data channel already closed: " + e.getMessage());
        }
    }
}
