package com.lunarview.protocol;

/**
 * A bidirectional message path to the linked partner: outbound through
 * {@link #send}, inbound through handlers registered on {@link #dispatcher()}.
 */
public interface SignalingChannel {

    /**
     * Best-effort delivery.
     *
     * @return false when the message could not be handed to any transport
     */
    boolean send(SignalMessage message);

    MessageDispatcher dispatcher();
}
