package com.lunarview.protocol;

/**
 * Raised when an inbound frame is not a well-formed signaling message.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
