package com.lunarview.protocol;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Every message kind that may appear on the signaling WebSocket.
 *
 * Each kind knows its wire name, the payload fields that must be present
 * for the message to be accepted, and whether the relay server forwards it
 * to the linked partner. Anything not listed here is rejected by
 * {@link MessageCodec} at the protocol boundary.
 */
public enum MessageType {

    // Session brokering
    REGISTER("register", false, "connectionId", "password", "isHost"),
    REGISTERED("registered", false, "connectionId"),
    CONNECT("connect", false, "targetConnectionId", "password"),
    CONNECT_SUCCESS("connect-success", false, "sessionId", "targetConnectionId"),
    CONNECT_ERROR("connect-error", false, "error"),
    INCOMING_CONNECTION("incoming-connection", false, "sessionId", "fromConnectionId"),
    DISCONNECT("disconnect", false),
    DISCONNECTED("disconnected", false, "reason"),
    PING("ping", false),
    PONG("pong", false),
    ERROR("error", false, "error"),

    // P2P negotiation
    KEY_EXCHANGE("key-exchange", true, "publicKey"),
    OFFER("offer", true, "offer"),
    ANSWER("answer", true, "answer"),
    ICE_CANDIDATE("ice-candidate", true, "candidate"),

    // Payload
    RELAY("relay", true, "data"),
    RELAYED("relayed", false, "data"),
    SCREEN_FRAME("screen-frame", true, "frame"),
    MOUSE_EVENT("mouse-event", true, "event"),
    KEYBOARD_EVENT("keyboard-event", true, "event"),
    CLIPBOARD_SYNC("clipboard-sync", true, "content"),

    // File transfer
    FILE_START("file-start", true, "fileId", "fileName", "fileSize", "totalChunks", "checksum"),
    FILE_READY("file-ready", true, "fileId"),
    FILE_CHUNK("file-chunk", true, "fileId", "chunkIndex", "totalChunks", "data", "checksum"),
    FILE_CHUNK_ACK("file-chunk-ack", true, "fileId", "chunkIndex"),
    FILE_CHUNK_RETRY("file-chunk-retry", true, "fileId", "chunkIndex"),
    FILE_COMPLETE("file-complete", true, "fileId"),
    FILE_CANCEL("file-cancel", true, "fileId");

    private static final Map<String, MessageType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (MessageType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
        }
    }

    private final String wireName;
    private final boolean relayed;
    private final List<String> requiredFields;

    MessageType(String wireName, boolean relayed, String... requiredFields) {
        this.wireName = wireName;
        this.relayed = relayed;
        this.requiredFields = Collections.unmodifiableList(List.of(requiredFields));
    }

    public String wireName() {
        return wireName;
    }

    /**
     * True when the server forwards this kind to the sender's linked partner.
     */
    public boolean isRelayed() {
        return relayed;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }

    public boolean isFileTransfer() {
        return wireName.startsWith("file-");
    }

    /**
     * @return the matching kind, or null when the wire name is unknown
     */
    public static MessageType fromWireName(String wireName) {
        return wireName == null ? null : BY_WIRE_NAME.get(wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
