package com.lunarview.server;

import com.google.gson.JsonObject;

/**
 * One audited event: registration, connect attempt, disconnect, admin action.
 */
public final class AccessLogEntry {

    private final long timestamp;
    private final String ip;
    private final String connectionId;
    private final String event;
    private final boolean success;
    private final String details;

    public AccessLogEntry(long timestamp, String ip, String connectionId, String event,
                          boolean success, String details) {
        this.timestamp = timestamp;
        this.ip = ip;
        this.connectionId = connectionId;
        this.event = event;
        this.success = success;
        this.details = details;
    }

    public long timestamp() { return timestamp; }
    public String ip() { return ip; }
    public String connectionId() { return connectionId; }
    public String event() { return event; }
    public boolean success() { return success; }
    public String details() { return details; }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("timestamp", timestamp);
        json.addProperty("ip", ip);
        if (connectionId != null) {
            json.addProperty("connectionId", connectionId);
        }
        json.addProperty("event", event);
        json.addProperty("success", success);
        if (details != null) {
            json.addProperty("details", details);
        }
        return json;
    }

    @Override
    public String toString() {
        return event + (success ? " ok" : " FAILED") + " ip=" + ip
            + (connectionId != null ? " id=" + connectionId : "")
            + (details != null ? " (" + details + ")" : "");
    }
}
