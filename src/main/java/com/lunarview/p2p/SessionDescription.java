package com.lunarview.p2p;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.lunarview.protocol.ProtocolException;

/**
 * SDP blob plus its role, serialized like a browser {@code RTCSessionDescriptionInit}:
 * {@code {"type":"offer","sdp":"v=0..."}}.
 */
public final class SessionDescription {

    public enum Type { OFFER, ANSWER }

    private final Type type;
    private final String sdp;

    public SessionDescription(Type type, String sdp) {
        this.type = type;
        this.sdp = sdp;
    }

    public Type getType() { return type; }
    public String getSdp() { return sdp; }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("type", type.name().toLowerCase());
        json.addProperty("sdp", sdp);
        return json;
    }

    public static SessionDescription fromJson(JsonElement element, Type expected) {
        if (element == null || !element.isJsonObject()) {
            throw new ProtocolException("Session description must be an object");
        }
        JsonObject json = element.getAsJsonObject();
        JsonElement sdp = json.get("sdp");
        if (sdp == null || sdp.isJsonNull()) {
            throw new ProtocolException("Session description without sdp");
        }
        return new SessionDescription(expected, sdp.getAsString());
    }
}
