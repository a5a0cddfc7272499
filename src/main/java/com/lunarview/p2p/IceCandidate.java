package com.lunarview.p2p;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.lunarview.protocol.ProtocolException;

public final class IceCandidate {

    private final String sdpMid;
    private final int sdpMLineIndex;
    private final String candidate;

    public IceCandidate(String sdpMid, int sdpMLineIndex, String candidate) {
        this.sdpMid = sdpMid;
        this.sdpMLineIndex = sdpMLineIndex;
        this.candidate = candidate;
    }

    public String getSdpMid() { return sdpMid; }
    public int getSdpMLineIndex() { return sdpMLineIndex; }
    public String getCandidate() { return candidate; }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("candidate", candidate);
        json.addProperty("sdpMid", sdpMid);
        json.addProperty("sdpMLineIndex", sdpMLineIndex);
        return json;
    }

    public static IceCandidate fromJson(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw new ProtocolException("ICE candidate must be an object");
        }
        JsonObject json = element.getAsJsonObject();
        JsonElement candidate = json.get("candidate");
        if (candidate == null || candidate.isJsonNull()) {
            throw new ProtocolException("ICE candidate without candidate line");
        }
        JsonElement mid = json.get("sdpMid");
        JsonElement index = json.get("sdpMLineIndex");
        return new IceCandidate(
            mid == null || mid.isJsonNull() ? null : mid.getAsString(),
            index == null || index.isJsonNull() ? 0 : index.getAsInt(),
            candidate.getAsString());
    }

    @Override
    public String toString() {
        return candidate;
    }
}
