package com.lunarview.protocol;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * JSON text frames &lt;-&gt; {@link SignalMessage}.
 *
 * Decoding validates the {@code type} discriminator against {@link MessageType}
 * and checks every required field, so handlers never see a half-formed message.
 */
public final class MessageCodec {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private MessageCodec() {}

    public static SignalMessage decode(String text) {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("Empty frame");
        }

        JsonElement root;
        try {
            root = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new ProtocolException("Malformed JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new ProtocolException("Frame is not a JSON object");
        }

        JsonObject body = root.getAsJsonObject();
        JsonElement typeElement = body.get("type");
        if (typeElement == null || !typeElement.isJsonPrimitive()) {
            throw new ProtocolException("Missing message type");
        }

        String wireName = typeElement.getAsString();
        MessageType type = MessageType.fromWireName(wireName);
        if (type == null) {
            throw new ProtocolException("Unknown message type: " + wireName);
        }

        for (String field : type.requiredFields()) {
            JsonElement value = body.get(field);
            if (value == null || value.isJsonNull()) {
                throw new ProtocolException("Missing field '" + field + "' in " + wireName);
            }
        }

        return new SignalMessage(type, body, text);
    }

    public static String encode(SignalMessage message) {
        return GSON.toJson(message.body());
    }

    public static Gson gson() {
        return GSON;
    }
}
