package com.lunarview.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * One signaling message: a {@link MessageType} plus its JSON payload.
 *
 * Inbound messages are built by {@link MessageCodec#decode(String)} and keep
 * the exact text they arrived as, so relayed kinds can be forwarded
 * byte-for-byte. Outbound messages are built with {@link #of(MessageType)}
 * and the {@code with(...)} setters.
 */
public final class SignalMessage {

    private final MessageType type;
    private final JsonObject body;
    private final String rawText;

    SignalMessage(MessageType type, JsonObject body, String rawText) {
        this.type = type;
        this.body = body;
        this.rawText = rawText;
    }

    public static SignalMessage of(MessageType type) {
        JsonObject body = new JsonObject();
        body.addProperty("type", type.wireName());
        return new SignalMessage(type, body, null);
    }

    public MessageType type() {
        return type;
    }

    public SignalMessage with(String field, String value) {
        if (value != null) {
            body.addProperty(field, value);
        }
        return this;
    }

    public SignalMessage with(String field, Number value) {
        if (value != null) {
            body.addProperty(field, value);
        }
        return this;
    }

    public SignalMessage with(String field, boolean value) {
        body.addProperty(field, value);
        return this;
    }

    public SignalMessage with(String field, JsonElement value) {
        if (value != null) {
            body.add(field, value);
        }
        return this;
    }

    public boolean has(String field) {
        JsonElement element = body.get(field);
        return element != null && !element.isJsonNull();
    }

    public JsonElement get(String field) {
        return body.get(field);
    }

    public String getString(String field) {
        JsonElement element = require(field);
        return element.isJsonPrimitive() ? element.getAsString() : element.toString();
    }

    public String optString(String field, String fallback) {
        return has(field) ? getString(field) : fallback;
    }

    public int getInt(String field) {
        return primitive(field).getAsInt();
    }

    public long getLong(String field) {
        return primitive(field).getAsLong();
    }

    public boolean getBoolean(String field) {
        return primitive(field).getAsBoolean();
    }

    public JsonObject getObject(String field) {
        JsonElement element = require(field);
        if (!element.isJsonObject()) {
            throw new ProtocolException("Field '" + field + "' of " + type + " is not an object");
        }
        return element.getAsJsonObject();
    }

    /**
     * The text this message was decoded from, or null for locally built messages.
     */
    public String rawText() {
        return rawText;
    }

    JsonObject body() {
        return body;
    }

    private JsonElement require(String field) {
        JsonElement element = body.get(field);
        if (element == null || element.isJsonNull()) {
            throw new ProtocolException("Missing field '" + field + "' in " + type);
        }
        return element;
    }

    private JsonPrimitive primitive(String field) {
        JsonElement element = require(field);
        if (!element.isJsonPrimitive()) {
            throw new ProtocolException("Field '" + field + "' of " + type + " is not a scalar");
        }
        return element.getAsJsonPrimitive();
    }

    @Override
    public String toString() {
        return "SignalMessage{" + type + "}";
    }
}
