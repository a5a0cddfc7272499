package com.lunarview.input;

import com.google.gson.JsonElement;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.SignalMessage;
import com.lunarview.protocol.SignalingChannel;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host-side sink for remote input. Mouse and keyboard events reach the
 * {@link InputInjector} only while control is allowed; clipboard content is
 * applied in both directions.
 */
public class InputRouter {

    private static final Logger LOGGER = Logger.getLogger(InputRouter.class.getName());

    private final SignalingChannel channel;
    private final InputInjector injector;
    private final ClipboardProvider clipboard;

    private volatile boolean controlAllowed;
    private volatile String lastClipboard;
    private long injected;
    private long ignored;

    public InputRouter(SignalingChannel channel, InputInjector injector, ClipboardProvider clipboard,
                       boolean controlAllowed) {
        this.channel = channel;
        this.injector = injector;
        this.clipboard = clipboard;
        this.controlAllowed = controlAllowed;
    }

    public void bind() {
        channel.dispatcher().on(MessageType.MOUSE_EVENT, this::onMouse);
        channel.dispatcher().on(MessageType.KEYBOARD_EVENT, this::onKeyboard);
        channel.dispatcher().on(MessageType.CLIPBOARD_SYNC, this::onClipboard);
    }

    public void setControlAllowed(boolean allowed) {
        if (allowed != controlAllowed) {
            LOGGER.info("[Input] Remote control " + (allowed ? "enabled" : "disabled"));
        }
        controlAllowed = allowed;
    }

    public boolean isControlAllowed() {
        return controlAllowed;
    }

    /**
     * Push the local clipboard to the partner if it changed since the last sync.
     *
     * @return true if a message was sent
     */
    public boolean syncClipboard() {
        String text = clipboard.readText();
        if (text == null || text.equals(lastClipboard)) {
            return false;
        }
        lastClipboard = text;
        return channel.send(SignalMessage.of(MessageType.CLIPBOARD_SYNC).with("content", text));
    }

    public synchronized long getInjectedCount() {
        return injected;
    }

    public synchronized long getIgnoredCount() {
        return ignored;
    }

    private void onMouse(SignalMessage message) {
        JsonElement event = accept(message);
        if (event != null) {
            injector.injectMouse(event.getAsJsonObject());
        }
    }

    private void onKeyboard(SignalMessage message) {
        JsonElement event = accept(message);
        if (event != null) {
            injector.injectKeyboard(event.getAsJsonObject());
        }
    }

    private JsonElement accept(SignalMessage message) {
        JsonElement event = message.get("event");
        synchronized (this) {
            if (!controlAllowed || event == null || !event.isJsonObject()) {
                ignored++;
                return null;
            }
            injected++;
        }
        return event;
    }

    private void onClipboard(SignalMessage message) {
        String text = message.optString("content", null);
        if (text == null) {
            return;
        }
        lastClipboard = text;
        try {
            clipboard.writeText(text);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[Input] Clipboard update failed", e);
        }
    }
}
