package com.lunarview.input;

import com.google.gson.JsonObject;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.SignalMessage;
import com.lunarview.testutil.LoopbackLink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InputRouterTest {

    private final List<JsonObject> mouse = new ArrayList<>();
    private final List<JsonObject> keys = new ArrayList<>();
    private final List<String> clipboardWrites = new ArrayList<>();
    private String clipboardText;

    private LoopbackLink link;
    private InputRouter router;

    @BeforeEach
    public void setUp() {
        link = new LoopbackLink();
        InputInjector injector = new InputInjector() {
            @Override
            public void injectMouse(JsonObject event) {
                mouse.add(event);
            }

            @Override
            public void injectKeyboard(JsonObject event) {
                keys.add(event);
            }
        };
        ClipboardProvider clipboard = new ClipboardProvider() {
            @Override
            public String readText() {
                return clipboardText;
            }

            @Override
            public void writeText(String text) {
                clipboardWrites.add(text);
                clipboardText = text;
            }
        };
        router = new InputRouter(link.right(), injector, clipboard, true);
        router.bind();
    }

    private static SignalMessage mouseMove(int x, int y) {
        JsonObject event = new JsonObject();
        event.addProperty("type", "move");
        event.addProperty("x", x);
        event.addProperty("y", y);
        return SignalMessage.of(MessageType.MOUSE_EVENT).with("event", event);
    }

    @Test
    public void injectsEventsVerbatim() {
        JsonObject key = new JsonObject();
        key.addProperty("type", "keydown");
        key.addProperty("key", "Enter");

        link.left().send(mouseMove(100, 200));
        link.left().send(SignalMessage.of(MessageType.KEYBOARD_EVENT).with("event", key));
        link.pump();

        assertEquals(1, mouse.size());
        assertEquals(200, mouse.get(0).get("y").getAsInt());
        assertEquals(key, keys.get(0));
        assertEquals(2, router.getInjectedCount());
    }

    @Test
    public void ignoresInputWhileControlDisabled() {
        router.setControlAllowed(false);

        link.left().send(mouseMove(1, 1));
        link.pump();

        assertTrue(mouse.isEmpty());
        assertEquals(1, router.getIgnoredCount());

        router.setControlAllowed(true);
        link.left().send(mouseMove(2, 2));
        link.pump();
        assertEquals(1, mouse.size());
    }

    @Test
    public void ignoresNonObjectEvents() {
        link.left().send(SignalMessage.of(MessageType.MOUSE_EVENT).with("event", "click"));
        link.pump();

        assertTrue(mouse.isEmpty());
        assertEquals(1, router.getIgnoredCount());
    }

    @Test
    public void appliesIncomingClipboard() {
        link.left().send(SignalMessage.of(MessageType.CLIPBOARD_SYNC).with("content", "copied text"));
        link.pump();

        assertEquals(List.of("copied text"), clipboardWrites);
        assertFalse(router.syncClipboard());
    }

    @Test
    public void sendsClipboardOnlyWhenChanged() {
        List<String> partner = new ArrayList<>();
        link.left().dispatcher().on(MessageType.CLIPBOARD_SYNC, m -> partner.add(m.getString("content")));

        assertFalse(router.syncClipboard());
        clipboardText = "one";
        assertTrue(router.syncClipboard());
        assertFalse(router.syncClipboard());
        clipboardText = "two";
        assertTrue(router.syncClipboard());
        link.pump();

        assertEquals(List.of("one", "two"), partner);
    }
}
