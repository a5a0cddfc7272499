package com.lunarview.protocol;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes decoded messages to the handlers registered for their type.
 * Several subscribers may listen to the same type; a failing handler is
 * logged and does not stop the others.
 */
public class MessageDispatcher {

    private static final Logger LOGGER = Logger.getLogger(MessageDispatcher.class.getName());

    private final Map<MessageType, List<Consumer<SignalMessage>>> handlers = new EnumMap<>(MessageType.class);

    public synchronized void on(MessageType type, Consumer<SignalMessage> handler) {
        handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public synchronized void off(MessageType type, Consumer<SignalMessage> handler) {
        List<Consumer<SignalMessage>> list = handlers.get(type);
        if (list != null) {
            list.remove(handler);
        }
    }

    /**
     * @return true when at least one handler was registered for the message type
     */
    public boolean dispatch(SignalMessage message) {
        List<Consumer<SignalMessage>> list;
        synchronized (this) {
            list = handlers.get(message.type());
        }
        if (list == null || list.isEmpty()) {
            return false;
        }
        for (Consumer<SignalMessage> handler : list) {
            try {
                handler.accept(message);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "[Dispatch] Handler for " + message.type() + " failed", e);
            }
        }
        return true;
    }
}
