package com.lunarview.client;

import com.google.gson.JsonObject;
import com.lunarview.entitlement.EntitlementService;
import com.lunarview.entitlement.Feature;
import com.lunarview.error.CapacityException;
import com.lunarview.error.RemoteSessionException;
import com.lunarview.file_transfer.ChunkedFileTransfer;
import com.lunarview.input.ClipboardProvider;
import com.lunarview.p2p.P2PTransportNegotiator;
import com.lunarview.p2p.TransportRouter;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.SignalMessage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * The controlling side of a remote-desktop session.
 *
 * Connects to a host by id and password, opens the direct transport by
 * sending the offer, receives screen frames and sends input, clipboard
 * content and files. A capped plan ends the session when its time runs out.
 */
public class ViewerSession implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ViewerSession.class.getName());

    private final PeerConnectionStateMachine connection;
    private final P2PTransportNegotiator negotiator;
    private final TransportRouter router;
    private final ChunkedFileTransfer fileTransfer;
    private final EntitlementService entitlements;
    private final ClipboardProvider clipboard;
    private final ScheduledExecutorService scheduler;
    private final List<Consumer<byte[]>> frameListeners = new CopyOnWriteArrayList<>();

    private boolean sessionActive;
    private ScheduledFuture<?> sessionCapTask;
    private long framesReceived;

    public ViewerSession(PeerConnectionStateMachine connection, P2PTransportNegotiator negotiator,
                         ClipboardProvider clipboard, EntitlementService entitlements, ClientSettings settings,
                         ScheduledExecutorService scheduler, LongSupplier clock) {
        this.connection = connection;
        this.negotiator = negotiator;
        this.clipboard = clipboard;
        this.entitlements = entitlements;
        this.scheduler = scheduler;
        this.router = new TransportRouter(connection, negotiator);
        this.fileTransfer = new ChunkedFileTransfer(router, settings, scheduler, clock);
    }

    /**
     * Register with the relay. Call {@link #connectToHost} once the state is
     * {@link ConnectionState#CONNECTED}.
     */
    public void start(ConnectionConfig config) {
        negotiator.bind(connection);
        fileTransfer.start();
        connection.dispatcher().on(MessageType.SCREEN_FRAME, this::onFrame);
        connection.dispatcher().on(MessageType.CLIPBOARD_SYNC, this::onClipboard);
        connection.addStateListener(this::onConnectionState);
        connection.connect(config);
    }

    /**
     * @return false if the plan's daily connection allowance is used up
     */
    public boolean connectToHost(String hostConnectionId, String password) {
        if (!entitlements.canStartConnection()) {
            LOGGER.info("[Viewer] Connection to " + hostConnectionId + " refused by plan limits");
            return false;
        }
        connection.connectToHost(hostConnectionId, password);
        return true;
    }

    public void leave() {
        connection.leaveSession();
    }

    @Override
    public void close() {
        fileTransfer.close();
        negotiator.disconnect();
        connection.disconnect();
        endSession();
    }

    public void addFrameListener(Consumer<byte[]> listener) {
        frameListeners.add(listener);
    }

    // ===============================
    // Outbound
    // ===============================

    public boolean sendMouseEvent(JsonObject event) {
        return router.send(SignalMessage.of(MessageType.MOUSE_EVENT).with("event", event));
    }

    public boolean sendKeyboardEvent(JsonObject event) {
        return router.send(SignalMessage.of(MessageType.KEYBOARD_EVENT).with("event", event));
    }

    public boolean sendClipboard(String text) {
        return router.send(SignalMessage.of(MessageType.CLIPBOARD_SYNC).with("content", text));
    }

    /**
     * @throws CapacityException if the plan excludes file transfer or the file is too large
     */
    public String sendFile(Path file) throws IOException, RemoteSessionException {
        if (!entitlements.canUseFeature(Feature.FILE_TRANSFER)) {
            throw new CapacityException("File transfer is not included in this plan");
        }
        return fileTransfer.sendFile(file);
    }

    public ChunkedFileTransfer fileTransfer() {
        return fileTransfer;
    }

    public TransportRouter router() {
        return router;
    }

    public synchronized long getFramesReceived() {
        return framesReceived;
    }

    public OptionalLong remainingSessionTimeMillis() {
        return entitlements.remainingSessionTimeMillis();
    }

    // ===============================
    // Inbound
    // ===============================

    private void onFrame(SignalMessage message) {
        byte[] frame;
        try {
            frame = Base64.getDecoder().decode(message.getString("frame"));
        } catch (IllegalArgumentException e) {
            LOGGER.fine("[Viewer] Dropping undecodable frame");
            return;
        }
        synchronized (this) {
            framesReceived++;
        }
        for (Consumer<byte[]> listener : frameListeners) {
            listener.accept(frame);
        }
    }

    private void onClipboard(SignalMessage message) {
        String text = message.optString("content", null);
        if (text != null && clipboard != null) {
            clipboard.writeText(text);
        }
    }

    private void onConnectionState(ConnectionState state, String detail) {
        if (state == ConnectionState.SESSION_ACTIVE) {
            synchronized (this) {
                if (sessionActive) {
                    return;
                }
                sessionActive = true;
            }
            LOGGER.info("[Viewer] Connected to " + connection.getPartnerConnectionId());
            entitlements.sessionStarted();
            scheduleSessionCap();
            negotiator.start();
        } else {
            endSession();
        }
    }

    private void scheduleSessionCap() {
        OptionalLong remaining = entitlements.remainingSessionTimeMillis();
        if (remaining.isEmpty()) {
            return;
        }
        synchronized (this) {
            sessionCapTask = scheduler.schedule(this::sessionExpired, remaining.getAsLong(), TimeUnit.MILLISECONDS);
        }
    }

    private void sessionExpired() {
        LOGGER.info("[Viewer] Session time limit reached");
        connection.leaveSession();
    }

    private void endSession() {
        synchronized (this) {
            if (!sessionActive) {
                return;
            }
            sessionActive = false;
            if (sessionCapTask != null) {
                sessionCapTask.cancel(false);
                sessionCapTask = null;
            }
        }
        negotiator.disconnect();
        entitlements.sessionEnded();
    }
}
