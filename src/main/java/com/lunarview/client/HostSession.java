package com.lunarview.client;

import com.lunarview.entitlement.EntitlementService;
import com.lunarview.entitlement.Feature;
import com.lunarview.file_transfer.ChunkedFileTransfer;
import com.lunarview.input.ClipboardProvider;
import com.lunarview.input.InputInjector;
import com.lunarview.input.InputRouter;
import com.lunarview.p2p.P2PTransportNegotiator;
import com.lunarview.p2p.TransportRouter;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.SignalMessage;
import com.lunarview.streaming.AdaptiveStreamingLoop;
import com.lunarview.streaming.FrameSource;
import com.lunarview.streaming.QualityController;
import com.lunarview.streaming.QualityPreset;
import com.lunarview.streaming.StreamingStats;

import java.util.Base64;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * The sharing side of a remote-desktop session.
 *
 * Registers under its connection id, answers the viewer's offer, streams
 * frames while a session is active and feeds remote input to the local
 * injector. Incoming files are accepted into the download directory.
 */
public class HostSession implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(HostSession.class.getName());

    private final PeerConnectionStateMachine connection;
    private final P2PTransportNegotiator negotiator;
    private final TransportRouter router;
    private final AdaptiveStreamingLoop streaming;
    private final ChunkedFileTransfer fileTransfer;
    private final InputRouter input;
    private final EntitlementService entitlements;

    private boolean sessionActive;

    public HostSession(PeerConnectionStateMachine connection, P2PTransportNegotiator negotiator,
                       FrameSource frameSource, InputInjector injector, ClipboardProvider clipboard,
                       EntitlementService entitlements, ClientSettings settings,
                       ScheduledExecutorService scheduler, LongSupplier clock, boolean allowControl) {
        this.connection = connection;
        this.negotiator = negotiator;
        this.entitlements = entitlements;
        this.router = new TransportRouter(connection, negotiator);
        this.streaming = new AdaptiveStreamingLoop(frameSource, this::sendFrame,
            new QualityController(settings.getDowngradeBytes(), settings.getUpgradeBytes()), scheduler, clock);
        this.streaming.setAutoQuality(settings.isAutoQuality());
        this.fileTransfer = new ChunkedFileTransfer(router, settings, scheduler, clock);
        this.input = new InputRouter(router, injector, clipboard, allowControl);
    }

    public void start(ConnectionConfig config) {
        if (!config.isHost()) {
            throw new IllegalArgumentException("Host session needs a host configuration");
        }
        negotiator.bind(connection);
        input.bind();
        fileTransfer.start();
        connection.addStateListener(this::onConnectionState);
        connection.connect(config);
        LOGGER.info("[Host] Sharing as " + config.getConnectionId());
    }

    @Override
    public void close() {
        streaming.stop();
        fileTransfer.close();
        negotiator.disconnect();
        connection.disconnect();
        synchronized (this) {
            if (sessionActive) {
                sessionActive = false;
                entitlements.sessionEnded();
            }
        }
    }

    // ===============================
    // Controls
    // ===============================

    /**
     * @return false if the plan does not include game mode
     */
    public boolean setGameMode(boolean enabled) {
        if (enabled && !entitlements.canUseFeature(Feature.GAME_MODE)) {
            LOGGER.info("[Host] Game mode not available on this plan");
            return false;
        }
        streaming.setGameMode(enabled);
        return true;
    }

    /**
     * @return false if the preset belongs to the game ladder and the plan excludes it
     */
    public boolean setQuality(QualityPreset preset) {
        if (preset.isGame() && !entitlements.canUseFeature(Feature.GAME_MODE)) {
            return false;
        }
        streaming.setQuality(preset);
        return true;
    }

    public void setAutoQuality(boolean enabled) {
        streaming.setAutoQuality(enabled);
    }

    public void setControlAllowed(boolean allowed) {
        input.setControlAllowed(allowed);
    }

    public boolean syncClipboard() {
        return input.syncClipboard();
    }

    public StreamingStats stats() {
        return streaming.stats();
    }

    public ChunkedFileTransfer fileTransfer() {
        return fileTransfer;
    }

    public TransportRouter router() {
        return router;
    }

    public boolean isStreaming() {
        return streaming.isRunning();
    }

    // ===============================
    // Internals
    // ===============================

    boolean sendFrame(byte[] jpeg) {
        return router.send(SignalMessage.of(MessageType.SCREEN_FRAME)
            .with("frame", Base64.getEncoder().encodeToString(jpeg)));
    }

    private void onConnectionState(ConnectionState state, String detail) {
        boolean active = state == ConnectionState.SESSION_ACTIVE;
        synchronized (this) {
            if (active == sessionActive) {
                return;
            }
            sessionActive = active;
        }
        if (active) {
            LOGGER.info("[Host] Viewer " + connection.getPartnerConnectionId() + " joined");
            entitlements.sessionStarted();
            streaming.start();
        } else {
            LOGGER.info("[Host] Session ended" + (detail != null ? ": " + detail : ""));
            streaming.stop();
            negotiator.disconnect();
            entitlements.sessionEnded();
        }
    }
}
