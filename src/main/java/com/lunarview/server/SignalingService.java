package com.lunarview.server;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lunarview.crypto.PasswordHasher;
import com.lunarview.error.AuthenticationException;
import com.lunarview.error.NotFoundException;
import com.lunarview.protocol.CloseCodes;
import com.lunarview.protocol.MessageCodec;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.PeerRole;
import com.lunarview.protocol.ProtocolException;
import com.lunarview.protocol.SignalMessage;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transport-independent core of the relay server: registration, password
 * gated session brokering, payload relay, idle sweep and the admin actions.
 *
 * The Netty layer feeds it {@link #onOpen}, {@link #onMessage} and
 * {@link #onClose}; everything it sends goes through {@link ClientConnection}.
 * A failure while handling one frame is reported to that connection only.
 */
public class SignalingService {

    private static final Logger LOGGER = Logger.getLogger(SignalingService.class.getName());

    static final String ERR_NOT_FOUND = "Connection ID not found";
    static final String ERR_INVALID_PASSWORD = "Invalid password";
    static final String ERR_LOCKED_OUT = "Too many failed attempts. Try again later.";
    static final String ERR_BUSY = "Target is busy";
    static final String ERR_NOT_REGISTERED = "Not registered";
    static final String ERR_SELF = "Cannot connect to yourself";
    static final String ERR_ID_IN_USE = "Connection ID already in use";
    static final String REASON_PARTNER_LEFT = "Partner disconnected";
    static final String REASON_TIMEOUT = "Session timeout";

    private final RelayServerConfig config;
    private final Registry registry;
    private final LockoutPolicy lockout;
    private final AccessLog accessLog;
    private final PasswordHasher hasher;
    private final LongSupplier clock;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

    public SignalingService(RelayServerConfig config) {
        this(config, new PasswordHasher(), System::currentTimeMillis);
    }

    public SignalingService(RelayServerConfig config, PasswordHasher hasher, LongSupplier clock) {
        this(config,
            new Registry(),
            new LockoutPolicy(config.getMaxFailedAttempts(), config.getLockoutMillis(), clock),
            new AccessLog(config.getAccessLogCapacity()),
            hasher,
            clock);
    }

    public SignalingService(RelayServerConfig config, Registry registry, LockoutPolicy lockout,
                            AccessLog accessLog, PasswordHasher hasher, LongSupplier clock) {
        this.config = config;
        this.registry = registry;
        this.lockout = lockout;
        this.accessLog = accessLog;
        this.hasher = hasher;
        this.clock = clock;
    }

    // ===============================
    // Connection lifecycle
    // ===============================

    /**
     * Admit a freshly accepted connection.
     *
     * @return false if the source IP is locked out; the connection is then closed with 4003
     */
    public boolean onOpen(ClientConnection connection) {
        String ip = connection.remoteAddress();
        if (lockout.isBlocked(ip)) {
            audit(ip, null, "blocked_connection", false, "IP is locked out");
            connection.close(CloseCodes.IP_BLOCKED, "IP blocked");
            return false;
        }
        connections.put(connection.id(), connection);
        LOGGER.fine("[Signaling] Connection opened: " + connection.id() + " from " + ip);
        return true;
    }

    public void onMessage(ClientConnection connection, String text) {
        SignalMessage message;
        try {
            message = MessageCodec.decode(text);
        } catch (ProtocolException e) {
            LOGGER.warning("[Signaling] Rejected frame from " + describe(connection) + ": " + e.getMessage());
            sendError(connection, e.getMessage());
            return;
        }

        PeerSession self = registry.byClientId(connection.id());
        if (self != null) {
            self.touch(clock.getAsLong());
        }

        try {
            handle(connection, message);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[Signaling] Failed to handle " + message.type()
                + " from " + describe(connection), e);
            sendError(connection, "Internal server error");
        }
    }

    public void onClose(ClientConnection connection) {
        connections.remove(connection.id());
        detach(connection.id(), REASON_PARTNER_LEFT, "disconnect");
        LOGGER.fine("[Signaling] Connection closed: " + connection.id());
    }

    private void handle(ClientConnection connection, SignalMessage message) {
        switch (message.type()) {
            case REGISTER -> register(connection, message);
            case CONNECT -> connect(connection, message);
            case DISCONNECT -> disconnect(connection);
            case PING -> connection.send(MessageCodec.encode(SignalMessage.of(MessageType.PONG)));
            case PONG -> { }
            default -> {
                if (message.type().isRelayed()) {
                    relay(connection, message);
                } else {
                    LOGGER.warning("[Signaling] Unexpected " + message.type() + " from " + describe(connection));
                    sendError(connection, "Unexpected message type: " + message.type());
                }
            }
        }
    }

    // ===============================
    // register / connect / disconnect
    // ===============================

    void register(ClientConnection connection, SignalMessage message) {
        String connectionId = message.getString("connectionId").trim();
        String password = message.getString("password");
        boolean isHost = message.getBoolean("isHost");
        String publicKey = message.optString("publicKey", null);
        String ip = connection.remoteAddress();

        if (connectionId.isEmpty()) {
            sendError(connection, "Connection ID must not be empty");
            return;
        }

        // A client re-registering drops its previous identity first.
        if (registry.byClientId(connection.id()) != null) {
            detach(connection.id(), REASON_PARTNER_LEFT, "re_register");
        }

        PeerSession holder = registry.byConnectionId(connectionId);
        if (holder != null) {
            if (config.getDuplicatePolicy() == RelayServerConfig.DuplicatePolicy.REJECT) {
                audit(ip, connectionId, "register", false, ERR_ID_IN_USE);
                sendError(connection, ERR_ID_IN_USE);
                return;
            }
            evict(holder);
        }

        String hash = hasher.hash(password, connectionId);
        PeerSession peer = new PeerSession(connectionId, hash, PeerRole.fromHostFlag(isHost),
            connection, publicKey, clock.getAsLong());
        PeerSession displaced = registry.put(peer);
        if (displaced != null) {
            evict(displaced);
        }

        connection.send(MessageCodec.encode(SignalMessage.of(MessageType.REGISTERED)
            .with("connectionId", connectionId)));
        audit(ip, connectionId, "register", true, isHost ? "host" : "viewer");
        LOGGER.info("[Signaling] Registered " + connectionId + " as " + peer.role()
            + " (client " + connection.id() + ")");
    }

    private void evict(PeerSession stale) {
        detach(stale.clientId(), REASON_PARTNER_LEFT, "replaced");
        stale.connection().close(CloseCodes.REPLACED, "Connection ID registered elsewhere");
        LOGGER.info("[Signaling] Evicted stale holder of " + stale.connectionId());
    }

    void connect(ClientConnection connection, SignalMessage message) {
        String targetId = message.getString("targetConnectionId").trim();
        String password = message.getString("password");

        try {
            Session session = brokerSession(connection, targetId, password);
            if (session == null) {
                return;
            }
            PeerSession self = registry.byClientId(connection.id());
            PeerSession target = registry.byClientId(session.partnerOf(connection.id()));
            if (self == null || target == null) {
                return;
            }

            connection.send(MessageCodec.encode(SignalMessage.of(MessageType.CONNECT_SUCCESS)
                .with("sessionId", session.id())
                .with("targetConnectionId", target.connectionId())
                .with("targetPublicKey", target.publicKey())));
            target.connection().send(MessageCodec.encode(SignalMessage.of(MessageType.INCOMING_CONNECTION)
                .with("sessionId", session.id())
                .with("fromConnectionId", self.connectionId())
                .with("fromPublicKey", self.publicKey())));

            audit(connection.remoteAddress(), targetId, "connect", true, "session " + session.id());
            LOGGER.info("[Signaling] Session " + session.id() + ": "
                + self.connectionId() + " -> " + target.connectionId());
        } catch (AuthenticationException | NotFoundException e) {
            sendConnectError(connection, e.getMessage());
        }
    }

    /**
     * @return the new session, or null when an error reply has already been sent
     */
    private Session brokerSession(ClientConnection connection, String targetId, String password)
            throws AuthenticationException, NotFoundException {
        String ip = connection.remoteAddress();

        if (lockout.isBlocked(ip)) {
            audit(ip, targetId, "connect_attempt", false, "locked out");
            throw new AuthenticationException(ERR_LOCKED_OUT);
        }

        PeerSession self = registry.byClientId(connection.id());
        if (self == null) {
            sendConnectError(connection, ERR_NOT_REGISTERED);
            return null;
        }

        PeerSession target = registry.byConnectionId(targetId);
        if (target == null) {
            audit(ip, targetId, "connect_attempt", false, ERR_NOT_FOUND);
            throw new NotFoundException(ERR_NOT_FOUND);
        }
        if (target.clientId().equals(self.clientId())) {
            sendConnectError(connection, ERR_SELF);
            return null;
        }

        if (!hasher.matches(password, targetId, target.passwordHash())) {
            int failures = lockout.recordFailure(ip);
            audit(ip, targetId, "connect_attempt", false, ERR_INVALID_PASSWORD + " (" + failures + ")");
            throw new AuthenticationException(ERR_INVALID_PASSWORD);
        }

        Session session = registry.link(self.clientId(), target.clientId(),
            UUID.randomUUID().toString(), clock.getAsLong());
        if (session == null) {
            audit(ip, targetId, "connect_attempt", false, ERR_BUSY);
            sendConnectError(connection, ERR_BUSY);
        }
        return session;
    }

    void disconnect(ClientConnection connection) {
        PeerSession self = registry.byClientId(connection.id());
        PeerSession partner = registry.unlink(connection.id());
        if (partner != null) {
            notifyDisconnected(partner, REASON_PARTNER_LEFT);
        }
        if (self != null) {
            audit(connection.remoteAddress(), self.connectionId(), "disconnect", true, null);
        }
    }

    /**
     * Remove a peer, telling its partner exactly once. Safe to call repeatedly:
     * later calls find nothing to remove.
     */
    private void detach(String clientId, String reason, String event) {
        Registry.Removal removal = registry.remove(clientId);
        if (removal.formerPartner() != null) {
            notifyDisconnected(removal.formerPartner(), reason);
        }
        if (removal.removed() != null) {
            PeerSession removed = removal.removed();
            audit(removed.ip(), removed.connectionId(), event, true, null);
        }
    }

    private void notifyDisconnected(PeerSession partner, String reason) {
        partner.connection().send(MessageCodec.encode(SignalMessage.of(MessageType.DISCONNECTED)
            .with("reason", reason)));
    }

    // ===============================
    // Relay
    // ===============================

    void relay(ClientConnection connection, SignalMessage message) {
        PeerSession self = registry.byClientId(connection.id());
        PeerSession partner = self == null ? null : registry.byClientId(self.connectedTo());
        if (partner == null) {
            LOGGER.fine("[Signaling] Dropped " + message.type() + " from " + describe(connection) + ": not linked");
            return;
        }

        String payload;
        if (message.type() == MessageType.RELAY) {
            payload = MessageCodec.encode(SignalMessage.of(MessageType.RELAYED).with("data", message.get("data")));
        } else if (message.type() == MessageType.SCREEN_FRAME) {
            payload = MessageCodec.encode(SignalMessage.of(MessageType.SCREEN_FRAME).with("frame", message.get("frame")));
        } else {
            payload = message.rawText();
        }

        if (!partner.connection().send(payload)) {
            LOGGER.fine("[Signaling] Partner of " + self.connectionId() + " gone, dropped " + message.type());
        }
    }

    // ===============================
    // Maintenance
    // ===============================

    /**
     * Close every registered peer idle for longer than the session timeout,
     * and forget failed-password records whose lockout window has passed.
     *
     * @return number of peers closed
     */
    public int sweepIdleSessions() {
        int purged = lockout.purgeExpired();
        if (purged > 0) {
            LOGGER.fine("[Signaling] Forgot " + purged + " expired lockout record(s)");
        }
        long now = clock.getAsLong();
        int closed = 0;
        for (PeerSession peer : registry.snapshot()) {
            if (now - peer.lastActivity() > config.getSessionTimeoutMillis()) {
                LOGGER.info("[Signaling] Session timeout for " + peer.connectionId());
                detach(peer.clientId(), REASON_TIMEOUT, "session_timeout");
                peer.connection().close(CloseCodes.SESSION_TIMEOUT, REASON_TIMEOUT);
                closed++;
            }
        }
        return closed;
    }

    // ===============================
    // Admin surface
    // ===============================

    public JsonObject health() {
        JsonObject json = new JsonObject();
        json.addProperty("status", "ok");
        json.addProperty("clients", registry.size());
        json.addProperty("sessions", registry.sessionCount());
        json.addProperty("timestamp", clock.getAsLong());
        return json;
    }

    public JsonArray listClients() {
        JsonArray array = new JsonArray();
        for (PeerSession peer : registry.snapshot()) {
            JsonObject json = new JsonObject();
            json.addProperty("connectionId", peer.connectionId());
            json.addProperty("isHost", peer.role().isHost());
            json.addProperty("ip", peer.ip());
            PeerSession partner = registry.byClientId(peer.connectedTo());
            if (partner != null) {
                json.addProperty("connectedTo", partner.connectionId());
            }
            json.addProperty("registeredAt", peer.registeredAt());
            json.addProperty("lastActivity", peer.lastActivity());
            array.add(json);
        }
        return array;
    }

    public JsonArray accessLogs(int limit) {
        JsonArray array = new JsonArray();
        for (AccessLogEntry entry : accessLog.latest(limit)) {
            array.add(entry.toJson());
        }
        return array;
    }

    public void blockIp(String ip, String adminIp) {
        lockout.block(ip);
        audit(adminIp, null, "admin_block_ip", true, ip);
    }

    public void unblockIp(String ip, String adminIp) {
        lockout.unblock(ip);
        audit(adminIp, null, "admin_unblock_ip", true, ip);
    }

    /**
     * @return false when no peer holds {@code connectionId}
     */
    public boolean forceDisconnect(String connectionId, String adminIp) {
        PeerSession peer = registry.byConnectionId(connectionId);
        if (peer == null) {
            return false;
        }
        detach(peer.clientId(), REASON_PARTNER_LEFT, "admin_disconnect");
        peer.connection().close(CloseCodes.ADMIN_DISCONNECT, "Disconnected by administrator");
        audit(adminIp, connectionId, "admin_disconnect", true, null);
        return true;
    }

    public void recordAdminAuthFailure(String ip) {
        audit(ip, null, "admin_auth_failed", false, null);
    }

    public boolean isAdminKey(String key) {
        return key != null && key.equals(config.getAdminApiKey());
    }

    // ===============================
    // Helpers
    // ===============================

    private void sendError(ClientConnection connection, String error) {
        connection.send(MessageCodec.encode(SignalMessage.of(MessageType.ERROR).with("error", error)));
    }

    private void sendConnectError(ClientConnection connection, String error) {
        connection.send(MessageCodec.encode(SignalMessage.of(MessageType.CONNECT_ERROR).with("error", error)));
    }

    private void audit(String ip, String connectionId, String event, boolean success, String details) {
        accessLog.append(new AccessLogEntry(clock.getAsLong(), ip, connectionId, event, success, details));
    }

    private String describe(ClientConnection connection) {
        PeerSession peer = registry.byClientId(connection.id());
        return peer != null ? peer.connectionId() : connection.id();
    }

    public Registry registry() { return registry; }
    public LockoutPolicy lockout() { return lockout; }
    public AccessLog accessLog() { return accessLog; }
    public RelayServerConfig config() { return config; }

    public int openConnections() {
        return connections.size();
    }
}
