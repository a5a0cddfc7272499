package com.lunarview.server;

import com.lunarview.protocol.PeerRole;

/**
 * One registered peer. {@code connectedTo} and {@code sessionId} are only
 * changed by {@link Registry} while it holds its lock.
 */
public final class PeerSession {

    private final String clientId;
    private final String connectionId;
    private final String passwordHash;
    private final PeerRole role;
    private final ClientConnection connection;
    private final String publicKey;
    private final String ip;
    private final long registeredAt;

    private volatile long lastActivity;
    private String connectedTo;
    private String sessionId;

    public PeerSession(String connectionId, String passwordHash, PeerRole role,
                       ClientConnection connection, String publicKey, long now) {
        this.clientId = connection.id();
        this.connectionId = connectionId;
        this.passwordHash = passwordHash;
        this.role = role;
        this.connection = connection;
        this.publicKey = publicKey;
        this.ip = connection.remoteAddress();
        this.registeredAt = now;
        this.lastActivity = now;
    }

    public String clientId() { return clientId; }
    public String connectionId() { return connectionId; }
    public String passwordHash() { return passwordHash; }
    public PeerRole role() { return role; }
    public ClientConnection connection() { return connection; }
    public String publicKey() { return publicKey; }
    public String ip() { return ip; }
    public long registeredAt() { return registeredAt; }

    public long lastActivity() {
        return lastActivity;
    }

    public void touch(long now) {
        lastActivity = now;
    }

    /** Client id of the linked partner, or null. */
    public synchronized String connectedTo() {
        return connectedTo;
    }

    public synchronized String sessionId() {
        return sessionId;
    }

    synchronized void link(String partnerClientId, String sessionId) {
        this.connectedTo = partnerClientId;
        this.sessionId = sessionId;
    }

    synchronized void unlink() {
        this.connectedTo = null;
        this.sessionId = null;
    }

    @Override
    public String toString() {
        return "PeerSession{" + connectionId + ", " + role + ", client=" + clientId + "}";
    }
}
