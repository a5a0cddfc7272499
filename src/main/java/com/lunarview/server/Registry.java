package com.lunarview.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory directory of registered peers and live sessions.
 *
 * All mutations run under the registry's monitor, so a link and an unlink
 * touching the same pair can never interleave: either both peers point at
 * each other or neither does.
 */
public class Registry {

    /** Result of {@link #remove(String)}. */
    public static final class Removal {
        private final PeerSession removed;
        private final PeerSession formerPartner;

        Removal(PeerSession removed, PeerSession formerPartner) {
            this.removed = removed;
            this.formerPartner = formerPartner;
        }

        public PeerSession removed() { return removed; }
        public PeerSession formerPartner() { return formerPartner; }
    }

    private final Map<String, PeerSession> byClientId = new HashMap<>();
    private final Map<String, String> connectionIdToClientId = new HashMap<>();
    private final Map<String, Session> sessions = new HashMap<>();

    /**
     * Store {@code peer}, taking over its connection-id.
     *
     * @return the peer that previously held the same connection-id, or null.
     *         It stays in the registry under its client id; callers decide what to do with it.
     */
    public synchronized PeerSession put(PeerSession peer) {
        PeerSession displaced = null;
        String previousClientId = connectionIdToClientId.get(peer.connectionId());
        if (previousClientId != null && !previousClientId.equals(peer.clientId())) {
            displaced = byClientId.get(previousClientId);
        }
        PeerSession prior = byClientId.put(peer.clientId(), peer);
        if (prior != null && !prior.connectionId().equals(peer.connectionId())
                && peer.clientId().equals(connectionIdToClientId.get(prior.connectionId()))) {
            connectionIdToClientId.remove(prior.connectionId());
        }
        connectionIdToClientId.put(peer.connectionId(), peer.clientId());
        return displaced;
    }

    public synchronized PeerSession byClientId(String clientId) {
        return clientId == null ? null : byClientId.get(clientId);
    }

    public synchronized PeerSession byConnectionId(String connectionId) {
        String clientId = connectionIdToClientId.get(connectionId);
        return clientId == null ? null : byClientId.get(clientId);
    }

    public synchronized boolean isConnectionIdTaken(String connectionId) {
        return connectionIdToClientId.containsKey(connectionId);
    }

    /**
     * Link two registered, currently unlinked peers under {@code sessionId}.
     *
     * @return the new session, or null if either side is missing or already linked
     */
    public synchronized Session link(String firstClientId, String secondClientId, String sessionId, long now) {
        if (firstClientId.equals(secondClientId)) {
            return null;
        }
        PeerSession first = byClientId.get(firstClientId);
        PeerSession second = byClientId.get(secondClientId);
        if (first == null || second == null || first.connectedTo() != null || second.connectedTo() != null) {
            return null;
        }
        first.link(secondClientId, sessionId);
        second.link(firstClientId, sessionId);
        Session session = new Session(sessionId, firstClientId, secondClientId, now);
        sessions.put(sessionId, session);
        return session;
    }

    /**
     * Break the link of {@code clientId} on both sides.
     *
     * @return the former partner, or null if the peer was not linked
     */
    public synchronized PeerSession unlink(String clientId) {
        PeerSession peer = byClientId.get(clientId);
        if (peer == null || peer.connectedTo() == null) {
            return null;
        }
        PeerSession partner = byClientId.get(peer.connectedTo());
        String sessionId = peer.sessionId();
        peer.unlink();
        if (partner != null && clientId.equals(partner.connectedTo())) {
            partner.unlink();
        }
        if (sessionId != null) {
            sessions.remove(sessionId);
        }
        return partner;
    }

    /**
     * Drop a peer entirely, unlinking it first.
     * The connection-id mapping is only released if it still points at this client.
     */
    public synchronized Removal remove(String clientId) {
        PeerSession partner = unlink(clientId);
        PeerSession removed = byClientId.remove(clientId);
        if (removed != null && clientId.equals(connectionIdToClientId.get(removed.connectionId()))) {
            connectionIdToClientId.remove(removed.connectionId());
        }
        return new Removal(removed, partner);
    }

    public synchronized Session session(String sessionId) {
        return sessions.get(sessionId);
    }

    public synchronized List<PeerSession> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(byClientId.values()));
    }

    public synchronized int size() {
        return byClientId.size();
    }

    public synchronized int sessionCount() {
        return sessions.size();
    }
}
