package com.lunarview.server;

/**
 * A live link between two peers, identified by the client ids of both sides.
 */
public final class Session {

    private final String id;
    private final String firstClientId;
    private final String secondClientId;
    private final long createdAt;

    public Session(String id, String firstClientId, String secondClientId, long createdAt) {
        this.id = id;
        this.firstClientId = firstClientId;
        this.secondClientId = secondClientId;
        this.createdAt = createdAt;
    }

    public String id() { return id; }
    public String firstClientId() { return firstClientId; }
    public String secondClientId() { return secondClientId; }
    public long createdAt() { return createdAt; }

    public boolean involves(String clientId) {
        return firstClientId.equals(clientId) || secondClientId.equals(clientId);
    }

    public String partnerOf(String clientId) {
        return firstClientId.equals(clientId) ? secondClientId : firstClientId;
    }
}
