package com.lunarview.client;

import java.net.URI;
import java.util.Objects;

/**
 * Identity a peer registers with on the relay server.
 */
public final class ConnectionConfig {

    private final URI serverUri;
    private final String connectionId;
    private final String password;
    private final boolean host;
    private final String publicKey;

    public ConnectionConfig(URI serverUri, String connectionId, String password, boolean host, String publicKey) {
        this.serverUri = Objects.requireNonNull(serverUri, "serverUri");
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.password = password == null ? "" : password;
        this.host = host;
        this.publicKey = publicKey;
    }

    public static ConnectionConfig host(URI serverUri, String connectionId, String password) {
        return new ConnectionConfig(serverUri, connectionId, password, true, null);
    }

    public static ConnectionConfig viewer(URI serverUri, String connectionId) {
        return new ConnectionConfig(serverUri, connectionId, "", false, null);
    }

    public ConnectionConfig withPublicKey(String key) {
        return new ConnectionConfig(serverUri, connectionId, password, host, key);
    }

    public URI getServerUri() { return serverUri; }
    public String getConnectionId() { return connectionId; }
    public String getPassword() { return password; }
    public boolean isHost() { return host; }
    public String getPublicKey() { return publicKey; }

    @Override
    public String toString() {
        return "ConnectionConfig{" + connectionId + (host ? ", host" : ", viewer") + " @ " + serverUri + "}";
    }
}
