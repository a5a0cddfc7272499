package com.lunarview.client;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Client tunables, read from {@code lunarview-client.properties} with
 * {@code lunarview.<key>} system properties taking precedence.
 */
public class ClientSettings {

    public static final String RESOURCE = "lunarview-client.properties";
    private static final String SYSTEM_PREFIX = "lunarview.";

    private final URI serverUri;
    private final int reconnectMaxAttempts;
    private final long reconnectBaseDelayMillis;
    private final long heartbeatIntervalMillis;
    private final int chunkSize;
    private final long maxFileBytes;
    private final long transferStaleMillis;
    private final long transferSweepIntervalMillis;
    private final int maxChunkRetries;
    private final Path downloadDir;
    private final int downgradeBytes;
    private final int upgradeBytes;
    private final boolean autoQuality;
    private final List<String> stunUrls;

    public ClientSettings(Properties props) {
        this.serverUri = URI.create(props.getProperty("server.url", "ws://localhost:8080"));
        this.reconnectMaxAttempts = Integer.parseInt(props.getProperty("reconnect.maxAttempts", "5"));
        this.reconnectBaseDelayMillis = Long.parseLong(props.getProperty("reconnect.baseDelayMillis", "1000"));
        this.heartbeatIntervalMillis = Long.parseLong(props.getProperty("heartbeat.intervalMillis", "30000"));
        this.chunkSize = Integer.parseInt(props.getProperty("transfer.chunkSize", "65536"));
        this.maxFileBytes = Long.parseLong(props.getProperty("transfer.maxFileBytes", "10737418240"));
        this.transferStaleMillis = Long.parseLong(props.getProperty("transfer.staleMillis", "300000"));
        this.transferSweepIntervalMillis = Long.parseLong(props.getProperty("transfer.sweepIntervalMillis", "60000"));
        this.maxChunkRetries = Integer.parseInt(props.getProperty("transfer.maxChunkRetries", "3"));
        String dir = props.getProperty("transfer.downloadDir", "").trim();
        this.downloadDir = dir.isEmpty()
            ? Paths.get(System.getProperty("user.home"), "Downloads", "LunarView")
            : Paths.get(dir);
        this.downgradeBytes = Integer.parseInt(props.getProperty("stream.downgradeBytes", "204800"));
        this.upgradeBytes = Integer.parseInt(props.getProperty("stream.upgradeBytes", "51200"));
        this.autoQuality = Boolean.parseBoolean(props.getProperty("stream.autoQuality", "true"));

        this.stunUrls = new ArrayList<>();
        String urls = props.getProperty("ice.stunUrls",
            "stun:stun.l.google.com:19302,stun:stun1.l.google.com:19302,stun:stun2.l.google.com:19302");
        for (String url : urls.split(",")) {
            if (!url.isBlank()) {
                stunUrls.add(url.trim());
            }
        }
    }

    public static ClientSettings defaults() {
        return new ClientSettings(new Properties());
    }

    public static ClientSettings load() throws IOException {
        Properties props = new Properties();
        try (InputStream in = ClientSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return new ClientSettings(props);
    }

    public URI getServerUri() { return serverUri; }
    public int getReconnectMaxAttempts() { return reconnectMaxAttempts; }
    public long getReconnectBaseDelayMillis() { return reconnectBaseDelayMillis; }
    public long getHeartbeatIntervalMillis() { return heartbeatIntervalMillis; }
    public int getChunkSize() { return chunkSize; }
    public long getMaxFileBytes() { return maxFileBytes; }
    public long getTransferStaleMillis() { return transferStaleMillis; }
    public long getTransferSweepIntervalMillis() { return transferSweepIntervalMillis; }
    public int getMaxChunkRetries() { return maxChunkRetries; }
    public Path getDownloadDir() { return downloadDir; }
    public int getDowngradeBytes() { return downgradeBytes; }
    public int getUpgradeBytes() { return upgradeBytes; }
    public boolean isAutoQuality() { return autoQuality; }
    public List<String> getStunUrls() { return stunUrls; }
}
