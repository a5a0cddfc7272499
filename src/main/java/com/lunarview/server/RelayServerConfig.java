package com.lunarview.server;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Relay server settings.
 *
 * Resolution order, lowest to highest precedence: built-in defaults,
 * {@code relay-server.properties} on the classpath, an optional file given on
 * the command line, then {@code lunarview.<key>} system properties.
 */
public class RelayServerConfig {

    private static final Logger LOGGER = Logger.getLogger(RelayServerConfig.class.getName());

    public static final String RESOURCE = "relay-server.properties";
    private static final String SYSTEM_PREFIX = "lunarview.";

    public enum DuplicatePolicy { EVICT, REJECT }

    private final int port;
    private final int maxFrameBytes;
    private final int maxFailedAttempts;
    private final long lockoutMillis;
    private final long sessionTimeoutMillis;
    private final long sweepIntervalMillis;
    private final long pingIntervalMillis;
    private final int accessLogCapacity;
    private final String adminApiKey;
    private final DuplicatePolicy duplicatePolicy;
    private final boolean trustForwardedFor;
    private final int handlerThreads;

    public RelayServerConfig(Properties props) {
        this.port = intValue(props, "server.port", 8080);
        this.maxFrameBytes = intValue(props, "server.maxFrameBytes", 10 * 1024 * 1024);
        this.maxFailedAttempts = intValue(props, "security.maxFailedAttempts", 5);
        this.lockoutMillis = longValue(props, "security.lockoutMillis", 15 * 60 * 1000L);
        this.sessionTimeoutMillis = longValue(props, "session.timeoutMillis", 30 * 60 * 1000L);
        this.sweepIntervalMillis = longValue(props, "session.sweepIntervalMillis", 5 * 60 * 1000L);
        this.pingIntervalMillis = longValue(props, "heartbeat.pingIntervalMillis", 30_000L);
        this.accessLogCapacity = intValue(props, "accessLog.capacity", 1000);
        this.adminApiKey = props.getProperty("admin.apiKey", "default-admin-key-change-me");
        this.duplicatePolicy = DuplicatePolicy.valueOf(
            props.getProperty("registration.duplicatePolicy", "EVICT").trim().toUpperCase());
        this.trustForwardedFor = Boolean.parseBoolean(props.getProperty("server.trustForwardedFor", "false").trim());
        this.handlerThreads = intValue(props, "server.handlerThreads", 8);
    }

    public static RelayServerConfig defaults() {
        return new RelayServerConfig(new Properties());
    }

    /**
     * Load settings for the server process.
     *
     * @param overrideFile optional path to a properties file, may be null
     */
    public static RelayServerConfig load(String overrideFile) throws IOException {
        Properties props = new Properties();
        try (InputStream in = RelayServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        }
        if (overrideFile != null) {
            try (FileInputStream fis = new FileInputStream(overrideFile)) {
                props.load(fis);
            }
            LOGGER.info("[Config] Loaded overrides from " + overrideFile);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return new RelayServerConfig(props);
    }

    private static int intValue(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        return value == null ? fallback : Integer.parseInt(value.trim());
    }

    private static long longValue(Properties props, String key, long fallback) {
        String value = props.getProperty(key);
        return value == null ? fallback : Long.parseLong(value.trim());
    }

    public int getPort() { return port; }
    public int getMaxFrameBytes() { return maxFrameBytes; }
    public int getMaxFailedAttempts() { return maxFailedAttempts; }
    public long getLockoutMillis() { return lockoutMillis; }
    public long getSessionTimeoutMillis() { return sessionTimeoutMillis; }
    public long getSweepIntervalMillis() { return sweepIntervalMillis; }
    public long getPingIntervalMillis() { return pingIntervalMillis; }
    public int getAccessLogCapacity() { return accessLogCapacity; }
    public String getAdminApiKey() { return adminApiKey; }
    public DuplicatePolicy getDuplicatePolicy() { return duplicatePolicy; }

    /** Whether the first X-Forwarded-For hop names the client; only safe behind a proxy that sets it. */
    public boolean isTrustForwardedFor() { return trustForwardedFor; }
    public int getHandlerThreads() { return handlerThreads; }
}
