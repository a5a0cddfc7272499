package com.lunarview.server;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class RelayServerMain {

    private static final Logger LOGGER = Logger.getLogger(RelayServerMain.class.getName());

    public static void main(String[] args) throws Exception {
        installLogging();

        RelayServerConfig config = RelayServerConfig.load(args.length > 0 ? args[0] : null);
        SignalingRelayServer server = new SignalingRelayServer(config);
        server.start();

        LOGGER.info("LunarView relay started:");
        LOGGER.info("   WebSocket: ws://0.0.0.0:" + server.boundPort());
        LOGGER.info("   Health:    http://0.0.0.0:" + server.boundPort() + "/health");
        if ("default-admin-key-change-me".equals(config.getAdminApiKey())) {
            LOGGER.warning("[Relay] admin.apiKey is the default value; set lunarview.admin.apiKey");
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "RelayShutdown"));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            LOGGER.info("Server interrupted, shutting down...");
            Thread.currentThread().interrupt();
        }
    }

    private static void installLogging() {
        try (InputStream in = RelayServerMain.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("[Relay] Could not read logging.properties: " + e.getMessage());
        }
    }
}
