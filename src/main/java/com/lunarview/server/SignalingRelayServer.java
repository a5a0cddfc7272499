package com.lunarview.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Netty host for {@link SignalingService}: one port serving the WebSocket
 * signaling endpoint and the admin HTTP surface, plus the periodic idle
 * sweep and WebSocket keep-alive pings.
 */
public class SignalingRelayServer {

    private static final Logger LOGGER = Logger.getLogger(SignalingRelayServer.class.getName());

    private final RelayServerConfig config;
    private final SignalingService service;
    private final ChannelGroup webSocketChannels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;
    private ScheduledExecutorService maintenance;

    public SignalingRelayServer(RelayServerConfig config) {
        this(config, new SignalingService(config));
    }

    public SignalingRelayServer(RelayServerConfig config, SignalingService service) {
        this.config = config;
        this.service = service;
    }

    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(config.getHandlerThreads());

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new RelayChannelInitializer(config, service, webSocketChannels, handlerGroup));

            serverChannel = bootstrap.bind(config.getPort()).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "[Relay] Failed to bind port " + config.getPort(), e);
            stop();
            throw e;
        }

        maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "RelayMaintenance");
            t.setDaemon(true);
            return t;
        });
        maintenance.scheduleAtFixedRate(this::sweep,
            config.getSweepIntervalMillis(), config.getSweepIntervalMillis(), TimeUnit.MILLISECONDS);
        maintenance.scheduleAtFixedRate(this::pingAll,
            config.getPingIntervalMillis(), config.getPingIntervalMillis(), TimeUnit.MILLISECONDS);

        LOGGER.info("[Relay] Signaling server listening on port " + boundPort());
    }

    private void sweep() {
        try {
            int closed = service.sweepIdleSessions();
            if (closed > 0) {
                LOGGER.info("[Relay] Idle sweep closed " + closed + " session(s)");
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[Relay] Idle sweep failed", e);
        }
    }

    private void pingAll() {
        if (!webSocketChannels.isEmpty()) {
            webSocketChannels.writeAndFlush(new PingWebSocketFrame());
        }
    }

    public synchronized void stop() {
        if (maintenance != null) {
            maintenance.shutdownNow();
            maintenance = null;
        }
        webSocketChannels.close().awaitUninterruptibly(5, TimeUnit.SECONDS);
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly(5, TimeUnit.SECONDS);
            serverChannel = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (handlerGroup != null) {
            handlerGroup.shutdownGracefully();
            handlerGroup = null;
        }
        LOGGER.info("[Relay] Signaling server stopped");
    }

    /**
     * Actual listening port; differs from the configured one when that was 0.
     */
    public synchronized int boundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public SignalingService service() {
        return service;
    }
}
