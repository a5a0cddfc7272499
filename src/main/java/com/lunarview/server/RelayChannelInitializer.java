package com.lunarview.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.group.ChannelGroup;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.util.concurrent.EventExecutorGroup;

/**
 * Pipeline for one accepted channel. The signaling handler is bound to
 * {@code handlerGroup} so password hashing never blocks the I/O loop; each
 * channel still sees its frames in order on a single executor.
 */
class RelayChannelInitializer extends ChannelInitializer<Channel> {

    private static final int HTTP_AGGREGATE_BYTES = 65536;

    private final RelayServerConfig config;
    private final SignalingService service;
    private final ChannelGroup webSocketChannels;
    private final EventExecutorGroup handlerGroup;

    RelayChannelInitializer(RelayServerConfig config, SignalingService service,
                            ChannelGroup webSocketChannels, EventExecutorGroup handlerGroup) {
        this.config = config;
        this.service = service;
        this.webSocketChannels = webSocketChannels;
        this.handlerGroup = handlerGroup;
    }

    @Override
    protected void initChannel(Channel ch) {
        ChannelPipeline pipeline = ch.pipeline();
        pipeline.addLast(new HttpServerCodec());
        pipeline.addLast(new HttpObjectAggregator(HTTP_AGGREGATE_BYTES));
        pipeline.addLast(new WebSocketFrameAggregator(config.getMaxFrameBytes()));
        pipeline.addLast(new AdminHttpHandler(service));
        pipeline.addLast(handlerGroup, "signaling", new RelayServerHandler(service, webSocketChannels,
            config.getMaxFrameBytes(), config.isTrustForwardedFor()));
    }
}
