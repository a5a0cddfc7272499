package com.lunarview.server;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-channel WebSocket endpoint: performs the upgrade, then hands text
 * frames to {@link SignalingService}.
 */
class RelayServerHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = Logger.getLogger(RelayServerHandler.class.getName());

    private final SignalingService service;
    private final ChannelGroup webSocketChannels;
    private final int maxFrameBytes;
    private final boolean trustForwardedFor;

    private WebSocketServerHandshaker handshaker;
    // set from the handshake listener on the I/O loop, read on the handler executor
    private volatile NettyClientConnection connection;

    RelayServerHandler(SignalingService service, ChannelGroup webSocketChannels, int maxFrameBytes,
                       boolean trustForwardedFor) {
        this.service = service;
        this.webSocketChannels = webSocketChannels;
        this.maxFrameBytes = maxFrameBytes;
        this.trustForwardedFor = trustForwardedFor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof FullHttpRequest request) {
            handleHttpRequest(ctx, request);
        } else if (msg instanceof WebSocketFrame frame) {
            handleWebSocketFrame(ctx, frame);
        }
    }

    private void handleHttpRequest(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (!request.decoderResult().isSuccess()) {
            ctx.writeAndFlush(new DefaultFullHttpResponse(request.protocolVersion(), HttpResponseStatus.BAD_REQUEST))
                .addListener(ChannelFutureListener.CLOSE);
            return;
        }

        String location = "ws://" + request.headers().get(HttpHeaderNames.HOST) + request.uri();
        WebSocketServerHandshakerFactory factory =
            new WebSocketServerHandshakerFactory(location, null, true, maxFrameBytes);
        handshaker = factory.newHandshaker(request);
        if (handshaker == null) {
            WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
            return;
        }

        String ip = clientIp(ctx, request);
        ChannelFuture done = handshaker.handshake(ctx.channel(), request);
        done.addListener(future -> {
            if (!future.isSuccess()) {
                LOGGER.warning("[Relay] Handshake failed for " + ip + ": " + future.cause());
                return;
            }
            connection = new NettyClientConnection(ctx.channel(), ip);
            if (service.onOpen(connection)) {
                webSocketChannels.add(ctx.channel());
            } else {
                connection = null;
            }
        });
    }

    private void handleWebSocketFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof CloseWebSocketFrame) {
            handshaker.close(ctx.channel(), (CloseWebSocketFrame) frame.retain());
            return;
        }
        if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
            return;
        }
        if (frame instanceof PongWebSocketFrame) {
            return;
        }
        if (!(frame instanceof TextWebSocketFrame text)) {
            LOGGER.warning("[Relay] Ignoring " + frame.getClass().getSimpleName() + " on " + ctx.channel().id());
            return;
        }
        if (connection == null) {
            return;
        }
        service.onMessage(connection, text.text());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (connection != null) {
            NettyClientConnection closed = connection;
            connection = null;
            service.onClose(closed);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.log(Level.WARNING, "[Relay] Closing channel " + ctx.channel().id() + " after error", cause);
        ctx.close();
    }

    /**
     * Source IP for lockout accounting: the socket peer, or the first
     * X-Forwarded-For hop when the server is configured to trust its proxy.
     */
    private String clientIp(ChannelHandlerContext ctx, FullHttpRequest request) {
        if (trustForwardedFor) {
            String forwarded = request.headers().get("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        return NettyClientConnection.hostOf(ctx.channel().remoteAddress());
    }
}
