package com.lunarview.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * {@link SignalingSocket} on a Netty WebSocket client channel. Supports
 * {@code ws://} and {@code wss://}.
 */
public class NettySignalingSocket implements SignalingSocket {

    private static final Logger LOGGER = Logger.getLogger(NettySignalingSocket.class.getName());

    private static final int MAX_FRAME_BYTES = 10 * 1024 * 1024;
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int ABNORMAL_CLOSURE = 1006;

    private final EventLoopGroup group;
    private final URI uri;
    private final Listener listener;
    private final AtomicBoolean closeReported = new AtomicBoolean();

    private volatile Channel channel;
    private volatile boolean open;
    private volatile int closeCode = ABNORMAL_CLOSURE;
    private volatile String closeReason = "Connection lost";

    public NettySignalingSocket(EventLoopGroup group, URI uri, Listener listener) {
        this.group = group;
        this.uri = uri;
        this.listener = listener;
    }

    public static SignalingSocket.Factory factory(EventLoopGroup group) {
        return (uri, listener) -> new NettySignalingSocket(group, uri, listener);
    }

    @Override
    public void connect() {
        String scheme = uri.getScheme() == null ? "ws" : uri.getScheme().toLowerCase();
        boolean secure = "wss".equals(scheme);
        String host = uri.getHost();
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);

        SslContext sslContext = null;
        if (secure) {
            try {
                sslContext = SslContextBuilder.forClient().build();
            } catch (SSLException e) {
                listener.onError(e);
                reportClose(ABNORMAL_CLOSURE, "TLS setup failed");
                return;
            }
        }
        final SslContext ssl = sslContext;

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), MAX_FRAME_BYTES);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    if (ssl != null) {
                        pipeline.addLast(ssl.newHandler(ch.alloc(), host, port));
                    }
                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(65536));
                    pipeline.addLast(new WebSocketClientProtocolHandler(handshaker, false));
                    pipeline.addLast(new WebSocketFrameAggregator(MAX_FRAME_BYTES));
                    pipeline.addLast(new ClientHandler());
                }
            });

        bootstrap.connect(host, port).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
            } else {
                listener.onError(future.cause());
                reportClose(ABNORMAL_CLOSURE, "Connect failed: " + future.cause().getMessage());
            }
        });
    }

    @Override
    public boolean send(String text) {
        Channel ch = channel;
        if (!open || ch == null || !ch.isActive()) {
            return false;
        }
        ch.writeAndFlush(new TextWebSocketFrame(text));
        return true;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            closeCode = 1000;
            closeReason = "Client closing";
            ch.writeAndFlush(new CloseWebSocketFrame(1000, "Client closing"))
                .addListener(ChannelFutureListener.CLOSE);
        }
    }

    private void reportClose(int code, String reason) {
        open = false;
        if (closeReported.compareAndSet(false, true)) {
            listener.onClose(code, reason);
        }
    }

    private class ClientHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                channel = ctx.channel();
                open = true;
                listener.onOpen();
            } else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                closeReason = "Handshake timeout";
                ctx.close();
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (frame instanceof TextWebSocketFrame text) {
                listener.onMessage(text.text());
            } else if (frame instanceof CloseWebSocketFrame close) {
                closeCode = close.statusCode();
                closeReason = close.reasonText();
                open = false;
                ctx.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            reportClose(closeCode, closeReason);
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOGGER.warning("[Signaling] Socket failure: " + cause.getMessage());
            listener.onError(cause);
            ctx.close();
        }
    }
}
