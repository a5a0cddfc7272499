package com.lunarview.server;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;

/**
 * Plain HTTP endpoints served on the relay port next to the WebSocket upgrade.
 *
 * <pre>
 * GET    /health              unauthenticated
 * GET    /admin/clients       x-api-key or ?apiKey=
 * GET    /admin/logs
 * POST   /admin/block-ip      {"ip": "..."}
 * DELETE /admin/block-ip      {"ip": "..."}
 * POST   /admin/disconnect    {"connectionId": "..."}
 * </pre>
 *
 * Any other request is passed further down the pipeline.
 */
class AdminHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger LOGGER = Logger.getLogger(AdminHttpHandler.class.getName());

    static final int LOG_PAGE_SIZE = 100;
    static final String API_KEY_HEADER = "x-api-key";

    private final SignalingService service;

    AdminHttpHandler(SignalingService service) {
        this.service = service;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        QueryStringDecoder query = new QueryStringDecoder(request.uri());
        String path = query.path();

        if (!path.equals("/health") && !path.startsWith("/admin/")) {
            ctx.fireChannelRead(request.retain());
            return;
        }

        if (path.equals("/health")) {
            respond(ctx, request, HttpResponseStatus.OK, service.health());
            return;
        }

        String adminIp = NettyClientConnection.hostOf(ctx.channel().remoteAddress());
        if (!service.isAdminKey(apiKey(request, query))) {
            service.recordAdminAuthFailure(adminIp);
            LOGGER.warning("[Admin] Rejected request to " + path + " from " + adminIp);
            respond(ctx, request, HttpResponseStatus.UNAUTHORIZED, error("Unauthorized"));
            return;
        }

        HttpMethod method = request.method();
        switch (path) {
            case "/admin/clients" -> {
                if (method.equals(HttpMethod.GET)) {
                    respond(ctx, request, HttpResponseStatus.OK, service.listClients());
                } else {
                    methodNotAllowed(ctx, request);
                }
            }
            case "/admin/logs" -> {
                if (method.equals(HttpMethod.GET)) {
                    respond(ctx, request, HttpResponseStatus.OK, service.accessLogs(LOG_PAGE_SIZE));
                } else {
                    methodNotAllowed(ctx, request);
                }
            }
            case "/admin/block-ip" -> {
                String ip = bodyField(request, "ip");
                if (ip == null) {
                    respond(ctx, request, HttpResponseStatus.BAD_REQUEST, error("IP address required"));
                } else if (method.equals(HttpMethod.POST)) {
                    service.blockIp(ip, adminIp);
                    respond(ctx, request, HttpResponseStatus.OK, success("IP " + ip + " blocked"));
                } else if (method.equals(HttpMethod.DELETE)) {
                    service.unblockIp(ip, adminIp);
                    respond(ctx, request, HttpResponseStatus.OK, success("IP " + ip + " unblocked"));
                } else {
                    methodNotAllowed(ctx, request);
                }
            }
            case "/admin/disconnect" -> {
                if (!method.equals(HttpMethod.POST)) {
                    methodNotAllowed(ctx, request);
                    return;
                }
                String connectionId = bodyField(request, "connectionId");
                if (connectionId == null) {
                    respond(ctx, request, HttpResponseStatus.BAD_REQUEST, error("Connection ID required"));
                } else if (service.forceDisconnect(connectionId, adminIp)) {
                    respond(ctx, request, HttpResponseStatus.OK, success("Client disconnected"));
                } else {
                    respond(ctx, request, HttpResponseStatus.NOT_FOUND, error("Client not found"));
                }
            }
            default -> respond(ctx, request, HttpResponseStatus.NOT_FOUND, error("Not found"));
        }
    }

    private static String apiKey(FullHttpRequest request, QueryStringDecoder query) {
        String header = request.headers().get(API_KEY_HEADER);
        if (header != null) {
            return header;
        }
        List<String> values = query.parameters().get("apiKey");
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static String bodyField(FullHttpRequest request, String field) {
        String body = request.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return null;
        }
        try {
            JsonElement root = JsonParser.parseString(body);
            if (!root.isJsonObject()) {
                return null;
            }
            JsonElement value = root.getAsJsonObject().get(field);
            return value == null || value.isJsonNull() ? null : value.getAsString();
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            LOGGER.fine("[Admin] Unreadable body: " + e.getMessage());
            return null;
        }
    }

    private static JsonObject success(String message) {
        JsonObject json = new JsonObject();
        json.addProperty("success", true);
        json.addProperty("message", message);
        return json;
    }

    private static JsonObject error(String message) {
        JsonObject json = new JsonObject();
        json.addProperty("error", message);
        return json;
    }

    private static void methodNotAllowed(ChannelHandlerContext ctx, FullHttpRequest request) {
        respond(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, error("Method not allowed"));
    }

    private static void respond(ChannelHandlerContext ctx, FullHttpRequest request,
                                HttpResponseStatus status, JsonElement body) {
        byte[] bytes = body.toString().getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(
            request.protocolVersion(), status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        HttpUtil.setContentLength(response, bytes.length);

        boolean keepAlive = HttpUtil.isKeepAlive(request);
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        }
        ChannelFuture future = ctx.writeAndFlush(response);
        if (!keepAlive) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }
}
