package com.lunarview.server;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.lunarview.crypto.PasswordHasher;
import com.lunarview.protocol.CloseCodes;
import com.lunarview.protocol.MessageCodec;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.SignalMessage;
import com.lunarview.testutil.RecordingConnection;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class AdminHttpHandlerTest {

    private static final String KEY = "test-admin-key";

    private SignalingService service;
    private EmbeddedChannel channel;

    @BeforeEach
    public void setUp() {
        Properties props = new Properties();
        props.setProperty("admin.apiKey", KEY);
        service = new SignalingService(new RelayServerConfig(props), new PasswordHasher(1_000), () -> 5_000L);
        channel = new EmbeddedChannel(new AdminHttpHandler(service));
    }

    @AfterEach
    public void tearDown() {
        channel.finishAndReleaseAll();
    }

    private FullHttpRequest request(HttpMethod method, String uri, String body) {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri,
            Unpooled.copiedBuffer(body == null ? "" : body, StandardCharsets.UTF_8));
        request.headers().set("Content-Type", "application/json");
        return request;
    }

    private FullHttpRequest authorized(HttpMethod method, String uri, String body) {
        FullHttpRequest request = request(method, uri, body);
        request.headers().set(AdminHttpHandler.API_KEY_HEADER, KEY);
        return request;
    }

    private Reply exchange(FullHttpRequest request) {
        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "no response written");
        try {
            String text = response.content().toString(StandardCharsets.UTF_8);
            return new Reply(response.status(), JsonParser.parseString(text));
        } finally {
            response.release();
        }
    }

    private static final class Reply {
        final HttpResponseStatus status;
        final JsonElement body;

        Reply(HttpResponseStatus status, JsonElement body) {
            this.status = status;
            this.body = body;
        }
    }

    private RecordingConnection register(String connectionId) {
        RecordingConnection connection = new RecordingConnection("c-" + connectionId, "10.0.0.1");
        service.onOpen(connection);
        service.onMessage(connection, MessageCodec.encode(SignalMessage.of(MessageType.REGISTER)
            .with("connectionId", connectionId).with("password", "pw").with("isHost", true)));
        return connection;
    }

    @Test
    public void healthNeedsNoKey() {
        register("111");

        Reply reply = exchange(request(HttpMethod.GET, "/health", null));

        assertEquals(HttpResponseStatus.OK, reply.status);
        assertEquals("ok", reply.body.getAsJsonObject().get("status").getAsString());
        assertEquals(1, reply.body.getAsJsonObject().get("clients").getAsInt());
        assertEquals(5_000L, reply.body.getAsJsonObject().get("timestamp").getAsLong());
    }

    @Test
    public void adminRoutesRequireKey() {
        Reply reply = exchange(request(HttpMethod.GET, "/admin/clients", null));

        assertEquals(HttpResponseStatus.UNAUTHORIZED, reply.status);
        assertEquals("admin_auth_failed", service.accessLog().latest(1).get(0).event());
    }

    @Test
    public void keyMayComeFromQuery() {
        register("111");

        Reply reply = exchange(request(HttpMethod.GET, "/admin/clients?apiKey=" + KEY, null));

        assertEquals(HttpResponseStatus.OK, reply.status);
        assertEquals("111", reply.body.getAsJsonArray().get(0).getAsJsonObject().get("connectionId").getAsString());
    }

    @Test
    public void logsAreReturnedNewestFirst() {
        register("111");
        register("222");

        Reply reply = exchange(authorized(HttpMethod.GET, "/admin/logs", null));

        assertEquals(HttpResponseStatus.OK, reply.status);
        assertEquals("222", reply.body.getAsJsonArray().get(0).getAsJsonObject().get("connectionId").getAsString());
    }

    @Test
    public void blockAndUnblockIp() {
        Reply blocked = exchange(authorized(HttpMethod.POST, "/admin/block-ip", "{\"ip\":\"10.6.6.6\"}"));
        assertEquals(HttpResponseStatus.OK, blocked.status);
        assertTrue(service.lockout().isBlocked("10.6.6.6"));

        Reply unblocked = exchange(authorized(HttpMethod.DELETE, "/admin/block-ip", "{\"ip\":\"10.6.6.6\"}"));
        assertEquals(HttpResponseStatus.OK, unblocked.status);
        assertFalse(service.lockout().isBlocked("10.6.6.6"));
    }

    @Test
    public void blockIpNeedsAnAddress() {
        Reply reply = exchange(authorized(HttpMethod.POST, "/admin/block-ip", "{}"));
        assertEquals(HttpResponseStatus.BAD_REQUEST, reply.status);
    }

    @Test
    public void disconnectClosesTheClient() {
        RecordingConnection client = register("111");

        Reply reply = exchange(authorized(HttpMethod.POST, "/admin/disconnect", "{\"connectionId\":\"111\"}"));

        assertEquals(HttpResponseStatus.OK, reply.status);
        assertEquals(CloseCodes.ADMIN_DISCONNECT, client.closeCode());
        assertNull(service.registry().byConnectionId("111"));
    }

    @Test
    public void disconnectUnknownClientIs404() {
        Reply reply = exchange(authorized(HttpMethod.POST, "/admin/disconnect", "{\"connectionId\":\"nope\"}"));
        assertEquals(HttpResponseStatus.NOT_FOUND, reply.status);
    }

    @Test
    public void wrongMethodIs405() {
        Reply reply = exchange(authorized(HttpMethod.POST, "/admin/clients", null));
        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, reply.status);
    }

    @Test
    public void otherRequestsPassThrough() {
        FullHttpRequest upgrade = request(HttpMethod.GET, "/", null);

        channel.writeInbound(upgrade);

        FullHttpRequest forwarded = channel.readInbound();
        assertNotNull(forwarded);
        assertEquals("/", forwarded.uri());
        assertNull(channel.readOutbound());
        forwarded.release();
    }
}
