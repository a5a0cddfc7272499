package com.lunarview.server;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lunarview.crypto.PasswordHasher;
import com.lunarview.protocol.CloseCodes;
import com.lunarview.protocol.MessageCodec;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.SignalMessage;
import com.lunarview.testutil.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class SignalingServiceTest {

    private static final String HOST_ID = "123456789";
    private static final String HOST_PASSWORD = "AB12";
    private static final String VIEWER_ID = "555000111";

    private final AtomicLong now = new AtomicLong(1_700_000_000_000L);
    private SignalingService service;
    private int nextClient;

    @BeforeEach
    public void setUp() {
        service = newService(new Properties());
    }

    private SignalingService newService(Properties props) {
        return new SignalingService(new RelayServerConfig(props), new PasswordHasher(1_000), now::get);
    }

    private RecordingConnection open(String ip) {
        RecordingConnection connection = new RecordingConnection("client-" + (++nextClient), ip);
        service.onOpen(connection);
        return connection;
    }

    private void send(RecordingConnection connection, SignalMessage message) {
        service.onMessage(connection, MessageCodec.encode(message));
    }

    private RecordingConnection registered(String connectionId, String password, boolean host, String ip) {
        RecordingConnection connection = open(ip);
        send(connection, SignalMessage.of(MessageType.REGISTER)
            .with("connectionId", connectionId)
            .with("password", password)
            .with("isHost", host));
        assertEquals(MessageType.REGISTERED, connection.last().type());
        connection.clear();
        return connection;
    }

    private void connect(RecordingConnection viewer, String target, String password) {
        send(viewer, SignalMessage.of(MessageType.CONNECT)
            .with("targetConnectionId", target)
            .with("password", password));
    }

    private RecordingConnection[] linkedPair() {
        RecordingConnection host = registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");
        RecordingConnection viewer = registered(VIEWER_ID, "", false, "10.0.0.2");
        connect(viewer, HOST_ID, HOST_PASSWORD);
        assertEquals(MessageType.CONNECT_SUCCESS, viewer.last().type());
        host.clear();
        viewer.clear();
        return new RecordingConnection[] {host, viewer};
    }

    // ===============================
    // Session brokering
    // ===============================

    @Test
    @DisplayName("viewer with the right password is linked to the host and payload flows verbatim")
    public void fullSessionScenario() {
        RecordingConnection host = registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");
        RecordingConnection viewer = registered(VIEWER_ID, "", false, "10.0.0.2");

        connect(viewer, HOST_ID, HOST_PASSWORD);

        SignalMessage success = viewer.last();
        assertEquals(MessageType.CONNECT_SUCCESS, success.type());
        assertEquals(HOST_ID, success.getString("targetConnectionId"));
        SignalMessage incoming = host.last();
        assertEquals(MessageType.INCOMING_CONNECTION, incoming.type());
        assertEquals(VIEWER_ID, incoming.getString("fromConnectionId"));
        assertEquals(success.getString("sessionId"), incoming.getString("sessionId"));

        host.clear();
        String mouse = "{\"type\":\"mouse-event\",\"event\":{\"x\":100,\"y\":200,\"action\":\"move\"}}";
        service.onMessage(viewer, mouse);
        assertEquals(List.of(mouse), host.sentText());

        viewer.clear();
        service.onClose(host);
        service.onClose(host);

        List<SignalMessage> notices = viewer.messagesOfType(MessageType.DISCONNECTED);
        assertEquals(1, notices.size());
        assertEquals("Partner disconnected", notices.get(0).getString("reason"));
        assertNull(service.registry().byClientId(viewer.id()).connectedTo());
    }

    @Test
    public void registerRepliesWithConnectionId() {
        RecordingConnection connection = open("10.0.0.1");
        send(connection, SignalMessage.of(MessageType.REGISTER)
            .with("connectionId", " 42 ")
            .with("password", "pw")
            .with("isHost", true));

        SignalMessage reply = connection.last();
        assertEquals(MessageType.REGISTERED, reply.type());
        assertEquals("42", reply.getString("connectionId"));
        assertTrue(service.registry().isConnectionIdTaken("42"));
    }

    @Test
    public void passwordIsStoredHashedNotPlain() {
        registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");

        PeerSession host = service.registry().byConnectionId(HOST_ID);
        assertNotEquals(HOST_PASSWORD, host.passwordHash());
        assertEquals(new PasswordHasher(1_000).hash(HOST_PASSWORD, HOST_ID), host.passwordHash());
    }

    @Test
    public void publicKeysAreExchangedOnConnect() {
        RecordingConnection host = open("10.0.0.1");
        send(host, SignalMessage.of(MessageType.REGISTER).with("connectionId", HOST_ID)
            .with("password", HOST_PASSWORD).with("isHost", true).with("publicKey", "HOST-KEY"));
        RecordingConnection viewer = open("10.0.0.2");
        send(viewer, SignalMessage.of(MessageType.REGISTER).with("connectionId", VIEWER_ID)
            .with("password", "").with("isHost", false).with("publicKey", "VIEWER-KEY"));

        connect(viewer, HOST_ID, HOST_PASSWORD);

        assertEquals("HOST-KEY", viewer.last().getString("targetPublicKey"));
        assertEquals("VIEWER-KEY", host.last().getString("fromPublicKey"));
    }

    @Test
    public void unknownTargetIsNotFound() {
        RecordingConnection viewer = registered(VIEWER_ID, "", false, "10.0.0.2");

        connect(viewer, "000000000", "x");

        SignalMessage reply = viewer.last();
        assertEquals(MessageType.CONNECT_ERROR, reply.type());
        assertEquals("Connection ID not found", reply.getString("error"));
    }

    @Test
    public void wrongPasswordIsRejectedAndCounted() {
        registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");
        RecordingConnection viewer = registered(VIEWER_ID, "", false, "10.0.0.2");

        connect(viewer, HOST_ID, "WRONG");

        assertEquals("Invalid password", viewer.last().getString("error"));
        assertEquals(1, service.lockout().failureCount("10.0.0.2"));
        assertNull(service.registry().byClientId(viewer.id()).connectedTo());
    }

    @Test
    @DisplayName("five wrong passwords lock the IP out; the sixth attempt and new sockets are refused")
    public void lockoutAfterFiveFailures() {
        registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");
        RecordingConnection viewer = registered(VIEWER_ID, "", false, "10.9.9.9");

        for (int i = 0; i < 5; i++) {
            connect(viewer, HOST_ID, "WRONG-" + i);
            assertEquals("Invalid password", viewer.last().getString("error"));
        }

        connect(viewer, HOST_ID, HOST_PASSWORD);
        assertEquals("Too many failed attempts. Try again later.", viewer.last().getString("error"));
        assertEquals(0, service.registry().sessionCount());

        RecordingConnection retry = new RecordingConnection("late", "10.9.9.9");
        assertFalse(service.onOpen(retry));
        assertEquals(CloseCodes.IP_BLOCKED, retry.closeCode());

        now.addAndGet(15 * 60 * 1000L);
        assertTrue(service.onOpen(new RecordingConnection("later", "10.9.9.9")));
    }

    @Test
    public void connectingToYourselfIsRefused() {
        RecordingConnection host = registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");

        connect(host, HOST_ID, HOST_PASSWORD);

        assertEquals("Cannot connect to yourself", host.last().getString("error"));
    }

    @Test
    public void busyHostRefusesSecondViewer() {
        linkedPair();
        RecordingConnection second = registered("777", "", false, "10.0.0.3");

        connect(second, HOST_ID, HOST_PASSWORD);

        assertEquals("Target is busy", second.last().getString("error"));
    }

    @Test
    public void connectBeforeRegisterIsRefused() {
        registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");
        RecordingConnection stranger = open("10.0.0.5");

        connect(stranger, HOST_ID, HOST_PASSWORD);

        assertEquals("Not registered", stranger.last().getString("error"));
    }

    @Test
    public void explicitDisconnectNotifiesPartnerOnce() {
        RecordingConnection[] pair = linkedPair();

        send(pair[1], SignalMessage.of(MessageType.DISCONNECT));
        send(pair[1], SignalMessage.of(MessageType.DISCONNECT));

        assertEquals(1, pair[0].messagesOfType(MessageType.DISCONNECTED).size());
        // both stay registered and can link again
        assertNotNull(service.registry().byConnectionId(HOST_ID));
        connect(pair[1], HOST_ID, HOST_PASSWORD);
        assertEquals(MessageType.CONNECT_SUCCESS, pair[1].last().type());
    }

    // ===============================
    // Relay
    // ===============================

    @Test
    public void relayIsRewrappedAsRelayed() {
        RecordingConnection[] pair = linkedPair();

        service.onMessage(pair[1], "{\"type\":\"relay\",\"data\":{\"kind\":\"chat\",\"text\":\"hi\"}}");

        SignalMessage delivered = pair[0].last();
        assertEquals(MessageType.RELAYED, delivered.type());
        assertEquals("hi", delivered.getObject("data").get("text").getAsString());
    }

    @Test
    public void screenFrameKeepsOnlyTheFrame() {
        RecordingConnection[] pair = linkedPair();

        service.onMessage(pair[0], "{\"type\":\"screen-frame\",\"frame\":\"AAAA\",\"extra\":1}");

        SignalMessage delivered = pair[1].last();
        assertEquals(MessageType.SCREEN_FRAME, delivered.type());
        assertEquals("AAAA", delivered.getString("frame"));
        assertFalse(delivered.has("extra"));
    }

    @Test
    public void negotiationAndFileMessagesAreForwardedVerbatim() {
        RecordingConnection[] pair = linkedPair();
        String offer = "{\"type\":\"offer\",\"offer\":{\"type\":\"offer\",\"sdp\":\"v=0\"}}";
        String chunk = "{\"type\":\"file-chunk-ack\",\"fileId\":\"f\",\"chunkIndex\":3}";

        service.onMessage(pair[1], offer);
        service.onMessage(pair[0], chunk);

        assertEquals(List.of(offer), pair[0].sentText());
        assertEquals(List.of(chunk), pair[1].sentText());
    }

    @Test
    public void relayFromUnlinkedPeerIsDroppedSilently() {
        RecordingConnection host = registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");
        RecordingConnection viewer = registered(VIEWER_ID, "", false, "10.0.0.2");

        service.onMessage(viewer, "{\"type\":\"mouse-event\",\"event\":{}}");

        assertTrue(viewer.sentText().isEmpty());
        assertTrue(host.sentText().isEmpty());
    }

    // ===============================
    // Protocol hygiene
    // ===============================

    @Test
    public void pingIsAnsweredWithPong() {
        RecordingConnection connection = open("10.0.0.1");
        send(connection, SignalMessage.of(MessageType.PING));
        assertEquals(MessageType.PONG, connection.last().type());
    }

    @Test
    public void malformedFrameGetsErrorAndConnectionSurvives() {
        RecordingConnection connection = open("10.0.0.1");

        service.onMessage(connection, "{oops");
        assertEquals(MessageType.ERROR, connection.last().type());

        service.onMessage(connection, "{\"type\":\"warp\"}");
        assertEquals("Unknown message type: warp", connection.last().getString("error"));

        assertTrue(connection.isOpen());
        send(connection, SignalMessage.of(MessageType.PING));
        assertEquals(MessageType.PONG, connection.last().type());
    }

    @Test
    public void serverOnlyKindsFromClientsAreRejected() {
        RecordingConnection connection = open("10.0.0.1");
        service.onMessage(connection, "{\"type\":\"registered\",\"connectionId\":\"1\"}");

        SignalMessage reply = connection.last();
        assertEquals(MessageType.ERROR, reply.type());
        assertTrue(reply.getString("error").startsWith("Unexpected message type"));
    }

    // ===============================
    // Duplicate registration
    // ===============================

    @Test
    public void duplicateRegistrationEvictsStaleHolder() {
        RecordingConnection[] pair = linkedPair();
        RecordingConnection fresh = registered(HOST_ID, "NEW1", true, "10.0.0.7");

        assertEquals(CloseCodes.REPLACED, pair[0].closeCode());
        assertEquals(1, pair[1].messagesOfType(MessageType.DISCONNECTED).size());
        assertSame(fresh.id(), service.registry().byConnectionId(HOST_ID).clientId());

        // closing the stale socket later must not disturb the new holder
        service.onClose(pair[0]);
        assertSame(fresh.id(), service.registry().byConnectionId(HOST_ID).clientId());
        assertEquals(1, pair[1].messagesOfType(MessageType.DISCONNECTED).size());
    }

    @Test
    public void duplicateRegistrationCanBeRejected() {
        Properties props = new Properties();
        props.setProperty("registration.duplicatePolicy", "reject");
        service = newService(props);
        RecordingConnection first = registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");

        RecordingConnection second = open("10.0.0.2");
        send(second, SignalMessage.of(MessageType.REGISTER)
            .with("connectionId", HOST_ID).with("password", "x").with("isHost", true));

        assertEquals("Connection ID already in use", second.last().getString("error"));
        assertTrue(first.isOpen());
        assertSame(first.id(), service.registry().byConnectionId(HOST_ID).clientId());
    }

    // ===============================
    // Maintenance and admin
    // ===============================

    @Test
    public void idleSessionsAreSweptWithTimeoutCode() {
        RecordingConnection[] pair = linkedPair();
        now.addAndGet(10 * 60 * 1000L);
        service.onMessage(pair[1], MessageCodec.encode(SignalMessage.of(MessageType.PING)));
        now.addAndGet(25 * 60 * 1000L);

        assertEquals(1, service.sweepIdleSessions());

        assertEquals(CloseCodes.SESSION_TIMEOUT, pair[0].closeCode());
        assertTrue(pair[1].isOpen());
        assertEquals("Session timeout", pair[1].last().getString("reason"));
        assertNull(service.registry().byConnectionId(HOST_ID));
        assertNotNull(service.registry().byConnectionId(VIEWER_ID));
    }

    @Test
    public void sweepForgetsExpiredFailureRecords() {
        service.lockout().recordFailure("10.9.9.1");
        service.lockout().recordFailure("10.9.9.2");
        now.addAndGet(10 * 60 * 1000L);
        service.lockout().recordFailure("10.9.9.3");
        now.addAndGet(5 * 60 * 1000L);

        service.sweepIdleSessions();

        assertEquals(1, service.lockout().trackedIps());
        assertEquals(1, service.lockout().failureCount("10.9.9.3"));
        assertEquals(0, service.lockout().failureCount("10.9.9.1"));
    }

    @Test
    public void adminDisconnectClosesWith4001() {
        RecordingConnection[] pair = linkedPair();

        assertTrue(service.forceDisconnect(HOST_ID, "127.0.0.1"));
        assertFalse(service.forceDisconnect("nobody", "127.0.0.1"));

        assertEquals(CloseCodes.ADMIN_DISCONNECT, pair[0].closeCode());
        assertEquals(1, pair[1].messagesOfType(MessageType.DISCONNECTED).size());
    }

    @Test
    public void healthAndClientListing() {
        linkedPair();

        JsonObject health = service.health();
        assertEquals("ok", health.get("status").getAsString());
        assertEquals(2, health.get("clients").getAsInt());
        assertEquals(1, health.get("sessions").getAsInt());

        JsonArray clients = service.listClients();
        assertEquals(2, clients.size());
        for (int i = 0; i < clients.size(); i++) {
            JsonObject client = clients.get(i).getAsJsonObject();
            assertTrue(client.has("connectedTo"));
            assertFalse(client.has("password"));
        }
    }

    @Test
    public void accessLogRecordsEventsNewestFirst() {
        registered(HOST_ID, HOST_PASSWORD, true, "10.0.0.1");
        RecordingConnection viewer = registered(VIEWER_ID, "", false, "10.0.0.2");
        connect(viewer, HOST_ID, "WRONG");

        JsonArray logs = service.accessLogs(10);
        JsonObject newest = logs.get(0).getAsJsonObject();
        assertEquals("connect_attempt", newest.get("event").getAsString());
        assertFalse(newest.get("success").getAsBoolean());
        assertEquals("10.0.0.2", newest.get("ip").getAsString());
        assertEquals(3, service.accessLog().size());
    }

    @Test
    public void adminBlockAndUnblock() {
        service.blockIp("10.6.6.6", "127.0.0.1");
        assertFalse(service.onOpen(new RecordingConnection("x", "10.6.6.6")));

        service.unblockIp("10.6.6.6", "127.0.0.1");
        assertTrue(service.onOpen(new RecordingConnection("y", "10.6.6.6")));
    }
}
