package com.lunarview.server;

import com.lunarview.protocol.PeerRole;
import com.lunarview.testutil.RecordingConnection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RegistryTest {

    private final Registry registry = new Registry();

    private PeerSession peer(String clientId, String connectionId, PeerRole role) {
        return new PeerSession(connectionId, "hash", role, new RecordingConnection(clientId, "10.0.0.1"), null, 0);
    }

    @Test
    public void lookupByBothKeys() {
        PeerSession host = peer("c1", "123456789", PeerRole.HOST);
        assertNull(registry.put(host));

        assertSame(host, registry.byClientId("c1"));
        assertSame(host, registry.byConnectionId("123456789"));
        assertTrue(registry.isConnectionIdTaken("123456789"));
        assertNull(registry.byClientId(null));
        assertEquals(1, registry.size());
    }

    @Test
    public void putReportsDisplacedHolderOfConnectionId() {
        PeerSession stale = peer("c1", "123456789", PeerRole.HOST);
        PeerSession fresh = peer("c2", "123456789", PeerRole.HOST);
        registry.put(stale);

        assertSame(stale, registry.put(fresh));
        assertSame(fresh, registry.byConnectionId("123456789"));

        // removing the stale client must not release the id now held by the fresh one
        registry.remove("c1");
        assertSame(fresh, registry.byConnectionId("123456789"));
    }

    @Test
    public void linkIsSymmetric() {
        registry.put(peer("h", "111", PeerRole.HOST));
        registry.put(peer("v", "222", PeerRole.VIEWER));

        Session session = registry.link("v", "h", "s-1", 42);

        assertNotNull(session);
        assertEquals("h", registry.byClientId("v").connectedTo());
        assertEquals("v", registry.byClientId("h").connectedTo());
        assertEquals("s-1", registry.byClientId("h").sessionId());
        assertEquals("h", session.partnerOf("v"));
        assertSame(session, registry.session("s-1"));
        assertEquals(1, registry.sessionCount());
    }

    @Test
    public void linkRefusesBusySelfAndMissingPeers() {
        registry.put(peer("h", "111", PeerRole.HOST));
        registry.put(peer("v1", "222", PeerRole.VIEWER));
        registry.put(peer("v2", "333", PeerRole.VIEWER));
        assertNotNull(registry.link("v1", "h", "s-1", 0));

        assertNull(registry.link("v2", "h", "s-2", 0));
        assertNull(registry.link("v2", "v2", "s-3", 0));
        assertNull(registry.link("v2", "ghost", "s-4", 0));
        assertNull(registry.byClientId("v2").connectedTo());
    }

    @Test
    public void unlinkClearsBothSides() {
        registry.put(peer("h", "111", PeerRole.HOST));
        registry.put(peer("v", "222", PeerRole.VIEWER));
        registry.link("v", "h", "s-1", 0);

        PeerSession partner = registry.unlink("h");

        assertEquals("v", partner.clientId());
        assertNull(registry.byClientId("h").connectedTo());
        assertNull(registry.byClientId("v").connectedTo());
        assertNull(registry.session("s-1"));
        assertNull(registry.unlink("h"));
    }

    @Test
    public void removeUnlinksAndForgets() {
        registry.put(peer("h", "111", PeerRole.HOST));
        registry.put(peer("v", "222", PeerRole.VIEWER));
        registry.link("v", "h", "s-1", 0);

        Registry.Removal removal = registry.remove("v");

        assertEquals("v", removal.removed().clientId());
        assertEquals("h", removal.formerPartner().clientId());
        assertNull(registry.byConnectionId("222"));
        assertFalse(registry.isConnectionIdTaken("222"));
        assertNull(registry.byClientId("h").connectedTo());
        assertEquals(0, registry.sessionCount());
    }
}
