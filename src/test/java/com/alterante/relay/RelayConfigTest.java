package com.alterante.relay;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelayConfigTest {

    @Test
    void parsesServerAddress() {
        RelayConfig.Server s = RelayConfig.Server.parse("render.local:8443", "tok", "s1");

        assertEquals("render.local", s.host());
        assertEquals(8443, s.port());
        assertEquals("tok", s.token());
        assertEquals("s1", s.sessionId());
    }

    @Test
    void rejectsMalformedAddress() {
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.Server.parse("render.local", "t", null));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.Server.parse("render.local:", "t", null));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.Server.parse(":80", "t", null));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.Server.parse("host:http", "t", null));
    }

    @Test
    void rejectsNegativeRetries() {
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.defaults().withRetries(-1, 10));
    }

    @Test
    void defaultsHaveNoServer() {
        RelayConfig c = RelayConfig.defaults();

        assertNull(c.server());
        assertEquals(3, c.maxRetries());
        assertEquals("h", c.withServer(new RelayConfig.Server("h", 1, "t", null)).server().host());
    }
}
