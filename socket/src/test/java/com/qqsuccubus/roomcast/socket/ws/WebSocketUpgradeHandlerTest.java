package com.qqsuccubus.roomcast.socket.ws;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class WebSocketUpgradeHandlerTest {

    @Test
    void testExtractToken_fromQuery() {
        assertEquals("abc.def", WebSocketUpgradeHandler.extractToken("/ws?token=abc.def"));
        assertEquals("first", WebSocketUpgradeHandler.extractToken("/ws?token=first&token=second"));
        assertEquals("a b", WebSocketUpgradeHandler.extractToken("/ws?other=1&token=a%20b"));
    }

    @Test
    void testExtractToken_absentOrBlank() {
        assertNull(WebSocketUpgradeHandler.extractToken("/ws"));
        assertNull(WebSocketUpgradeHandler.extractToken("/ws?token="));
        assertNull(WebSocketUpgradeHandler.extractToken("/ws?token=%20%20"));
    }
}
