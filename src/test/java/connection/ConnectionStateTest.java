package connection;

import org.junit.Test;

import static org.junit.Assert.*;

public class ConnectionStateTest {

    @Test
    public void testDisplayName() {
        assertEquals("Disconnected", ConnectionState.DISCONNECTED.getDisplayName());
        assertEquals("Connecting...", ConnectionState.CONNECTING.getDisplayName());
        assertEquals("Connected", ConnectionState.CONNECTED.getDisplayName());
        assertEquals("Error: Host unreachable.", ConnectionState.error("Host unreachable.").getDisplayName());
    }

    @Test
    public void testErrorNeedsMessage() {
        assertEquals("Unknown error.", ConnectionState.error(null).getErrorMessage());
        assertEquals("Unknown error.", ConnectionState.error("").getErrorMessage());
        assertNull(ConnectionState.CONNECTED.getErrorMessage());
    }

    @Test
    public void testEquals() {
        assertEquals(ConnectionState.error("a"), ConnectionState.error("a"));
        assertNotEquals(ConnectionState.error("a"), ConnectionState.error("b"));
        assertNotEquals(ConnectionState.error("a"), ConnectionState.DISCONNECTED);
        assertTrue(ConnectionState.error("a").is(ConnectionState.Status.ERROR));
    }
}
