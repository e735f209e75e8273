package connection;

import exceptions.SyncClientException;
import org.junit.Test;
import transport.FakeTransport;
import transport.Transport;
import transport.TransportFactory;
import transport.WebSocketTransport;

import java.util.ArrayList;

import static org.junit.Assert.*;

public class ClientConfigTest {

    @Test
    public void testDefaults() {
        ClientConfig config = new ClientConfig();

        assertEquals("http://localhost:5000", config.baseUrl);
        assertEquals("/socket.io/?EIO=4&transport=websocket", config.handshakePath);
        assertEquals(30_000, config.handshakeTimeoutMs);
        assertEquals(5_000, config.reconnectDelayMs);
        assertEquals(60_000, config.heartbeatCheckIntervalMs);
        assertEquals(3, config.heartbeatFailureThreshold);
        assertEquals(10_000, config.healthPollIntervalMs);
        assertTrue(config.reconnect);
        assertNull(config.deviceUuid);
    }

    @Test
    public void testConfigClone() {
        ClientConfig conf = new ClientConfig("http://a.com");
        ClientConfig cpyConf = conf.clone();

        // Override for conf only.
        conf.baseUrl = "http://b.com";
        conf.headerMap.put("which", "original");

        assertEquals("http://a.com", cpyConf.baseUrl);
        assertNotEquals(conf.headerMap, cpyConf.headerMap);
        // Clones share the OkHttp client.
        assertSame(conf.okHttpClient(), conf.clone().okHttpClient());
    }

    @Test
    public void testValidate() {
        ClientConfig config = new ClientConfig();
        config.validate();

        config.baseUrl = " ";
        assertThrows(SyncClientException.class, config::validate);

        config = new ClientConfig();
        config.reconnectDelayMs = -1;
        assertThrows(SyncClientException.class, config::validate);

        config = new ClientConfig();
        config.handshakeTimeoutMs = 0;
        assertThrows(SyncClientException.class, config::validate);

        config = new ClientConfig();
        config.heartbeatFailureThreshold = 0;
        assertThrows(SyncClientException.class, config::validate);
        config.heartbeatEnabled = false;
        config.validate();
    }

    @Test
    public void testTransportFactory() {
        ClientConfig config = new ClientConfig();
        assertTrue(config.transportFactory().create("ws://a.com") instanceof WebSocketTransport);

        TransportFactory fake = FakeTransport.factory(new ArrayList<>());
        config.transportFactory = fake;
        Transport transport = config.transportFactory().create("ws://a.com");
        assertTrue(transport instanceof FakeTransport);
        assertEquals("ws://a.com", transport.getUrl());
    }
}
