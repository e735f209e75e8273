package diagnostics;

import com.sun.net.httpserver.HttpServer;
import connection.ClientConfig;
import org.junit.Before;
import org.junit.Test;
import transport.FakeTransport;

import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class ConnectionDiagnosticsTest {

    private ClientConfig config;
    private Set<Integer> workingPorts;
    private Set<Integer> silentPorts;
    private Set<Integer> closingPorts;
    private boolean answerPings;
    private ConnectionDiagnostics diagnostics;

    @Before
    public void beforeEach() {
        workingPorts = ConcurrentHashMap.newKeySet();
        silentPorts = ConcurrentHashMap.newKeySet();
        closingPorts = ConcurrentHashMap.newKeySet();
        answerPings = true;
        config = new ClientConfig("http://game.local:5001");
        config.transportFactory = this::createTransport;
        diagnostics = new ConnectionDiagnostics(config, 1_000, 500, 5_000);
    }

    /*
        Plays a server per port: working ports complete the handshake, silent ports accept the socket
        but never answer, closing ports open a session and then close normally, every other port refuses.
     */
    private FakeTransport createTransport(String url) {
        int port = Integer.parseInt(url.replaceAll("^wss?://[^:/]+:(\\d+)/.*$", "$1"));
        boolean accepts = workingPorts.contains(port) || silentPorts.contains(port) || closingPorts.contains(port);
        return new FakeTransport(url, accepts) {
            @Override
            public void open() {
                super.open();
                if(workingPorts.contains(port))
                    serverSends("0{\"sid\":\"port-" + port + "\"}", "40");
                else if(closingPorts.contains(port)) {
                    serverSends("0{\"sid\":\"port-" + port + "\"}");
                    serverCloses(1000, "bye");
                }
                else if(!accepts)
                    fail(new ConnectException("Connection refused"));
            }

            @Override
            public boolean send(String text) {
                boolean sent = super.send(text);
                if(sent && answerPings && "2".equals(text))
                    serverSends("3");
                return sent;
            }
        };
    }

    @Test
    public void testConnectionSucceeds() throws Exception {
        workingPorts.add(5001);

        DiagnosticResult result = diagnostics.testConnection("http://game.local:5001").get(5, TimeUnit.SECONDS);

        assertTrue(result.isConnected());
        assertTrue(result.isPongReceived());
        assertTrue(result.getHandshakeLatencyMs() >= 0);
        assertNull(result.getError());
        assertTrue(result.getSummary().startsWith("Connected to http://game.local:5001"));
    }

    @Test
    public void testConnectionWithoutPong() throws Exception {
        workingPorts.add(5001);
        answerPings = false;

        DiagnosticResult result = diagnostics.testConnection("http://game.local:5001").get(5, TimeUnit.SECONDS);

        assertTrue(result.isConnected());
        assertFalse(result.isPongReceived());
    }

    @Test
    public void testConnectionRefused() throws Exception {
        DiagnosticResult result = diagnostics.testConnection("http://game.local:5001").get(5, TimeUnit.SECONDS);

        assertFalse(result.isConnected());
        assertEquals(-1, result.getHandshakeLatencyMs());
        assertEquals("Connection refused by game.local:5001. Is the server running on that port?", result.getError());
    }

    @Test
    public void testConnectionTimesOut() throws Exception {
        silentPorts.add(5001);

        DiagnosticResult result = diagnostics.testConnection("http://game.local:5001").get(5, TimeUnit.SECONDS);

        assertFalse(result.isConnected());
        assertTrue(result.getError().startsWith("Timed out waiting for server handshake"));
    }

    @Test
    public void testNormalCloseDuringHandshake() throws Exception {
        closingPorts.add(5001);

        DiagnosticResult result = diagnostics.testConnection("http://game.local:5001").get(5, TimeUnit.SECONDS);

        assertFalse(result.isConnected());
        assertEquals("Server closed the connection before completing the handshake.", result.getError());
    }

    @Test
    public void testInvalidUrl() throws Exception {
        DiagnosticResult result = diagnostics.testConnection("ftp://game.local").get(5, TimeUnit.SECONDS);

        assertFalse(result.isConnected());
        assertTrue(result.getError().startsWith("Invalid URL"));
    }

    @Test
    public void testProbesLeaveTemplateUntouched() throws Exception {
        workingPorts.add(5001);
        diagnostics.testConnection("http://game.local:5001").get(5, TimeUnit.SECONDS);

        assertTrue(config.reconnect);
        assertTrue(config.heartbeatEnabled);
        assertEquals("http://game.local:5001", config.baseUrl);
    }

    @Test
    public void testScanReportsSoleWinner() throws Exception {
        workingPorts.add(8080);
        silentPorts.add(3000);

        MultiPortResult result = diagnostics.scanPorts("game.local", Arrays.asList(5001, 5000, 8080, 3000))
                                            .get(5, TimeUnit.SECONDS);

        assertEquals(Integer.valueOf(8080), result.getWorkingPort());
        assertEquals("http://game.local:8080", result.getWorkingUrl());
        assertTrue(result.getAlsoReachable().isEmpty());
        assertEquals(3, result.getFailures().size());
        assertEquals(Arrays.asList(5001, 5000, 3000), Arrays.asList(result.getFailures().get(0).getPort(),
                                                                   result.getFailures().get(1).getPort(),
                                                                   result.getFailures().get(2).getPort()));
        assertTrue(result.getFailures().get(0).getError().startsWith("Connection refused by game.local:5001"));
        assertTrue(result.getFailures().get(2).getError().startsWith("Timed out waiting for server handshake"));
        assertTrue(result.getSummary().startsWith("Working port found on game.local: 8080"));
    }

    @Test
    public void testScanWithSeveralWorkingPortsHasOneWinner() throws Exception {
        workingPorts.add(5000);
        workingPorts.add(3000);

        MultiPortResult result = diagnostics.scanPorts("game.local", Arrays.asList(5000, 3000, 80, 5000))
                                            .get(5, TimeUnit.SECONDS);

        assertTrue(result.hasWorkingPort());
        assertEquals(1, result.getAlsoReachable().size());
        Set<Integer> reachable = new HashSet<>(result.getAlsoReachable());
        reachable.add(result.getWorkingPort());
        assertEquals(new HashSet<>(Arrays.asList(5000, 3000)), reachable);
        assertEquals(1, result.getFailures().size());
        assertEquals(80, result.getFailures().get(0).getPort());
    }

    @Test
    public void testScanWithoutWorkingPort() throws Exception {
        MultiPortResult result = diagnostics.scanPorts("game.local", Collections.singletonList(5001))
                                            .get(5, TimeUnit.SECONDS);

        assertFalse(result.hasWorkingPort());
        assertNull(result.getWorkingUrl());
        assertTrue(result.getSummary().startsWith("No working port found on game.local."));
    }

    @Test
    public void testFullDiagnostics() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
        try {
            int port = server.getAddress().getPort();
            workingPorts.add(port);

            DiagnosticReport report = diagnostics.runFullDiagnostics("127.0.0.1:" + port).get(10, TimeUnit.SECONDS);

            assertNull(report.getError());
            assertTrue(report.getHttpTest().isReachable());
            assertEquals(Integer.valueOf(404), report.getHttpTest().getStatusCode());
            assertTrue(report.getConnectionTest().isConnected());
            assertEquals(Integer.valueOf(port), report.getPortScan().getWorkingPort());
            assertEquals(ConnectionDiagnostics.COMMON_PORTS.size(), report.getPortScan().getFailures().size());

            String summary = report.getSummary();
            assertTrue(summary.startsWith("Network Diagnostics for 127.0.0.1:" + port));
            assertTrue(summary.contains("HTTP reachable"));
            assertTrue(summary.contains("Working port found on 127.0.0.1: " + port));
            assertEquals(1, report.getTraceRoute().getHopCount());
            assertTrue(summary.contains("Trace Route:\n  Trace complete: 1 hop(s), 127.0.0.1:" + port));
        } finally {
            server.stop(0);
        }
    }

    @Test
    public void testFullDiagnosticsWithInvalidUrl() throws Exception {
        DiagnosticReport report = diagnostics.runFullDiagnostics("http://").get(1, TimeUnit.SECONDS);

        assertTrue(report.getError().startsWith("Invalid server URL"));
        assertNull(report.getHttpTest());
        assertNull(report.getPortScan());
        assertTrue(report.getSummary().contains("Error: Invalid server URL"));
    }

    @Test
    public void testHttpUnreachable() throws Exception {
        HttpTestResult result = diagnostics.testHttp("http://127.0.0.1:1").get(10, TimeUnit.SECONDS);

        assertFalse(result.isReachable());
        assertNull(result.getStatusCode());
        assertNotNull(result.getError());
        assertTrue(result.getSummary().startsWith("HTTP not reachable"));
    }

    @Test
    public void testTraceRouteReachesListeningPort() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            int port = server.getLocalPort();

            TraceRouteResult result = diagnostics.traceRoute("http://127.0.0.1:" + port).get(5, TimeUnit.SECONDS);

            assertNull(result.getError());
            assertEquals("127.0.0.1", result.getHost());
            assertEquals(port, result.getPort());
            assertEquals(1, result.getHopCount());
            assertTrue(result.getLatencyMs() >= 0);
        }
    }

    @Test
    public void testTraceRouteToClosedPort() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }

        TraceRouteResult result = diagnostics.traceRoute("127.0.0.1:" + port).get(5, TimeUnit.SECONDS);

        assertEquals(0, result.getHopCount());
        assertTrue(result.getError().startsWith("Target host 127.0.0.1:" + port + " is not reachable"));
        assertTrue(result.getSummary().startsWith("Trace failed: "));
    }

    @Test
    public void testTraceRouteWithInvalidHost() throws Exception {
        TraceRouteResult result = diagnostics.traceRoute("http://").get(1, TimeUnit.SECONDS);

        assertEquals("Invalid host format: http://", result.getError());
        assertEquals(0, result.getHopCount());
    }
}
