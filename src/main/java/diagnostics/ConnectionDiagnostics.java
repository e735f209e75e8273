package diagnostics;

import common.Utils;
import common.Worker;
import connection.ClientConfig;
import exceptions.SyncClientException;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URL;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Probes the reachability of a game server without touching the primary connection.
 * Every probe opens its own throwaway connection (see {@link Probe}), so diagnostics can run at any time,
 *  concurrently with each other and with the live client.
 * <p>
 * All operations are asynchronous and report failures in their result values, never as exceptions.
 */
public class ConnectionDiagnostics {

    public static final long CONNECTION_TEST_TIMEOUT_MS = 5_000;
    public static final long PORT_SCAN_TIMEOUT_MS = 3_000;
    public static final long HTTP_TEST_TIMEOUT_MS = 10_000;
    // Ports game servers are commonly run on, in the order they are tried.
    public static final List<Integer> COMMON_PORTS = Collections.unmodifiableList(Arrays.asList(5001, 5000, 8080, 3000, 8000, 80, 443));

    private final Logger logger = LoggerFactory.getLogger(ConnectionDiagnostics.class);

    private final ClientConfig template;
    private final long connectionTimeoutMs;
    private final long portTimeoutMs;
    private final long httpTimeoutMs;

    /**
     * @param template Configuration of the live client. Probes copy its transport settings, it is never modified.
     */
    public ConnectionDiagnostics(ClientConfig template) {
        this(template, CONNECTION_TEST_TIMEOUT_MS, PORT_SCAN_TIMEOUT_MS, HTTP_TEST_TIMEOUT_MS);
    }

    public ConnectionDiagnostics(ClientConfig template, long connectionTimeoutMs, long portTimeoutMs, long httpTimeoutMs) {
        this.template = template == null ? new ClientConfig() : template;
        this.connectionTimeoutMs = connectionTimeoutMs;
        this.portTimeoutMs = portTimeoutMs;
        this.httpTimeoutMs = httpTimeoutMs;
    }

    /**
     * Open one connection to the server, run it through the handshake and check that a ping is answered.
     *
     * @param baseUrl HTTP(S) address of the server.
     */
    public CompletableFuture<DiagnosticResult> testConnection(String baseUrl) {
        logger.info("Testing connection to {}", baseUrl);
        return new Probe(template, baseUrl, connectionTimeoutMs, true).run();
    }

    /**
     * @see #scanPorts(String, String, List)
     */
    public CompletableFuture<MultiPortResult> scanPorts(String host, List<Integer> ports) {
        return scanPorts("http", host, ports);
    }

    /**
     * Try all the given ports of a host at the same time.
     * The first port that completes the handshake is the working one, every other port is reported
     *  either as a failure with its own cause or as also reachable.
     *
     * @param scheme "http" or "https".
     * @param host Host name or IP address.
     * @param ports Candidate ports. Duplicates are ignored.
     */
    public CompletableFuture<MultiPortResult> scanPorts(String scheme, String host, List<Integer> ports) {
        Set<Integer> candidates = new LinkedHashSet<>(ports);
        logger.info("Scanning ports {} of {}", candidates, host);

        AtomicReference<Integer> winner = new AtomicReference<>();
        List<Integer> order = new ArrayList<>(candidates);
        List<CompletableFuture<DiagnosticResult>> probes = new ArrayList<>();
        for(Integer port : order) {
            String url = baseUrl(scheme, host, port);
            probes.add(new Probe(template, url, portTimeoutMs, false).run()
                    .thenApply(outcome -> {
                        if(outcome.isConnected() && winner.compareAndSet(null, port))
                            logger.info("Port {} of {} completed the handshake first.", port, host);
                        return outcome;
                    }));
        }

        return CompletableFuture.allOf(probes.toArray(new CompletableFuture[0])).thenApply(v -> {
            List<PortFailure> failures = new ArrayList<>();
            List<Integer> alsoReachable = new ArrayList<>();
            Integer workingPort = winner.get();
            for(int i = 0; i < order.size(); i++) {
                int port = order.get(i);
                DiagnosticResult outcome = probes.get(i).join();
                if(!outcome.isConnected())
                    failures.add(new PortFailure(port, outcome.getError()));
                else if(workingPort == null || port != workingPort)
                    alsoReachable.add(port);
            }
            String workingUrl = workingPort == null ? null : baseUrl(scheme, host, workingPort);
            return new MultiPortResult(host, workingPort, workingUrl, failures, alsoReachable);
        });
    }

    /**
     * GET the given URL. Any HTTP response counts as reachable.
     */
    public CompletableFuture<HttpTestResult> testHttp(String url) {
        CompletableFuture<HttpTestResult> future = new CompletableFuture<>();
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            future.complete(new HttpTestResult(url, false, null, -1, "Invalid URL: " + url));
            return future;
        }

        OkHttpClient client = template.okHttpClient().newBuilder()
                .callTimeout(httpTimeoutMs, TimeUnit.MILLISECONDS)
                .build();
        long startedAt = System.nanoTime();
        client.newCall(request).enqueue(new okhttp3.Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                long latency = (System.nanoTime() - startedAt) / 1_000_000;
                String error = Utils.describeTransportFailure(Utils.hostAndPort(url), e, e.getMessage());
                logger.debug("HTTP test of {} failed: {}", url, error);
                future.complete(new HttpTestResult(url, false, null, latency, error));
            }

            @Override
            public void onResponse(Call call, Response response) {
                long latency = (System.nanoTime() - startedAt) / 1_000_000;
                response.close();
                future.complete(new HttpTestResult(url, true, response.code(), latency, null));
            }
        });
        return future;
    }

    /**
     * Check that a TCP connection to the target can be opened, and how long that takes.
     *
     * @param target "host", "host:port" or a URL. The port defaults to the scheme's, or 80.
     */
    public CompletableFuture<TraceRouteResult> traceRoute(String target) {
        URL url;
        try {
            url = Utils.parseUrl(Utils.normalizeServerUrl(target));
        } catch (SyncClientException e) {
            return CompletableFuture.completedFuture(TraceRouteResult.failed(target, "Invalid host format: " + target));
        }

        String host = url.getHost();
        int port = Utils.portOf(url);
        CompletableFuture<TraceRouteResult> future = new CompletableFuture<>();
        Worker worker = new Worker("TraceRoute-" + host);
        worker.execute(() -> {
            try {
                future.complete(connectOnce(target, host, port));
            } finally {
                worker.shutdown();
            }
        });
        return future;
    }

    private TraceRouteResult connectOnce(String target, String host, int port) {
        long startedAt = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) portTimeoutMs);
            long latency = (System.nanoTime() - startedAt) / 1_000_000;
            logger.debug("Trace of {} reached {}:{} in {} ms", target, host, port, latency);
            return new TraceRouteResult(target, host, port, latency, null);
        } catch (IOException | IllegalArgumentException e) {
            String error = "Target host " + host + ":" + port + " is not reachable: "
                    + Utils.describeTransportFailure(host + ":" + port, e, e.getMessage());
            logger.debug("Trace of {} failed: {}", target, error);
            return TraceRouteResult.failed(target, error);
        }
    }

    /**
     * Run the HTTP test, the connection test, a scan of the common ports and a trace against a server,
     *  one after the other.
     *
     * @param serverUrl Address of the server. "http://" is assumed if it has no scheme.
     * @return Future of the report, which carries only an error if the address isn't a valid URL.
     */
    public CompletableFuture<DiagnosticReport> runFullDiagnostics(String serverUrl) {
        DiagnosticReport report = new DiagnosticReport(serverUrl);
        String normalized = Utils.normalizeServerUrl(serverUrl);
        URL url;
        try {
            url = Utils.parseUrl(normalized);
        } catch (SyncClientException e) {
            report.setError(e.getMessage());
            return CompletableFuture.completedFuture(report);
        }

        String scheme = url.getProtocol();
        String host = url.getHost();
        int port = Utils.portOf(url);
        List<Integer> ports = new ArrayList<>();
        ports.add(port);
        for(Integer commonPort : COMMON_PORTS)
            if(commonPort != port)
                ports.add(commonPort);

        logger.info("Running diagnostics for {}:{}", host, port);
        return testHttp(normalized)
                .thenCompose(httpTest -> {
                    report.setHttpTest(httpTest);
                    return testConnection(baseUrl(scheme, host, port));
                })
                .thenCompose(connectionTest -> {
                    report.setConnectionTest(connectionTest);
                    return scanPorts(scheme, host, ports);
                })
                .thenCompose(portScan -> {
                    report.setPortScan(portScan);
                    return traceRoute(normalized);
                })
                .thenApply(trace -> {
                    report.setTraceRoute(trace);
                    logger.info("Diagnostics for {} complete.", serverUrl);
                    return report;
                });
    }

    private static String baseUrl(String scheme, String host, int port) {
        return scheme + "://" + host + ":" + port;
    }
}
