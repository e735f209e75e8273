package diagnostics;

/**
 * Outcome of {@link ConnectionDiagnostics#traceRoute(String)}.
 * Hops between the client and the server can't be observed without raw sockets, so a trace has either one hop,
 *  the target itself, or none.
 */
public class TraceRouteResult {

    private final String target;
    private final String host;
    private final int port;
    private final long latencyMs;
    private final String error;

    TraceRouteResult(String target, String host, int port, long latencyMs, String error) {
        this.target = target;
        this.host = host;
        this.port = port;
        this.latencyMs = latencyMs;
        this.error = error;
    }

    static TraceRouteResult failed(String target, String error) {
        return new TraceRouteResult(target, null, -1, -1, error);
    }

    public String getTarget() {
        return target;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getHopCount() {
        return error == null ? 1 : 0;
    }

    /**
     * @return Time the TCP connection took to open, -1 if it didn't.
     */
    public long getLatencyMs() {
        return latencyMs;
    }

    public String getError() {
        return error;
    }

    public String getSummary() {
        if(error != null)
            return "Trace failed: " + error;
        return "Trace complete: " + getHopCount() + " hop(s), " + host + ":" + port + " answered in " + latencyMs + " ms";
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
