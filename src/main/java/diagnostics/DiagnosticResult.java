package diagnostics;

/**
 * Outcome of a single-connection test.
 */
public class DiagnosticResult {

    private final String url;
    private final boolean connected;
    private final long handshakeLatencyMs;
    private final boolean pongReceived;
    private final String error;

    DiagnosticResult(String url, boolean connected, long handshakeLatencyMs, boolean pongReceived, String error) {
        this.url = url;
        this.connected = connected;
        this.handshakeLatencyMs = handshakeLatencyMs;
        this.pongReceived = pongReceived;
        this.error = error;
    }

    static DiagnosticResult failed(String url, String error) {
        return new DiagnosticResult(url, false, -1, false, error);
    }

    public String getUrl() {
        return url;
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * @return Milliseconds from opening the socket to the completed handshake, -1 if it never completed.
     */
    public long getHandshakeLatencyMs() {
        return handshakeLatencyMs;
    }

    public boolean isPongReceived() {
        return pongReceived;
    }

    /**
     * @return Why the test failed, null on success.
     */
    public String getError() {
        return error;
    }

    public String getSummary() {
        if(!connected)
            return "Connection to " + url + " failed: " + (error != null ? error : "Unknown error.");
        return "Connected to " + url + " in " + handshakeLatencyMs + " ms, "
                + (pongReceived ? "heartbeat answered." : "no heartbeat answer.");
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
