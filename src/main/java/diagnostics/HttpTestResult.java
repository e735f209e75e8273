package diagnostics;

/**
 * Outcome of the plain HTTP reachability test. Any HTTP response, whatever its status, means reachable.
 */
public class HttpTestResult {

    private final String url;
    private final boolean reachable;
    private final Integer statusCode;
    private final long latencyMs;
    private final String error;

    HttpTestResult(String url, boolean reachable, Integer statusCode, long latencyMs, String error) {
        this.url = url;
        this.reachable = reachable;
        this.statusCode = statusCode;
        this.latencyMs = latencyMs;
        this.error = error;
    }

    public String getUrl() {
        return url;
    }

    public boolean isReachable() {
        return reachable;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public String getError() {
        return error;
    }

    public String getSummary() {
        if(reachable)
            return "HTTP reachable (" + latencyMs + " ms)" + (statusCode != null ? " (HTTP " + statusCode + ")" : "");
        return "HTTP not reachable: " + (error != null ? error : "Unknown error.");
    }
}
