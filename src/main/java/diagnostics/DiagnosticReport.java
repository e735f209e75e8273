package diagnostics;

/**
 * Everything {@link ConnectionDiagnostics#runFullDiagnostics(String)} found out about a server.
 * For an invalid server URL, only {@link #getError()} is set.
 */
public class DiagnosticReport {

    private final String serverUrl;
    private HttpTestResult httpTest;
    private DiagnosticResult connectionTest;
    private MultiPortResult portScan;
    private TraceRouteResult traceRoute;
    private String error;

    DiagnosticReport(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public HttpTestResult getHttpTest() {
        return httpTest;
    }

    void setHttpTest(HttpTestResult httpTest) {
        this.httpTest = httpTest;
    }

    public DiagnosticResult getConnectionTest() {
        return connectionTest;
    }

    void setConnectionTest(DiagnosticResult connectionTest) {
        this.connectionTest = connectionTest;
    }

    public MultiPortResult getPortScan() {
        return portScan;
    }

    void setPortScan(MultiPortResult portScan) {
        this.portScan = portScan;
    }

    public TraceRouteResult getTraceRoute() {
        return traceRoute;
    }

    void setTraceRoute(TraceRouteResult traceRoute) {
        this.traceRoute = traceRoute;
    }

    public String getError() {
        return error;
    }

    void setError(String error) {
        this.error = error;
    }

    public String getSummary() {
        StringBuilder builder = new StringBuilder("Network Diagnostics for ").append(serverUrl).append('\n');
        if(httpTest != null)
            builder.append("\nHTTP Test:\n  ").append(httpTest.getSummary());
        if(connectionTest != null)
            builder.append("\nConnection Test:\n  ").append(connectionTest.getSummary());
        if(portScan != null)
            builder.append("\nCommon Ports Test:\n  ").append(portScan.getSummary().replace("\n", "\n  "));
        if(traceRoute != null)
            builder.append("\nTrace Route:\n  ").append(traceRoute.getSummary());
        if(error != null)
            builder.append("\nError: ").append(error);
        return builder.toString();
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
