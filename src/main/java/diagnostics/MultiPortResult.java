package diagnostics;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a multi-port scan. At most one port is reported as working: the first one that completed the handshake.
 * Ports that completed it later are listed in {@link #getAlsoReachable()}.
 */
public class MultiPortResult {

    private final String host;
    private final Integer workingPort;
    private final String workingUrl;
    private final List<PortFailure> failures;
    private final List<Integer> alsoReachable;

    MultiPortResult(String host, Integer workingPort, String workingUrl, List<PortFailure> failures, List<Integer> alsoReachable) {
        this.host = host;
        this.workingPort = workingPort;
        this.workingUrl = workingUrl;
        this.failures = Collections.unmodifiableList(failures);
        this.alsoReachable = Collections.unmodifiableList(alsoReachable);
    }

    public String getHost() {
        return host;
    }

    /**
     * @return The winning port, null if no port completed the handshake.
     */
    public Integer getWorkingPort() {
        return workingPort;
    }

    /**
     * @return Base URL ("scheme://host:port") of the winning port, null if there is none.
     */
    public String getWorkingUrl() {
        return workingUrl;
    }

    public boolean hasWorkingPort() {
        return workingPort != null;
    }

    public List<PortFailure> getFailures() {
        return failures;
    }

    public List<Integer> getAlsoReachable() {
        return alsoReachable;
    }

    public String getSummary() {
        StringBuilder builder = new StringBuilder();
        if(workingPort != null)
            builder.append("Working port found on ").append(host).append(": ").append(workingPort)
                    .append(" (").append(workingUrl).append(")");
        else
            builder.append("No working port found on ").append(host).append('.');

        if(!alsoReachable.isEmpty())
            builder.append("\nAlso reachable: ").append(alsoReachable);
        for(PortFailure failure : failures)
            builder.append("\n  ").append(failure);
        return builder.toString();
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
