package connection;

/**
 * Liveness bookkeeping of one connection. Timestamps are in milliseconds, {@link #NEVER} when the signal hasn't been seen.
 * {@code consecutiveFailures} counts stale checks in a row and is reset by every inbound ping or pong.
 */
public class HeartbeatLedger {

    public static final long NEVER = -1;

    private long lastOutboundPingAt = NEVER;
    private long lastInboundPongAt = NEVER;
    private long lastInboundServerPingAt = NEVER;
    private int consecutiveFailures;

    public HeartbeatLedger() {
    }

    private HeartbeatLedger(HeartbeatLedger other) {
        lastOutboundPingAt = other.lastOutboundPingAt;
        lastInboundPongAt = other.lastInboundPongAt;
        lastInboundServerPingAt = other.lastInboundServerPingAt;
        consecutiveFailures = other.consecutiveFailures;
    }

    void recordOutboundPing(long now) {
        lastOutboundPingAt = now;
    }

    void recordInboundPong(long now) {
        lastInboundPongAt = now;
        consecutiveFailures = 0;
    }

    void recordInboundServerPing(long now) {
        lastInboundServerPingAt = now;
        consecutiveFailures = 0;
    }

    /**
     * @return Failures after counting this one.
     */
    int recordFailure() {
        return ++consecutiveFailures;
    }

    /**
     * @return true if no server ping has been seen within {@code thresholdMs} before {@code now}.
     */
    boolean isServerPingStale(long now, long thresholdMs) {
        return lastInboundServerPingAt == NEVER || now - lastInboundServerPingAt > thresholdMs;
    }

    void reset() {
        lastOutboundPingAt = NEVER;
        lastInboundPongAt = NEVER;
        lastInboundServerPingAt = NEVER;
        consecutiveFailures = 0;
    }

    public HeartbeatLedger copy() {
        return new HeartbeatLedger(this);
    }

    public long getLastOutboundPingAt() {
        return lastOutboundPingAt;
    }

    public long getLastInboundPongAt() {
        return lastInboundPongAt;
    }

    public long getLastInboundServerPingAt() {
        return lastInboundServerPingAt;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    @Override
    public String toString() {
        return "HeartbeatLedger{" +
                "lastOutboundPingAt=" + lastOutboundPingAt +
                ", lastInboundPongAt=" + lastInboundPongAt +
                ", lastInboundServerPingAt=" + lastInboundServerPingAt +
                ", consecutiveFailures=" + consecutiveFailures +
                '}';
    }
}
