package connection;

import common.Observable;
import common.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import protocol.FrameCodec;

import java.util.concurrent.Future;

/**
 * Tracks the liveness of an established connection with two independent signals, since servers differ in which side
 *  drives the heartbeat:
 * <p> Server initiated: every PING from the server is answered right away with a PONG.
 * <br> Client initiated: a PING is sent every {@code clientPingIntervalMs} and the server's PONG is recorded.
 * <p>
 * Any inbound ping or pong resets the failure count. A periodic check counts a failure whenever the last server ping is
 *  missing or older than the threshold, and from {@code heartbeatFailureThreshold} failures on the connection is reported
 *  as {@link #DEGRADED}. This is advisory only: application events may still flow on a connection with an irregular
 *  keepalive, so the monitor never closes it.
 * <p>
 * All methods must be called on the owner's worker.
 */
public class HeartbeatMonitor extends Observable {

    private final Logger logger = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final Worker worker;
    private final ClientConfig config;
    private final FrameSender sender;
    private final FrameCodec codec;
    private final HeartbeatLedger ledger;
    private Future<?> graceFuture;
    private Future<?> staleCheckFuture;
    private Future<?> clientPingFuture;
    private boolean running;

    public HeartbeatMonitor(Worker worker, ClientConfig config, FrameSender sender) {
        this.worker = worker;
        this.config = config;
        this.sender = sender;
        this.codec = new FrameCodec();
        this.ledger = new HeartbeatLedger();
    }

    /**
     * Start monitoring a freshly established connection. Timers are armed after the grace period.
     */
    public void start() {
        stop();
        ledger.reset();
        running = true;
        graceFuture = worker.schedule(this::armTimers, config.heartbeatGracePeriodMs);
    }

    private void armTimers() {
        graceFuture = null;
        if(!running)
            return;

        logger.debug("Heartbeat timers armed, staleness check every {} ms", config.heartbeatCheckIntervalMs);
        staleCheckFuture = worker.scheduleAtFixedRate(this::checkStaleness,
                config.heartbeatCheckIntervalMs, config.heartbeatCheckIntervalMs);
        if(config.clientPingIntervalMs > 0) {
            sendPing();
            clientPingFuture = worker.scheduleAtFixedRate(this::sendPing,
                    config.clientPingIntervalMs, config.clientPingIntervalMs);
        }
    }

    /**
     * Cancel every heartbeat timer. The ledger keeps its values for inspection.
     */
    public void stop() {
        running = false;
        graceFuture = cancel(graceFuture);
        staleCheckFuture = cancel(staleCheckFuture);
        clientPingFuture = cancel(clientPingFuture);
    }

    private static Future<?> cancel(Future<?> future) {
        if(future != null)
            future.cancel(false);
        return null;
    }

    /**
     * The server sent a PING: answer it with a PONG before anything else happens.
     */
    public void onServerPing() {
        sender.send(codec.encodePong());
        ledger.recordInboundServerPing(worker.now());
        logger.debug("Answered server ping.");
        emitEvent(SERVER_PING);
    }

    /**
     * The server answered one of our PINGs.
     */
    public void onPong() {
        ledger.recordInboundPong(worker.now());
        emitEvent(PONG);
    }

    /**
     * Send a client initiated PING.
     *
     * @return false if it couldn't be written.
     */
    public boolean sendPing() {
        if(!sender.send(codec.encodePing())) {
            logger.debug("Couldn't write client ping.");
            return false;
        }
        ledger.recordOutboundPing(worker.now());
        emitEvent(PING);
        return true;
    }

    void checkStaleness() {
        if(!ledger.isServerPingStale(worker.now(), config.heartbeatStaleThresholdMs))
            return;

        int failures = ledger.recordFailure();
        logger.debug("No recent server ping, {} consecutive failure(s).", failures);
        if(failures >= config.heartbeatFailureThreshold) {
            logger.warn("Connection looks degraded: {} heartbeat checks without a server ping. {}", failures, ledger);
            emitEvent(DEGRADED, failures);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public HeartbeatLedger getLedger() {
        return ledger;
    }

    /**
     * Writes heartbeat frames to the connection.
     */
    @FunctionalInterface
    public interface FrameSender {

        boolean send(String encodedFrame);
    }

    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String SERVER_PING = "server_ping";
    public static final String DEGRADED = "degraded";
}
