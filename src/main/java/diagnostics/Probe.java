package diagnostics;

import common.Worker;
import connection.ClientConfig;
import connection.ConnectionManager;
import exceptions.SyncClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * One throwaway connection attempt.
 * The probe builds its own {@link ConnectionManager} on its own {@link Worker}, with reconnection, heartbeat and device
 *  registration turned off and the handshake timeout set to the probe's timeout, so it never touches another client.
 *  The manager is shut down as soon as the outcome is known.
 */
class Probe {

    private final Logger logger = LoggerFactory.getLogger(Probe.class);

    private final String baseUrl;
    private final long timeoutMs;
    private final boolean awaitPong;
    private final ClientConfig config;
    private final CompletableFuture<DiagnosticResult> result;
    private ConnectionManager manager;
    private long startedAt;
    private long latencyMs = -1;
    private boolean finished;

    /**
     * @param template Configuration to take the transport settings from. It is not modified.
     * @param baseUrl HTTP(S) address to probe.
     * @param timeoutMs Time allowed for the complete probe.
     * @param awaitPong Whether to send a ping after the handshake and wait for the pong within the remaining time.
     */
    Probe(ClientConfig template, String baseUrl, long timeoutMs, boolean awaitPong) {
        this.baseUrl = baseUrl;
        this.timeoutMs = timeoutMs;
        this.awaitPong = awaitPong;
        this.result = new CompletableFuture<>();

        config = template.clone();
        config.baseUrl = baseUrl;
        config.reconnect = false;
        config.heartbeatEnabled = false;
        config.deviceUuid = null;
        config.handshakeTimeoutMs = timeoutMs;
    }

    CompletableFuture<DiagnosticResult> run() {
        try {
            manager = new ConnectionManager(config, new Worker("Probe-" + baseUrl));
        } catch (SyncClientException e) {
            result.complete(DiagnosticResult.failed(baseUrl, e.getMessage()));
            return result;
        }

        manager.once(ConnectionManager.CONNECTED, args -> onConnected())
                .once(ConnectionManager.ERROR, args -> finish(false, false, (String) args[0]))
                .once(ConnectionManager.DISCONNECTED, args -> onDisconnected());

        logger.debug("Probing {} with a {} ms timeout", baseUrl, timeoutMs);
        startedAt = System.nanoTime();
        manager.connect();
        return result;
    }

    // Runs on the probe's worker.
    private void onConnected() {
        latencyMs = (System.nanoTime() - startedAt) / 1_000_000;
        long remaining = timeoutMs - latencyMs;
        if(!awaitPong || remaining <= 0) {
            finish(true, false, null);
            return;
        }

        manager.once(ConnectionManager.PONG, args -> finish(true, true, null));
        if(!manager.sendPing()) {
            finish(true, false, null);
            return;
        }
        manager.getWorker().schedule(() -> finish(true, false, null), remaining);
    }

    // A normal close by the server. Also fires while the probe shuts its own manager down, which finish() ignores.
    private void onDisconnected() {
        if(latencyMs >= 0)
            finish(true, false, null);
        else
            finish(false, false, "Server closed the connection before completing the handshake.");
    }

    private void finish(boolean connected, boolean pongReceived, String error) {
        if(finished)
            return;
        finished = true;
        DiagnosticResult outcome = connected
                ? new DiagnosticResult(baseUrl, true, latencyMs, pongReceived, null)
                : DiagnosticResult.failed(baseUrl, error);
        logger.debug("Probe of {} finished: {}", baseUrl, outcome.getSummary());
        manager.shutdown();
        result.complete(outcome);
    }
}
