package health;

import common.Worker;
import connection.ConnectionManager;
import connection.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Periodically checks the server's health and steers the {@link ConnectionManager} accordingly.
 * <p> Healthy while DISCONNECTED: {@code connect()} is requested.
 * <br> Unhealthy, or the check failed: the manager is forced to DISCONNECTED, whatever its socket reports.
 *      A check that throws counts as unhealthy and doesn't stop the polling.
 * <p>
 * Polls run on the manager's worker. A poll is skipped while the previous check is still pending.
 */
public class HealthPoller {

    private final Logger logger = LoggerFactory.getLogger(HealthPoller.class);

    private final ConnectionManager manager;
    private final HealthCheck healthCheck;
    private final Worker worker;
    private final long interval;
    private Future<?> pollFuture;
    private boolean checkInFlight;

    /**
     * Poller that GETs {@code baseUrl + healthPath} of the manager's configuration.
     */
    public HealthPoller(ConnectionManager manager) {
        this(manager, new HttpHealthCheck(manager.getConfig().okHttpClient(),
                                            manager.getConfig().baseUrl,
                                            manager.getConfig().healthPath));
    }

    public HealthPoller(ConnectionManager manager, HealthCheck healthCheck) {
        this.manager = manager;
        this.healthCheck = healthCheck;
        this.worker = manager.getWorker();
        this.interval = manager.getConfig().healthPollIntervalMs;
    }

    /**
     * Start polling, the first check runs right away. Does nothing if already started.
     */
    public void start() {
        worker.runSync(() -> {
            if(pollFuture != null)
                return;
            logger.info("Health polling every {} ms", interval);
            pollFuture = worker.scheduleAtFixedRate(this::poll, 0, interval);
        });
    }

    public void stop() {
        if(worker.isShutdown() && !worker.isWorkerThread())
            return;
        worker.runSync(() -> {
            if(pollFuture != null) {
                pollFuture.cancel(false);
                pollFuture = null;
                logger.info("Health polling stopped.");
            }
        });
    }

    /**
     * Run one check now, independently of the schedule.
     */
    public void pollNow() {
        worker.execute(this::poll);
    }

    public boolean isRunning() {
        boolean[] running = {false};
        if(!worker.isShutdown() || worker.isWorkerThread())
            worker.runSync(() -> running[0] = pollFuture != null);
        return running[0];
    }

    private void poll() {
        if(checkInFlight) {
            logger.debug("Previous health check still pending, skipping poll.");
            return;
        }
        checkInFlight = true;

        CompletableFuture<Boolean> pending;
        try {
            pending = healthCheck.check();
        } catch (RuntimeException e) {
            logger.debug("Health check failed.", e);
            pending = null;
        }
        if(pending == null) {
            checkInFlight = false;
            onResult(false);
            return;
        }

        pending.whenComplete((healthy, throwable) -> worker.execute(() -> {
            checkInFlight = false;
            if(throwable != null)
                logger.debug("Health check failed.", throwable);
            onResult(throwable == null && Boolean.TRUE.equals(healthy));
        }));
    }

    private void onResult(boolean healthy) {
        ConnectionState state = manager.getState();
        if(healthy) {
            if(state.is(ConnectionState.Status.DISCONNECTED)) {
                logger.info("Server is healthy, connecting.");
                manager.connect();
            }
            return;
        }

        if(!state.is(ConnectionState.Status.DISCONNECTED)) {
            logger.warn("Server is unhealthy, dropping the connection (was {}).", state.getDisplayName());
            manager.markServerUnavailable();
        }
    }
}
