package connection;

import common.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Future;
import java.util.function.IntConsumer;

/**
 * Single-shot reconnection timer. At most one attempt is armed at a time, arming again replaces the pending one.
 */
class ReconnectPolicy {

    private final Logger logger = LoggerFactory.getLogger(ReconnectPolicy.class);

    private final Worker worker;
    private final long delay;
    private Future<?> pending;
    private int attempts;

    ReconnectPolicy(Worker worker, long delay) {
        this.worker = worker;
        this.delay = delay;
    }

    /**
     * Arm the timer. The attempt runs on the worker after the configured delay, unless cancelled before.
     *
     * @param attempt Receives the number of the attempt, starting from 1.
     */
    void schedule(IntConsumer attempt) {
        cancel();
        int attemptNumber = ++attempts;
        logger.info("Reconnect attempt {} scheduled in {} ms", attemptNumber, delay);
        pending = worker.schedule(() -> {
            pending = null;
            attempt.accept(attemptNumber);
        }, delay);
    }

    void cancel() {
        if(pending != null) {
            pending.cancel(false);
            pending = null;
            logger.debug("Pending reconnect cancelled.");
        }
    }

    // Called once a connection is established.
    void reset() {
        cancel();
        attempts = 0;
    }

    boolean isArmed() {
        return pending != null && !pending.isDone();
    }

    int getAttempts() {
        return attempts;
    }
}
