package common;

import exceptions.SyncClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.*;

/**
 * A single threaded execution context that serializes every job given to it.
 * Each client owns its own Worker, so state transitions, socket receive callbacks and timer callbacks
 *  of one client never run concurrently, while two clients (like a diagnostics probe and the primary connection)
 *  never share a thread.
 * <p>
 * The underlying {@link ScheduledExecutorService} is created lazily, right before it is first needed.
 */
public class Worker {

    private final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final String name;
    private ScheduledExecutorService scheduler;
    private volatile Thread workerThread;
    private volatile boolean shutdown;

    public Worker(String name) {
        this.name = name;
    }

    /*
        Init scheduler if necessary.
        This helps to avoid having a thread that is open even when it's not needed yet.
     */
    private synchronized ScheduledExecutorService scheduler() {
        if(scheduler == null) {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
                Thread thread = new Thread(r, "Worker-" + name);
                thread.setDaemon(true);
                workerThread = thread;
                return thread;
            });
            // Timers armed before shutdown must never fire afterwards.
            executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            executor.setRemoveOnCancelPolicy(true);
            scheduler = executor;
        }
        return scheduler;
    }

    /**
     * Submit a {@link Runnable} to be executed on this worker's thread, after every job submitted before it.
     */
    public void execute(Runnable runnable) {
        if(shutdown)
            return;
        try {
            scheduler().execute(runnable);
        } catch (RejectedExecutionException e) {
            logger.debug("Worker '{}' is shut down, dropping job.", name);
        }
    }

    /**
     * Run the given job on this worker's thread and return only after it has completed.
     * If the caller already is on the worker's thread, the job runs inline.
     *
     * @param runnable The job to run.
     */
    public void runSync(Runnable runnable) {
        if(isWorkerThread()) {
            runnable.run();
            return;
        }
        if(shutdown)
            throw new SyncClientException("Worker '" + name + "' is shut down.");

        try {
            scheduler().submit(runnable).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncClientException("Interrupted while waiting on worker '" + name + "'.", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if(cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            throw new SyncClientException("Job failed on worker '" + name + "'.", cause);
        } catch (RejectedExecutionException e) {
            throw new SyncClientException("Worker '" + name + "' is shut down.", e);
        }
    }

    /**
     * Schedule a Runnable that will be run once after {@code delay} milliseconds.
     *
     * @param runnable The Runnable to run after delay.
     * @param delay Amount of time, in milliseconds, to wait before executing the Runnable.
     * @return Future instance that can be used to cancel the job, or null if the worker is shut down.
     */
    public Future<?> schedule(Runnable runnable, long delay) {
        if(shutdown)
            return null;
        try {
            return scheduler().schedule(runnable, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Worker '{}' is shut down, not scheduling job.", name);
            return null;
        }
    }

    /**
     * Schedule a Runnable that will be run every {@code period} milliseconds, starting after {@code initialDelay}.
     *
     * @return Future instance that can be used to cancel the job, or null if the worker is shut down.
     */
    public Future<?> scheduleAtFixedRate(Runnable runnable, long initialDelay, long period) {
        if(shutdown)
            return null;
        try {
            return scheduler().scheduleAtFixedRate(runnable, initialDelay, period, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Worker '{}' is shut down, not scheduling periodic job.", name);
            return null;
        }
    }

    /**
     * @return true if the calling thread is this worker's thread.
     */
    public boolean isWorkerThread() {
        return Thread.currentThread() == workerThread;
    }

    /**
     * Current time in milliseconds, as seen by the jobs of this worker.
     */
    public long now() {
        return System.currentTimeMillis();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public String getName() {
        return name;
    }

    /**
     *  Shuts down the worker thread, and waits 1 second for it to terminate.
     */
    public void shutdown() {
        shutdown(1000);
    }

    /**
     *  Shuts down the worker thread, and waits for the given amount in millis for it to terminate.
     *  When called from the worker thread itself, returns without waiting.
     */
    public void shutdown(int timeOutInMillis) {
        shutdown = true;
        ScheduledExecutorService executor;
        synchronized (this) {
            executor = scheduler;
        }
        if(executor == null)
            return;

        executor.shutdown();
        if(isWorkerThread())
            return;
        try {
            executor.awaitTermination(timeOutInMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncClientException("Interrupted while closing worker '" + name + "'.", e);
        }
    }
}
