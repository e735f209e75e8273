package health;

import java.util.concurrent.CompletableFuture;

/**
 * Out-of-band check of whether the game server is up.
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Start a check. Implementations must not block the caller.
     *
     * @return Future completed with true if the server is healthy. A failed check completes with false
     *          or exceptionally, both meaning unhealthy.
     */
    CompletableFuture<Boolean> check();
}
