package cloud.keyvault.sdk.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Completes a stage once a backoff delay has elapsed.
 */
@FunctionalInterface
public interface BackoffScheduler {

    CompletionStage<Void> delay(Duration delay);

    /**
     * Scheduler backed by {@link CompletableFuture#delayedExecutor}; it does not own any threads.
     */
    static BackoffScheduler system() {
        return delay -> {
            if (delay.isZero() || delay.isNegative()) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
        };
    }
}
