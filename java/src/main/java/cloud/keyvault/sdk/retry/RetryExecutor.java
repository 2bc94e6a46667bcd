package cloud.keyvault.sdk.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Re-invokes an asynchronous operation under a {@link RetryPolicy}.
 *
 * <p>The returned future completes with the first successful result, or with the last failure once the failure is
 * classified as non-retryable or the attempt budget is spent. Cancelling the returned future stops the loop: an
 * attempt that is waiting for its backoff is never started.
 */
public final class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final RetryClassifier classifier;
    private final BackoffScheduler scheduler;

    public RetryExecutor(RetryPolicy policy, RetryClassifier classifier, BackoffScheduler scheduler) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public RetryExecutor(RetryPolicy policy) {
        this(policy, RetryClassifier.transientFailures(), BackoffScheduler.system());
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        CompletableFuture<T> result = new CompletableFuture<>();
        if (policy.maxAttempts() < 1) {
            result.completeExceptionally(new IllegalStateException("retry policy permits no attempts"));
            return result;
        }
        attempt(operation, 1, result);
        return result;
    }

    private <T> void attempt(Supplier<? extends CompletionStage<T>> operation, int attempt, CompletableFuture<T> result) {
        if (result.isDone()) {
            return;
        }

        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException ex) {
            stage = CompletableFuture.failedFuture(ex);
        }

        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }

            Throwable failure = unwrap(error);
            if (!classifier.isRetryable(failure)) {
                result.completeExceptionally(failure);
                return;
            }
            if (attempt >= policy.maxAttempts()) {
                logger.warn("All {} attempts failed, giving up: {}", attempt, failure.toString());
                result.completeExceptionally(failure);
                return;
            }
            if (result.isDone()) {
                return;
            }

            Duration delay = policy.delayBefore(attempt + 1);
            logger.debug("Attempt {} failed ({}), retrying in {} ms", attempt, failure.toString(), delay.toMillis());
            scheduler.delay(delay).whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    failure.addSuppressed(unwrap(delayError));
                    result.completeExceptionally(failure);
                    return;
                }
                attempt(operation, attempt + 1, result);
            });
        });
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
