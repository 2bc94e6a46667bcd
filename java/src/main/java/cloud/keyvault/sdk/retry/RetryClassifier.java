package cloud.keyvault.sdk.retry;

import cloud.keyvault.sdk.TokenRequestException;

import java.io.IOException;

/**
 * Decides whether a failed attempt is worth repeating.
 */
@FunctionalInterface
public interface RetryClassifier {

    boolean isRetryable(Throwable failure);

    /**
     * Network failures, timeouts included, and 5xx responses are retried. Client errors are not: repeating a
     * rejected credential only risks a lockout on the identity provider side.
     */
    static RetryClassifier transientFailures() {
        return failure -> {
            if (failure instanceof TokenRequestException) {
                return ((TokenRequestException) failure).isTransient();
            }
            return failure instanceof IOException;
        };
    }
}
