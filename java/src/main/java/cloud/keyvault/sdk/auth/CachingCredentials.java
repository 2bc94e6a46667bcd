package cloud.keyvault.sdk.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class holding the token cache shared by credential implementations.
 *
 * <p>The cached token is swapped atomically after each successful refresh, unless the cache already holds a token
 * for the same scope that expires later. {@link #accessToken} deduplicates
 * concurrent refreshes: callers that arrive while a refresh for the same scope is running share its outcome.
 * {@link #refresh} is never deduplicated.
 */
public abstract class CachingCredentials implements Credentials {

    public static final Duration DEFAULT_LEEWAY = Duration.ofSeconds(30);

    private final Clock clock;
    private final Duration leeway;
    private final AtomicReference<AccessToken> cached = new AtomicReference<>();
    private final AtomicReference<PendingRefresh> pending = new AtomicReference<>();

    protected CachingCredentials(Clock clock, Duration leeway) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.leeway = leeway == null || leeway.isNegative() ? DEFAULT_LEEWAY : leeway;
    }

    /**
     * Performs the network exchange. Implementations must not touch the cache.
     */
    protected abstract CompletableFuture<AccessToken> fetch(ResourceScope scope);

    protected final Clock clock() {
        return clock;
    }

    @Override
    public final CompletableFuture<AccessToken> refresh(ResourceScope scope) {
        Objects.requireNonNull(scope, "scope");
        CompletableFuture<AccessToken> fetched = fetch(scope);
        CompletableFuture<AccessToken> result = fetched.thenApply(token -> {
            cached.accumulateAndGet(token, CachingCredentials::newer);
            return token;
        });
        result.whenComplete((token, error) -> {
            if (result.isCancelled()) {
                fetched.cancel(false);
            }
        });
        return result;
    }

    @Override
    public final CompletableFuture<AccessToken> accessToken(ResourceScope scope) {
        Objects.requireNonNull(scope, "scope");
        AccessToken current = cached.get();
        if (isUsable(current, scope)) {
            return CompletableFuture.completedFuture(current);
        }

        while (true) {
            PendingRefresh inFlight = pending.get();
            if (inFlight != null && inFlight.scope().equals(scope)) {
                return inFlight.future().copy();
            }

            PendingRefresh mine = new PendingRefresh(scope, new CompletableFuture<>());
            if (pending.compareAndSet(inFlight, mine)) {
                CompletableFuture<AccessToken> refreshed;
                try {
                    refreshed = refresh(scope);
                } catch (RuntimeException ex) {
                    pending.compareAndSet(mine, null);
                    mine.future().completeExceptionally(ex);
                    return mine.future().copy();
                }
                refreshed.whenComplete((token, error) -> {
                    pending.compareAndSet(mine, null);
                    if (error != null) {
                        mine.future().completeExceptionally(unwrap(error));
                    } else {
                        mine.future().complete(token);
                    }
                });
                return mine.future().copy();
            }
        }
    }

    @Override
    public Optional<AccessToken> cachedToken() {
        return Optional.ofNullable(cached.get());
    }

    @Override
    public void invalidate() {
        cached.set(null);
    }

    private boolean isUsable(AccessToken token, ResourceScope scope) {
        return token != null
            && token.getScope().equals(scope)
            && !token.isExpiringWithin(clock.instant(), leeway);
    }

    /**
     * Keeps the current token when a slower refresh for the same scope completes with an earlier expiry.
     */
    private static AccessToken newer(AccessToken current, AccessToken candidate) {
        if (current == null || !current.getScope().equals(candidate.getScope())) {
            return candidate;
        }
        return candidate.getExpiresAt().isBefore(current.getExpiresAt()) ? current : candidate;
    }

    static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private record PendingRefresh(ResourceScope scope, CompletableFuture<AccessToken> future) {
    }
}
