package cloud.keyvault.sdk.encryption;

import cloud.keyvault.sdk.retry.BackoffScheduler;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * In-memory {@link EncryptionContext}.
 */
public final class SimpleEncryptionContext implements EncryptionContext {

    private final ConcurrentMap<Object, KeyProvider> providers = new ConcurrentHashMap<>();
    private final BackoffScheduler scheduler;
    private final Clock clock;

    public SimpleEncryptionContext() {
        this(BackoffScheduler.system(), Clock.systemUTC());
    }

    public SimpleEncryptionContext(BackoffScheduler scheduler, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public KeyProvider cachedProvider(Object key, Supplier<? extends KeyProvider> factory) {
        return providers.computeIfAbsent(key, ignored -> factory.get());
    }

    @Override
    public BackoffScheduler scheduler() {
        return scheduler;
    }

    @Override
    public Clock clock() {
        return clock;
    }

    public int providerCount() {
        return providers.size();
    }
}
