package cloud.keyvault.sdk.encryption;

import cloud.keyvault.sdk.retry.BackoffScheduler;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Resources shared by every key provider of an encryption subsystem.
 */
public interface EncryptionContext {

    /**
     * Returns the provider cached under {@code key}, creating and caching it with {@code factory} when absent. When
     * {@code factory} throws nothing is cached. Keys are compared with {@code equals}.
     */
    KeyProvider cachedProvider(Object key, Supplier<? extends KeyProvider> factory);

    BackoffScheduler scheduler();

    Clock clock();
}
