package cloud.keyvault.sdk.encryption;

import java.util.concurrent.CompletableFuture;

/**
 * Supplies encryption keys to the encryption subsystem.
 */
public interface KeyProvider {

    String name();

    /**
     * Checks that the provider is usable, e.g. that its credentials are accepted. Completes exceptionally otherwise.
     */
    CompletableFuture<Void> validate();
}
