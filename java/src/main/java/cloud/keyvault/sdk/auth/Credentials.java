package cloud.keyvault.sdk.auth;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Contract for obtaining access tokens on behalf of an application.
 *
 * <p>Returned futures fail with {@link cloud.keyvault.sdk.AuthenticationException} when the identity provider
 * rejects the request or stays unreachable, and with
 * {@link cloud.keyvault.sdk.MalformedTokenResponseException} when its answer cannot be understood.
 */
public interface Credentials {

    /**
     * @return human readable name of the credential type
     */
    String name();

    /**
     * Runs the authentication flow for {@code scope}. Every call performs a fresh exchange with the identity
     * provider, whatever is cached.
     */
    CompletableFuture<AccessToken> refresh(ResourceScope scope);

    /**
     * Returns the cached token for {@code scope} while it is outside the refresh leeway, and refreshes otherwise.
     * An expired token is never returned.
     */
    CompletableFuture<AccessToken> accessToken(ResourceScope scope);

    /**
     * @return the latest-expiring token stored by a successful refresh of the most recently refreshed scope
     */
    Optional<AccessToken> cachedToken();

    default void invalidate() {
        // default no-op
    }
}
