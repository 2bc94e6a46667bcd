package cloud.keyvault.sdk.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Represents an issued bearer token and the resource it was requested for.
 */
public final class AccessToken {
    private final String token;
    private final Instant expiresAt;
    private final ResourceScope scope;

    public AccessToken(String token, Instant expiresAt, ResourceScope scope) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token must be non-empty");
        }
        this.token = token;
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public String getToken() {
        return token;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public ResourceScope getScope() {
        return scope;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * @return true when the token expires before {@code now + leeway}
     */
    public boolean isExpiringWithin(Instant now, Duration leeway) {
        return !now.plus(leeway).isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "AccessToken{" +
            "token='********'" +
            ", expiresAt=" + expiresAt +
            ", scope=" + scope +
            '}';
    }
}
