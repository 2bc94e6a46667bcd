package cloud.keyvault.sdk.auth;

import cloud.keyvault.sdk.CredentialsConfigurationException;
import cloud.keyvault.sdk.retry.RetryPolicy;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable configuration used to build {@link ServicePrincipalCredentials}.
 *
 * <p>Exactly one of {@code clientSecret} and {@code clientCertificatePath} must be set. The certificate path points
 * at a PEM file holding the certificate and its PKCS#8 private key.
 */
public final class ServicePrincipalConfig {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TOKEN_LEEWAY = CachingCredentials.DEFAULT_LEEWAY;

    // one unreserved path segment, dot segments excluded
    private static final Pattern TENANT_ID_PATTERN = Pattern.compile("(?!\\.+$)[A-Za-z0-9._-]+");

    private final String tenantId;
    private final String clientId;
    private final String clientSecret;
    private final String clientCertificatePath;
    private final String authority;
    private final String truststore;
    private final String priorityString;
    private final Duration requestTimeout;
    private final Duration tokenLeeway;
    private final RetryPolicy retryPolicy;
    private final String logContext;
    private final Authority resolvedAuthority;

    private ServicePrincipalConfig(Builder builder, Authority resolvedAuthority) {
        this.tenantId = builder.tenantId;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.clientCertificatePath = builder.clientCertificatePath;
        this.authority = builder.authority;
        this.truststore = builder.truststore;
        this.priorityString = builder.priorityString;
        this.requestTimeout = builder.requestTimeout;
        this.tokenLeeway = builder.tokenLeeway;
        this.retryPolicy = builder.retryPolicy;
        this.logContext = builder.logContext;
        this.resolvedAuthority = resolvedAuthority;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getClientCertificatePath() {
        return clientCertificatePath;
    }

    public String getAuthority() {
        return authority;
    }

    public Authority getResolvedAuthority() {
        return resolvedAuthority;
    }

    public String getTruststore() {
        return truststore;
    }

    public String getPriorityString() {
        return priorityString;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getTokenLeeway() {
        return tokenLeeway;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public String getLogContext() {
        return logContext;
    }

    public boolean usesCertificate() {
        return clientCertificatePath != null;
    }

    @Override
    public String toString() {
        return "ServicePrincipalConfig{" +
            "tenantId='" + tenantId + '\'' +
            ", clientId='" + clientId + '\'' +
            ", clientSecret=" + (clientSecret == null ? "null" : "'********'") +
            ", clientCertificatePath='" + clientCertificatePath + '\'' +
            ", authority=" + resolvedAuthority +
            '}';
    }

    public static final class Builder {
        private String tenantId;
        private String clientId;
        private String clientSecret;
        private String clientCertificatePath;
        private String authority;
        private String truststore;
        private String priorityString;
        private Duration requestTimeout;
        private Duration tokenLeeway;
        private RetryPolicy retryPolicy;
        private String logContext;

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder clientCertificatePath(String clientCertificatePath) {
            this.clientCertificatePath = clientCertificatePath;
            return this;
        }

        public Builder authority(String authority) {
            this.authority = authority;
            return this;
        }

        public Builder truststore(String truststore) {
            this.truststore = truststore;
            return this;
        }

        public Builder priorityString(String priorityString) {
            this.priorityString = priorityString;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder tokenLeeway(Duration tokenLeeway) {
            this.tokenLeeway = tokenLeeway;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder logContext(String logContext) {
            this.logContext = logContext;
            return this;
        }

        String tenantId() {
            return tenantId;
        }

        String clientId() {
            return clientId;
        }

        boolean hasAuthenticationMaterial() {
            return !isBlank(clientSecret) || !isBlank(clientCertificatePath);
        }

        String authority() {
            return authority;
        }

        public ServicePrincipalConfig build() {
            if (isBlank(tenantId)) {
                throw new CredentialsConfigurationException("tenant id is required");
            }
            if (!TENANT_ID_PATTERN.matcher(tenantId.trim()).matches()) {
                throw new CredentialsConfigurationException(
                    "tenant id must be a single path segment of letters, digits, '.', '_' or '-': " + tenantId);
            }
            if (isBlank(clientId)) {
                throw new CredentialsConfigurationException("client id is required");
            }

            boolean hasSecret = !isBlank(clientSecret);
            boolean hasCertificate = !isBlank(clientCertificatePath);
            if (hasSecret && hasCertificate) {
                throw new CredentialsConfigurationException(
                    "both client secret and client certificate provided, configure exactly one");
            }
            if (!hasSecret && !hasCertificate) {
                throw new CredentialsConfigurationException(
                    "neither client secret nor client certificate provided, configure exactly one");
            }

            Authority resolved = Authority.parse(authority);

            Builder resolvedBuilder = new Builder()
                .tenantId(tenantId.trim())
                .clientId(clientId.trim())
                .clientSecret(hasSecret ? clientSecret : null)
                .clientCertificatePath(hasCertificate ? clientCertificatePath.trim() : null)
                .authority(resolved.toString())
                .truststore(isBlank(truststore) ? null : truststore.trim())
                .priorityString(isBlank(priorityString) ? null : priorityString.trim())
                .requestTimeout(positiveOr(requestTimeout, DEFAULT_REQUEST_TIMEOUT))
                .tokenLeeway(tokenLeeway == null || tokenLeeway.isNegative() ? DEFAULT_TOKEN_LEEWAY : tokenLeeway)
                .retryPolicy(Optional.ofNullable(retryPolicy).orElseGet(RetryPolicy::defaults))
                .logContext(Optional.ofNullable(logContext).map(String::trim).orElse(""));
            return new ServicePrincipalConfig(resolvedBuilder, resolved);
        }

        private static Duration positiveOr(Duration value, Duration fallback) {
            if (value == null || value.isZero() || value.isNegative()) {
                return fallback;
            }
            return value;
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
