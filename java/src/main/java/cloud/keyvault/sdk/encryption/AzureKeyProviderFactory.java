package cloud.keyvault.sdk.encryption;

import cloud.keyvault.sdk.CredentialsConfigurationException;
import cloud.keyvault.sdk.auth.EnvironmentCredentialsResolver;
import cloud.keyvault.sdk.auth.ResourceScope;
import cloud.keyvault.sdk.auth.ServicePrincipalConfig;
import cloud.keyvault.sdk.auth.ServicePrincipalCredentials;
import cloud.keyvault.sdk.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@link AzureKeyProvider}s authenticated as a service principal.
 *
 * <h2>Options</h2>
 * <ul>
 *   <li>{@code master_key} - required, {@code <vault>/<key>}</li>
 *   <li>{@code azure_tenant_id}, {@code azure_client_id} - service principal identity</li>
 *   <li>{@code azure_client_secret} or {@code azure_client_certificate_path} - exactly one</li>
 *   <li>{@code azure_authority_host} - identity provider, defaults to {@code https://login.microsoftonline.com}</li>
 *   <li>{@code truststore}, {@code priority_string} - TLS settings for the identity provider connection</li>
 *   <li>{@code azure_vault_resource} - token audience, defaults to {@code https://vault.azure.net}</li>
 *   <li>{@code azure_request_timeout_ms}, {@code azure_max_attempts} - per request timeout and retry budget</li>
 * </ul>
 *
 * <p>Settings missing from the options are looked up in the {@code AZURE_*} environment variables. Construction
 * performs no network I/O.
 */
public final class AzureKeyProviderFactory implements KeyProviderFactory {

    private static final Logger logger = LoggerFactory.getLogger(AzureKeyProviderFactory.class);

    static final String TYPE = "azure";

    public static final String MASTER_KEY = "master_key";
    public static final String TENANT_ID = "azure_tenant_id";
    public static final String CLIENT_ID = "azure_client_id";
    public static final String CLIENT_SECRET = "azure_client_secret";
    public static final String CLIENT_CERTIFICATE_PATH = "azure_client_certificate_path";
    public static final String AUTHORITY_HOST = "azure_authority_host";
    public static final String TRUSTSTORE = "truststore";
    public static final String PRIORITY_STRING = "priority_string";
    public static final String VAULT_RESOURCE = "azure_vault_resource";
    public static final String REQUEST_TIMEOUT_MS = "azure_request_timeout_ms";
    public static final String MAX_ATTEMPTS = "azure_max_attempts";

    private final EnvironmentCredentialsResolver environment;

    public AzureKeyProviderFactory() {
        this(EnvironmentCredentialsResolver.system());
    }

    public AzureKeyProviderFactory(EnvironmentCredentialsResolver environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public KeyProvider provider(EncryptionContext context, KeyProviderOptions options) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(options, "options");
        return context.cachedProvider(List.of(TYPE, options), () -> create(context, options));
    }

    private AzureKeyProvider create(EncryptionContext context, KeyProviderOptions options) {
        String masterKey = options.require(MASTER_KEY);
        ServicePrincipalConfig config = config(options);
        ResourceScope scope = options.get(VAULT_RESOURCE).map(ResourceScope::of).orElse(ResourceScope.AZURE_KEY_VAULT);

        ServicePrincipalCredentials credentials =
            new ServicePrincipalCredentials(config, null, context.scheduler(), context.clock());
        AzureKeyProvider provider = new AzureKeyProvider(masterKey, credentials, masterKey, scope);
        logger.info("Created key provider for {} using {}", masterKey, credentials);
        return provider;
    }

    ServicePrincipalConfig config(KeyProviderOptions options) {
        ServicePrincipalConfig.Builder builder = ServicePrincipalConfig.builder()
            .tenantId(options.get(TENANT_ID).orElse(null))
            .clientId(options.get(CLIENT_ID).orElse(null))
            .clientSecret(options.get(CLIENT_SECRET).orElse(null))
            .clientCertificatePath(options.get(CLIENT_CERTIFICATE_PATH).orElse(null))
            .authority(options.get(AUTHORITY_HOST).orElse(null))
            .truststore(options.get(TRUSTSTORE).orElse(null))
            .priorityString(options.get(PRIORITY_STRING).orElse(null))
            .logContext(options.get(MASTER_KEY).orElse(null));

        options.getLong(REQUEST_TIMEOUT_MS).ifPresent(ms -> {
            if (ms <= 0) {
                throw new CredentialsConfigurationException(REQUEST_TIMEOUT_MS + " must be positive: " + ms);
            }
            builder.requestTimeout(Duration.ofMillis(ms));
        });
        options.getLong(MAX_ATTEMPTS).ifPresent(attempts -> {
            if (attempts < 1 || attempts > Integer.MAX_VALUE) {
                throw new CredentialsConfigurationException(MAX_ATTEMPTS + " must be at least 1: " + attempts);
            }
            builder.retryPolicy(RetryPolicy.defaults().withMaxAttempts(attempts.intValue()));
        });

        try {
            return environment.resolve(builder).build();
        } catch (CredentialsConfigurationException ex) {
            throw new CredentialsConfigurationException("invalid key provider options " + options + ": " + ex.getMessage(), ex);
        }
    }
}
