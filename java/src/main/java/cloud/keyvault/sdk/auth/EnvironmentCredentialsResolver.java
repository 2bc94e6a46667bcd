package cloud.keyvault.sdk.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Fills unset service principal settings from the standard Azure environment variables.
 *
 * <p>Tenant id, client id and authority are taken individually when missing. Authentication material is taken
 * from the environment only when the builder carries neither a secret nor a certificate, so explicit
 * configuration is never mixed with environment material.
 *
 * <h2>Variables</h2>
 * <ul>
 *   <li>{@code AZURE_TENANT_ID}</li>
 *   <li>{@code AZURE_CLIENT_ID}</li>
 *   <li>{@code AZURE_CLIENT_SECRET}</li>
 *   <li>{@code AZURE_CLIENT_CERTIFICATE_PATH}</li>
 *   <li>{@code AZURE_AUTHORITY_HOST}</li>
 * </ul>
 */
public final class EnvironmentCredentialsResolver {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentCredentialsResolver.class);

    public static final String AZURE_TENANT_ID = "AZURE_TENANT_ID";
    public static final String AZURE_CLIENT_ID = "AZURE_CLIENT_ID";
    public static final String AZURE_CLIENT_SECRET = "AZURE_CLIENT_SECRET";
    public static final String AZURE_CLIENT_CERTIFICATE_PATH = "AZURE_CLIENT_CERTIFICATE_PATH";
    public static final String AZURE_AUTHORITY_HOST = "AZURE_AUTHORITY_HOST";

    private final Function<String, String> environment;

    public EnvironmentCredentialsResolver(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public static EnvironmentCredentialsResolver system() {
        return new EnvironmentCredentialsResolver(System::getenv);
    }

    public ServicePrincipalConfig.Builder resolve(ServicePrincipalConfig.Builder builder) {
        if (isBlank(builder.tenantId())) {
            builder.tenantId(lookup(AZURE_TENANT_ID));
        }
        if (isBlank(builder.clientId())) {
            builder.clientId(lookup(AZURE_CLIENT_ID));
        }
        if (isBlank(builder.authority())) {
            builder.authority(lookup(AZURE_AUTHORITY_HOST));
        }
        if (!builder.hasAuthenticationMaterial()) {
            builder.clientSecret(lookup(AZURE_CLIENT_SECRET));
            builder.clientCertificatePath(lookup(AZURE_CLIENT_CERTIFICATE_PATH));
        }
        return builder;
    }

    private String lookup(String name) {
        String value = environment.apply(name);
        if (isBlank(value)) {
            return null;
        }
        logger.debug("Using {} from environment", name);
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
