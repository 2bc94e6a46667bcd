package cloud.keyvault.sdk.auth;

import cloud.keyvault.sdk.AuthenticationException;
import cloud.keyvault.sdk.KeyVaultException;
import cloud.keyvault.sdk.MalformedTokenResponseException;
import cloud.keyvault.sdk.internal.HttpUtil;
import cloud.keyvault.sdk.internal.Json;
import cloud.keyvault.sdk.internal.SslContexts;
import cloud.keyvault.sdk.internal.TokenErrorDecoder;
import cloud.keyvault.sdk.retry.BackoffScheduler;
import cloud.keyvault.sdk.retry.RetryClassifier;
import cloud.keyvault.sdk.retry.RetryExecutor;
import cloud.keyvault.sdk.signing.AssertionSigner;
import cloud.keyvault.sdk.signing.CertificateAssertionSigner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Credentials performing the OAuth client credentials grant against a Microsoft Entra style token endpoint,
 * authenticating with either a client secret or a certificate-signed client assertion.
 *
 * <p>The flow is chosen once at construction from the configured material. Each token request goes through a
 * {@link RetryExecutor}: network failures and 5xx answers are retried with backoff, client errors fail at once.
 */
public final class ServicePrincipalCredentials extends CachingCredentials {

    private static final Logger logger = LoggerFactory.getLogger(ServicePrincipalCredentials.class);

    public static final String NAME = "ServicePrincipalCredentials";
    public static final String FLOW_SECRET = "client_secret";
    public static final String FLOW_CERTIFICATE = "client_certificate";

    static final String GRANT_TYPE = "client_credentials";
    static final String ASSERTION_TYPE = "urn:ietf:params:oauth:client-assertion-type:jwt-bearer";
    static final long ASSERTION_LIFETIME_SECONDS = 600;

    private final ServicePrincipalConfig config;
    private final HttpClient httpClient;
    private final AssertionSigner signer;
    private final RetryExecutor retryExecutor;
    private final URI tokenEndpoint;
    private final String logPrefix;

    public ServicePrincipalCredentials(ServicePrincipalConfig config) {
        this(config, null, BackoffScheduler.system(), Clock.systemUTC());
    }

    /**
     * @param httpClient transport to use; when null one is built from the truststore and priority string
     */
    public ServicePrincipalCredentials(ServicePrincipalConfig config, HttpClient httpClient, BackoffScheduler scheduler, Clock clock) {
        super(clock, Objects.requireNonNull(config, "config").getTokenLeeway());
        this.config = config;
        this.httpClient = httpClient != null
            ? httpClient
            : SslContexts.httpClient(config.getTruststore(), config.getPriorityString(), config.getRequestTimeout());
        this.signer = config.usesCertificate()
            ? CertificateAssertionSigner.fromPemFile(Path.of(config.getClientCertificatePath()))
            : null;
        this.retryExecutor = new RetryExecutor(config.getRetryPolicy(), RetryClassifier.transientFailures(),
            Objects.requireNonNull(scheduler, "scheduler"));
        this.tokenEndpoint = config.getResolvedAuthority().tokenEndpoint(config.getTenantId());
        this.logPrefix = config.getLogContext().isEmpty() ? "" : "[" + config.getLogContext() + "] ";
    }

    public ServicePrincipalCredentials(String tenantId, String clientId, String clientSecret, String clientCertificatePath,
                                       String authority, String truststore, String priorityString, String logContext) {
        this(ServicePrincipalConfig.builder()
            .tenantId(tenantId)
            .clientId(clientId)
            .clientSecret(clientSecret)
            .clientCertificatePath(clientCertificatePath)
            .authority(authority)
            .truststore(truststore)
            .priorityString(priorityString)
            .logContext(logContext)
            .build());
    }

    @Override
    public String name() {
        return NAME;
    }

    public ServicePrincipalConfig getConfig() {
        return config;
    }

    public URI getTokenEndpoint() {
        return tokenEndpoint;
    }

    public String getFlow() {
        return config.usesCertificate() ? FLOW_CERTIFICATE : FLOW_SECRET;
    }

    @Override
    protected CompletableFuture<AccessToken> fetch(ResourceScope scope) {
        String flow = getFlow();
        String host = config.getResolvedAuthority().host();

        String form;
        try {
            form = config.usesCertificate() ? certificateForm(scope) : secretForm(scope);
        } catch (KeyVaultException ex) {
            return CompletableFuture.failedFuture(new AuthenticationException(flow, host, ex));
        }

        logger.debug("{}Requesting token for {} from {} using {}", logPrefix, scope, host, flow);
        CompletableFuture<AccessToken> result = new CompletableFuture<>();
        CompletableFuture<byte[]> exchange = retryExecutor.execute(() -> post(form));
        exchange.whenComplete((body, error) -> {
            if (error != null) {
                Throwable failure = unwrap(error);
                if (failure instanceof MalformedTokenResponseException) {
                    result.completeExceptionally(failure);
                } else {
                    result.completeExceptionally(new AuthenticationException(flow, host, failure));
                }
                return;
            }
            try {
                AccessToken token = makeToken(body, scope);
                logger.debug("{}Obtained token for {} expiring at {}", logPrefix, scope, token.getExpiresAt());
                result.complete(token);
            } catch (MalformedTokenResponseException ex) {
                result.completeExceptionally(ex);
            } catch (RuntimeException ex) {
                result.completeExceptionally(new MalformedTokenResponseException("process token response: " + ex, ex));
            }
        });
        result.whenComplete((token, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(false);
            }
        });
        return result;
    }

    private CompletableFuture<byte[]> post(String form) {
        return HttpUtil.postForm(httpClient, tokenEndpoint, form, config.getRequestTimeout())
            .thenCompose(this::checkStatus);
    }

    private CompletableFuture<byte[]> checkStatus(HttpResponse<byte[]> response) {
        if (HttpUtil.isSuccess(response.statusCode())) {
            return CompletableFuture.completedFuture(response.body());
        }
        logger.debug("{}Token endpoint answered {}", logPrefix, response.statusCode());
        return CompletableFuture.failedFuture(TokenErrorDecoder.decode(response.statusCode(), response.body()));
    }

    String secretForm(ResourceScope scope) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", GRANT_TYPE);
        params.put("client_id", config.getClientId());
        params.put("client_secret", config.getClientSecret());
        params.put("scope", scope.toScopeParameter());
        return HttpUtil.formEncode(params);
    }

    String certificateForm(ResourceScope scope) throws KeyVaultException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", GRANT_TYPE);
        params.put("client_id", config.getClientId());
        params.put("client_assertion_type", ASSERTION_TYPE);
        params.put("client_assertion", signer.sign(assertionClaims()));
        params.put("scope", scope.toScopeParameter());
        return HttpUtil.formEncode(params);
    }

    Map<String, Object> assertionClaims() {
        long now = clock().instant().getEpochSecond();
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("aud", tokenEndpoint.toString());
        claims.put("iss", config.getClientId());
        claims.put("sub", config.getClientId());
        claims.put("jti", UUID.randomUUID().toString());
        claims.put("nbf", now);
        claims.put("iat", now);
        claims.put("exp", now + ASSERTION_LIFETIME_SECONDS);
        return claims;
    }

    AccessToken makeToken(byte[] body, ResourceScope scope) throws MalformedTokenResponseException {
        ObjectNode node;
        try {
            node = Json.readObject(body);
        } catch (IOException ex) {
            throw new MalformedTokenResponseException("token response is not a JSON object: " + ex.getMessage(), ex);
        }

        JsonNode accessToken = node.path("access_token");
        if (!accessToken.isTextual() || accessToken.asText().isBlank()) {
            throw new MalformedTokenResponseException("token response missing access_token");
        }

        long expiresIn = expiresIn(node.path("expires_in"));
        Instant expiresAt;
        try {
            expiresAt = clock().instant().plusSeconds(expiresIn);
        } catch (DateTimeException | ArithmeticException ex) {
            throw new MalformedTokenResponseException("token response has out of range expires_in: " + expiresIn, ex);
        }
        return new AccessToken(accessToken.asText(), expiresAt, scope);
    }

    private static long expiresIn(JsonNode value) throws MalformedTokenResponseException {
        long seconds;
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) {
                throw new MalformedTokenResponseException("token response has out of range expires_in: " + value.asText());
            }
            seconds = value.longValue();
        } else if (value.isTextual()) {
            try {
                seconds = Long.parseLong(value.asText().trim());
            } catch (NumberFormatException ex) {
                throw new MalformedTokenResponseException("token response has non-numeric expires_in: " + value.asText(), ex);
            }
        } else {
            throw new MalformedTokenResponseException("token response missing expires_in");
        }
        if (seconds <= 0) {
            throw new MalformedTokenResponseException("token response has non-positive expires_in: " + seconds);
        }
        return seconds;
    }

    @Override
    public String toString() {
        return NAME + "{" +
            "tenantId='" + config.getTenantId() + '\'' +
            ", clientId='" + config.getClientId() + '\'' +
            ", flow=" + getFlow() +
            ", authority=" + config.getResolvedAuthority() +
            '}';
    }
}
