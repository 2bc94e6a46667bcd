package cloud.keyvault.sdk.encryption;

import cloud.keyvault.sdk.AuthenticationException;
import cloud.keyvault.sdk.CredentialsConfigurationException;
import cloud.keyvault.sdk.auth.EnvironmentCredentialsResolver;
import cloud.keyvault.sdk.auth.ResourceScope;
import cloud.keyvault.sdk.auth.ServicePrincipalConfig;
import cloud.keyvault.sdk.auth.ServicePrincipalCredentials;
import cloud.keyvault.sdk.retry.RecordingScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AzureKeyProviderFactoryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private String authority;
    private final AtomicInteger tokenRequestCount = new AtomicInteger();
    private final AtomicReference<String> lastForm = new AtomicReference<>();
    private final SimpleEncryptionContext context = new SimpleEncryptionContext(new RecordingScheduler(), Clock.systemUTC());
    private final AzureKeyProviderFactory factory = new AzureKeyProviderFactory(new EnvironmentCredentialsResolver(name -> null));

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/tenant/oauth2/v2.0/token", this::handleToken);
        server.start();
        authority = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private Map<String, String> options() {
        Map<String, String> options = new HashMap<>();
        options.put(AzureKeyProviderFactory.MASTER_KEY, "myvault/mykey");
        options.put(AzureKeyProviderFactory.TENANT_ID, "tenant");
        options.put(AzureKeyProviderFactory.CLIENT_ID, "client");
        options.put(AzureKeyProviderFactory.CLIENT_SECRET, "secret");
        options.put(AzureKeyProviderFactory.AUTHORITY_HOST, authority);
        return options;
    }

    @Test
    void buildsProviderWithoutNetworkCalls() {
        KeyProvider provider = factory.provider(context, KeyProviderOptions.of(options()));

        AzureKeyProvider azure = assertInstanceOf(AzureKeyProvider.class, provider);
        assertEquals("myvault/mykey", azure.name());
        assertEquals("mykey", azure.getKeyName());
        assertEquals("myvault.vault.azure.net", azure.getVaultHost());
        assertEquals(ResourceScope.AZURE_KEY_VAULT, azure.getVaultScope());
        assertEquals(ServicePrincipalCredentials.NAME, azure.getCredentials().name());
        assertEquals(0, tokenRequestCount.get());
    }

    @Test
    void sameOptionsShareProvider() {
        KeyProvider first = factory.provider(context, KeyProviderOptions.of(options()));
        KeyProvider second = factory.provider(context, KeyProviderOptions.of(options()));

        Map<String, String> other = options();
        other.put(AzureKeyProviderFactory.MASTER_KEY, "myvault/otherkey");
        KeyProvider third = factory.provider(context, KeyProviderOptions.of(other));

        assertSame(first, second);
        assertNotSame(first, third);
        assertEquals(2, context.providerCount());
    }

    @Test
    void secretsWithSeparatorsGetTheirOwnProvider() {
        Map<String, String> embedded = options();
        embedded.put(AzureKeyProviderFactory.CLIENT_SECRET, "a;b=c");
        Map<String, String> split = options();
        split.put(AzureKeyProviderFactory.CLIENT_SECRET, "a");
        split.put("b", "c");

        AzureKeyProvider first = (AzureKeyProvider) factory.provider(context, KeyProviderOptions.of(embedded));
        AzureKeyProvider second = (AzureKeyProvider) factory.provider(context, KeyProviderOptions.of(split));

        assertNotSame(first, second);
        assertEquals("a", ((ServicePrincipalCredentials) second.getCredentials()).getConfig().getClientSecret());
        assertEquals(2, context.providerCount());
    }

    @Test
    void authorizationUsesCachedBearerToken() throws Exception {
        AzureKeyProvider provider = (AzureKeyProvider) factory.provider(context, KeyProviderOptions.of(options()));

        String header = provider.authorization().get(10, TimeUnit.SECONDS);
        String again = provider.authorization().get(10, TimeUnit.SECONDS);

        assertEquals("Bearer token-1", header);
        assertEquals(header, again);
        assertEquals(1, tokenRequestCount.get());
        assertTrue(lastForm.get().contains("scope=https%3A%2F%2Fvault.azure.net%2F.default"));
    }

    @Test
    void validateForcesRefresh() throws Exception {
        AzureKeyProvider provider = (AzureKeyProvider) factory.provider(context, KeyProviderOptions.of(options()));

        provider.authorization().get(10, TimeUnit.SECONDS);
        provider.validate().get(10, TimeUnit.SECONDS);

        assertEquals(2, tokenRequestCount.get());
    }

    @Test
    void validateReportsRejectedCredentials() {
        Map<String, String> options = options();
        options.put(AzureKeyProviderFactory.CLIENT_SECRET, "wrong");
        KeyProvider provider = factory.provider(context, KeyProviderOptions.of(options));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> provider.validate().get(10, TimeUnit.SECONDS));

        assertInstanceOf(AuthenticationException.class, ex.getCause());
        assertEquals(1, tokenRequestCount.get());
    }

    @Test
    void customVaultResourceIsUsedAsScope() throws Exception {
        Map<String, String> options = options();
        options.put(AzureKeyProviderFactory.VAULT_RESOURCE, "https://vault.azure.cn");
        AzureKeyProvider provider = (AzureKeyProvider) factory.provider(context, KeyProviderOptions.of(options));

        provider.authorization().get(10, TimeUnit.SECONDS);

        assertTrue(lastForm.get().contains("scope=https%3A%2F%2Fvault.azure.cn%2F.default"));
    }

    @Test
    void rejectsAmbiguousAuthentication() {
        Map<String, String> options = options();
        options.put(AzureKeyProviderFactory.CLIENT_CERTIFICATE_PATH, "/etc/certs/client.pem");

        CredentialsConfigurationException ex = assertThrows(CredentialsConfigurationException.class,
            () -> factory.provider(context, KeyProviderOptions.of(options)));
        assertTrue(ex.getMessage().contains("exactly one"));
        assertEquals(0, context.providerCount());
    }

    @Test
    void rejectsMissingAuthentication() {
        Map<String, String> options = options();
        options.remove(AzureKeyProviderFactory.CLIENT_SECRET);

        assertThrows(CredentialsConfigurationException.class,
            () -> factory.provider(context, KeyProviderOptions.of(options)));
    }

    @Test
    void rejectsMalformedOptions() {
        Map<String, String> noKey = options();
        noKey.remove(AzureKeyProviderFactory.MASTER_KEY);
        assertThrows(CredentialsConfigurationException.class, () -> factory.provider(context, KeyProviderOptions.of(noKey)));

        Map<String, String> badKey = options();
        badKey.put(AzureKeyProviderFactory.MASTER_KEY, "vault-only");
        assertThrows(CredentialsConfigurationException.class, () -> factory.provider(context, KeyProviderOptions.of(badKey)));

        Map<String, String> badTimeout = options();
        badTimeout.put(AzureKeyProviderFactory.REQUEST_TIMEOUT_MS, "soon");
        assertThrows(CredentialsConfigurationException.class, () -> factory.provider(context, KeyProviderOptions.of(badTimeout)));

        Map<String, String> badAttempts = options();
        badAttempts.put(AzureKeyProviderFactory.MAX_ATTEMPTS, "0");
        assertThrows(CredentialsConfigurationException.class, () -> factory.provider(context, KeyProviderOptions.of(badAttempts)));
    }

    @Test
    void appliesRetryAndTimeoutOptions() {
        Map<String, String> options = options();
        options.put(AzureKeyProviderFactory.REQUEST_TIMEOUT_MS, "2500");
        options.put(AzureKeyProviderFactory.MAX_ATTEMPTS, "2");

        ServicePrincipalConfig config = factory.config(KeyProviderOptions.of(options));

        assertEquals(2500, config.getRequestTimeout().toMillis());
        assertEquals(2, config.getRetryPolicy().maxAttempts());
    }

    @Test
    void fallsBackToEnvironment() {
        Map<String, String> env = Map.of(
            "AZURE_TENANT_ID", "tenant",
            "AZURE_CLIENT_ID", "env-client",
            "AZURE_CLIENT_SECRET", "env-secret");
        AzureKeyProviderFactory envFactory = new AzureKeyProviderFactory(new EnvironmentCredentialsResolver(env::get));

        ServicePrincipalConfig config = envFactory.config(KeyProviderOptions.of(Map.of(
            AzureKeyProviderFactory.MASTER_KEY, "myvault/mykey")));

        assertEquals("tenant", config.getTenantId());
        assertEquals("env-client", config.getClientId());
        assertEquals("env-secret", config.getClientSecret());
    }

    private void handleToken(HttpExchange exchange) throws IOException {
        int call = tokenRequestCount.incrementAndGet();
        String form = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        lastForm.set(form);
        if (form.contains("client_secret=wrong")) {
            respond(exchange, 401, Map.of("error", "invalid_client"));
            return;
        }
        respond(exchange, 200, Map.of("access_token", "token-" + call, "expires_in", 3600, "token_type", "Bearer"));
    }

    private static void respond(HttpExchange exchange, int status, Map<String, ?> body) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
