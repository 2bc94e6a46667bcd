package cloud.keyvault.sdk.internal;

import cloud.keyvault.sdk.CredentialsConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SslContextsTest {

    @Test
    void parsesPriorityString() {
        assertTrue(SslContexts.cipherSuites(null).isEmpty());
        assertTrue(SslContexts.cipherSuites("NORMAL").isEmpty());
        assertEquals(List.of("TLS_AES_128_GCM_SHA256", "TLS_AES_256_GCM_SHA384"),
            SslContexts.cipherSuites("TLS_AES_128_GCM_SHA256: TLS_AES_256_GCM_SHA384,"));
    }

    @Test
    void buildsClientWithTruststoreAndCipherSuites() throws Exception {
        Path truststore = Path.of(SslContextsTest.class.getResource("/truststore.pem").toURI());

        HttpClient client = SslContexts.httpClient(truststore.toString(), "TLS_AES_128_GCM_SHA256", Duration.ofSeconds(3));

        assertNotNull(client.sslContext());
        assertArrayEquals(new String[] {"TLS_AES_128_GCM_SHA256"}, client.sslParameters().getCipherSuites());
        assertEquals(Duration.ofSeconds(3), client.connectTimeout().orElseThrow());
    }

    @Test
    void rejectsTruststoreWithoutCertificates(@TempDir Path dir) throws Exception {
        Path empty = dir.resolve("empty.pem");
        Files.writeString(empty, "");

        assertThrows(CredentialsConfigurationException.class, () -> SslContexts.httpClient(empty.toString(), null, Duration.ofSeconds(1)));
        assertThrows(CredentialsConfigurationException.class,
            () -> SslContexts.httpClient(dir.resolve("missing.pem").toString(), null, Duration.ofSeconds(1)));
    }
}
