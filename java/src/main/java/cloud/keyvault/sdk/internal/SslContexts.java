package cloud.keyvault.sdk.internal;

import cloud.keyvault.sdk.CredentialsConfigurationException;
import cloud.keyvault.sdk.signing.PemReader;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.TrustManagerFactory;

/**
 * Builds TLS-aware HTTP clients from the truststore and priority string options.
 *
 * <p>The priority string is a list of JSSE cipher suite names separated by {@code :} or {@code ,}. A blank
 * value, or the keyword {@code NORMAL}, keeps the JVM defaults.
 */
public final class SslContexts {

    private SslContexts() {
    }

    public static HttpClient httpClient(String truststore, String priorityString, Duration connectTimeout) {
        HttpClient.Builder builder = HttpClient.newBuilder().connectTimeout(connectTimeout);
        if (truststore != null && !truststore.isBlank()) {
            builder.sslContext(sslContext(truststore));
        }
        List<String> suites = cipherSuites(priorityString);
        if (!suites.isEmpty()) {
            SSLParameters parameters = new SSLParameters();
            parameters.setCipherSuites(suites.toArray(new String[0]));
            builder.sslParameters(parameters);
        }
        return builder.build();
    }

    static SSLContext sslContext(String truststore) {
        try {
            String pem = Files.readString(Path.of(truststore), StandardCharsets.UTF_8);
            List<X509Certificate> certs = PemReader.readCertificates(pem);
            if (certs.isEmpty()) {
                throw new CredentialsConfigurationException("no certificates found in truststore " + truststore);
            }

            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            for (int i = 0; i < certs.size(); i++) {
                trustStore.setCertificateEntry("ca-" + i, certs.get(i));
            }

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, tmf.getTrustManagers(), new SecureRandom());
            return context;
        } catch (IOException | GeneralSecurityException ex) {
            throw new CredentialsConfigurationException("load truststore " + truststore + ": " + ex.getMessage(), ex);
        }
    }

    static List<String> cipherSuites(String priorityString) {
        if (priorityString == null || priorityString.isBlank()
            || priorityString.trim().toUpperCase(Locale.ROOT).equals("NORMAL")) {
            return List.of();
        }
        return Arrays.stream(priorityString.split("[:,]"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
