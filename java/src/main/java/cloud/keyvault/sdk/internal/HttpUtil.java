package cloud.keyvault.sdk.internal;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Helper methods for issuing form encoded HTTP requests.
 */
public final class HttpUtil {

    public static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private HttpUtil() {
    }

    /**
     * Encodes the parameters in iteration order. Null values are skipped.
     */
    public static String formEncode(Map<String, String> params) {
        StringBuilder form = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (form.length() > 0) {
                form.append('&');
            }
            form.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return form.toString();
    }

    public static CompletableFuture<HttpResponse<byte[]>> postForm(HttpClient client, URI uri, String form, Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
            .header("Content-Type", FORM_CONTENT_TYPE)
            .header("Accept", "application/json")
            .timeout(timeout)
            .build();
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
    }

    public static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
