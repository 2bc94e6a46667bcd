package cloud.keyvault.sdk.auth;

import cloud.keyvault.sdk.CredentialsConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Identity provider endpoint: host, port and whether TLS is used.
 */
public record Authority(String host, int port, boolean secured) {

    public static final String DEFAULT_HOST = "login.microsoftonline.com";
    public static final Authority DEFAULT = new Authority(DEFAULT_HOST, 443, true);

    static final String TOKEN_PATH_TEMPLATE = "/%s/oauth2/v2.0/token";

    public Authority {
        if (host == null || host.isBlank()) {
            throw new CredentialsConfigurationException("authority host must be non-empty");
        }
        if (port < 1 || port > 65535) {
            throw new CredentialsConfigurationException("authority port out of range: " + port);
        }
    }

    /**
     * Parses {@code [scheme://]host[:port]}. The scheme defaults to {@code https}; a missing port defaults to the
     * scheme's well-known port.
     */
    public static Authority parse(String authority) {
        if (authority == null || authority.isBlank()) {
            return DEFAULT;
        }
        String trimmed = authority.trim();
        String withScheme = trimmed.contains("://") ? trimmed : "https://" + trimmed;
        URI uri;
        try {
            uri = new URI(withScheme);
        } catch (URISyntaxException ex) {
            throw new CredentialsConfigurationException("invalid authority: " + trimmed, ex);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        boolean secured;
        switch (scheme) {
            case "https":
                secured = true;
                break;
            case "http":
                secured = false;
                break;
            default:
                throw new CredentialsConfigurationException("unsupported authority scheme: " + uri.getScheme());
        }
        if (uri.getHost() == null) {
            throw new CredentialsConfigurationException("authority must include a host: " + trimmed);
        }
        if (uri.getRawPath() != null && !uri.getRawPath().isEmpty() && !uri.getRawPath().equals("/")) {
            throw new CredentialsConfigurationException("authority must not include a path: " + trimmed);
        }
        int port = uri.getPort() == -1 ? (secured ? 443 : 80) : uri.getPort();
        return new Authority(uri.getHost(), port, secured);
    }

    public URI tokenEndpoint(String tenantId) {
        String scheme = secured ? "https" : "http";
        return URI.create(scheme + "://" + host + ":" + port + String.format(TOKEN_PATH_TEMPLATE, tenantId));
    }

    @Override
    public String toString() {
        return (secured ? "https" : "http") + "://" + host + ":" + port;
    }
}
