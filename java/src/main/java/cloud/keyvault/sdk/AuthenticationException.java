package cloud.keyvault.sdk;

/**
 * Raised when a credential refresh could not obtain a token. The cause carries the last error observed, either
 * the identity provider's rejection or the transient failure that exhausted the retry budget.
 */
public class AuthenticationException extends KeyVaultException {

    private static final long serialVersionUID = 1L;

    private final String flow;
    private final String host;

    public AuthenticationException(String flow, String host, Throwable cause) {
        super(flow + " authentication against " + host + " failed: " + describe(cause), cause);
        this.flow = flow;
        this.host = host;
    }

    /**
     * @return authentication flow that was attempted, e.g. {@code client_secret}.
     */
    public String getFlow() {
        return flow;
    }

    /**
     * @return identity provider host the request was sent to.
     */
    public String getHost() {
        return host;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
