package cloud.keyvault.sdk;

/**
 * Exception representing an error response from the token endpoint. The identity provider reports OAuth errors as
 * {@code error} and {@code error_description}; both are kept when present so callers can tell a disabled principal
 * from an expired secret.
 */
public final class TokenRequestException extends KeyVaultException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String errorCode;

    public TokenRequestException(int statusCode, String errorCode, String description) {
        super(description == null || description.isBlank() ? defaultMessage(statusCode, errorCode) : description);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    /**
     * @return HTTP status code returned by the token endpoint.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return OAuth error code (nullable when the response body did not include one).
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return true for server-side failures that may succeed on a later attempt.
     */
    public boolean isTransient() {
        return statusCode >= 500;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "token request failed with status " + status;
        }
        return "token request failed with status " + status + " (" + code + ")";
    }
}
