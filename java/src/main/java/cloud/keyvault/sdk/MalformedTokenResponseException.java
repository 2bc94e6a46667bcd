package cloud.keyvault.sdk;

/**
 * The token endpoint answered with a success status but the body could not be understood.
 */
public final class MalformedTokenResponseException extends KeyVaultException {

    private static final long serialVersionUID = 1L;

    public MalformedTokenResponseException(String message) {
        super(message);
    }

    public MalformedTokenResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
