package cloud.keyvault.sdk;

/**
 * Invalid or ambiguous credential configuration, reported while objects are being built.
 */
public class CredentialsConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public CredentialsConfigurationException(String message) {
        super(message);
    }

    public CredentialsConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
