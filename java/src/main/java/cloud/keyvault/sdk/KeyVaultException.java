package cloud.keyvault.sdk;

/**
 * Base exception thrown by the key vault SDK.
 */
public class KeyVaultException extends Exception {

    private static final long serialVersionUID = 1L;

    public KeyVaultException(String message) {
        super(message);
    }

    public KeyVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
