package cloud.keyvault.sdk.encryption;

/**
 * Creates key providers from user supplied options.
 *
 * <p>Factories are stateless. Returned providers may be shared with other callers that asked for the same options,
 * so callers must not assume exclusive ownership.
 */
public interface KeyProviderFactory {

    /**
     * @throws cloud.keyvault.sdk.CredentialsConfigurationException when the options are incomplete or ambiguous
     */
    KeyProvider provider(EncryptionContext context, KeyProviderOptions options);
}
