package cloud.keyvault.sdk.encryption;

import cloud.keyvault.sdk.CredentialsConfigurationException;
import cloud.keyvault.sdk.auth.Credentials;
import cloud.keyvault.sdk.auth.ResourceScope;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Key provider backed by a remote key vault. Requests to the vault are authorized with bearer tokens obtained
 * from its {@link Credentials}.
 */
public final class AzureKeyProvider implements KeyProvider {

    static final String VAULT_DOMAIN = ".vault.azure.net";

    private final String name;
    private final Credentials credentials;
    private final String vaultName;
    private final String keyName;
    private final ResourceScope vaultScope;

    public AzureKeyProvider(String name, Credentials credentials, String masterKey, ResourceScope vaultScope) {
        this.name = Objects.requireNonNull(name, "name");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.vaultScope = Objects.requireNonNull(vaultScope, "vaultScope");

        Objects.requireNonNull(masterKey, "masterKey");
        int slash = masterKey.indexOf('/');
        if (slash <= 0 || slash == masterKey.length() - 1 || masterKey.indexOf('/', slash + 1) != -1) {
            throw new CredentialsConfigurationException("master key must be of the form <vault>/<key>: " + masterKey);
        }
        this.vaultName = masterKey.substring(0, slash);
        this.keyName = masterKey.substring(slash + 1);
    }

    @Override
    public String name() {
        return name;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public String getMasterKey() {
        return vaultName + "/" + keyName;
    }

    public String getKeyName() {
        return keyName;
    }

    /**
     * @return the vault host; a bare vault name is qualified with the public cloud vault domain
     */
    public String getVaultHost() {
        return vaultName.contains(".") ? vaultName : vaultName + VAULT_DOMAIN;
    }

    public ResourceScope getVaultScope() {
        return vaultScope;
    }

    /**
     * @return value for the {@code Authorization} header of a vault request
     */
    public CompletableFuture<String> authorization() {
        return credentials.accessToken(vaultScope).thenApply(token -> "Bearer " + token.getToken());
    }

    @Override
    public CompletableFuture<Void> validate() {
        return credentials.refresh(vaultScope).thenApply(token -> null);
    }

    @Override
    public String toString() {
        return "AzureKeyProvider{" +
            "name='" + name + '\'' +
            ", masterKey='" + getMasterKey() + '\'' +
            ", credentials=" + credentials +
            '}';
    }
}
