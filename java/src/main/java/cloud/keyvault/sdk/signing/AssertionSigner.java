package cloud.keyvault.sdk.signing;

import cloud.keyvault.sdk.KeyVaultException;

import java.util.Map;

/**
 * Turns a set of JWT claims into a signed client assertion.
 */
public interface AssertionSigner {

    String sign(Map<String, Object> claims) throws KeyVaultException;
}
