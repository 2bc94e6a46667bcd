package cloud.keyvault.sdk.signing;

import cloud.keyvault.sdk.CredentialsConfigurationException;
import cloud.keyvault.sdk.KeyVaultException;
import cloud.keyvault.sdk.internal.Json;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Signs client assertions as RS256 JWTs with the private key of an X.509 certificate. The certificate is identified
 * to the identity provider through the {@code x5t} header, the base64url SHA-1 thumbprint of its DER encoding.
 */
public final class CertificateAssertionSigner implements AssertionSigner {

    static final String ALGORITHM = "RS256";

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final PrivateKey privateKey;
    private final String thumbprint;

    public CertificateAssertionSigner(X509Certificate certificate, PrivateKey privateKey) {
        Objects.requireNonNull(certificate, "certificate");
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        if (!"RSA".equals(privateKey.getAlgorithm())) {
            throw new CredentialsConfigurationException("client certificate key must be RSA, got " + privateKey.getAlgorithm());
        }
        this.thumbprint = thumbprint(certificate);
    }

    /**
     * Loads a PEM file holding the client certificate followed, or preceded, by its PKCS#8 private key.
     */
    public static CertificateAssertionSigner fromPemFile(Path path) {
        try {
            String pem = Files.readString(path, StandardCharsets.UTF_8);
            List<X509Certificate> certs = PemReader.readCertificates(pem);
            if (certs.isEmpty()) {
                throw new CredentialsConfigurationException("no certificate found in " + path);
            }
            return new CertificateAssertionSigner(certs.get(0), PemReader.readRsaPrivateKey(pem));
        } catch (CredentialsConfigurationException ex) {
            throw ex;
        } catch (IOException | GeneralSecurityException | IllegalArgumentException ex) {
            throw new CredentialsConfigurationException("load client certificate " + path + ": " + ex.getMessage(), ex);
        }
    }

    public String getThumbprint() {
        return thumbprint;
    }

    @Override
    public String sign(Map<String, Object> claims) throws KeyVaultException {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", ALGORITHM);
        header.put("typ", "JWT");
        header.put("x5t", thumbprint);

        String signingInput;
        try {
            signingInput = encode(Json.mapper().writeValueAsBytes(header)) + "."
                + encode(Json.mapper().writeValueAsBytes(claims));
        } catch (JsonProcessingException ex) {
            throw new KeyVaultException("encode client assertion: " + ex.getOriginalMessage(), ex);
        }

        try {
            Signature signature = Signature.getInstance("SHA256withRSA");
            signature.initSign(privateKey);
            signature.update(signingInput.getBytes(StandardCharsets.US_ASCII));
            return signingInput + "." + encode(signature.sign());
        } catch (GeneralSecurityException ex) {
            throw new KeyVaultException("sign client assertion: " + ex.getMessage(), ex);
        }
    }

    private static String thumbprint(X509Certificate certificate) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(certificate.getEncoded());
            return encode(digest);
        } catch (GeneralSecurityException ex) {
            throw new CredentialsConfigurationException("compute certificate thumbprint: " + ex.getMessage(), ex);
        }
    }

    private static String encode(byte[] bytes) {
        return URL_ENCODER.encodeToString(bytes);
    }
}
