package cloud.keyvault.sdk.signing;

import cloud.keyvault.sdk.CredentialsConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CertificateAssertionSignerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Path resource(String name) throws Exception {
        return Path.of(CertificateAssertionSignerTest.class.getResource(name).toURI());
    }

    private static X509Certificate certificate() throws Exception {
        return PemReader.readCertificates(Files.readString(resource("/truststore.pem"))).get(0);
    }

    @Test
    void signsVerifiableRs256Assertion() throws Exception {
        CertificateAssertionSigner signer = CertificateAssertionSigner.fromPemFile(resource("/client-cert.pem"));

        String jwt = signer.sign(Map.of("iss", "client", "aud", "https://login.example.com/t/oauth2/v2.0/token"));

        String[] parts = jwt.split("\\.");
        assertEquals(3, parts.length);
        JsonNode header = MAPPER.readTree(Base64.getUrlDecoder().decode(parts[0]));
        JsonNode claims = MAPPER.readTree(Base64.getUrlDecoder().decode(parts[1]));
        assertEquals("RS256", header.path("alg").asText());
        assertEquals("JWT", header.path("typ").asText());
        assertEquals(signer.getThumbprint(), header.path("x5t").asText());
        assertEquals("client", claims.path("iss").asText());

        Signature verifier = Signature.getInstance("SHA256withRSA");
        verifier.initVerify(certificate().getPublicKey());
        verifier.update((parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII));
        assertTrue(verifier.verify(Base64.getUrlDecoder().decode(parts[2])));
    }

    @Test
    void thumbprintIsSha1OfDerCertificate() throws Exception {
        CertificateAssertionSigner signer = CertificateAssertionSigner.fromPemFile(resource("/client-cert.pem"));

        byte[] digest = MessageDigest.getInstance("SHA-1").digest(certificate().getEncoded());
        assertEquals(Base64.getUrlEncoder().withoutPadding().encodeToString(digest), signer.getThumbprint());
    }

    @Test
    void rejectsTraditionalKeyFormat() {
        CredentialsConfigurationException ex = assertThrows(CredentialsConfigurationException.class,
            () -> CertificateAssertionSigner.fromPemFile(resource("/client-cert-traditional.pem")));
        assertTrue(ex.getMessage().contains("PKCS#8"));
    }

    @Test
    void rejectsFileWithoutKey() {
        assertThrows(CredentialsConfigurationException.class,
            () -> CertificateAssertionSigner.fromPemFile(resource("/truststore.pem")));
    }

    @Test
    void rejectsFileWithoutCertificate(@TempDir Path dir) throws Exception {
        Path empty = dir.resolve("empty.pem");
        Files.writeString(empty, "nothing here");

        assertThrows(CredentialsConfigurationException.class, () -> CertificateAssertionSigner.fromPemFile(empty));
    }

    @Test
    void rejectsNonRsaKeys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(256);

        assertThrows(CredentialsConfigurationException.class,
            () -> new CertificateAssertionSigner(certificate(), generator.generateKeyPair().getPrivate()));
    }
}
