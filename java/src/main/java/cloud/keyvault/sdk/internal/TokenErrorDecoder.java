package cloud.keyvault.sdk.internal;

import cloud.keyvault.sdk.TokenRequestException;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding OAuth error payloads returned by the identity provider.
 */
public final class TokenErrorDecoder {

    private TokenErrorDecoder() {
    }

    public static TokenRequestException decode(int statusCode, byte[] body) {
        if (body == null || body.length == 0) {
            return new TokenRequestException(statusCode, null, null);
        }

        try {
            ObjectNode node = Json.readObject(body);
            String code = node.hasNonNull("error") ? node.get("error").asText() : null;
            String description = node.hasNonNull("error_description") ? node.get("error_description").asText() : null;
            return new TokenRequestException(statusCode, code, description);
        } catch (IOException ex) {
            String fallback = new String(body, StandardCharsets.UTF_8);
            return new TokenRequestException(statusCode, null, fallback);
        }
    }
}
