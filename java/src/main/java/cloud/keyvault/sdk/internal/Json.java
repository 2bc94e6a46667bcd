package cloud.keyvault.sdk.internal;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * ObjectMapper shared by the token exchange and assertion signing.
 *
 * <p>Identity provider payloads are read strictly: a body with a repeated member or with content after the top-level
 * value is rejected rather than resolved in favour of one of its readings.
 */
public final class Json {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses a response body that must hold a single JSON object.
     *
     * @throws IOException when the body is empty, is not JSON, or holds something other than an object
     */
    public static ObjectNode readObject(byte[] body) throws IOException {
        return MAPPER.readValue(body, ObjectNode.class);
    }
}
