package work.strata.core.id;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.function.Supplier;
import work.strata.core.error.DecodingException;
import work.strata.core.error.EncodingException;

/**
 * Encodes payloads into opaque identity strings and back.
 *
 * <p>An identity is the URL-safe base64 (unpadded) form of {@code {"payload": ..., "v": 1}} written
 * with sorted properties and sorted map keys, so structurally equal payloads always share one
 * identity. The empty string is reserved for the scratch value of each payload type.
 */
public final class IdCodec {
    public static final int VERSION = 1;

    private static final ObjectMapper JSON = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private IdCodec() {}

    public static String encode(Object payload) {
        var envelope = new LinkedHashMap<String, Object>();
        envelope.put("payload", payload);
        envelope.put("v", VERSION);
        try {
            return ENCODER.encodeToString(JSON.writeValueAsBytes(envelope));
        } catch (JsonProcessingException ex) {
            throw new EncodingException("unable to encode " + describe(payload) + ": " + ex.getOriginalMessage(), ex);
        }
    }

    public static <T> T decode(String id, Class<T> type, Supplier<T> scratch) {
        if (id == null || id.isEmpty()) {
            return scratch.get();
        }
        byte[] raw;
        try {
            raw = DECODER.decode(id);
        } catch (IllegalArgumentException ex) {
            throw new DecodingException("malformed " + type.getSimpleName() + " id: " + ex.getMessage(), ex);
        }
        try {
            JsonNode envelope = JSON.readTree(raw);
            if (envelope == null || !envelope.isObject()) {
                throw new DecodingException("malformed " + type.getSimpleName() + " id: not an envelope");
            }
            JsonNode version = envelope.get("v");
            if (version == null || !version.isInt() || version.intValue() != VERSION) {
                throw new DecodingException("unsupported " + type.getSimpleName() + " id version: " + version);
            }
            JsonNode payload = envelope.get("payload");
            if (payload == null || !payload.isObject()) {
                throw new DecodingException("malformed " + type.getSimpleName() + " id: missing payload");
            }
            return JSON.treeToValue(payload, type);
        } catch (IOException ex) {
            throw new DecodingException("malformed " + type.getSimpleName() + " id: " + ex.getMessage(), ex);
        }
    }

    /**
     * Pretty JSON rendering of a decoded payload, for diagnostics.
     */
    public static String describe(Object payload) {
        if (payload == null) {
            return "null";
        }
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            return payload.getClass().getSimpleName();
        }
    }
}
