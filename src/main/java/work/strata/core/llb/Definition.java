package work.strata.core.llb;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Marshaled, engine-consumable form of a lazy state: canonical node documents in dependency order,
 * the last one pointing at the output that the definition stands for. An empty node list is the
 * canonical empty filesystem.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Definition(List<String> nodes) {
    private static final Definition EMPTY = new Definition(List.of());

    public Definition {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public static Definition empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Content digest of the whole graph. The terminal node embeds the digests of its inputs, so
     * hashing it is enough.
     */
    @JsonIgnore
    public String digest() {
        return sha256(nodes.isEmpty() ? "" : nodes.get(nodes.size() - 1));
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder("sha256:");
            for (byte b : hashed) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", ex);
        }
    }
}
