package work.strata.core.llb;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Locale;
import java.util.Objects;

/**
 * Target platform constraint (os/architecture[/variant]) attached to marshaled graph nodes.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Platform(String os, String architecture, String variant) {
    public static final Platform DEFAULT = new Platform("linux", "amd64", null);

    public Platform {
        Objects.requireNonNull(os, "os");
        Objects.requireNonNull(architecture, "architecture");
        variant = variant == null || variant.isBlank() ? null : variant;
    }

    public static Platform parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        String[] parts = raw.trim().toLowerCase(Locale.ROOT).split("/");
        if (parts.length < 2 || parts.length > 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new IllegalArgumentException("Unsupported platform: " + raw + " (expected os/arch[/variant])");
        }
        return new Platform(parts[0], parts[1], parts.length == 3 ? parts[2] : null);
    }

    public String format() {
        return variant == null ? os + "/" + architecture : os + "/" + architecture + "/" + variant;
    }

    @Override
    public String toString() {
        return format();
    }
}
