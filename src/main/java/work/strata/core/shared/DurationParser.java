package work.strata.core.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses deadlines written the way the CLI and {@code strata.toml} accept them: {@code 250ms},
 * {@code 30s}, {@code 2m}, {@code 1h}, {@code 1d}; a bare number is milliseconds.
 */
public final class DurationParser {
    private static final Pattern FORMAT = Pattern.compile("(\\d+)(ms|s|m|h|d)?");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var matcher = FORMAT.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + raw + " (expected e.g. 500ms, 30s, 2m, 1h)");
        }
        long value = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        switch (unit) {
            case "s":
                return Optional.of(Duration.ofSeconds(value));
            case "m":
                return Optional.of(Duration.ofMinutes(value));
            case "h":
                return Optional.of(Duration.ofHours(value));
            case "d":
                return Optional.of(Duration.ofDays(value));
            default:
                return Optional.of(Duration.ofMillis(value));
        }
    }
}
