package work.strata.core.error;

/**
 * The registry answered with bytes that are not an image configuration document.
 */
public final class ConfigParseException extends StrataException {
    public ConfigParseException(String reference, Throwable cause) {
        super("config_parse_error", "malformed image config for " + reference + ": " + cause.getMessage(), reference, cause);
    }
}
