package work.strata.core.error;

public final class ExitCodeParseException extends StrataException {
    public ExitCodeParseException(String content, Throwable cause) {
        super("parse_error", "exit code is not an integer: \"" + content + "\"", content, cause);
    }
}
