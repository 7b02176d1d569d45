package work.strata.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Optional knobs of an exec. {@code null} means "not requested".
 */
public record ExecOptions(String stdin, String redirectStdout, String redirectStderr) {
    public static final ExecOptions NONE = new ExecOptions(null, null, null);

    public enum Option {
        STDIN("stdin"),
        REDIRECT_STDOUT("redirectStdout"),
        REDIRECT_STDERR("redirectStderr");

        private final String field;

        Option(String field) {
            this.field = field;
        }

        public String field() {
            return field;
        }
    }

    public Set<Option> requested() {
        Set<Option> options = EnumSet.noneOf(Option.class);
        if (stdin != null) {
            options.add(Option.STDIN);
        }
        if (redirectStdout != null) {
            options.add(Option.REDIRECT_STDOUT);
        }
        if (redirectStderr != null) {
            options.add(Option.REDIRECT_STDERR);
        }
        return options;
    }
}
