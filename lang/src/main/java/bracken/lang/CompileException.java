package bracken.lang;

import lombok.Getter;

/**
 * Base class of every failure raised while compiling a source text.
 * Nothing below the CLI catches these; the first one aborts the run.
 */
public abstract class CompileException extends RuntimeException {
    @Getter
    private final Token.Location location;

    CompileException(Token.Location location, String message) {
        super(message);
        this.location = location;
    }

    CompileException(Token.Location location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * Short name of the compilation stage that raised this error, used as the
     * prefix of CLI diagnostics.
     */
    public abstract String stage();
}
