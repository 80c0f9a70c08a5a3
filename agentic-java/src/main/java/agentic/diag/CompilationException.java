package agentic.diag;

/**
 * Base of every fatal error raised while compiling a unit. Carries the location of the
 * offending construct when one is known.
 */
public class CompilationException extends RuntimeException {
    private final SourceLocation location;
    private final String detail;

    public CompilationException(String message, SourceLocation location) {
        super(location == null ? message : location.render() + ": " + message);
        this.location = location;
        this.detail = message;
    }

    public CompilationException(String message, SourceLocation location, Throwable cause) {
        super(location == null ? message : location.render() + ": " + message, cause);
        this.location = location;
        this.detail = message;
    }

    public SourceLocation location() {
        return location;
    }

    /** Message without the location prefix. */
    public String detail() {
        return detail;
    }
}
