package agentic.sema;

import agentic.diag.CompilationException;
import agentic.diag.SourceLocation;

public class ResolveException extends CompilationException {
    public ResolveException(String message, SourceLocation location) {
        super(message, location);
    }

    public ResolveException(String message, SourceLocation location, Throwable cause) {
        super(message, location, cause);
    }
}
