package agentic.emitter;

import agentic.diag.CompilationException;
import agentic.diag.SourceLocation;

public class EmitException extends CompilationException {
    public EmitException(String message) {
        super(message, null);
    }

    public EmitException(String message, SourceLocation location) {
        super(message, location);
    }

    public EmitException(String message, SourceLocation location, Throwable cause) {
        super(message, location, cause);
    }
}
