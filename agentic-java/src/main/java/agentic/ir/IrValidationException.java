package agentic.ir;

import agentic.diag.CompilationException;
import agentic.diag.SourceLocation;

/** A tree violates a construction rule of the IR. */
public class IrValidationException extends CompilationException {
    public IrValidationException(String message) {
        super(message, null);
    }

    public IrValidationException(String message, SourceLocation location, Throwable cause) {
        super(message, location, cause);
    }
}
