package agentic.parser;

import agentic.diag.CompilationException;
import agentic.diag.SourceLocation;

public class ParseException extends CompilationException {
    public ParseException(String message, SourceLocation location) {
        super(message, location);
    }
}
