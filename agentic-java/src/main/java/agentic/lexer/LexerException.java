package agentic.lexer;

import agentic.diag.CompilationException;
import agentic.diag.SourceLocation;

public class LexerException extends CompilationException {
    public LexerException(String message, SourceLocation location) {
        super(message, location);
    }
}
