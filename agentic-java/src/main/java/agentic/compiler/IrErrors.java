package agentic.compiler;

import agentic.diag.SourceLocation;
import agentic.ir.IrValidationException;

import java.util.function.Supplier;

/** Attaches a source location to IR construction errors raised without one. */
final class IrErrors {
    private IrErrors() {}

    static <T> T at(SourceLocation loc, Supplier<T> build) {
        try {
            return build.get();
        } catch (IrValidationException e) {
            if (e.location() != null) throw e;
            throw new IrValidationException(e.detail(), loc, e);
        }
    }
}
