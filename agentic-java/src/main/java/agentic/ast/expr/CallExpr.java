package agentic.ast.expr;

import agentic.ast.type.TypeRef;
import agentic.diag.SourceLocation;

import java.util.List;

public record CallExpr(
        Expr callee,
        List<TypeRef> typeArgs,
        List<Expr> args,
        SourceLocation loc
) implements Expr {

    /** Callee name when the callee is a plain identifier, else null. */
    public String calleeName() {
        return callee instanceof Identifier id ? id.name() : null;
    }
}
