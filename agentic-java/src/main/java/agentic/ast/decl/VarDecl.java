package agentic.ast.decl;

import agentic.ast.expr.Expr;
import agentic.ast.type.TypeRef;
import agentic.diag.SourceLocation;

public record VarDecl(
        String name,
        boolean exported,
        boolean constant,
        TypeRef type,
        Expr initializer,
        SourceLocation loc
) implements Decl {
    @Override
    public String declaredName() {
        return name;
    }
}
