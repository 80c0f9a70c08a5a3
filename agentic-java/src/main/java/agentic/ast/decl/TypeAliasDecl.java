package agentic.ast.decl;

import agentic.ast.type.TypeRef;
import agentic.diag.SourceLocation;

public record TypeAliasDecl(
        String name,
        boolean exported,
        TypeRef type,
        SourceLocation loc
) implements Decl {
    @Override
    public String declaredName() {
        return name;
    }
}
