package agentic.ast.decl;

import agentic.ast.stmt.BlockStmt;
import agentic.ast.type.TypeRef;
import agentic.diag.SourceLocation;

import java.util.List;

public record FunctionDecl(
        String name,
        boolean exported,
        boolean isDefault,
        List<Param> params,
        BlockStmt body,
        SourceLocation loc
) implements Decl {

    public record Param(String name, TypeRef type) {}

    @Override
    public String declaredName() {
        return name;
    }
}
