package agentic.ast.decl;

import agentic.diag.SourceLocation;

import java.util.List;

public record InterfaceDecl(
        String name,
        boolean exported,
        List<String> parents,
        List<FieldDecl> fields,
        SourceLocation loc
) implements Decl {
    @Override
    public String declaredName() {
        return name;
    }
}
