package agentic.ast.stmt;

import agentic.ast.decl.VarDecl;
import agentic.diag.SourceLocation;

public record VarDeclStmt(VarDecl decl) implements Stmt {
    @Override
    public SourceLocation loc() {
        return decl.loc();
    }
}
