package agentic.ast.decl;

import agentic.diag.SourceLocation;

public sealed interface Decl
        permits ImportDecl, ExportFromDecl, ExportListDecl, ExportDefaultDecl,
        InterfaceDecl, TypeAliasDecl, VarDecl, FunctionDecl {

    SourceLocation loc();

    /** Name introduced into module scope, or null when the declaration binds nothing. */
    default String declaredName() {
        return null;
    }
}
