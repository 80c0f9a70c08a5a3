package agentic.ast.decl;

import agentic.diag.SourceLocation;

import java.util.List;

public record ExportListDecl(
        List<Specifier> specifiers,
        SourceLocation loc
) implements Decl {}
