package agentic.ast.decl;

import agentic.ast.type.TypeRef;
import agentic.diag.SourceLocation;

/** Property signature inside an interface or object type literal. */
public record FieldDecl(
        String name,
        TypeRef type,
        boolean optional,
        SourceLocation loc
) {}
