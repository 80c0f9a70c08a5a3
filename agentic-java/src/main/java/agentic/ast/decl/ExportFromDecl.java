package agentic.ast.decl;

import agentic.diag.SourceLocation;

import java.util.List;

/** {@code export { a, b as c } from './x'} or {@code export * from './x'}. */
public record ExportFromDecl(
        String source,
        List<Specifier> specifiers,
        boolean star,
        SourceLocation loc
) implements Decl {}
