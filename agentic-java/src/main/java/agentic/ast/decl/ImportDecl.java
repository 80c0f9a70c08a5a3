package agentic.ast.decl;

import agentic.diag.SourceLocation;

import java.util.List;

public record ImportDecl(
        String source,
        String defaultBinding,
        String namespaceBinding,
        List<Specifier> specifiers,
        boolean typeOnly,
        SourceLocation loc
) implements Decl {

    public boolean isRelative() {
        return source.startsWith("./") || source.startsWith("../");
    }

    /** The specifier whose local alias is {@code local}, or null. */
    public Specifier findLocal(String local) {
        for (Specifier s : specifiers) {
            if (s.alias().equals(local)) return s;
        }
        return null;
    }
}
