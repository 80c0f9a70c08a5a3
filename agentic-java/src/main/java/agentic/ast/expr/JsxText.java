package agentic.ast.expr;

import agentic.diag.SourceLocation;

public record JsxText(String raw, SourceLocation loc) implements Expr {
    public boolean isBlank() {
        return raw.isBlank();
    }
}
