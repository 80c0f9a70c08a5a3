package agentic.ast.expr;

import agentic.diag.SourceLocation;

public sealed interface JsxAttribute permits JsxAttribute.Named, JsxAttribute.Spread {

    SourceLocation loc();

    /** {@code name="v"}, {@code name={expr}} or a bare {@code name} (value null, meaning true). */
    record Named(String name, Expr value, SourceLocation loc) implements JsxAttribute {}

    record Spread(Expr argument, SourceLocation loc) implements JsxAttribute {}
}
