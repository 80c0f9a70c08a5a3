package agentic.ast.expr;

import agentic.diag.SourceLocation;

import java.util.List;

public record ObjectLiteral(List<Member> members, SourceLocation loc) implements Expr {

    public sealed interface Member permits KeyValue, Spread {}

    /** {@code key: value}; shorthand {@code { key }} is stored with an Identifier value. */
    public record KeyValue(String key, Expr value, SourceLocation loc) implements Member {}

    public record Spread(Expr argument, SourceLocation loc) implements Member {}
}
