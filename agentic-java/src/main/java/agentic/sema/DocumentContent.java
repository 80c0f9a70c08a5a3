package agentic.sema;

import agentic.ast.expr.Expr;

import java.util.List;

/**
 * Children of a document root: either written out directly or produced by a render function
 * that needs the document's own metadata first.
 */
public sealed interface DocumentContent permits DocumentContent.Literal, DocumentContent.Deferred {

    record Literal(List<Expr> children) implements DocumentContent {
        public Literal {
            children = List.copyOf(children);
        }
    }

    /** {@code param} is null for a parameterless render function. */
    record Deferred(String param, FunctionBody body) implements DocumentContent {}
}
