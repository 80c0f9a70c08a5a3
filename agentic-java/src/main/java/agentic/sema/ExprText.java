package agentic.sema;

import agentic.ast.expr.*;

import java.util.stream.Collectors;

/** Short source-like rendering of an expression for error messages. */
public final class ExprText {
    private ExprText() {}

    public static String describe(Expr e) {
        if (e instanceof Identifier id) return id.name();
        if (e instanceof StringLiteral s) return "'" + s.value() + "'";
        if (e instanceof NumberLiteral n) return n.isIntegral() ? Long.toString((long) n.value()) : Double.toString(n.value());
        if (e instanceof BoolLiteral b) return Boolean.toString(b.value());
        if (e instanceof NullLiteral) return "null";
        if (e instanceof TemplateLiteral) return "template literal";
        if (e instanceof MemberExpr m) return describe(m.object()) + "." + m.property();
        if (e instanceof IndexExpr i) return describe(i.object()) + "[" + describe(i.index()) + "]";
        if (e instanceof CallExpr c) {
            return describe(c.callee()) + c.args().stream().map(ExprText::describe).collect(Collectors.joining(", ", "(", ")"));
        }
        if (e instanceof UnaryExpr u) return (u.op() == UnaryExpr.Operator.NOT ? "!" : "-") + describe(u.operand());
        if (e instanceof BinaryExpr b) return describe(b.left()) + " " + symbol(b.op()) + " " + describe(b.right());
        if (e instanceof ObjectLiteral) return "object literal";
        if (e instanceof ArrayLiteral) return "array literal";
        if (e instanceof ArrowFunction) return "arrow function";
        if (e instanceof JsxElement j) return "<" + j.name() + ">";
        if (e instanceof JsxFragment) return "<>";
        if (e instanceof JsxText) return "JSX text";
        if (e instanceof JsxExpressionContainer c) return c.isEmpty() ? "{}" : "{" + describe(c.expression()) + "}";
        return e.getClass().getSimpleName();
    }

    private static String symbol(BinaryExpr.Operator op) {
        return switch (op) {
            case EQ -> "===";
            case NE -> "!==";
            case LT -> "<";
            case GT -> ">";
            case LE -> "<=";
            case GE -> ">=";
            case AND -> "&&";
            case OR -> "||";
        };
    }
}
