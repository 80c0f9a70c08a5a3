package agentic.compiler;

import agentic.ast.expr.*;
import agentic.ir.Condition;
import agentic.ir.RuntimeVar;
import agentic.sema.ExprText;
import agentic.sema.ResolveException;
import agentic.sema.StaticEvaluator;

/**
 * Condition expressions to a {@link Condition} tree. Comparisons need a runtime variable on the
 * left and a literal on the right.
 */
final class ConditionCompiler {
    private final StaticEvaluator evaluator;

    ConditionCompiler(StaticEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    Condition compile(Expr e) {
        if (e instanceof BoolLiteral b) return new Condition.Literal(b.value());
        if (e instanceof UnaryExpr u && u.op() == UnaryExpr.Operator.NOT) {
            return new Condition.Not(compile(u.operand()));
        }
        if (e instanceof BinaryExpr b) {
            return switch (b.op()) {
                case AND -> new Condition.And(compile(b.left()), compile(b.right()));
                case OR -> new Condition.Or(compile(b.left()), compile(b.right()));
                case EQ -> compare(Condition.Operator.EQ, b);
                case NE -> compare(Condition.Operator.NEQ, b);
                case GT -> compare(Condition.Operator.GT, b);
                case GE -> compare(Condition.Operator.GTE, b);
                case LT -> compare(Condition.Operator.LT, b);
                case LE -> compare(Condition.Operator.LTE, b);
            };
        }
        if (e instanceof Identifier || e instanceof MemberExpr || e instanceof IndexExpr) {
            Object v = evaluator.evaluate(e);
            if (v instanceof RuntimeVar rv) return new Condition.Ref(rv);
            if (v instanceof Boolean bool) return new Condition.Literal(bool);
        }
        throw new ResolveException("Unsupported condition: " + ExprText.describe(e), e.loc());
    }

    private Condition compare(Condition.Operator op, BinaryExpr b) {
        Object left = evaluator.evaluate(b.left());
        if (!(left instanceof RuntimeVar var)) {
            throw new ResolveException("Left side of a comparison must be a runtime variable, got "
                    + ExprText.describe(b.left()), b.left().loc());
        }
        Object right = evaluator.evaluate(b.right());
        if (right != null && !(right instanceof String || right instanceof Number || right instanceof Boolean)) {
            throw new ResolveException("Right side of a comparison must be a literal, got "
                    + ExprText.describe(b.right()), b.right().loc());
        }
        return new Condition.Compare(op, var, right);
    }
}
