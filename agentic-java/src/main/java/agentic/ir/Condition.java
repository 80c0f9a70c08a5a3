package agentic.ir;

/** Boolean expression over runtime variables, evaluated by the external runtime. */
public sealed interface Condition
        permits Condition.Ref, Condition.Literal, Condition.Not, Condition.And, Condition.Or, Condition.Compare {

    enum Operator {
        EQ("==="), NEQ("!=="), GT(">"), GTE(">="), LT("<"), LTE("<=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    record Ref(RuntimeVar var) implements Condition {}

    record Literal(boolean value) implements Condition {}

    record Not(Condition operand) implements Condition {}

    record And(Condition left, Condition right) implements Condition {}

    record Or(Condition left, Condition right) implements Condition {}

    /** {@code right} is a String, Number, Boolean or null. */
    record Compare(Operator op, RuntimeVar left, Object right) implements Condition {
        public Compare {
            if (right != null && !(right instanceof String || right instanceof Number || right instanceof Boolean)) {
                throw new IrValidationException("Condition operand must be a literal, got " + right);
            }
            if (op != Operator.EQ && op != Operator.NEQ && !(right instanceof Number)) {
                throw new IrValidationException("Operator " + op.symbol() + " requires a numeric operand");
            }
        }
    }
}
