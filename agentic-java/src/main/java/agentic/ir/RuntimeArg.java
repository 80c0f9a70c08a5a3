package agentic.ir;

/** Argument of a runtime function call. */
public sealed interface RuntimeArg permits RuntimeArg.Literal, RuntimeArg.Reference {

    /** JSON-compatible value: String, Number, Boolean, null, List or Map. */
    record Literal(Object value) implements RuntimeArg {}

    record Reference(RuntimeVar var) implements RuntimeArg {}
}
