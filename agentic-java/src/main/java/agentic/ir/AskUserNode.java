package agentic.ir;

import java.util.List;

public record AskUserNode(
        String question,
        String header,
        List<Option> options,
        RuntimeVar output,
        boolean multiSelect
) implements CommandContent, AgentContent {

    /** {@code description} may be null. */
    public record Option(String value, String label, String description) {
        public Option {
            if (value == null || label == null) {
                throw new IrValidationException("AskUser option requires value and label");
            }
        }
    }

    public AskUserNode {
        if (question == null || question.isEmpty()) {
            throw new IrValidationException("AskUser requires a question");
        }
        if (options == null || options.isEmpty()) {
            throw new IrValidationException("AskUser requires at least one option");
        }
        if (output == null) {
            throw new IrValidationException("AskUser requires an output variable");
        }
        options = List.copyOf(options);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASK_USER;
    }
}
