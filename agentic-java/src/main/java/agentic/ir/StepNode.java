package agentic.ir;

import java.util.List;

/** Numbered workflow step. The number is kept as text so "1.2" and "2a" survive. */
public record StepNode(String number, String name, StepVariant variant, List<BlockNode> children) implements CommandContent, AgentContent, SubComponentContent {
    public StepNode {
        if (number == null || number.isEmpty()) {
            throw new IrValidationException("Step requires a number");
        }
        if (name == null || name.isEmpty()) {
            throw new IrValidationException("Step requires a name");
        }
        variant = variant == null ? StepVariant.HEADING : variant;
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STEP;
    }
}
