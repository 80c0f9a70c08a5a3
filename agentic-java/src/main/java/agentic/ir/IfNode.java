package agentic.ir;

import java.util.List;

public record IfNode(Condition condition, List<BlockNode> children) implements CommandContent, AgentContent {
    public IfNode {
        if (condition == null) {
            throw new IrValidationException("If requires a condition");
        }
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }
}
