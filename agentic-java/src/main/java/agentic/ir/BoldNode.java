package agentic.ir;

import java.util.List;

public record BoldNode(List<InlineNode> children) implements InlineNode {
    public BoldNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BOLD;
    }
}
