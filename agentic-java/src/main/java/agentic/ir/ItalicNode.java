package agentic.ir;

import java.util.List;

public record ItalicNode(List<InlineNode> children) implements InlineNode {
    public ItalicNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ITALIC;
    }
}
