package agentic.ir;

import java.util.List;

public record LinkNode(String url, List<InlineNode> children) implements InlineNode {
    public LinkNode {
        if (url == null) {
            throw new IrValidationException("Link requires href");
        }
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LINK;
    }
}
