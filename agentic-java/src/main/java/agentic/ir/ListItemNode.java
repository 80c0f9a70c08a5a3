package agentic.ir;

import java.util.List;

public record ListItemNode(List<BlockNode> children) implements Node {
    public ListItemNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST_ITEM;
    }
}
