package agentic.ir;

import java.util.List;

/** Children rendered with single newlines between them instead of blank lines. */
public record GroupNode(List<BlockNode> children) implements CommandContent, AgentContent, SubComponentContent {
    public GroupNode {
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GROUP;
    }
}
