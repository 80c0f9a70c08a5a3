package agentic.ir;

import java.util.List;

public record BlockquoteNode(List<BlockNode> children) implements CommandContent, AgentContent, SubComponentContent {
    public BlockquoteNode {
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCKQUOTE;
    }
}
