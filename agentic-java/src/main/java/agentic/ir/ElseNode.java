package agentic.ir;

import java.util.List;

public record ElseNode(List<BlockNode> children) implements CommandContent, AgentContent {
    public ElseNode {
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ELSE;
    }
}
