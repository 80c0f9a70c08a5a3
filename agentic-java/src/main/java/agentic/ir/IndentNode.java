package agentic.ir;

import java.util.List;

public record IndentNode(int spaces, List<BlockNode> children) implements CommandContent, AgentContent, SubComponentContent {
    public IndentNode {
        if (spaces < 0) {
            throw new IrValidationException("Indent spaces must not be negative, got " + spaces);
        }
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INDENT;
    }
}
