package agentic.ir;

import java.util.List;

public record ParagraphNode(List<InlineNode> children) implements CommandContent, AgentContent, SubComponentContent {
    public ParagraphNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PARAGRAPH;
    }
}
