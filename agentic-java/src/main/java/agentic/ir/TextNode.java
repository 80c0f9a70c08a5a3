package agentic.ir;

public record TextNode(String text) implements InlineNode {
    @Override
    public NodeKind kind() {
        return NodeKind.TEXT;
    }
}
