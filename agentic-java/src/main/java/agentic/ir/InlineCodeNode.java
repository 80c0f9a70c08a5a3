package agentic.ir;

public record InlineCodeNode(String code) implements InlineNode {
    @Override
    public NodeKind kind() {
        return NodeKind.INLINE_CODE;
    }
}
