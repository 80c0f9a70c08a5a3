package agentic.ir;

public record LineBreakNode() implements InlineNode {
    @Override
    public NodeKind kind() {
        return NodeKind.LINE_BREAK;
    }
}
