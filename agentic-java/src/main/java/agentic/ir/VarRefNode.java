package agentic.ir;

/** Runtime variable interpolated into prose. */
public record VarRefNode(RuntimeVar var) implements InlineNode {
    @Override
    public NodeKind kind() {
        return NodeKind.VAR_REF;
    }
}
