package agentic.ir;

import java.util.List;

/** Bounded loop. {@code counter} may be null. */
public record LoopNode(int max, RuntimeVar counter, List<BlockNode> children) implements CommandContent, AgentContent {
    public LoopNode {
        if (max < 1) {
            throw new IrValidationException("Loop max must be a positive integer, got " + max);
        }
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOOP;
    }
}
