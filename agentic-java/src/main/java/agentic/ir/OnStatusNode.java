package agentic.ir;

import agentic.diag.SourceLocation;

import java.util.List;

/** {@code location} is the handler element, reported when no matching spawn precedes it. */
public record OnStatusNode(OutputReference output, String status, List<BlockNode> children, SourceLocation location)
        implements CommandContent, AgentContent {
    public OnStatusNode {
        if (!output.acceptsStatus(status)) {
            throw new IrValidationException("Unknown status '" + status + "' for output of agent '"
                    + output.agent() + "'");
        }
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ON_STATUS;
    }
}
