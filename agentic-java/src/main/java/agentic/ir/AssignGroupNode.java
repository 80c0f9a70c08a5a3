package agentic.ir;

import java.util.List;

/** Several assignments rendered as one bash block. */
public record AssignGroupNode(List<AssignNode> assignments) implements CommandContent, AgentContent, SubComponentContent {
    public AssignGroupNode {
        assignments = List.copyOf(assignments);
        if (assignments.isEmpty()) {
            throw new IrValidationException("AssignGroup must contain at least one Assign element");
        }
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return List.copyOf(assignments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN_GROUP;
    }
}
