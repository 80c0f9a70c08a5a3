package agentic.ir;

import java.util.List;

public record HeadingNode(int level, List<InlineNode> children) implements CommandContent, AgentContent, SubComponentContent {
    public HeadingNode {
        if (level < 1 || level > 6) {
            throw new IrValidationException("Heading level must be between 1 and 6, got " + level);
        }
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HEADING;
    }
}
