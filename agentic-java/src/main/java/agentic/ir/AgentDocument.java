package agentic.ir;

import java.util.List;

public record AgentDocument(AgentFrontmatter frontmatter, List<AgentContent> children) implements DocumentNode {
    public AgentDocument {
        children = List.copyOf(children);
        ContractRules.validate(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AGENT;
    }
}
