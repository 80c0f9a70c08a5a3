package agentic.ir;

public record ThematicBreakNode() implements CommandContent, AgentContent, SubComponentContent {
    @Override
    public NodeKind kind() {
        return NodeKind.THEMATIC_BREAK;
    }
}
