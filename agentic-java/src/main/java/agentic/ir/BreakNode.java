package agentic.ir;

public record BreakNode(String message) implements CommandContent, AgentContent {
    @Override
    public NodeKind kind() {
        return NodeKind.BREAK;
    }
}
