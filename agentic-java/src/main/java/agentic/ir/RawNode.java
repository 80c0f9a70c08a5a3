package agentic.ir;

public record RawNode(String content) implements CommandContent, AgentContent, SubComponentContent {
    public RawNode {
        content = content == null ? "" : content;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RAW;
    }
}
