package agentic.ir;

/** Fenced code. {@code language} may be null. */
public record CodeBlockNode(String language, String content) implements CommandContent, AgentContent, SubComponentContent {
    public CodeBlockNode {
        content = content == null ? "" : content;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CODE_BLOCK;
    }
}
