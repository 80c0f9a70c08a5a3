package agentic.ir;

/** Declaration of a runtime variable; contributes no output text. */
public record RuntimeVarDeclNode(RuntimeVar var, String typeText) implements CommandContent, AgentContent {
    @Override
    public NodeKind kind() {
        return NodeKind.RUNTIME_VAR_DECL;
    }
}
