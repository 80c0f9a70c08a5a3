package agentic.ir;

/** Reads a state entry into a runtime variable. {@code field} may be null for the whole entry. */
public record ReadStateNode(String stateKey, RuntimeVar into, String field) implements CommandContent, AgentContent, SubComponentContent {
    public ReadStateNode {
        if (stateKey == null || stateKey.isEmpty()) {
            throw new IrValidationException("ReadState requires a state key");
        }
        if (into == null) {
            throw new IrValidationException("ReadState requires an 'into' variable");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.READ_STATE;
    }
}
