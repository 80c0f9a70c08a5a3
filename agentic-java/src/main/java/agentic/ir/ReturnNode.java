package agentic.ir;

/** Ends the command. Both fields are optional. */
public record ReturnNode(String status, String message) implements CommandContent, AgentContent {
    public ReturnNode {
        if (status != null && !ReturnStatus.isWellFormed(status)) {
            throw new IrValidationException("Return status must be a standard status or UPPER_SNAKE_CASE, got '"
                    + status + "'");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN;
    }
}
