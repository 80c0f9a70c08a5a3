package agentic.ir;

/**
 * Spawn of a sub-agent. Exactly one of {@code prompt} and {@code input} is set.
 * {@code loadFromFile} is the agent definition path the spawned agent reads first, or null.
 */
public record SpawnAgentNode(
        String agent,
        String model,
        String description,
        String prompt,
        SpawnInput input,
        RuntimeVar output,
        String loadFromFile,
        TypeReference inputType,
        TypeReference outputType
) implements CommandContent, AgentContent {

    public SpawnAgentNode {
        requireText(agent, "agent");
        requireText(model, "model");
        requireText(description, "description");
        if (prompt != null && input != null) {
            throw new IrValidationException("SpawnAgent cannot have both 'prompt' and 'input'");
        }
        if (prompt == null && input == null) {
            throw new IrValidationException("SpawnAgent requires either 'prompt' or 'input'");
        }
        inputType = inputType == null ? TypeReference.ANY : inputType;
        outputType = outputType == null ? TypeReference.ANY : outputType;
    }

    private static void requireText(String value, String attribute) {
        if (value == null || value.isEmpty()) {
            throw new IrValidationException("SpawnAgent requires '" + attribute + "'");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SPAWN_AGENT;
    }
}
