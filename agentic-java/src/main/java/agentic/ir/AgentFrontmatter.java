package agentic.ir;

/**
 * {@code tools} is the space-separated tool list. Input and output types default to
 * {@link TypeReference#ANY}.
 */
public record AgentFrontmatter(
        String name,
        String description,
        String tools,
        String color,
        String model,
        TypeReference inputType,
        TypeReference outputType,
        String folder
) {
    public AgentFrontmatter {
        if (name == null || name.isEmpty()) {
            throw new IrValidationException("Agent requires a name");
        }
        if (description == null || description.isEmpty()) {
            throw new IrValidationException("Agent '" + name + "' requires a description");
        }
        inputType = inputType == null ? TypeReference.ANY : inputType;
        outputType = outputType == null ? TypeReference.ANY : outputType;
    }
}
