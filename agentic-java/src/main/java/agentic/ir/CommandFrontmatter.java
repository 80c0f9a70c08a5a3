package agentic.ir;

import java.util.List;

/** Optional fields are null when absent; {@code allowedTools} is never null. */
public record CommandFrontmatter(
        String name,
        String description,
        String argumentHint,
        String agent,
        List<String> allowedTools,
        String folder
) {
    public CommandFrontmatter {
        if (name == null || name.isEmpty()) {
            throw new IrValidationException("Command requires a name");
        }
        if (description == null || description.isEmpty()) {
            throw new IrValidationException("Command '" + name + "' requires a description");
        }
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
    }
}
