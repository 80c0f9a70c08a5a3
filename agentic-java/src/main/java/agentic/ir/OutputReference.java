package agentic.ir;

import java.util.List;

/**
 * Handle on another agent's declared output, used by on-status handlers. {@code customStatuses}
 * holds the string-literal statuses declared on the output type beyond the standard set.
 */
public record OutputReference(String agent, TypeReference outputType, List<String> customStatuses) {
    public OutputReference {
        if (agent == null || agent.isBlank()) {
            throw new IrValidationException("useOutput requires an agent name");
        }
        customStatuses = List.copyOf(customStatuses);
    }

    public boolean acceptsStatus(String status) {
        return ReturnStatus.isStandard(status) || customStatuses.contains(status);
    }
}
