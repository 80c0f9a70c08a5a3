package agentic.sema;

import agentic.diag.SourceLocation;
import agentic.ir.SpawnAgentNode;
import agentic.ir.SpawnInput;

import java.util.List;
import java.util.Optional;

/**
 * Checks spawn sites against the input interface of the agent they spawn.
 */
public final class ContractValidator {
    private final TypeResolver types;

    public ContractValidator(TypeResolver types) {
        this.types = types;
    }

    public void validate(SpawnAgentNode spawn, SourceLocation site) {
        if (spawn.inputType().isAny() || !(spawn.input() instanceof SpawnInput.Properties props)) return;

        Optional<TypeShape> shape = types.resolve(spawn.inputType());
        if (shape.isEmpty()) {
            throw new ResolveException("Cannot resolve input type '" + spawn.inputType().name()
                    + "' of SpawnAgent '" + spawn.agent() + "'", site);
        }
        TypeShape type = shape.get();
        List<String> supplied = props.names();
        List<String> missing = type.requiredNames().stream().filter(n -> !supplied.contains(n)).toList();
        if (missing.isEmpty()) return;

        throw new ResolveException("SpawnAgent input missing required properties: " + String.join(", ", missing)
                + ". Interface '" + type.name() + "' requires: " + String.join(", ", type.requiredNames())
                + " (declared at " + declaredAt(type) + ")", site);
    }

    private static String declaredAt(TypeShape type) {
        SourceLocation at = type.declaredAt();
        if (at == null) return "<unknown>";
        String file = at.file() == null ? "<input>" : at.file().getFileName().toString();
        return file + ":" + at.line();
    }
}
