package agentic.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RuntimeCallNode(String function, Map<String, RuntimeArg> args, RuntimeVar output) implements CommandContent, AgentContent {
    public RuntimeCallNode {
        if (function == null || function.isEmpty()) {
            throw new IrValidationException("Runtime call requires a function name");
        }
        if (output == null) {
            throw new IrValidationException("Runtime call to '" + function + "' requires an output variable");
        }
        args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RUNTIME_CALL;
    }
}
