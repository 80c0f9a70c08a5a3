package agentic.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes to a state entry, either one field or a merge of several. In field mode exactly one of
 * {@code literal} and {@code variable} is set.
 */
public record WriteStateNode(
        String stateKey,
        Mode mode,
        String field,
        String literal,
        RuntimeVar variable,
        Map<String, Object> merge
) implements CommandContent, AgentContent, SubComponentContent {

    public enum Mode { FIELD, MERGE }

    public WriteStateNode {
        if (stateKey == null || stateKey.isEmpty()) {
            throw new IrValidationException("WriteState requires a state key");
        }
        if (mode == Mode.FIELD) {
            if (field == null || field.isEmpty()) {
                throw new IrValidationException("WriteState requires a field when not merging");
            }
            if ((literal == null) == (variable == null)) {
                throw new IrValidationException("WriteState requires exactly one value");
            }
            merge = Map.of();
        } else {
            if (merge == null) {
                throw new IrValidationException("WriteState merge requires an object");
            }
            merge = Collections.unmodifiableMap(new LinkedHashMap<>(merge));
        }
    }

    public static WriteStateNode field(String key, String field, String literal, RuntimeVar variable) {
        return new WriteStateNode(key, Mode.FIELD, field, literal, variable, null);
    }

    public static WriteStateNode merge(String key, Map<String, Object> values) {
        return new WriteStateNode(key, Mode.MERGE, null, null, null, values);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WRITE_STATE;
    }
}
