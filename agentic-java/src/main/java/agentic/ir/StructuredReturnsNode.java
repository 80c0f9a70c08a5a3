package agentic.ir;

import java.util.ArrayList;
import java.util.List;

public record StructuredReturnsNode(List<Entry> entries) implements CommandContent, AgentContent, SubComponentContent {

    /** One {@code <ReturnStatus>}: a status code and its description. */
    public record Entry(String status, List<InlineNode> description) {
        public Entry {
            if (status == null || status.isEmpty()) {
                throw new IrValidationException("ReturnStatus requires status prop");
            }
            description = List.copyOf(description);
        }
    }

    public StructuredReturnsNode {
        if (entries.isEmpty()) {
            throw new IrValidationException("StructuredReturns must have at least one ReturnStatus");
        }
        entries = List.copyOf(entries);
    }

    public List<String> statuses() {
        List<String> out = new ArrayList<>();
        for (Entry e : entries) out.add(e.status());
        return out;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRUCTURED_RETURNS;
    }
}
