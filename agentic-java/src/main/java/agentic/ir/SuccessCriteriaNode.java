package agentic.ir;

import java.util.List;

public record SuccessCriteriaNode(List<Item> items) implements CommandContent, AgentContent, SubComponentContent {

    public record Item(String text, boolean checked) {}

    public SuccessCriteriaNode {
        items = List.copyOf(items);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUCCESS_CRITERIA;
    }
}
