package agentic.ir;

import java.util.ArrayList;
import java.util.List;

/** Bulleted or numbered list. {@code start} only matters when {@code ordered}. */
public record ListNode(boolean ordered, int start, List<ListItemNode> items) implements CommandContent, AgentContent, SubComponentContent {
    public ListNode {
        items = List.copyOf(items);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        List<BlockNode> all = new ArrayList<>();
        for (ListItemNode item : items) {
            all.addAll(item.children());
        }
        return all;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }
}
