package agentic.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Table with optional headers. Cells are Strings, Numbers, Booleans or null; {@code align}
 * may be shorter than the column count.
 */
public record TableNode(
        List<String> headers,
        List<List<Object>> rows,
        List<Alignment> align,
        String emptyCell
) implements CommandContent, AgentContent, SubComponentContent {

    public enum Alignment { LEFT, CENTER, RIGHT }

    public TableNode {
        headers = List.copyOf(headers);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
        align = List.copyOf(align);
        emptyCell = emptyCell == null ? "" : emptyCell;
    }

    public int columnCount() {
        if (!headers.isEmpty()) return headers.size();
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TABLE;
    }
}
