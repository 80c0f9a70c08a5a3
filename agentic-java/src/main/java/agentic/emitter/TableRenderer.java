package agentic.emitter;

import agentic.ir.TableNode;

import java.util.ArrayList;
import java.util.List;

/** GitHub-flavored table. */
final class TableRenderer {
    private TableRenderer() {}

    static String render(TableNode table) {
        int columns = table.columnCount();
        if (columns == 0) return "";

        List<String> lines = new ArrayList<>();
        if (!table.headers().isEmpty()) {
            List<Object> header = new ArrayList<>(table.headers());
            lines.add(row(header, columns, table.emptyCell()));
        }
        List<String> separators = new ArrayList<>();
        for (int i = 0; i < columns; i++) {
            TableNode.Alignment a = i < table.align().size() ? table.align().get(i) : TableNode.Alignment.LEFT;
            separators.add(switch (a) {
                case LEFT -> ":---";
                case CENTER -> ":---:";
                case RIGHT -> "---:";
            });
        }
        lines.add("| " + String.join(" | ", separators) + " |");
        for (List<Object> r : table.rows()) {
            lines.add(row(r, columns, table.emptyCell()));
        }
        return String.join("\n", lines);
    }

    private static String row(List<Object> cells, int columns, String emptyCell) {
        List<String> out = new ArrayList<>(columns);
        for (int i = 0; i < columns; i++) {
            out.add(cell(i < cells.size() ? cells.get(i) : null, emptyCell));
        }
        return "| " + String.join(" | ", out) + " |";
    }

    static String cell(Object value, String emptyCell) {
        if (value == null) return emptyCell;
        String text;
        if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite()) {
            text = Long.toString(d.longValue());
        } else {
            text = value.toString();
        }
        if (text.isEmpty()) return emptyCell;
        return text.replace("|", "\\|").replaceAll("\\r?\\n", " ");
    }
}
