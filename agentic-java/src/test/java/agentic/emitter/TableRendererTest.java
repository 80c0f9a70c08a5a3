package agentic.emitter;

import agentic.ir.TableNode;
import agentic.ir.TableNode.Alignment;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TableRendererTest {

    private static List<Object> row(Object... cells) {
        return Arrays.asList(cells);
    }

    @Test
    void render_headers_alignment_and_rows() {
        var table = new TableNode(
                List.of("Name", "Count", "Note"),
                List.of(row("a", 1L, "x"), row("b", 2.0, "y")),
                List.of(Alignment.LEFT, Alignment.RIGHT, Alignment.CENTER),
                null);
        assertEquals("""
                | Name | Count | Note |
                | :--- | ---: | :---: |
                | a | 1 | x |
                | b | 2 | y |""", TableRenderer.render(table));
    }

    @Test
    void missing_alignments_default_to_left() {
        var table = new TableNode(List.of("A", "B"), List.of(), List.of(Alignment.RIGHT), null);
        assertEquals("| A | B |\n| ---: | :--- |", TableRenderer.render(table));
    }

    @Test
    void cells_escape_pipes_and_flatten_newlines() {
        var table = new TableNode(List.of("A"), List.of(row("x | y\nz")), List.of(), null);
        assertTrue(TableRenderer.render(table).endsWith("| x \\| y z |"));
    }

    @Test
    void null_and_empty_cells_use_empty_cell_text() {
        var table = new TableNode(List.of("A", "B"), List.of(row(null, "")), List.of(), "-");
        assertTrue(TableRenderer.render(table).endsWith("| - | - |"));
    }

    @Test
    void non_integral_numbers_keep_fraction() {
        assertEquals("1.5", TableRenderer.cell(1.5, ""));
        assertEquals("3", TableRenderer.cell(3.0, ""));
    }

    @Test
    void no_headers_keeps_separator_row() {
        var table = new TableNode(List.of(), List.of(row("a", "b")), List.of(), null);
        assertEquals("| :--- | :--- |\n| a | b |", TableRenderer.render(table));
    }

    @Test
    void empty_table_renders_nothing() {
        assertEquals("", TableRenderer.render(new TableNode(List.of(), List.of(), List.of(), null)));
    }
}
