package agentic.ir;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RuntimeVarTest {

    @Test
    void field_access_returns_new_handle() {
        var ctx = RuntimeVar.of("CTX");
        var user = ctx.field("user");
        var name = user.field("name");

        assertEquals(List.of(), ctx.path());
        assertEquals(List.of("user"), user.path());
        assertEquals(List.of("user", "name"), name.path());
        assertEquals("$CTX.user.name", name.reference());
    }

    @Test
    void numeric_segments_render_as_indices() {
        var v = RuntimeVar.of("CTX").field("data").field("items").index(0).field("name");
        assertEquals(".data.items[0].name", v.renderPath());
        assertEquals("$CTX.data.items[0].name", v.reference());
    }

    @Test
    void jq_extracts_path_or_whole_value() {
        assertEquals("$(echo \"$CTX\" | jq -r '.user.name')",
                RuntimeVar.of("CTX").field("user").field("name").jq());
        assertEquals("$(echo \"$CTX\" | jq -r '.')", RuntimeVar.of("CTX").jq());
    }

    @Test
    void bare_variable_has_empty_path() {
        var v = RuntimeVar.of("X");
        assertEquals("", v.renderPath());
        assertEquals("$X", v.reference());
    }

    @Test
    void negative_index_is_rejected() {
        var v = RuntimeVar.of("R").field("items");
        var ex = assertThrows(IrValidationException.class, () -> v.index(-1));
        assertEquals("Negative index -1 on runtime variable R", ex.detail());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1abc", "a-b", "", "has space"})
    void invalid_names_are_rejected(String name) {
        assertThrows(IrValidationException.class, () -> RuntimeVar.of(name));
    }
}
