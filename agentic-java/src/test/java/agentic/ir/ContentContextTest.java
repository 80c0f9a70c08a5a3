package agentic.ir;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ContentContextTest {

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void command_and_agent_accept_every_block_kind(NodeKind kind) {
        assertEquals(kind.isBlock(), ContentContext.COMMAND.accepts(kind));
        assertEquals(kind.isBlock(), ContentContext.AGENT.accepts(kind));
    }

    @ParameterizedTest
    @EnumSource(value = NodeKind.class, names = {
            "SPAWN_AGENT", "ON_STATUS", "IF", "ELSE", "LOOP", "BREAK", "RETURN",
            "ASK_USER", "RUNTIME_VAR_DECL", "RUNTIME_CALL"})
    void sub_components_reject_runtime_blocks(NodeKind kind) {
        assertFalse(ContentContext.SUB_COMPONENT.accepts(kind));
    }

    @ParameterizedTest
    @EnumSource(value = NodeKind.class, names = {
            "HEADING", "PARAGRAPH", "LIST", "TABLE", "XML_BLOCK", "STEP", "READ_STATE", "WRITE_STATE",
            "ASSIGN", "ASSIGN_GROUP"})
    void sub_components_accept_presentation_blocks(NodeKind kind) {
        assertTrue(ContentContext.SUB_COMPONENT.accepts(kind));
    }

    @Test
    void validation_descends_into_nested_blocks() {
        var loop = new LoopNode(2, null, List.of(new BreakNode(null)));
        List<BlockNode> nested = List.of(new GroupNode(List.of(loop)));

        var ex = assertThrows(IrValidationException.class, () -> ContentContext.SUB_COMPONENT.validate(nested));
        assertEquals("<loop> is not allowed in sub-component content", ex.getMessage());
        assertDoesNotThrow(() -> ContentContext.COMMAND.validate(nested));
    }
}
