package agentic.ir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AgentDocumentTest {

    private static final AgentFrontmatter FM =
            new AgentFrontmatter("researcher", "Researches", null, null, null, null, null, null);

    private static ContractSectionNode section(ContractSection s) {
        return new ContractSectionNode(s, List.of(new ParagraphNode(List.of(new TextNode(s.component())))));
    }

    @Test
    void contract_sections_in_order_are_accepted() {
        var doc = new AgentDocument(FM, List.of(
                section(ContractSection.ROLE),
                new ParagraphNode(List.of(new TextNode("between"))),
                section(ContractSection.UPSTREAM_INPUT),
                section(ContractSection.METHODOLOGY)));
        assertEquals(4, doc.children().size());
    }

    @Test
    void out_of_order_section_is_rejected() {
        var ex = assertThrows(IrValidationException.class, () -> new AgentDocument(FM, List.of(
                section(ContractSection.METHODOLOGY),
                section(ContractSection.ROLE))));
        assertTrue(ex.getMessage().startsWith("<Role> must appear in order: Role, UpstreamInput"));
    }

    @Test
    void duplicate_role_is_rejected() {
        var ex = assertThrows(IrValidationException.class, () -> new AgentDocument(FM, List.of(
                section(ContractSection.ROLE),
                section(ContractSection.ROLE))));
        assertEquals("Agent can only have one <Role>", ex.getMessage());
    }

    @Test
    void structured_returns_need_an_entry() {
        var ex = assertThrows(IrValidationException.class, () -> new StructuredReturnsNode(List.of()));
        assertEquals("StructuredReturns must have at least one ReturnStatus", ex.getMessage());
    }
}
