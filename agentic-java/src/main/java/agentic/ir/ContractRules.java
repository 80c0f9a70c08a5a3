package agentic.ir;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordering and cardinality of contract sections at the top level of an agent body.
 */
public final class ContractRules {
    private static final String ORDER = Arrays.stream(ContractSection.values())
            .map(ContractSection::component)
            .collect(Collectors.joining(", "));

    private ContractRules() {}

    public static void validate(List<? extends BlockNode> body) {
        Set<ContractSection> seen = EnumSet.noneOf(ContractSection.class);
        ContractSection last = null;
        for (BlockNode node : body) {
            ContractSection section = sectionOf(node);
            if (section == null) continue;
            if (!seen.add(section)) {
                throw new IrValidationException("Agent can only have one <" + section.component() + ">");
            }
            if (last != null && section.ordinal() < last.ordinal()) {
                throw new IrValidationException("<" + section.component() + "> must appear in order: " + ORDER);
            }
            last = section;
        }
    }

    static ContractSection sectionOf(BlockNode node) {
        if (node instanceof ContractSectionNode c) return c.section();
        if (node instanceof StructuredReturnsNode) return ContractSection.STRUCTURED_RETURNS;
        return null;
    }
}
