package agentic.ir;

import java.util.List;

/** Role, UpstreamInput, DownstreamConsumer or Methodology wrapper. */
public record ContractSectionNode(ContractSection section, List<BlockNode> children) implements CommandContent, AgentContent, SubComponentContent {
    public ContractSectionNode {
        if (section == ContractSection.STRUCTURED_RETURNS) {
            throw new IrValidationException("StructuredReturns is built as a StructuredReturnsNode");
        }
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONTRACT_SECTION;
    }
}
