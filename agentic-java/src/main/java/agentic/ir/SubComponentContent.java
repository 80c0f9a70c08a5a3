package agentic.ir;

/**
 * Nodes legal inside a composed sub-component: presentation and state helpers only.
 * Spawn, on-status, control flow, prompts and runtime variables are not permitted.
 */
public sealed interface SubComponentContent extends BlockNode
        permits HeadingNode, ParagraphNode, ListNode, CodeBlockNode, BlockquoteNode, ThematicBreakNode,
        TableNode, ExecutionContextNode, SuccessCriteriaNode, OfferNextNode, XmlBlockNode, GroupNode,
        RawNode, IndentNode, StepNode, ContractSectionNode, StructuredReturnsNode, ReadStateNode,
        WriteStateNode, AssignNode, AssignGroupNode {}
