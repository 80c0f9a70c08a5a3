package agentic.ir;

/** Nodes legal in an agent document body. Same set as {@link CommandContent} for now. */
public sealed interface AgentContent extends BlockNode
        permits HeadingNode, ParagraphNode, ListNode, CodeBlockNode, BlockquoteNode, ThematicBreakNode,
        TableNode, ExecutionContextNode, SuccessCriteriaNode, OfferNextNode, XmlBlockNode, GroupNode,
        RawNode, IndentNode, StepNode, ContractSectionNode, StructuredReturnsNode, ReadStateNode,
        WriteStateNode, AssignNode, AssignGroupNode, SpawnAgentNode, OnStatusNode, IfNode, ElseNode,
        LoopNode, BreakNode, ReturnNode,
        AskUserNode, RuntimeVarDeclNode, RuntimeCallNode {}
