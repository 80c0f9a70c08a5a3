package agentic.ir;

/** Nodes legal in a command document body. */
public sealed interface CommandContent extends BlockNode
        permits HeadingNode, ParagraphNode, ListNode, CodeBlockNode, BlockquoteNode, ThematicBreakNode,
        TableNode, ExecutionContextNode, SuccessCriteriaNode, OfferNextNode, XmlBlockNode, GroupNode,
        RawNode, IndentNode, StepNode, ContractSectionNode, StructuredReturnsNode, ReadStateNode,
        WriteStateNode, AssignNode, AssignGroupNode, SpawnAgentNode, OnStatusNode, IfNode, ElseNode,
        LoopNode, BreakNode, ReturnNode,
        AskUserNode, RuntimeVarDeclNode, RuntimeCallNode {}
