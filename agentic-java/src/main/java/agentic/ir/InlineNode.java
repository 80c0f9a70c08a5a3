package agentic.ir;

public sealed interface InlineNode extends Node
        permits TextNode, BoldNode, ItalicNode, InlineCodeNode, LinkNode, LineBreakNode, VarRefNode {}
