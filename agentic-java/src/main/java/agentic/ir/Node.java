package agentic.ir;

public sealed interface Node permits BlockNode, InlineNode, ListItemNode, McpServerNode, DocumentNode {
    NodeKind kind();
}
