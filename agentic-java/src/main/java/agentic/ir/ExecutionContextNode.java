package agentic.ir;

import java.util.List;

public record ExecutionContextNode(List<String> paths, String prefix, List<BlockNode> children) implements CommandContent, AgentContent, SubComponentContent {
    public ExecutionContextNode {
        paths = List.copyOf(paths);
        prefix = prefix == null ? "@" : prefix;
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXECUTION_CONTEXT;
    }
}
