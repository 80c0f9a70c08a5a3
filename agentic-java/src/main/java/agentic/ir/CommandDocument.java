package agentic.ir;

import java.util.List;

public record CommandDocument(CommandFrontmatter frontmatter, List<CommandContent> children) implements DocumentNode {
    public CommandDocument {
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMMAND;
    }
}
