package agentic.ir;

import java.util.List;

/**
 * Runtime counterpart of the content-context interfaces, for trees assembled from untyped lists.
 */
public enum ContentContext {
    COMMAND,
    AGENT,
    SUB_COMPONENT;

    public boolean accepts(NodeKind kind) {
        if (!kind.isBlock()) return false;
        return this != SUB_COMPONENT || kind.subComponentAllowed();
    }

    /** Checks every node and, recursively, everything nested inside it. */
    public void validate(List<? extends BlockNode> nodes) {
        for (BlockNode node : nodes) {
            if (!accepts(node.kind())) {
                throw new IrValidationException("<" + node.kind().tag() + "> is not allowed in "
                        + describe() + " content");
            }
            validate(node.nestedBlocks());
        }
    }

    private String describe() {
        return switch (this) {
            case COMMAND -> "command";
            case AGENT -> "agent";
            case SUB_COMPONENT -> "sub-component";
        };
    }
}
