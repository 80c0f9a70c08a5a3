package agentic.ir;

import java.util.List;

/**
 * Any node that can appear in a document body. The concrete records are reached through
 * the three content-context interfaces.
 */
public sealed interface BlockNode extends Node permits CommandContent, AgentContent, SubComponentContent {

    /** Blocks nested directly inside this one, in order. */
    default List<BlockNode> nestedBlocks() {
        return List.of();
    }
}
