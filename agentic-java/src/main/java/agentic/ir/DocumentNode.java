package agentic.ir;

/** Root of one compilation unit's output. */
public sealed interface DocumentNode extends Node permits CommandDocument, AgentDocument, McpConfigDocument {}
