package agentic.ir;

/**
 * Discriminator of every IR node. {@link #subComponentAllowed()} is the whitelist behind
 * {@link ContentContext#SUB_COMPONENT}.
 */
public enum NodeKind {
    // presentation blocks
    HEADING("heading", true),
    PARAGRAPH("paragraph", true),
    LIST("list", true),
    CODE_BLOCK("codeBlock", true),
    BLOCKQUOTE("blockquote", true),
    THEMATIC_BREAK("thematicBreak", true),
    TABLE("table", true),
    EXECUTION_CONTEXT("executionContext", true),
    SUCCESS_CRITERIA("successCriteria", true),
    OFFER_NEXT("offerNext", true),
    XML_BLOCK("xmlBlock", true),
    GROUP("group", true),
    RAW("raw", true),
    INDENT("indent", true),
    STEP("step", true),
    CONTRACT_SECTION("contractSection", true),
    STRUCTURED_RETURNS("structuredReturns", true),
    READ_STATE("readState", true),
    WRITE_STATE("writeState", true),
    ASSIGN("assign", true),
    ASSIGN_GROUP("assignGroup", true),

    // runtime blocks
    SPAWN_AGENT("spawnAgent", false),
    ON_STATUS("onStatus", false),
    IF("if", false),
    ELSE("else", false),
    LOOP("loop", false),
    BREAK("break", false),
    RETURN("return", false),
    ASK_USER("askUser", false),
    RUNTIME_VAR_DECL("runtimeVarDecl", false),
    RUNTIME_CALL("runtimeCall", false),

    // inline
    TEXT("text", true),
    BOLD("bold", true),
    ITALIC("italic", true),
    INLINE_CODE("inlineCode", true),
    LINK("link", true),
    LINE_BREAK("lineBreak", true),
    VAR_REF("varRef", true),

    // other
    LIST_ITEM("listItem", true),
    MCP_SERVER("mcpServer", false),
    COMMAND("command", false),
    AGENT("agent", false),
    MCP_CONFIG("mcpConfig", false);

    private final String tag;
    private final boolean subComponentAllowed;

    NodeKind(String tag, boolean subComponentAllowed) {
        this.tag = tag;
        this.subComponentAllowed = subComponentAllowed;
    }

    public String tag() {
        return tag;
    }

    public boolean subComponentAllowed() {
        return subComponentAllowed;
    }

    public boolean isBlock() {
        return ordinal() <= RUNTIME_CALL.ordinal();
    }
}
