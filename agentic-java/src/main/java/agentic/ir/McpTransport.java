package agentic.ir;

public enum McpTransport {
    STDIO("stdio"),
    HTTP("http"),
    SSE("sse");

    private final String wireName;

    McpTransport(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static McpTransport fromWireName(String value) {
        for (McpTransport t : values()) {
            if (t.wireName.equals(value)) return t;
        }
        throw new IrValidationException("MCP server type must be stdio, http or sse, got '" + value + "'");
    }
}
