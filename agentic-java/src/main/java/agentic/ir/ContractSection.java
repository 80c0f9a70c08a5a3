package agentic.ir;

/** Agent contract sections in their required order. */
public enum ContractSection {
    ROLE("Role", "role"),
    UPSTREAM_INPUT("UpstreamInput", "upstream_input"),
    DOWNSTREAM_CONSUMER("DownstreamConsumer", "downstream_consumer"),
    METHODOLOGY("Methodology", "methodology"),
    STRUCTURED_RETURNS("StructuredReturns", "structured_returns");

    private final String component;
    private final String tag;

    ContractSection(String component, String tag) {
        this.component = component;
        this.tag = tag;
    }

    public String component() {
        return component;
    }

    public String tag() {
        return tag;
    }

    public static ContractSection fromComponent(String name) {
        for (ContractSection s : values()) {
            if (s.component.equals(name)) return s;
        }
        return null;
    }
}
