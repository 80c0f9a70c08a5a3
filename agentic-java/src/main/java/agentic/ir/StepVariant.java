package agentic.ir;

public enum StepVariant {
    HEADING("heading"),
    BOLD("bold"),
    XML("xml");

    private final String attribute;

    StepVariant(String attribute) {
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }

    public static StepVariant fromAttribute(String value) {
        if (value == null) return HEADING;
        for (StepVariant v : values()) {
            if (v.attribute.equals(value)) return v;
        }
        throw new IrValidationException("Step variant must be one of heading, bold, xml, got '" + value + "'");
    }
}
