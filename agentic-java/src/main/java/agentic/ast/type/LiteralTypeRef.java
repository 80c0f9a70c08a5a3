package agentic.ast.type;

/**
 * String, number or boolean literal type. {@code value} is the literal without quotes.
 */
public record LiteralTypeRef(String value, boolean quoted) implements TypeRef {
    @Override
    public String text() {
        return quoted ? "'" + value + "'" : value;
    }
}
