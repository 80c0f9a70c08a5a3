package agentic.ast.decl;

/**
 * One entry of an import or export list: {@code name as alias}. Without an alias both are equal.
 */
public record Specifier(String name, String alias, boolean typeOnly) {
    public static Specifier of(String name) {
        return new Specifier(name, name, false);
    }
}
