package agentic.sema;

import java.util.List;

/**
 * One property of a resolved contract type. {@code literals} lists the options when the type
 * is a string literal or a union of string literals, and is empty otherwise.
 */
public record FieldInfo(String name, String typeText, boolean required, List<String> literals) {
    public FieldInfo {
        literals = List.copyOf(literals);
    }
}
