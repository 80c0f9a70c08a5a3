package agentic.ir;

import agentic.diag.SourceLocation;

import java.nio.file.Path;

/**
 * Reference to a declared contract type, carried across module boundaries without the AST.
 * {@code sourceFile} is the module the name was written in and {@code location} the element or
 * call whose type arguments named it.
 */
public record TypeReference(String name, Path sourceFile, SourceLocation location) {
    public static final TypeReference ANY = new TypeReference("any", null, null);

    public static TypeReference named(String name, Path sourceFile, SourceLocation location) {
        return new TypeReference(name, sourceFile, location);
    }

    public boolean isAny() {
        return "any".equals(name) || "unknown".equals(name);
    }
}
