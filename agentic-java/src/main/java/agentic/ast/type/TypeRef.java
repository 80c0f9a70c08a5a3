package agentic.ast.type;

public sealed interface TypeRef
        permits NamedTypeRef, ArrayTypeRef, UnionTypeRef, LiteralTypeRef, ObjectTypeRef {

    /** Source-like rendering, used for type hints in generated documentation. */
    String text();
}
