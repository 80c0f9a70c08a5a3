package agentic.ast.type;

public record ArrayTypeRef(TypeRef element) implements TypeRef {
    @Override
    public String text() {
        String inner = element.text();
        return (element instanceof UnionTypeRef ? "(" + inner + ")" : inner) + "[]";
    }
}
