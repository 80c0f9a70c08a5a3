package agentic.ast.type;

import agentic.ast.decl.FieldDecl;

import java.util.List;
import java.util.stream.Collectors;

public record ObjectTypeRef(List<FieldDecl> fields) implements TypeRef {
    @Override
    public String text() {
        if (fields.isEmpty()) return "{}";
        return fields.stream()
                .map(f -> f.name() + (f.optional() ? "?: " : ": ") + f.type().text())
                .collect(Collectors.joining("; ", "{ ", " }"));
    }
}
