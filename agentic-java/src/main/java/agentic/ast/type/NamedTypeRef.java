package agentic.ast.type;

import java.util.List;
import java.util.stream.Collectors;

public record NamedTypeRef(String name, List<TypeRef> args) implements TypeRef {
    public NamedTypeRef(String name) {
        this(name, List.of());
    }

    @Override
    public String text() {
        if (args.isEmpty()) return name;
        return name + args.stream().map(TypeRef::text).collect(Collectors.joining(", ", "<", ">"));
    }
}
