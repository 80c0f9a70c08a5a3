package agentic.ast.type;

import java.util.List;
import java.util.stream.Collectors;

public record UnionTypeRef(List<TypeRef> options) implements TypeRef {
    @Override
    public String text() {
        return options.stream().map(TypeRef::text).collect(Collectors.joining(" | "));
    }
}
