package agentic.sema;

import agentic.diag.SourceLocation;

import java.util.List;
import java.util.Optional;

/** Interface or object type alias with its inherited fields flattened in. */
public record TypeShape(String name, List<FieldInfo> fields, SourceLocation declaredAt) {
    public TypeShape {
        fields = List.copyOf(fields);
    }

    public Optional<FieldInfo> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public List<String> requiredNames() {
        return fields.stream().filter(FieldInfo::required).map(FieldInfo::name).toList();
    }

    public List<String> allNames() {
        return fields.stream().map(FieldInfo::name).toList();
    }
}
