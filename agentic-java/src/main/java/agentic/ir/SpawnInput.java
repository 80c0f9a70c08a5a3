package agentic.ir;

import java.util.List;

/** Structured input handed to a spawned agent: a whole variable or named properties. */
public sealed interface SpawnInput permits SpawnInput.Variable, SpawnInput.Properties {

    record Variable(RuntimeVar var) implements SpawnInput {}

    record Properties(List<Property> properties) implements SpawnInput {
        public Properties {
            properties = List.copyOf(properties);
        }

        public List<String> names() {
            return properties.stream().map(Property::name).toList();
        }
    }

    record Property(String name, Value value) {}

    sealed interface Value permits Text, VarRef, Json {}

    record Text(String value) implements Value {}

    record VarRef(RuntimeVar var) implements Value {}

    /** Any other literal: numbers, booleans, arrays and objects. */
    record Json(Object value) implements Value {}
}
