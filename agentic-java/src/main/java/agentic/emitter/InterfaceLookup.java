package agentic.emitter;

import agentic.ir.TypeReference;
import agentic.sema.TypeShape;

import java.util.Optional;

/** Resolves an agent's declared output type for the generated output-format section. */
@FunctionalInterface
public interface InterfaceLookup {
    Optional<TypeShape> lookup(TypeReference type);

    InterfaceLookup NONE = type -> Optional.empty();
}
