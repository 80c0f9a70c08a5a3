package agentic.sema;

import agentic.ast.Module;
import agentic.ast.decl.*;
import agentic.ast.type.*;
import agentic.ir.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * Resolves {@link TypeReference}s to the interface or object type alias that declares them,
 * following the same relative-import chain as components.
 */
public final class TypeResolver {
    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    private final ImportResolver imports;
    private final Map<String, Optional<TypeShape>> cache = new HashMap<>();

    public TypeResolver(ImportResolver imports) {
        this.imports = imports;
    }

    public Optional<TypeShape> resolve(TypeReference ref) {
        if (ref == null || ref.isAny() || ref.sourceFile() == null) return Optional.empty();
        String key = ref.sourceFile() + "#" + ref.name();
        Optional<TypeShape> cached = cache.get(key);
        if (cached != null) return cached;

        Module module = imports.registry().load(ref.sourceFile());
        Optional<TypeShape> shape = Optional.ofNullable(resolveIn(module, ref.name(), new HashSet<>()));
        log.debug("Type {} from {} resolved: {}", ref.name(), ref.sourceFile().getFileName(), shape.isPresent());
        cache.put(key, shape);
        return shape;
    }

    private TypeShape resolveIn(Module module, String name, Set<String> visiting) {
        List<Path> chain = new ArrayList<>(List.of(module.path()));
        ImportResolver.Resolved found = imports.resolveLocal(module, name, TypeResolver::isTypeDecl, chain, null);
        if (found == null) return null;

        String key = found.module().path() + "#" + name;
        if (!visiting.add(key)) {
            throw new ResolveException("Circular type inheritance involving '" + name + "'", found.decl().loc());
        }

        Map<String, FieldInfo> fields = new LinkedHashMap<>();
        if (found.decl() instanceof InterfaceDecl iface) {
            for (String parent : iface.parents()) {
                TypeShape p = resolveIn(found.module(), parent, visiting);
                if (p == null) {
                    throw new ResolveException("Cannot resolve parent type '" + parent + "' of '" + name + "'",
                            iface.loc());
                }
                p.fields().forEach(f -> fields.put(f.name(), f));
            }
            addFields(iface.fields(), fields);
        } else {
            TypeAliasDecl alias = (TypeAliasDecl) found.decl();
            if (alias.type() instanceof ObjectTypeRef obj) {
                addFields(obj.fields(), fields);
            } else if (alias.type() instanceof NamedTypeRef named) {
                TypeShape target = resolveIn(found.module(), named.name(), visiting);
                if (target == null) return null;
                target.fields().forEach(f -> fields.put(f.name(), f));
            } else {
                return null;
            }
        }
        visiting.remove(key);
        return new TypeShape(name, new ArrayList<>(fields.values()), found.decl().loc());
    }

    private static void addFields(List<FieldDecl> decls, Map<String, FieldInfo> into) {
        for (FieldDecl f : decls) {
            into.put(f.name(), new FieldInfo(f.name(), f.type().text(), !f.optional(), literals(f.type())));
        }
    }

    private static List<String> literals(TypeRef type) {
        if (type instanceof LiteralTypeRef lit && lit.quoted()) return List.of(lit.value());
        if (type instanceof UnionTypeRef union) {
            List<String> out = new ArrayList<>();
            for (TypeRef option : union.options()) {
                if (!(option instanceof LiteralTypeRef lit) || !lit.quoted()) return List.of();
                out.add(lit.value());
            }
            return out;
        }
        return List.of();
    }

    private static boolean isTypeDecl(Decl d) {
        return d instanceof InterfaceDecl || d instanceof TypeAliasDecl;
    }
}
