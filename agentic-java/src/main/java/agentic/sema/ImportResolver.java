package agentic.sema;

import agentic.ast.Module;
import agentic.ast.decl.*;
import agentic.ast.expr.Identifier;
import agentic.diag.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Follows names across relative imports and re-exports to the module that declares them.
 * Every call threads the chain of modules entered so far; entering one twice is an import cycle.
 */
public final class ImportResolver {
    private static final Logger log = LoggerFactory.getLogger(ImportResolver.class);

    /** A declaration together with the module it lives in. */
    public record Resolved(Module module, Decl decl) {}

    private final ModuleRegistry registry;

    public ImportResolver(ModuleRegistry registry) {
        this.registry = registry;
    }

    public ModuleRegistry registry() {
        return registry;
    }

    /**
     * Looks {@code name} up as seen from inside {@code module}: local declarations first, then
     * imports. Returns null when the module neither declares nor imports the name.
     */
    public Resolved resolveLocal(Module module, String name, Predicate<Decl> kind, List<Path> chain,
                                 SourceLocation loc) {
        for (Decl d : module.declarations()) {
            if (name.equals(d.declaredName()) && kind.test(d)) {
                return new Resolved(module, d);
            }
        }
        for (ImportDecl imp : module.imports()) {
            String imported = importedName(imp, name);
            if (imported == null) continue;
            if (!imp.isRelative()) {
                throw new ResolveException("package imports unsupported: '" + imp.source() + "'", loc);
            }
            List<Path> next = new ArrayList<>(chain);
            Module target = enter(module, imp.source(), next, loc);
            Resolved found = resolveExport(target, imported, kind, next, loc);
            if (found == null) {
                throw new ResolveException("Module '" + imp.source() + "' does not export '" + imported + "'", loc);
            }
            log.debug("Resolved {} in {} to {}", name, module.path(), found.module().path());
            return found;
        }
        return null;
    }

    /** Finds the declaration {@code module} exports as {@code exportedName}, or null. */
    public Resolved resolveExport(Module module, String exportedName, Predicate<Decl> kind, List<Path> chain,
                                  SourceLocation loc) {
        for (Decl d : module.declarations()) {
            if (isExported(d, exportedName) && kind.test(d)) {
                return new Resolved(module, d);
            }
            if (d instanceof ExportDefaultDecl def && exportedName.equals("default")
                    && def.value() instanceof Identifier id) {
                return resolveLocal(module, id.name(), kind, chain, loc);
            }
        }
        for (Decl d : module.declarations()) {
            if (d instanceof ExportListDecl list) {
                for (Specifier s : list.specifiers()) {
                    if (s.alias().equals(exportedName)) {
                        return resolveLocal(module, s.name(), kind, chain, loc);
                    }
                }
            }
            if (d instanceof ExportFromDecl from && !from.star()) {
                for (Specifier s : from.specifiers()) {
                    if (s.alias().equals(exportedName)) {
                        List<Path> next = new ArrayList<>(chain);
                        Module target = enter(module, from.source(), next, from.loc());
                        return resolveExport(target, s.name(), kind, next, loc);
                    }
                }
            }
        }
        for (Decl d : module.declarations()) {
            if (d instanceof ExportFromDecl from && from.star()) {
                List<Path> next = new ArrayList<>(chain);
                Module target = enter(module, from.source(), next, from.loc());
                Resolved found = resolveExport(target, exportedName, kind, next, loc);
                if (found != null) return found;
            }
        }
        return null;
    }

    /**
     * Loads the module {@code source} refers to and appends it to {@code chain}.
     */
    private Module enter(Module from, String source, List<Path> chain, SourceLocation loc) {
        if (!source.startsWith("./") && !source.startsWith("../")) {
            throw new ResolveException("package imports unsupported: '" + source + "'", loc);
        }
        Path target = registry.resolveImport(from.path(), source, loc);
        if (chain.contains(target)) {
            List<Path> cycle = new ArrayList<>(chain.subList(chain.indexOf(target), chain.size()));
            cycle.add(target);
            String rendered = cycle.stream()
                    .map(p -> p.getFileName().toString())
                    .collect(Collectors.joining(" -> "));
            throw new ResolveException("Circular import detected: " + rendered, loc);
        }
        chain.add(target);
        return registry.load(target);
    }

    private static String importedName(ImportDecl imp, String local) {
        if (local.equals(imp.defaultBinding())) return "default";
        Specifier s = imp.findLocal(local);
        return s == null ? null : s.name();
    }

    private static boolean isExported(Decl d, String exportedName) {
        if (d instanceof FunctionDecl f) {
            return f.isDefault() ? exportedName.equals("default") : f.exported() && f.name().equals(exportedName);
        }
        if (d instanceof VarDecl v) return v.exported() && v.name().equals(exportedName);
        if (d instanceof InterfaceDecl i) return i.exported() && i.name().equals(exportedName);
        if (d instanceof TypeAliasDecl t) return t.exported() && t.name().equals(exportedName);
        return false;
    }
}
