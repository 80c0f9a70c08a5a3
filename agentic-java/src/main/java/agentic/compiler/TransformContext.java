package agentic.compiler;

import agentic.ast.Module;
import agentic.ast.decl.*;
import agentic.diag.SourceLocation;
import agentic.ir.ContentContext;
import agentic.ir.RuntimeVarDeclNode;
import agentic.sema.*;

import java.nio.file.Path;
import java.util.*;
import java.util.function.Supplier;

/**
 * Mutable state of one document compilation: the module being read, its scopes, the chain of
 * modules entered through composition and the enclosing control-flow context.
 */
public final class TransformContext {
    private final ImportResolver imports;
    private final TypeResolver types;
    private final ContractValidator contracts;
    private final Path rootPath;

    private Module module;
    private SymbolTable symbols;
    private StaticEvaluator evaluator;
    private SpreadResolver spreads;

    private final List<Path> chain = new ArrayList<>();
    private final Deque<String> components = new ArrayDeque<>();
    private final List<RuntimeVarDeclNode> declarations = new ArrayList<>();
    private ContentContext content = ContentContext.COMMAND;
    private int loopDepth = 0;

    public TransformContext(ImportResolver imports, TypeResolver types, Module root) {
        this.imports = imports;
        this.types = types;
        this.contracts = new ContractValidator(types);
        this.rootPath = root.path();
        this.chain.add(root.path());
        enter(root);
    }

    // ---------- module frames ----------

    private void enter(Module m) {
        this.module = m;
        this.symbols = new SymbolTable();
        this.evaluator = new StaticEvaluator(symbols);
        this.spreads = new SpreadResolver(symbols);
        defineModuleScope(m);
    }

    private void defineModuleScope(Module m) {
        for (Decl d : m.declarations()) {
            if (d instanceof ImportDecl imp) {
                if (imp.defaultBinding() != null) {
                    symbols.define(new Symbol.Imported(imp.defaultBinding(), imp, "default"), imp.loc());
                }
                if (imp.namespaceBinding() != null) {
                    symbols.define(new Symbol.Imported(imp.namespaceBinding(), imp, "*"), imp.loc());
                }
                for (Specifier s : imp.specifiers()) {
                    symbols.define(new Symbol.Imported(s.alias(), imp, s.name()), imp.loc());
                }
            } else if (d instanceof FunctionDecl f) {
                symbols.define(new Symbol.Function(f.name(), f), f.loc());
            } else if (d instanceof VarDecl v) {
                symbols.define(VariableCompiler.declare(v, this), v.loc());
            }
        }
    }

    /** Runs {@code body} with {@code target} as the current module, then restores the caller's frame. */
    public <T> T inModule(Module target, Supplier<T> body) {
        if (target.path() != null && target.path().equals(module.path())) {
            return body.get();
        }
        Module savedModule = module;
        SymbolTable savedSymbols = symbols;
        StaticEvaluator savedEvaluator = evaluator;
        SpreadResolver savedSpreads = spreads;
        chain.add(target.path());
        try {
            enter(target);
            return body.get();
        } finally {
            chain.remove(chain.size() - 1);
            module = savedModule;
            symbols = savedSymbols;
            evaluator = savedEvaluator;
            spreads = savedSpreads;
        }
    }

    /** Opens a function scope holding {@code locals}, runs {@code body}, and closes it. */
    public <T> T inFunctionScope(List<VarDecl> locals, Symbol extra, SourceLocation extraLoc, Supplier<T> body) {
        symbols.push();
        try {
            if (extra != null) symbols.define(extra, extraLoc);
            for (VarDecl v : locals) {
                symbols.define(VariableCompiler.declare(v, this), v.loc());
            }
            return body.get();
        } finally {
            symbols.pop();
        }
    }

    public <T> T inContent(ContentContext next, Supplier<T> body) {
        ContentContext saved = content;
        content = next;
        try {
            return body.get();
        } finally {
            content = saved;
        }
    }

    public <T> T inLoop(Supplier<T> body) {
        loopDepth++;
        try {
            return body.get();
        } finally {
            loopDepth--;
        }
    }

    /** Enters a composed component; revisiting one already being inlined is a cycle. */
    public <T> T inComponent(String key, SourceLocation loc, Supplier<T> body) {
        if (components.contains(key)) {
            List<String> cycle = new ArrayList<>(components);
            Collections.reverse(cycle);
            cycle.add(key);
            throw new ResolveException("Circular component composition: " + String.join(" -> ", cycle), loc);
        }
        components.push(key);
        try {
            return body.get();
        } finally {
            components.pop();
        }
    }

    // ---------- accessors ----------

    public ImportResolver imports() { return imports; }
    public TypeResolver types() { return types; }
    public ContractValidator contracts() { return contracts; }
    public Module module() { return module; }
    public SymbolTable symbols() { return symbols; }
    public StaticEvaluator evaluator() { return evaluator; }
    public SpreadResolver spreads() { return spreads; }
    public ContentContext content() { return content; }
    public boolean insideLoop() { return loopDepth > 0; }

    public List<Path> chain() {
        return List.copyOf(chain);
    }

    /** True while compiling the document's own module, outside any composed component. */
    public boolean atRoot() {
        return components.isEmpty() && Objects.equals(module.path(), rootPath);
    }

    public void addDeclaration(RuntimeVarDeclNode decl) {
        declarations.add(decl);
    }

    public List<RuntimeVarDeclNode> declarations() {
        return List.copyOf(declarations);
    }
}
