package agentic.sema;

import agentic.diag.SourceLocation;

import java.util.HashMap;
import java.util.Map;

public final class Scope {
    private final Map<String, Symbol> symbols = new HashMap<>();

    public void define(Symbol sym, SourceLocation loc) {
        if (symbols.containsKey(sym.name())) {
            throw new ResolveException("Duplicate symbol: " + sym.name(), loc);
        }
        symbols.put(sym.name(), sym);
    }

    public Symbol getLocal(String name) {
        return symbols.get(name);
    }
}
