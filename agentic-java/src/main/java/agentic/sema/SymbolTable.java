package agentic.sema;

import agentic.diag.SourceLocation;

import java.util.ArrayDeque;
import java.util.Deque;

/** Lexical scopes, innermost first: function scopes above the module scope. */
public final class SymbolTable {
    private final Deque<Scope> scopes = new ArrayDeque<>();

    public SymbolTable() { push(); }

    public void push() { scopes.push(new Scope()); }
    public void pop() { scopes.pop(); }

    public void define(Symbol sym, SourceLocation loc) { scopes.peek().define(sym, loc); }

    public Symbol lookup(String name) {
        for (Scope s : scopes) {
            Symbol sym = s.getLocal(name);
            if (sym != null) return sym;
        }
        return null;
    }

    public int depth() {
        return scopes.size();
    }
}
