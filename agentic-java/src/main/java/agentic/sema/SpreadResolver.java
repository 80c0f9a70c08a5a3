package agentic.sema;

import agentic.ast.decl.VarDecl;
import agentic.ast.expr.*;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves {@code {...props}} on a JSX element to the properties of the object literal the
 * identifier is bound to. Nested spreads inside that literal resolve recursively.
 */
public final class SpreadResolver {
    private final SymbolTable symbols;

    public SpreadResolver(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public Map<String, Expr> resolve(JsxAttribute.Spread spread) {
        Map<String, Expr> out = new LinkedHashMap<>();
        collect(spread.argument(), out, new HashSet<>());
        return out;
    }

    private void collect(Expr argument, Map<String, Expr> out, Set<String> visiting) {
        if (argument instanceof CallExpr c) {
            throw new ResolveException("Spread of a function call result is not supported: "
                    + ExprText.describe(c), c.loc());
        }
        if (argument instanceof MemberExpr m) {
            throw new ResolveException("Spread of a member expression is not supported: "
                    + ExprText.describe(m) + ". Assign it to a const first", m.loc());
        }
        if (!(argument instanceof Identifier id)) {
            throw new ResolveException("Spread argument must be an identifier, got "
                    + ExprText.describe(argument), argument.loc());
        }

        Symbol sym = symbols.lookup(id.name());
        if (sym == null) {
            throw new ResolveException("Undefined identifier in spread: " + id.name(), id.loc());
        }
        if (sym instanceof Symbol.Imported) {
            throw new ResolveException("Spread of imported binding '" + id.name()
                    + "' is not supported. Declare the object in this file", id.loc());
        }
        if (!(sym instanceof Symbol.Local local)) {
            throw new ResolveException("Spread identifier '" + id.name() + "' must refer to an object literal", id.loc());
        }
        VarDecl decl = local.decl();
        if (!(decl.initializer() instanceof ObjectLiteral obj)) {
            throw new ResolveException("Spread identifier '" + id.name() + "' must be initialized with an object literal",
                    id.loc());
        }
        if (!visiting.add(id.name())) {
            throw new ResolveException("Circular spread of '" + id.name() + "'", id.loc());
        }
        for (ObjectLiteral.Member member : obj.members()) {
            if (member instanceof ObjectLiteral.KeyValue kv) {
                out.remove(kv.key());
                out.put(kv.key(), kv.value());
            } else {
                collect(((ObjectLiteral.Spread) member).argument(), out, visiting);
            }
        }
        visiting.remove(id.name());
    }
}
