package agentic.sema;

import agentic.ast.decl.FunctionDecl;
import agentic.ast.decl.ImportDecl;
import agentic.ast.decl.VarDecl;
import agentic.ir.OutputReference;
import agentic.ir.RuntimeVar;

import java.util.Map;

/** What a name in scope is bound to. */
public sealed interface Symbol {
    String name();

    /** Plain {@code const}/{@code let} binding, evaluated on demand. */
    record Local(String name, VarDecl decl) implements Symbol {}

    record Function(String name, FunctionDecl decl) implements Symbol {}

    /** {@code importedName} is "default" for default imports and "*" for namespace imports. */
    record Imported(String name, ImportDecl decl, String importedName) implements Symbol {}

    record RuntimeVariable(String name, RuntimeVar var) implements Symbol {}

    record Output(String name, OutputReference ref) implements Symbol {}

    record RuntimeFunction(String name, String functionName) implements Symbol {}

    record StateRef(String name, String key) implements Symbol {}

    record RenderContext(String name, Map<String, String> values) implements Symbol {}
}
