package agentic.sema;

import agentic.ast.Module;
import agentic.ast.decl.*;
import agentic.ast.expr.ArrowFunction;
import agentic.ast.expr.Expr;
import agentic.ast.expr.Identifier;
import agentic.ast.expr.JsxElement;
import agentic.ast.expr.JsxFragment;
import agentic.ast.stmt.BlockStmt;
import agentic.ast.stmt.ReturnStmt;
import agentic.ast.stmt.Stmt;
import agentic.diag.SourceLocation;

import java.util.List;

/**
 * Finds the JSX tree a compilation unit renders: the default export, or failing that the
 * first function that returns JSX.
 */
public final class DocumentLocator {
    private DocumentLocator() {}

    public static FunctionBody locate(Module module) {
        for (Decl d : module.declarations()) {
            if (d instanceof FunctionDecl f && f.isDefault()) {
                return FunctionBody.ofBlock(f.body(), "Default export", f.loc());
            }
            if (d instanceof ExportDefaultDecl def) {
                return fromExpr(module, def.value());
            }
        }
        for (Decl d : module.declarations()) {
            if (d instanceof FunctionDecl f && returnsJsx(f.body())) {
                return FunctionBody.ofBlock(f.body(), "Function '" + f.name() + "'", f.loc());
            }
        }
        throw new ResolveException("No default export returning JSX found",
                SourceLocation.of(module.path(), 1, 1));
    }

    private static boolean returnsJsx(BlockStmt body) {
        List<Stmt> stmts = body.statements();
        return !stmts.isEmpty()
                && stmts.get(stmts.size() - 1) instanceof ReturnStmt r
                && (r.value() instanceof JsxElement || r.value() instanceof JsxFragment);
    }

    private static FunctionBody fromExpr(Module module, Expr value) {
        if (value instanceof JsxElement || value instanceof JsxFragment) {
            return FunctionBody.ofExpression(value, "Default export");
        }
        if (value instanceof ArrowFunction a) {
            return a.blockBody() != null
                    ? FunctionBody.ofBlock(a.blockBody(), "Default export", a.loc())
                    : FunctionBody.ofExpression(a.expressionBody(), "Default export");
        }
        if (value instanceof Identifier id) {
            for (Decl d : module.declarations()) {
                if (d instanceof FunctionDecl f && f.name().equals(id.name())) {
                    return FunctionBody.ofBlock(f.body(), "Function '" + f.name() + "'", f.loc());
                }
                if (d instanceof VarDecl v && v.name().equals(id.name()) && v.initializer() != null) {
                    return fromExpr(module, v.initializer());
                }
            }
        }
        throw new ResolveException("Default export must be JSX or a function returning JSX", value.loc());
    }
}
