package agentic.sema;

import agentic.ast.decl.VarDecl;
import agentic.ast.expr.Expr;
import agentic.ast.expr.JsxElement;
import agentic.ast.expr.JsxFragment;
import agentic.ast.stmt.BlockStmt;
import agentic.ast.stmt.ReturnStmt;
import agentic.ast.stmt.Stmt;
import agentic.ast.stmt.VarDeclStmt;
import agentic.diag.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a component or render function reduced to its const declarations and the JSX it
 * returns.
 */
public record FunctionBody(List<VarDecl> locals, Expr jsx) {

    public FunctionBody {
        locals = List.copyOf(locals);
    }

    public static FunctionBody ofBlock(BlockStmt block, String what, SourceLocation loc) {
        List<VarDecl> locals = new ArrayList<>();
        List<Stmt> stmts = block.statements();
        for (int i = 0; i < stmts.size(); i++) {
            Stmt s = stmts.get(i);
            if (s instanceof VarDeclStmt v) {
                locals.add(v.decl());
            } else if (s instanceof ReturnStmt r && i == stmts.size() - 1) {
                return new FunctionBody(locals, requireJsx(r.value(), what, r.loc()));
            } else {
                throw new ResolveException(what + " body may only contain const declarations followed by a single return",
                        s.loc());
            }
        }
        throw new ResolveException(what + " must return JSX", loc);
    }

    public static FunctionBody ofExpression(Expr body, String what) {
        return new FunctionBody(List.of(), requireJsx(body, what, body.loc()));
    }

    private static Expr requireJsx(Expr value, String what, SourceLocation loc) {
        if (value instanceof JsxElement || value instanceof JsxFragment) return value;
        throw new ResolveException(what + " must return JSX", loc);
    }
}
