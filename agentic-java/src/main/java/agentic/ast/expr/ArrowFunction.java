package agentic.ast.expr;

import agentic.ast.decl.FunctionDecl;
import agentic.ast.stmt.BlockStmt;
import agentic.diag.SourceLocation;

import java.util.List;

/**
 * Arrow function. Exactly one of {@code expressionBody} and {@code blockBody} is non-null.
 */
public record ArrowFunction(
        List<FunctionDecl.Param> params,
        Expr expressionBody,
        BlockStmt blockBody,
        SourceLocation loc
) implements Expr {}
