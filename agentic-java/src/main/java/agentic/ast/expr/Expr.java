package agentic.ast.expr;

import agentic.diag.SourceLocation;

public sealed interface Expr
        permits StringLiteral, NumberLiteral, BoolLiteral, NullLiteral, TemplateLiteral,
        Identifier, MemberExpr, IndexExpr, CallExpr, UnaryExpr, BinaryExpr,
        ObjectLiteral, ArrayLiteral, ArrowFunction,
        JsxElement, JsxFragment, JsxText, JsxExpressionContainer {

    SourceLocation loc();
}
