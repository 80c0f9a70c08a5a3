package agentic.compiler;

import agentic.ast.expr.Expr;
import agentic.ast.expr.JsxElement;
import agentic.ast.expr.JsxExpressionContainer;
import agentic.ast.expr.JsxText;
import agentic.ir.ContractSection;
import agentic.ir.ContractSectionNode;
import agentic.ir.StructuredReturnsNode;
import agentic.sema.ResolveException;

import java.util.ArrayList;
import java.util.List;

/** Agent contract sections and the structured-returns table. */
final class ContractCompiler {
    private final TransformContext ctx;
    private final BlockCompiler blocks;

    ContractCompiler(TransformContext ctx, BlockCompiler blocks) {
        this.ctx = ctx;
        this.blocks = blocks;
    }

    ContractSectionNode section(JsxElement el, ContractSection section) {
        return new ContractSectionNode(section, blocks.compileChildren(el.children()));
    }

    StructuredReturnsNode structuredReturns(JsxElement el) {
        List<StructuredReturnsNode.Entry> entries = new ArrayList<>();
        for (Expr child : el.children()) {
            if (child instanceof JsxText t && t.isBlank()) continue;
            if (child instanceof JsxExpressionContainer c && c.isEmpty()) continue;
            if (!(child instanceof JsxElement status) || !status.name().equals("ReturnStatus")) {
                throw new ResolveException("StructuredReturns can only contain ReturnStatus", child.loc());
            }
            AttributeReader attrs = new AttributeReader(status, ctx);
            String code = attrs.string("status");
            if (code == null) {
                throw new ResolveException("ReturnStatus requires status prop", status.loc());
            }
            entries.add(new StructuredReturnsNode.Entry(code, blocks.inline().compile(status.children())));
        }
        if (entries.isEmpty()) {
            throw new ResolveException("StructuredReturns must have at least one ReturnStatus", el.loc());
        }
        return new StructuredReturnsNode(entries);
    }
}
