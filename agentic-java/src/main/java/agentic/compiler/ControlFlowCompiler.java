package agentic.compiler;

import agentic.ast.expr.Expr;
import agentic.ast.expr.JsxElement;
import agentic.ir.*;
import agentic.sema.ResolveException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** If, Else, Loop, Break, Return and AskUser. */
final class ControlFlowCompiler {
    private final TransformContext ctx;
    private final BlockCompiler blocks;

    ControlFlowCompiler(TransformContext ctx, BlockCompiler blocks) {
        this.ctx = ctx;
        this.blocks = blocks;
    }

    IfNode ifBlock(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        Expr condition = attrs.expr("condition");
        if (condition == null) throw attrs.missing("condition");
        Condition compiled = new ConditionCompiler(ctx.evaluator()).compile(condition);
        return new IfNode(compiled, blocks.compileChildren(el.children()));
    }

    ElseNode elseBlock(JsxElement el) {
        return new ElseNode(blocks.compileChildren(el.children()));
    }

    LoopNode loop(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        Integer max = attrs.integer("max");
        if (max == null) throw attrs.missing("max");
        if (max < 1) {
            throw new ResolveException("Loop max must be a positive integer", el.loc());
        }
        RuntimeVar counter = attrs.targetVar("counter");
        List<BlockNode> children = ctx.inLoop(() -> blocks.compileChildren(el.children()));
        return new LoopNode(max, counter, children);
    }

    BreakNode breakLoop(JsxElement el) {
        if (!ctx.insideLoop()) {
            throw new ResolveException("Break must be inside a Loop", el.loc());
        }
        return new BreakNode(new AttributeReader(el, ctx).string("message"));
    }

    ReturnNode returnNode(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        return new ReturnNode(attrs.string("status"), attrs.string("message"));
    }

    AskUserNode askUser(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        List<AskUserNode.Option> options = new ArrayList<>();
        for (Object o : attrs.list("options")) {
            if (!(o instanceof Map<?, ?> m)) throw attrs.wrongType("options", "an array of objects");
            options.add(new AskUserNode.Option(text(m.get("value")), text(m.get("label")), text(m.get("description"))));
        }
        return new AskUserNode(
                attrs.requireString("question"),
                attrs.string("header"),
                options,
                attrs.requireTargetVar("output"),
                attrs.bool("multiSelect", false));
    }

    private static String text(Object v) {
        return v == null ? null : v.toString();
    }
}
