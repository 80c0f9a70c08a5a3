package agentic.compiler;

import agentic.ast.expr.Expr;
import agentic.ast.expr.JsxElement;
import agentic.ir.*;
import agentic.sema.ExprText;
import agentic.sema.ResolveException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** SpawnAgent and OnStatus. */
final class SpawnCompiler {
    private final TransformContext ctx;
    private final BlockCompiler blocks;

    SpawnCompiler(TransformContext ctx, BlockCompiler blocks) {
        this.ctx = ctx;
        this.blocks = blocks;
    }

    SpawnAgentNode spawnAgent(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        String agent = attrs.requireString("agent");

        SpawnInput input = null;
        if (attrs.has("input")) {
            input = input(attrs.value("input"), attrs.expr("input"));
        }
        String prompt = attrs.string("prompt");

        SpawnAgentNode node = new SpawnAgentNode(
                agent,
                attrs.requireString("model"),
                attrs.requireString("description"),
                prompt,
                input,
                attrs.targetVar("output"),
                loadFromFile(attrs, agent),
                VariableCompiler.typeReference(el.typeArgs(), 0, el.loc(), ctx),
                VariableCompiler.typeReference(el.typeArgs(), 1, el.loc(), ctx));
        ctx.contracts().validate(node, el.loc());
        return node;
    }

    private static SpawnInput input(Object value, Expr source) {
        if (value instanceof RuntimeVar rv) {
            return new SpawnInput.Variable(rv);
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ResolveException("SpawnAgent input must be an object literal or a runtime variable, got "
                    + ExprText.describe(source), source.loc());
        }
        List<SpawnInput.Property> props = new ArrayList<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            Object v = e.getValue();
            SpawnInput.Value converted;
            if (v instanceof String s) converted = new SpawnInput.Text(s);
            else if (v instanceof RuntimeVar rv) converted = new SpawnInput.VarRef(rv);
            else converted = new SpawnInput.Json(VariableCompiler.plain(v));
            props.add(new SpawnInput.Property((String) e.getKey(), converted));
        }
        return new SpawnInput.Properties(props);
    }

    private static String loadFromFile(AttributeReader attrs, String agent) {
        String attr = attrs.has("loadFromFile") ? "loadFromFile" : attrs.has("readAgentFile") ? "readAgentFile" : null;
        if (attr == null) return null;
        Object v = attrs.value(attr);
        if (Boolean.TRUE.equals(v)) return "~/.claude/agents/" + agent + ".md";
        if (Boolean.FALSE.equals(v) || v == null) return null;
        if (v instanceof String path && !path.isEmpty()) return path;
        throw attrs.wrongType(attr, "a path or a boolean");
    }

    OnStatusNode onStatus(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        Object output = attrs.value("output");
        if (!(output instanceof OutputReference ref)) {
            throw new ResolveException("<OnStatus> output must reference a useOutput declaration", el.loc());
        }
        String status = attrs.requireString("status");
        if (!ref.acceptsStatus(status)) {
            throw new ResolveException("Unknown status '" + status + "' for output of agent '" + ref.agent()
                    + "'. Expected a standard status or one declared by the output type", el.loc());
        }
        return new OnStatusNode(ref, status, blocks.compileChildren(el.children()), el.loc());
    }
}
