package agentic.compiler;

import agentic.ast.expr.*;
import agentic.ir.*;
import agentic.sema.ExprText;
import agentic.sema.ResolveException;
import agentic.sema.StaticEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** JSX children to inline nodes. */
final class InlineCompiler {
    static final Set<String> INLINE_TAGS = Set.of("b", "strong", "i", "em", "code", "a", "br", "span");

    private final TransformContext ctx;

    InlineCompiler(TransformContext ctx) {
        this.ctx = ctx;
    }

    static boolean isInline(Expr child) {
        if (child instanceof JsxText) return true;
        if (child instanceof JsxElement el) return INLINE_TAGS.contains(el.name());
        if (child instanceof JsxExpressionContainer c) {
            return !c.isEmpty() && !(c.expression() instanceof JsxElement) && !(c.expression() instanceof JsxFragment);
        }
        return false;
    }

    List<InlineNode> compile(List<Expr> children) {
        List<InlineNode> out = new ArrayList<>();
        for (Expr child : children) {
            compileChild(child, out);
        }
        return trim(out);
    }

    private void compileChild(Expr child, List<InlineNode> out) {
        if (child instanceof JsxText t) {
            String text = JsxWhitespace.normalize(t.raw());
            if (!text.isEmpty()) out.add(new TextNode(text));
        } else if (child instanceof JsxExpressionContainer c) {
            if (c.isEmpty()) return;
            if (c.expression() instanceof JsxElement el) {
                compileChild(el, out);
                return;
            }
            Object v = ctx.evaluator().evaluate(c.expression());
            if (v instanceof RuntimeVar rv) {
                out.add(new VarRefNode(rv));
            } else if (v instanceof String || v instanceof Number) {
                out.add(new TextNode(StaticEvaluator.toText(v)));
            } else if (v != null && !(v instanceof Boolean)) {
                throw new ResolveException("Cannot render " + ExprText.describe(c.expression()) + " as text",
                        c.loc());
            }
        } else if (child instanceof JsxElement el && el.name().equals("span")) {
            for (Expr inner : el.children()) compileChild(inner, out);
        } else if (child instanceof JsxElement el) {
            out.add(element(el));
        } else {
            throw new ResolveException("Unexpected inline content: " + ExprText.describe(child), child.loc());
        }
    }

    private InlineNode element(JsxElement el) {
        return switch (el.name()) {
            case "b", "strong" -> new BoldNode(compile(el.children()));
            case "i", "em" -> new ItalicNode(compile(el.children()));
            case "code" -> new InlineCodeNode(plainText(el.children()));
            case "a" -> new LinkNode(new AttributeReader(el, ctx).requireString("href"), compile(el.children()));
            case "br" -> new LineBreakNode();
            default -> throw new ResolveException("<" + el.name() + "> cannot be used inline", el.loc());
        };
    }

    /** Text content with whitespace normalized, for inline code. */
    String plainText(List<Expr> children) {
        StringBuilder sb = new StringBuilder();
        for (InlineNode n : compile(children)) {
            if (n instanceof TextNode t) sb.append(t.text());
            else if (n instanceof VarRefNode v) sb.append(v.var().reference());
            else throw new IrValidationException("Inline code can only contain text");
        }
        return sb.toString();
    }

    /** Raw text content, whitespace preserved, for code blocks and raw markdown. */
    String rawText(List<Expr> children) {
        StringBuilder sb = new StringBuilder();
        for (Expr child : children) {
            if (child instanceof JsxText t) {
                sb.append(t.raw());
            } else if (child instanceof JsxExpressionContainer c) {
                if (c.isEmpty()) continue;
                Object v = ctx.evaluator().evaluate(c.expression());
                if (!(v instanceof String || v instanceof Number || v instanceof RuntimeVar)) {
                    throw new ResolveException("Expected text, got " + ExprText.describe(c.expression()), c.loc());
                }
                sb.append(StaticEvaluator.toText(v));
            } else {
                throw new ResolveException("Expected text, got " + ExprText.describe(child), child.loc());
            }
        }
        return JsxWhitespace.verbatim(sb.toString());
    }

    private static List<InlineNode> trim(List<InlineNode> nodes) {
        List<InlineNode> out = new ArrayList<>(nodes);
        if (!out.isEmpty() && out.get(0) instanceof TextNode t) {
            String s = t.text().stripLeading();
            if (s.isEmpty()) out.remove(0); else out.set(0, new TextNode(s));
        }
        if (!out.isEmpty() && out.get(out.size() - 1) instanceof TextNode t) {
            String s = t.text().stripTrailing();
            if (s.isEmpty()) out.remove(out.size() - 1); else out.set(out.size() - 1, new TextNode(s));
        }
        return out;
    }
}
