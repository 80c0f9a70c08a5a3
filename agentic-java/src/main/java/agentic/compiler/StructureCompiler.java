package agentic.compiler;

import agentic.ast.expr.JsxElement;
import agentic.ir.*;
import agentic.sema.StaticEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Presentation components that carry their data in attributes. */
final class StructureCompiler {
    private final TransformContext ctx;
    private final BlockCompiler blocks;

    StructureCompiler(TransformContext ctx, BlockCompiler blocks) {
        this.ctx = ctx;
        this.blocks = blocks;
    }

    TableNode table(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        List<List<Object>> rows = new ArrayList<>();
        for (Object row : attrs.list("rows")) {
            if (!(row instanceof List<?> cells)) throw attrs.wrongType("rows", "an array of arrays");
            List<Object> converted = new ArrayList<>();
            for (Object cell : cells) {
                converted.add(cell instanceof String || cell instanceof Number || cell instanceof Boolean || cell == null
                        ? cell
                        : StaticEvaluator.toText(VariableCompiler.plain(cell)));
            }
            rows.add(converted);
        }
        List<TableNode.Alignment> align = new ArrayList<>();
        for (String a : attrs.stringList("align")) {
            align.add(switch (a) {
                case "left" -> TableNode.Alignment.LEFT;
                case "center" -> TableNode.Alignment.CENTER;
                case "right" -> TableNode.Alignment.RIGHT;
                default -> throw attrs.wrongType("align", "an array of 'left', 'center' or 'right'");
            });
        }
        return new TableNode(attrs.stringList("headers"), rows, align, attrs.string("emptyCell"));
    }

    XmlBlockNode xmlBlock(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        Map<String, String> extra = new LinkedHashMap<>();
        for (String name : attrs.all().names()) {
            if (name.equals("name")) continue;
            extra.put(name, attrs.string(name));
        }
        return new XmlBlockNode(attrs.requireString("name"), extra, blocks.compileChildren(el.children()));
    }

    IndentNode indent(JsxElement el) {
        Integer spaces = new AttributeReader(el, ctx).integer("spaces");
        return new IndentNode(spaces == null ? 2 : spaces, blocks.compileChildren(el.children()));
    }

    StepNode step(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        StepVariant variant = StepVariant.fromAttribute(attrs.string("variant"));
        return new StepNode(attrs.requireString("number"), attrs.requireString("name"), variant,
                blocks.compileChildren(el.children()));
    }

    ExecutionContextNode executionContext(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        return new ExecutionContextNode(attrs.stringList("paths"), attrs.string("prefix"),
                blocks.compileChildren(el.children()));
    }

    SuccessCriteriaNode successCriteria(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        List<SuccessCriteriaNode.Item> items = new ArrayList<>();
        for (Object o : attrs.list("items")) {
            if (o instanceof String s) {
                items.add(new SuccessCriteriaNode.Item(s, false));
            } else if (o instanceof Map<?, ?> m && m.get("text") instanceof String text) {
                items.add(new SuccessCriteriaNode.Item(text, Boolean.TRUE.equals(m.get("checked"))));
            } else {
                throw attrs.wrongType("items", "an array of strings or { text, checked } objects");
            }
        }
        return new SuccessCriteriaNode(items);
    }

    OfferNextNode offerNext(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        List<OfferNextNode.Route> routes = new ArrayList<>();
        for (Object o : attrs.list("routes")) {
            if (!(o instanceof Map<?, ?> m)) throw attrs.wrongType("routes", "an array of objects");
            routes.add(new OfferNextNode.Route(str(m.get("name")), str(m.get("description")), str(m.get("path"))));
        }
        return new OfferNextNode(routes);
    }

    private static String str(Object v) {
        return v == null ? null : StaticEvaluator.toText(v);
    }
}
