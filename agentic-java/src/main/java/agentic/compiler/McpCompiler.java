package agentic.compiler;

import agentic.ast.expr.Expr;
import agentic.ast.expr.JsxElement;
import agentic.ast.expr.JsxExpressionContainer;
import agentic.ast.expr.JsxText;
import agentic.ir.*;
import agentic.sema.ResolveException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@code <MCPConfig>} and its server elements. */
final class McpCompiler {
    private final TransformContext ctx;

    McpCompiler(TransformContext ctx) {
        this.ctx = ctx;
    }

    McpConfigDocument config(JsxElement root) {
        List<McpServerNode> servers = new ArrayList<>();
        for (Expr child : root.children()) {
            if (child instanceof JsxText t && t.isBlank()) continue;
            if (child instanceof JsxExpressionContainer c && c.isEmpty()) continue;
            if (!(child instanceof JsxElement el)) {
                throw new ResolveException("MCPConfig can only contain MCP server elements", child.loc());
            }
            servers.add(IrErrors.at(el.loc(), () -> server(el)));
        }
        return IrErrors.at(root.loc(), () -> new McpConfigDocument(servers));
    }

    private McpServerNode server(JsxElement el) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        McpTransport transport = switch (el.name()) {
            case "MCPServer" -> McpTransport.fromWireName(attrs.requireString("type"));
            case "MCPStdioServer" -> McpTransport.STDIO;
            case "MCPHTTPServer" -> attrs.has("type")
                    ? McpTransport.fromWireName(attrs.requireString("type"))
                    : McpTransport.HTTP;
            default -> throw new ResolveException("MCPConfig can only contain MCPServer, MCPStdioServer or "
                    + "MCPHTTPServer, got <" + el.name() + ">", el.loc());
        };

        List<ConfigValue> args = new ArrayList<>();
        Object rawArgs = attrs.value("args");
        if (rawArgs != null) {
            if (!(rawArgs instanceof List<?> list)) throw attrs.wrongType("args", "an array");
            for (Object a : list) args.add(configValue(a, attrs, "args"));
        }
        return new McpServerNode(
                attrs.requireString("name"),
                transport,
                optional(attrs, "command"),
                args,
                optional(attrs, "url"),
                configMap(attrs, "headers"),
                configMap(attrs, "env"));
    }

    private static ConfigValue optional(AttributeReader attrs, String name) {
        Object v = attrs.value(name);
        return v == null ? null : configValue(v, attrs, name);
    }

    private static Map<String, ConfigValue> configMap(AttributeReader attrs, String name) {
        Map<String, Object> raw = attrs.map(name);
        if (raw == null) return null;
        Map<String, ConfigValue> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> out.put(k, configValue(v, attrs, name)));
        return out;
    }

    private static ConfigValue configValue(Object v, AttributeReader attrs, String name) {
        if (v instanceof ConfigValue c) return c;
        if (v instanceof String s) return ConfigValue.literal(s);
        if (v instanceof Number || v instanceof Boolean) return ConfigValue.literal(v.toString());
        throw attrs.wrongType(name, "a string or process.env reference");
    }
}
