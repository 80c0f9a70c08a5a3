package agentic.emitter;

import agentic.ir.ConfigValue;
import agentic.ir.McpConfigDocument;
import agentic.ir.McpServerNode;
import agentic.ir.McpTransport;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns MCP server declarations into {@code mcpServers} entries. Environment references are
 * resolved through the supplied lookup, which returns null for an unset variable.
 */
public final class SettingsEmitter {
    private final Function<String, String> environment;

    public SettingsEmitter(Function<String, String> environment) {
        this.environment = environment;
    }

    public Map<String, ObjectNode> servers(McpConfigDocument document) {
        Map<String, ObjectNode> out = new LinkedHashMap<>();
        for (McpServerNode server : document.servers()) {
            out.put(server.name(), server(server));
        }
        return out;
    }

    ObjectNode server(McpServerNode server) {
        ObjectNode node = Json.mapper().createObjectNode();
        if (server.transport() != McpTransport.STDIO) {
            node.put("type", server.transport().wireName());
        }
        if (server.command() != null) {
            node.put("command", resolve(server, server.command()));
        }
        if (!server.args().isEmpty()) {
            ArrayNode args = node.putArray("args");
            server.args().forEach(a -> args.add(resolve(server, a)));
        }
        if (server.url() != null) {
            node.put("url", resolve(server, server.url()));
        }
        putMap(node, "headers", server, server.headers());
        putMap(node, "env", server, server.env());
        return node;
    }

    private void putMap(ObjectNode node, String key, McpServerNode server, Map<String, ConfigValue> values) {
        if (values.isEmpty()) return;
        ObjectNode map = node.putObject(key);
        values.forEach((k, v) -> map.put(k, resolve(server, v)));
    }

    private String resolve(McpServerNode server, ConfigValue value) {
        String resolved = value.resolve(environment);
        if (resolved == null) {
            String variable = value instanceof ConfigValue.Env env ? env.variable() : "?";
            throw new EmitException("Environment variable '" + variable + "' is not set (MCPServer '"
                    + server.name() + "')");
        }
        return resolved;
    }
}
