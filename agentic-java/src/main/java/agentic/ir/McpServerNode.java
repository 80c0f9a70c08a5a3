package agentic.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One MCP server entry. Stdio servers are launched from {@code command}; http and sse servers
 * are reached at {@code url}.
 */
public record McpServerNode(
        String name,
        McpTransport transport,
        ConfigValue command,
        List<ConfigValue> args,
        ConfigValue url,
        Map<String, ConfigValue> headers,
        Map<String, ConfigValue> env
) implements Node {

    public McpServerNode {
        if (name == null || name.isEmpty()) {
            throw new IrValidationException("MCPServer requires a name");
        }
        if (transport == null) {
            throw new IrValidationException("MCPServer '" + name + "' requires a type");
        }
        args = args == null ? List.of() : List.copyOf(args);
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));

        if (transport == McpTransport.STDIO) {
            if (command == null) {
                throw new IrValidationException("MCPServer '" + name + "' of type stdio requires command");
            }
            if (url != null) {
                throw new IrValidationException("MCPServer '" + name + "' of type stdio cannot have url");
            }
            if (!headers.isEmpty()) {
                throw new IrValidationException("MCPServer '" + name + "' of type stdio cannot have headers");
            }
        } else {
            String type = transport.wireName();
            if (url == null) {
                throw new IrValidationException("MCPServer '" + name + "' of type " + type + " requires url");
            }
            if (command != null) {
                throw new IrValidationException("MCPServer '" + name + "' of type " + type + " cannot have command");
            }
            if (!args.isEmpty()) {
                throw new IrValidationException("MCPServer '" + name + "' of type " + type + " cannot have args");
            }
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MCP_SERVER;
    }
}
