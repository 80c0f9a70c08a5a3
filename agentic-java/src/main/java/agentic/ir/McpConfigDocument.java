package agentic.ir;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record McpConfigDocument(List<McpServerNode> servers) implements DocumentNode {
    public McpConfigDocument {
        if (servers == null || servers.isEmpty()) {
            throw new IrValidationException("MCPConfig must contain at least one MCP server");
        }
        Set<String> seen = new HashSet<>();
        for (McpServerNode s : servers) {
            if (!seen.add(s.name())) {
                throw new IrValidationException("Duplicate MCP server name: '" + s.name() + "'");
            }
        }
        servers = List.copyOf(servers);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MCP_CONFIG;
    }
}
