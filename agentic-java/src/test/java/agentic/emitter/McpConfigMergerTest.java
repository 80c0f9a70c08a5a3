package agentic.emitter;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class McpConfigMergerTest {

    @TempDir
    Path dir;

    private static ObjectNode server(String command) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put("command", command);
        return node;
    }

    private static Map<String, ObjectNode> servers(String name, String command) {
        Map<String, ObjectNode> map = new LinkedHashMap<>();
        map.put(name, server(command));
        return map;
    }

    @Test
    void missing_file_starts_empty() {
        assertEquals(0, McpConfigMerger.read(dir.resolve("none.json")).size());
    }

    @Test
    void invalid_file_starts_empty() throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{ not json");
        assertEquals(0, McpConfigMerger.read(file).size());

        Files.writeString(file, "[1, 2]");
        assertEquals(0, McpConfigMerger.read(file).size());
    }

    @Test
    void merge_keeps_other_keys_and_servers() throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, """
                {
                  "permissions": { "allow": ["Bash"] },
                  "mcpServers": {
                    "old": { "command": "old-cmd" },
                    "shared": { "command": "stale" }
                  }
                }
                """);

        Map<String, ObjectNode> current = servers("shared", "fresh");
        current.put("new", server("new-cmd"));
        McpConfigMerger.write(file, current);

        var result = (ObjectNode) Json.mapper().readTree(Files.readString(file));
        assertEquals("Bash", result.get("permissions").get("allow").get(0).asText());
        var mcp = result.get("mcpServers");
        assertEquals("old-cmd", mcp.get("old").get("command").asText());
        assertEquals("fresh", mcp.get("shared").get("command").asText());
        assertEquals("new-cmd", mcp.get("new").get("command").asText());
    }

    @Test
    void merging_twice_is_idempotent() throws Exception {
        Path file = dir.resolve(".claude/settings.json");
        McpConfigMerger.write(file, servers("fs", "npx"));
        String first = Files.readString(file);
        McpConfigMerger.write(file, servers("fs", "npx"));
        assertEquals(first, Files.readString(file));
    }

    @Test
    void output_is_two_space_json_with_trailing_newline() {
        ObjectNode settings = Json.mapper().createObjectNode();
        var merged = McpConfigMerger.merge(settings, servers("fs", "npx"));
        assertEquals("""
                {
                  "mcpServers": {
                    "fs": {
                      "command": "npx"
                    }
                  }
                }
                """, McpConfigMerger.render(merged));
    }

    @Test
    void merge_does_not_modify_input() {
        ObjectNode settings = Json.mapper().createObjectNode();
        McpConfigMerger.merge(settings, servers("fs", "npx"));
        assertFalse(settings.has("mcpServers"));
    }
}
