package agentic.emitter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Merges server entries into a settings file. Only {@code mcpServers} is touched: entries with
 * the same name are replaced and every other key is kept as it was.
 */
public final class McpConfigMerger {
    private static final Logger log = LoggerFactory.getLogger(McpConfigMerger.class);

    public static final String SERVERS_KEY = "mcpServers";

    private McpConfigMerger() {}

    /** Existing settings, or an empty object when the file is missing or not a JSON object. */
    public static ObjectNode read(Path path) {
        if (!Files.exists(path)) {
            return Json.mapper().createObjectNode();
        }
        try {
            JsonNode node = Json.mapper().readTree(Files.readString(path, StandardCharsets.UTF_8));
            if (node instanceof ObjectNode object) return object;
            log.warn("Settings file {} is not a JSON object, starting from an empty object", path);
        } catch (JsonProcessingException e) {
            log.warn("Settings file {} is not valid JSON, starting from an empty object: {}", path, e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("Cannot read settings file {}, starting from an empty object: {}", path, e.getMessage());
        }
        return Json.mapper().createObjectNode();
    }

    public static ObjectNode merge(ObjectNode settings, Map<String, ObjectNode> servers) {
        ObjectNode merged = settings.deepCopy();
        JsonNode current = merged.get(SERVERS_KEY);
        ObjectNode target = current instanceof ObjectNode o ? o : merged.putObject(SERVERS_KEY);
        servers.forEach(target::set);
        return merged;
    }

    public static String render(ObjectNode settings) {
        return Json.pretty(settings) + "\n";
    }

    public static void write(Path path, Map<String, ObjectNode> servers) throws IOException {
        ObjectNode merged = merge(read(path), servers);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, render(merged), StandardCharsets.UTF_8);
        log.debug("Wrote {} MCP server(s) to {}", servers.size(), path);
    }
}
