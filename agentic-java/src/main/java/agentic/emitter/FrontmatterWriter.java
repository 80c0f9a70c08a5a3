package agentic.emitter;

import agentic.ir.AgentFrontmatter;
import agentic.ir.CommandFrontmatter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** YAML preamble between {@code ---} lines. Absent optional fields are left out. */
final class FrontmatterWriter {
    private FrontmatterWriter() {}

    static String command(CommandFrontmatter fm) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put("name", fm.name());
        node.put("description", fm.description());
        putIfPresent(node, "argument-hint", fm.argumentHint());
        putIfPresent(node, "agent", fm.agent());
        if (!fm.allowedTools().isEmpty()) {
            ArrayNode tools = node.putArray("allowed-tools");
            fm.allowedTools().forEach(tools::add);
        }
        return wrap(node);
    }

    static String agent(AgentFrontmatter fm) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put("name", fm.name());
        node.put("description", fm.description());
        putIfPresent(node, "tools", fm.tools());
        putIfPresent(node, "color", fm.color());
        putIfPresent(node, "model", fm.model());
        return wrap(node);
    }

    private static void putIfPresent(ObjectNode node, String key, String value) {
        if (value != null && !value.isEmpty()) node.put(key, value);
    }

    private static String wrap(ObjectNode node) {
        String yaml = Json.yaml(node);
        if (!yaml.endsWith("\n")) yaml += "\n";
        return "---\n" + yaml + "---";
    }
}
