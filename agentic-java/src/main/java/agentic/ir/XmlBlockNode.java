package agentic.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public record XmlBlockNode(String name, Map<String, String> attributes, List<BlockNode> children) implements CommandContent, AgentContent, SubComponentContent {
    private static final Pattern TAG = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    public XmlBlockNode {
        if (name == null || !TAG.matcher(name).matches()) {
            throw new IrValidationException("Invalid XML block name: '" + name + "'");
        }
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
    }

    @Override
    public List<BlockNode> nestedBlocks() {
        return children;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.XML_BLOCK;
    }
}
