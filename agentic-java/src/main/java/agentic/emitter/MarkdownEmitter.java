package agentic.emitter;

import agentic.ir.AgentDocument;
import agentic.ir.AskUserNode;
import agentic.ir.AssignGroupNode;
import agentic.ir.AssignNode;
import agentic.ir.BlockNode;
import agentic.ir.BlockquoteNode;
import agentic.ir.BoldNode;
import agentic.ir.BreakNode;
import agentic.ir.CodeBlockNode;
import agentic.ir.CommandDocument;
import agentic.ir.Condition;
import agentic.ir.ContractSectionNode;
import agentic.ir.ElseNode;
import agentic.ir.ExecutionContextNode;
import agentic.ir.GroupNode;
import agentic.ir.HeadingNode;
import agentic.ir.IfNode;
import agentic.ir.IndentNode;
import agentic.ir.InlineCodeNode;
import agentic.ir.InlineNode;
import agentic.ir.ItalicNode;
import agentic.ir.LinkNode;
import agentic.ir.ListItemNode;
import agentic.ir.ListNode;
import agentic.ir.LoopNode;
import agentic.ir.OfferNextNode;
import agentic.ir.OnStatusNode;
import agentic.ir.ParagraphNode;
import agentic.ir.RawNode;
import agentic.ir.ReadStateNode;
import agentic.ir.ReturnNode;
import agentic.ir.ReturnStatus;
import agentic.ir.RuntimeArg;
import agentic.ir.RuntimeCallNode;
import agentic.ir.SpawnAgentNode;
import agentic.ir.SpawnInput;
import agentic.ir.StepNode;
import agentic.ir.StructuredReturnsNode;
import agentic.ir.SuccessCriteriaNode;
import agentic.ir.TableNode;
import agentic.ir.TextNode;
import agentic.ir.TypeReference;
import agentic.ir.VarRefNode;
import agentic.ir.WriteStateNode;
import agentic.ir.XmlBlockNode;
import agentic.sema.FieldInfo;
import agentic.sema.TypeShape;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders command and agent documents as Markdown with a YAML preamble.
 *
 * <p>An instance keeps per-document state while emitting and must not be shared between threads.
 */
public class MarkdownEmitter {
    private static final String STATE_SKILL = "/react-agentic:state-";

    private final InterfaceLookup interfaces;
    private final Set<String> spawnedAgents = new HashSet<>();

    public MarkdownEmitter(InterfaceLookup interfaces) {
        this.interfaces = interfaces;
    }

    public MarkdownEmitter() {
        this(InterfaceLookup.NONE);
    }

    public String emit(CommandDocument document) {
        spawnedAgents.clear();
        return assemble(FrontmatterWriter.command(document.frontmatter()), blocks(document.children()));
    }

    public String emit(AgentDocument document) {
        spawnedAgents.clear();
        String body = blocks(document.children());
        TypeReference output = document.frontmatter().outputType();
        if (!output.isAny()) {
            body = join(body, outputFormat(document.frontmatter().name(), output));
        }
        return assemble(FrontmatterWriter.agent(document.frontmatter()), body);
    }

    private static String assemble(String frontmatter, String body) {
        if (body.isEmpty()) return frontmatter + "\n";
        return frontmatter + "\n\n" + body + "\n";
    }

    // Blocks

    private String blocks(List<? extends BlockNode> nodes) {
        return blocks(nodes, "\n\n");
    }

    private String blocks(List<? extends BlockNode> nodes, String separator) {
        List<String> parts = new ArrayList<>(nodes.size());
        for (BlockNode node : nodes) {
            String text = block(node);
            if (!text.isEmpty()) parts.add(text);
        }
        return String.join(separator, parts);
    }

    String block(BlockNode node) {
        switch (node.kind()) {
            case HEADING: {
                HeadingNode h = (HeadingNode) node;
                return "#".repeat(h.level()) + " " + inline(h.children());
            }
            case PARAGRAPH:
                return inline(((ParagraphNode) node).children());
            case LIST:
                return list((ListNode) node, 0);
            case CODE_BLOCK: {
                CodeBlockNode c = (CodeBlockNode) node;
                return "```" + (c.language() == null ? "" : c.language()) + "\n" + c.content() + "\n```";
            }
            case BLOCKQUOTE:
                return blockquote((BlockquoteNode) node);
            case THEMATIC_BREAK:
                return "---";
            case TABLE:
                return TableRenderer.render((TableNode) node);
            case EXECUTION_CONTEXT:
                return executionContext((ExecutionContextNode) node);
            case SUCCESS_CRITERIA:
                return successCriteria((SuccessCriteriaNode) node);
            case OFFER_NEXT:
                return offerNext((OfferNextNode) node);
            case XML_BLOCK: {
                XmlBlockNode x = (XmlBlockNode) node;
                return xml(x.name(), x.attributes(), blocks(x.children()));
            }
            case GROUP:
                return blocks(((GroupNode) node).children(), "\n");
            case RAW:
                return ((RawNode) node).content();
            case INDENT:
                return indent((IndentNode) node);
            case STEP:
                return step((StepNode) node);
            case CONTRACT_SECTION: {
                ContractSectionNode c = (ContractSectionNode) node;
                return xml(c.section().tag(), Map.of(), blocks(c.children()));
            }
            case STRUCTURED_RETURNS:
                return structuredReturns((StructuredReturnsNode) node);
            case READ_STATE:
                return readState((ReadStateNode) node);
            case WRITE_STATE:
                return writeState((WriteStateNode) node);
            case ASSIGN:
                return "```bash\n" + assignment((AssignNode) node) + "\n```";
            case ASSIGN_GROUP:
                return assignGroup((AssignGroupNode) node);
            case SPAWN_AGENT:
                return spawn((SpawnAgentNode) node);
            case ON_STATUS:
                return onStatus((OnStatusNode) node);
            case IF: {
                IfNode i = (IfNode) node;
                return titled("**If " + condition(i.condition()) + ":**", i.children());
            }
            case ELSE:
                return titled("**Otherwise:**", ((ElseNode) node).children());
            case LOOP: {
                LoopNode l = (LoopNode) node;
                String counter = l.counter() == null ? "" : " (counter: " + l.counter().reference() + ")";
                return titled("**Loop up to " + l.max() + " times" + counter + ":**", l.children());
            }
            case BREAK: {
                BreakNode b = (BreakNode) node;
                return b.message() == null ? "**Break loop**" : "**Break loop:** " + b.message();
            }
            case RETURN:
                return returnNode((ReturnNode) node);
            case ASK_USER:
                return askUser((AskUserNode) node);
            case RUNTIME_VAR_DECL:
                return "";
            case RUNTIME_CALL:
                return runtimeCall((RuntimeCallNode) node);
            default:
                throw new EmitException("Cannot emit " + node.kind().tag() + " as a block");
        }
    }

    private String titled(String title, List<BlockNode> children) {
        return join(title, blocks(children));
    }

    private String list(ListNode node, int depth) {
        String pad = "  ".repeat(depth);
        List<String> items = new ArrayList<>(node.items().size());
        for (int i = 0; i < node.items().size(); i++) {
            String marker = node.ordered() ? (node.start() + i) + "." : "-";
            items.add(listItem(node.items().get(i), pad, marker, depth));
        }
        return String.join("\n", items);
    }

    private String listItem(ListItemNode item, String pad, String marker, int depth) {
        List<String> lines = new ArrayList<>();
        String head = pad + marker;
        List<BlockNode> children = item.children();
        int start = 0;
        if (!children.isEmpty() && children.get(0) instanceof ParagraphNode p) {
            head = head + " " + inline(p.children());
            start = 1;
        }
        lines.add(head);
        String continuation = pad + "  ";
        for (int i = start; i < children.size(); i++) {
            BlockNode child = children.get(i);
            if (child instanceof ListNode nested) {
                lines.add(list(nested, depth + 1));
            } else {
                String text = block(child);
                if (!text.isEmpty()) lines.add(prefixLines(text, continuation));
            }
        }
        return String.join("\n", lines);
    }

    private String blockquote(BlockquoteNode node) {
        String content = blocks(node.children());
        List<String> out = new ArrayList<>();
        for (String line : content.split("\n", -1)) {
            out.add(line.isEmpty() ? ">" : "> " + line);
        }
        return String.join("\n", out);
    }

    private String indent(IndentNode node) {
        return prefixLines(blocks(node.children()), " ".repeat(node.spaces()));
    }

    private static String prefixLines(String text, String prefix) {
        List<String> out = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            out.add(line.isEmpty() ? line : prefix + line);
        }
        return String.join("\n", out);
    }

    private String executionContext(ExecutionContextNode node) {
        List<String> lines = new ArrayList<>();
        lines.add("<execution_context>");
        for (String path : node.paths()) {
            lines.add(path.startsWith(node.prefix()) ? path : node.prefix() + path);
        }
        String content = blocks(node.children());
        if (!content.isEmpty()) lines.add(content);
        lines.add("</execution_context>");
        return String.join("\n", lines);
    }

    private static String successCriteria(SuccessCriteriaNode node) {
        List<String> lines = new ArrayList<>();
        lines.add("<success_criteria>");
        for (SuccessCriteriaNode.Item item : node.items()) {
            lines.add((item.checked() ? "- [x] " : "- [ ] ") + item.text());
        }
        lines.add("</success_criteria>");
        return String.join("\n", lines);
    }

    private static String offerNext(OfferNextNode node) {
        List<String> lines = new ArrayList<>();
        lines.add("<offer_next>");
        for (OfferNextNode.Route route : node.routes()) {
            String line = "- **" + route.name() + "**";
            if (route.description() != null) line += ": " + route.description();
            lines.add(line);
            if (route.path() != null) lines.add("  `" + route.path() + "`");
        }
        lines.add("</offer_next>");
        return String.join("\n", lines);
    }

    private static String xml(String name, Map<String, String> attributes, String content) {
        StringBuilder open = new StringBuilder("<").append(name);
        attributes.forEach((k, v) -> open.append(' ').append(k).append("=\"").append(escapeAttribute(v)).append('"'));
        open.append('>');
        if (content.isEmpty()) return open + "\n</" + name + ">";
        return open + "\n" + content + "\n</" + name + ">";
    }

    private static String escapeAttribute(String value) {
        return value.replace("&", "&amp;").replace("\"", "&quot;");
    }

    private String step(StepNode node) {
        String title = "Step " + node.number() + ": " + node.name();
        String content = blocks(node.children());
        switch (node.variant()) {
            case BOLD:
                return join("**" + title + "**", content);
            case XML:
                return xml("step", orderedMap("number", node.number(), "name", node.name()), content);
            case HEADING:
            default:
                return join("## " + title, content);
        }
    }

    private static Map<String, String> orderedMap(String k1, String v1, String k2, String v2) {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        return map;
    }

    private String structuredReturns(StructuredReturnsNode node) {
        List<String> lines = new ArrayList<>();
        lines.add("<structured_returns>");
        for (StructuredReturnsNode.Entry entry : node.entries()) {
            String description = inline(entry.description());
            lines.add("- **" + entry.status() + "**" + (description.isEmpty() ? "" : ": " + description));
        }
        lines.add("</structured_returns>");
        return String.join("\n", lines);
    }

    // State

    private static String readState(ReadStateNode node) {
        String args = node.stateKey();
        if (node.field() != null) args += " --field \"" + node.field() + "\"";
        return "Use skill `" + STATE_SKILL + "read " + args + "` and store result in `" + node.into().name() + "`.";
    }

    private static String writeState(WriteStateNode node) {
        String args;
        if (node.mode() == WriteStateNode.Mode.MERGE) {
            args = node.stateKey() + " --merge '" + shellQuote(Json.compact(node.merge())) + "'";
        } else {
            String value = node.variable() != null
                    ? node.variable().reference()
                    : "\"" + node.literal().replace("\"", "\\\"") + "\"";
            args = node.stateKey() + " --field \"" + node.field() + "\" --value " + value;
        }
        return "Use skill `" + STATE_SKILL + "write " + args + "`.";
    }

    // Runtime

    private String spawn(SpawnAgentNode node) {
        spawnedAgents.add(node.agent());
        String prompt = node.prompt() != null ? node.prompt() : spawnInput(node.input());
        String agentType = node.agent();
        if (node.loadFromFile() != null) {
            agentType = "general-purpose";
            prompt = "First, read " + node.loadFromFile() + " for your role and instructions.\n\n" + prompt;
        }
        String task = "```\n"
                + "Task(\n"
                + "  prompt=\"" + escapeQuotes(prompt) + "\",\n"
                + "  subagent_type=\"" + escapeQuotes(agentType) + "\",\n"
                + "  model=\"" + escapeQuotes(node.model()) + "\",\n"
                + "  description=\"" + escapeQuotes(node.description()) + "\"\n"
                + ")\n"
                + "```";
        if (node.output() == null) return task;
        return task + "\n\nStore the agent's result in `" + node.output().reference() + "`.";
    }

    private static String spawnInput(SpawnInput input) {
        if (input instanceof SpawnInput.Variable v) {
            return "<input>\n" + v.var().jq() + "\n</input>";
        }
        List<String> sections = new ArrayList<>();
        for (SpawnInput.Property property : ((SpawnInput.Properties) input).properties()) {
            String value;
            if (property.value() instanceof SpawnInput.Text t) {
                value = t.value();
            } else if (property.value() instanceof SpawnInput.VarRef r) {
                value = r.var().jq();
            } else {
                value = Json.pretty(((SpawnInput.Json) property.value()).value());
            }
            sections.add("<" + property.name() + ">\n" + value + "\n</" + property.name() + ">");
        }
        return String.join("\n\n", sections);
    }

    private static String escapeQuotes(String value) {
        return value.replace("\"", "\\\"");
    }

    private String onStatus(OnStatusNode node) {
        if (!spawnedAgents.contains(node.output().agent())) {
            throw new EmitException("OnStatus for agent '" + node.output().agent()
                    + "' must come after a SpawnAgent of that agent", node.location());
        }
        return titled("**On " + node.status() + ":**", node.children());
    }

    private static String returnNode(ReturnNode node) {
        String head = "**End command" + (node.status() == null ? "" : " (" + node.status() + ")") + "**";
        return node.message() == null ? head : head + ": " + node.message();
    }

    private static String askUser(AskUserNode node) {
        List<String> lines = new ArrayList<>();
        lines.add("Use the AskUserQuestion tool:");
        lines.add("");
        lines.add("- Question: \"" + node.question() + "\"");
        if (node.header() != null) lines.add("- Header: \"" + node.header() + "\"");
        lines.add("- Options:");
        for (AskUserNode.Option option : node.options()) {
            String description = option.description() == null ? "" : " - " + option.description();
            lines.add("  - \"" + option.label() + "\" (value: \"" + option.value() + "\")" + description);
        }
        if (node.multiSelect()) lines.add("- Multiple selection allowed");
        lines.add("");
        lines.add("Store the user's response in `" + node.output().reference() + "`.");
        return String.join("\n", lines);
    }

    private static String assignGroup(AssignGroupNode node) {
        List<String> lines = new ArrayList<>();
        for (AssignNode a : node.assignments()) {
            if (a.blankBefore() && !lines.isEmpty()) lines.add("");
            lines.add(assignment(a));
        }
        return "```bash\n" + String.join("\n", lines) + "\n```";
    }

    /** {@code VAR=$(cmd)}, {@code VAR=value} or {@code VAR=$ENV}, preceded by its comment line. */
    static String assignment(AssignNode node) {
        String name = node.variable().name();
        String content = node.content();
        String line;
        switch (node.source()) {
            case BASH:
                line = name + "=$(" + content + ")";
                break;
            case VALUE:
                line = content.chars().anyMatch(Character::isWhitespace)
                        ? name + "=\"" + content + "\""
                        : name + "=" + content;
                break;
            default:
                line = name + "=$" + content;
        }
        return node.comment() == null ? line : "# " + node.comment() + "\n" + line;
    }

    private static String runtimeCall(RuntimeCallNode node) {
        Map<String, Object> args = new LinkedHashMap<>();
        node.args().forEach((name, arg) -> {
            if (arg instanceof RuntimeArg.Reference r) args.put(name, r.var().reference());
            else args.put(name, ((RuntimeArg.Literal) arg).value());
        });
        String json = shellQuote(Json.compact(args));
        return "```bash\n" + node.output().name() + "=$(node runtime.js " + node.function() + " '" + json + "')\n```";
    }

    /** Escapes a value placed inside single quotes in a shell command. */
    static String shellQuote(String value) {
        return value.replace("'", "'\"'\"'");
    }

    static String condition(Condition condition) {
        if (condition instanceof Condition.Ref r) return r.var().reference();
        if (condition instanceof Condition.Literal l) return Boolean.toString(l.value());
        if (condition instanceof Condition.Not n) return "!" + operand(n.operand());
        if (condition instanceof Condition.And a) return operand(a.left()) + " && " + operand(a.right());
        if (condition instanceof Condition.Or o) return operand(o.left()) + " || " + operand(o.right());
        Condition.Compare c = (Condition.Compare) condition;
        return c.left().reference() + " " + c.op().symbol() + " " + literal(c.right());
    }

    private static String operand(Condition condition) {
        String text = condition(condition);
        if (condition instanceof Condition.And || condition instanceof Condition.Or) return "(" + text + ")";
        return text;
    }

    private static String literal(Object value) {
        if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite()) return Long.toString(d.longValue());
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        return Json.compact(value);
    }

    // Inline

    String inline(List<InlineNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (InlineNode node : nodes) {
            sb.append(inline(node));
        }
        return sb.toString();
    }

    private String inline(InlineNode node) {
        switch (node.kind()) {
            case TEXT:
                return ((TextNode) node).text();
            case BOLD:
                return "**" + inline(((BoldNode) node).children()) + "**";
            case ITALIC:
                return "*" + inline(((ItalicNode) node).children()) + "*";
            case INLINE_CODE:
                return "`" + ((InlineCodeNode) node).code() + "`";
            case LINK: {
                LinkNode l = (LinkNode) node;
                return "[" + inline(l.children()) + "](" + l.url() + ")";
            }
            case LINE_BREAK:
                return "\n";
            case VAR_REF:
                return ((VarRefNode) node).var().reference();
            default:
                throw new EmitException("Cannot emit " + node.kind().tag() + " inline");
        }
    }

    // Agent output format

    private String outputFormat(String agent, TypeReference output) {
        TypeShape shape = interfaces.lookup(output).orElseThrow(() -> new EmitException(
                "Cannot resolve output type '" + output.name() + "' of agent '" + agent + "'", output.location()));

        List<String> lines = new ArrayList<>();
        lines.add("<structured_returns>");
        lines.add("");
        lines.add("## Output Format");
        lines.add("");
        lines.add("Return a YAML code block with the following structure:");
        lines.add("");
        lines.add("```yaml");
        List<String> statuses = new ArrayList<>();
        for (ReturnStatus s : ReturnStatus.values()) statuses.add(s.name());
        lines.add("status: " + String.join(" | ", statuses));
        if (shape.field("message").isPresent()) {
            lines.add("message: \"Human-readable status message\"");
        }
        for (FieldInfo field : shape.fields()) {
            if (field.name().equals("status") || field.name().equals("message")) continue;
            lines.add(field.name() + ": " + typeHint(field.typeText()) + (field.required() ? "" : "  # optional"));
        }
        lines.add("```");
        lines.add("");
        lines.add("### Status Codes");
        lines.add("");
        for (ReturnStatus s : ReturnStatus.values()) {
            lines.add("- **" + s.name() + "**: " + s.description());
        }
        lines.add("");
        lines.add("</structured_returns>");
        return String.join("\n", lines);
    }

    static String typeHint(String typeText) {
        String type = typeText.trim();
        switch (type) {
            case "string":
                return "\"...\"";
            case "number":
                return "0";
            case "boolean":
                return "true | false";
            default:
                if (type.endsWith("[]") || type.startsWith("Array<")) return "[...]";
                return "<" + type.replace("\"", "").replace("'", "") + ">";
        }
    }

    private static String join(String first, String second) {
        if (second.isEmpty()) return first;
        if (first.isEmpty()) return second;
        return first + "\n\n" + second;
    }
}
