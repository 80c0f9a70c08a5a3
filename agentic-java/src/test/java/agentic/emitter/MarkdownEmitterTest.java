package agentic.emitter;

import agentic.diag.SourceLocation;
import agentic.ir.*;
import agentic.sema.FieldInfo;
import agentic.sema.TypeShape;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MarkdownEmitterTest {

    private static final CommandFrontmatter FM =
            new CommandFrontmatter("build", "Builds things", null, null, List.of(), null);

    private static String command(CommandContent... body) {
        return new MarkdownEmitter().emit(new CommandDocument(FM, List.of(body)));
    }

    private static String body(CommandContent... body) {
        String full = command(body);
        return full.substring(full.indexOf("---\n\n", 4) + 5);
    }

    private static ParagraphNode p(String text) {
        return new ParagraphNode(List.of(new TextNode(text)));
    }

    private static ListItemNode item(BlockNode... children) {
        return new ListItemNode(List.of(children));
    }

    @Test
    void command_has_frontmatter_blank_line_and_single_trailing_newline() {
        var cmd = new CommandFrontmatter("build", "Builds things", "[target]", null, List.of("Read", "Bash"), null);
        String out = new MarkdownEmitter().emit(new CommandDocument(cmd, List.of(
                new HeadingNode(2, List.of(new TextNode("Title"))),
                p("Body"))));

        assertTrue(out.startsWith("---\nname: build\ndescription: Builds things\n"));
        assertTrue(out.contains("argument-hint:"));
        assertTrue(out.contains("allowed-tools:\n"));
        assertTrue(out.contains("- Read\n"));
        assertTrue(out.endsWith("---\n\n## Title\n\nBody\n"));
    }

    @Test
    void agent_frontmatter_orders_fields() {
        var fm = new AgentFrontmatter("researcher", "Researches", "Read Grep", "cyan", "sonnet", null, null, null);
        String out = new MarkdownEmitter().emit(new AgentDocument(fm, List.of(p("Hi"))));
        assertTrue(out.startsWith("---\nname: researcher\ndescription: Researches\ntools: Read Grep\ncolor: cyan\nmodel: sonnet\n---\n"));
    }

    @Test
    void runtime_var_declarations_render_nothing() {
        assertEquals("Text\n", body(
                new RuntimeVarDeclNode(RuntimeVar.of("CTX"), "Ctx"),
                p("Text")));
    }

    @Test
    void ordered_list_honors_start() {
        var list = new ListNode(true, 3, List.of(item(p("a")), item(p("b"))));
        assertEquals("3. a\n4. b\n", body(list));
    }

    @Test
    void nested_list_indents_by_depth() {
        var inner = new ListNode(false, 1, List.of(item(p("child"))));
        var outer = new ListNode(false, 1, List.of(item(p("parent"), inner), item(p("next"))));
        assertEquals("- parent\n  - child\n- next\n", body(outer));
    }

    @Test
    void blockquote_marks_empty_lines() {
        var quote = new BlockquoteNode(List.of(p("one"), p("two")));
        assertEquals("> one\n>\n> two\n", body(quote));
    }

    @Test
    void code_block_and_inline_formatting() {
        var para = new ParagraphNode(List.of(
                new BoldNode(List.of(new TextNode("b"))),
                new TextNode(" "),
                new ItalicNode(List.of(new TextNode("i"))),
                new TextNode(" "),
                new InlineCodeNode("c"),
                new TextNode(" "),
                new LinkNode("https://x", List.of(new TextNode("t"))),
                new TextNode(" "),
                new VarRefNode(RuntimeVar.of("CTX").field("a"))));
        assertEquals("**b** *i* `c` [t](https://x) $CTX.a\n\n```ts\nlet x = 1;\n```\n",
                body(para, new CodeBlockNode("ts", "let x = 1;")));
    }

    @Test
    void xml_block_with_attributes() {
        var xml = new XmlBlockNode("context", Map.of("kind", "a\"b"), List.of(p("inner")));
        assertEquals("<context kind=\"a&quot;b\">\ninner\n</context>\n", body(xml));
    }

    @ParameterizedTest
    @CsvSource({
            "HEADING, '## Step 1.2: Setup\\n\\nDo it'",
            "BOLD, '**Step 1.2: Setup**\\n\\nDo it'",
            "XML, '<step number=\"1.2\" name=\"Setup\">\\nDo it\\n</step>'"
    })
    void step_variants(StepVariant variant, String expected) {
        var step = new StepNode("1.2", "Setup", variant, List.of(p("Do it")));
        assertEquals(expected.replace("\\n", "\n") + "\n", body(step));
    }

    @Test
    void semantic_sections() {
        var ctx = new ExecutionContextNode(List.of("docs/a.md", "@docs/b.md"), "@", List.of());
        var criteria = new SuccessCriteriaNode(List.of(
                new SuccessCriteriaNode.Item("done", false),
                new SuccessCriteriaNode.Item("checked", true)));
        var next = new OfferNextNode(List.of(new OfferNextNode.Route("Plan", "Plan the work", "/plan")));

        String out = body(ctx, criteria, next);
        assertTrue(out.contains("<execution_context>\n@docs/a.md\n@docs/b.md\n</execution_context>"));
        assertTrue(out.contains("<success_criteria>\n- [ ] done\n- [x] checked\n</success_criteria>"));
        assertTrue(out.contains("<offer_next>\n- **Plan**: Plan the work\n  `/plan`\n</offer_next>"));
    }

    @Test
    void control_flow_prose() {
        var ctx = RuntimeVar.of("CTX");
        var cond = new Condition.And(
                new Condition.Ref(ctx.field("a")),
                new Condition.Not(new Condition.Ref(ctx.field("b"))));
        String out = body(
                new IfNode(cond, List.of(p("yes"))),
                new ElseNode(List.of(p("no"))),
                new LoopNode(3, RuntimeVar.of("I"), List.of(new BreakNode("done"))),
                new ReturnNode("SUCCESS", "All good"));
        assertEquals("""
                **If $CTX.a && !$CTX.b:**

                yes

                **Otherwise:**

                no

                **Loop up to 3 times (counter: $I):**

                **Break loop:** done

                **End command (SUCCESS)**: All good
                """, out);
    }

    @Test
    void comparison_conditions() {
        var v = RuntimeVar.of("CTX");
        assertEquals("$CTX.s === \"x\"",
                MarkdownEmitter.condition(new Condition.Compare(Condition.Operator.EQ, v.field("s"), "x")));
        assertEquals("$CTX.n > 3",
                MarkdownEmitter.condition(new Condition.Compare(Condition.Operator.GT, v.field("n"), 3L)));
        assertEquals("($CTX.a || $CTX.b) && $CTX.c",
                MarkdownEmitter.condition(new Condition.And(
                        new Condition.Or(new Condition.Ref(v.field("a")), new Condition.Ref(v.field("b"))),
                        new Condition.Ref(v.field("c")))));
    }

    @Test
    void ask_user_lists_options() {
        var ask = new AskUserNode("Which?", "Pick", List.of(
                new AskUserNode.Option("a", "Option A", "first"),
                new AskUserNode.Option("b", "Option B", null)), RuntimeVar.of("CHOICE"), true);
        assertEquals("""
                Use the AskUserQuestion tool:

                - Question: "Which?"
                - Header: "Pick"
                - Options:
                  - "Option A" (value: "a") - first
                  - "Option B" (value: "b")
                - Multiple selection allowed

                Store the user's response in `$CHOICE`.
                """, body(ask));
    }

    @Test
    void spawn_renders_task_block_with_output() {
        var spawn = new SpawnAgentNode("researcher", "sonnet", "Research \"it\"", "Find the thing",
                null, RuntimeVar.of("RESULT"), null, null, null);
        assertEquals("""
                ```
                Task(
                  prompt="Find the thing",
                  subagent_type="researcher",
                  model="sonnet",
                  description="Research \\"it\\""
                )
                ```

                Store the agent's result in `$RESULT`.
                """, body(spawn));
    }

    @Test
    void spawn_with_agent_file_uses_general_purpose() {
        var spawn = new SpawnAgentNode("researcher", "sonnet", "d", "Go",
                null, null, "~/.claude/agents/researcher.md", null, null);
        String out = body(spawn);
        assertTrue(out.contains("prompt=\"First, read ~/.claude/agents/researcher.md for your role and instructions.\n\nGo\""));
        assertTrue(out.contains("subagent_type=\"general-purpose\""));
    }

    @Test
    void spawn_object_input_renders_sections() {
        var input = new SpawnInput.Properties(List.of(
                new SpawnInput.Property("phase", new SpawnInput.Text("one")),
                new SpawnInput.Property("goal", new SpawnInput.VarRef(RuntimeVar.of("CTX").field("goal"))),
                new SpawnInput.Property("count", new SpawnInput.Json(2L))));
        var spawn = new SpawnAgentNode("a", "m", "d", null, input, null, null, null, null);
        String out = body(spawn);
        assertTrue(out.contains("<phase>\none\n</phase>\n\n<goal>\n$(echo \\\"$CTX\\\" | jq -r '.goal')\n</goal>\n\n<count>\n2\n</count>"));
    }

    @Test
    void on_status_requires_earlier_spawn() {
        var ref = new OutputReference("researcher", TypeReference.ANY, List.of());
        var handler = new OnStatusNode(ref, "SUCCESS", List.of(p("ok")), SourceLocation.of(Path.of("cmd.tsx"), 7, 9));
        var ex = assertThrows(EmitException.class, () -> body(handler));
        assertTrue(ex.getMessage().startsWith("cmd.tsx:7:9: OnStatus for agent 'researcher'"), ex.getMessage());

        var spawn = new SpawnAgentNode("researcher", "m", "d", "p", null, null, null, null, null);
        assertTrue(body(spawn, handler).endsWith("**On SUCCESS:**\n\nok\n"));
    }

    @Test
    void runtime_call_escapes_single_quotes() {
        Map<String, RuntimeArg> args = new LinkedHashMap<>();
        args.put("name", new RuntimeArg.Literal("it's"));
        args.put("ctx", new RuntimeArg.Reference(RuntimeVar.of("CTX").field("id")));
        var call = new RuntimeCallNode("init", args, RuntimeVar.of("OUT"));
        assertEquals("```bash\nOUT=$(node runtime.js init '{\"name\":\"it'\"'\"'s\",\"ctx\":\"$CTX.id\"}')\n```\n",
                body(call));
    }

    @Test
    void assignments_render_as_bash() {
        var dir = RuntimeVar.of("PHASE_DIR");
        assertEquals("```bash\nPHASE_DIR=$(ls -d .planning/* | head -1)\n```\n",
                body(new AssignNode(dir, AssignNode.Source.BASH, "ls -d .planning/* | head -1", null, false)));
        assertEquals("```bash\nPHASE_DIR=\"two words\"\n```\n",
                body(new AssignNode(dir, AssignNode.Source.VALUE, "two words", null, false)));
        assertEquals("```bash\n# From the caller\nPHASE_DIR=$PHASE\n```\n",
                body(new AssignNode(dir, AssignNode.Source.ENV, "PHASE", "From the caller", false)));
    }

    @Test
    void assign_group_shares_one_block() {
        var group = new AssignGroupNode(List.of(
                new AssignNode(RuntimeVar.of("A"), AssignNode.Source.VALUE, "1", null, false),
                new AssignNode(RuntimeVar.of("B"), AssignNode.Source.ENV, "HOME", null, false),
                new AssignNode(RuntimeVar.of("C"), AssignNode.Source.BASH, "date", null, true)));
        assertEquals("```bash\nA=1\nB=$HOME\n\nC=$(date)\n```\n", body(group));
    }

    @Test
    void state_skills() {
        var read = new ReadStateNode("project", RuntimeVar.of("STATE"), "phase");
        var write = WriteStateNode.field("project", "phase", null, RuntimeVar.of("NEXT"));
        var literal = WriteStateNode.field("project", "phase", "2", null);
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("a", 1L);
        var merge = WriteStateNode.merge("project", values);

        String out = body(read, write, literal, merge);
        assertTrue(out.contains("Use skill `/react-agentic:state-read project --field \"phase\"` and store result in `STATE`."));
        assertTrue(out.contains("Use skill `/react-agentic:state-write project --field \"phase\" --value $NEXT`."));
        assertTrue(out.contains("--field \"phase\" --value \"2\"`."));
        assertTrue(out.contains("Use skill `/react-agentic:state-write project --merge '{\"a\":1}'`."));
    }

    @Test
    void structured_returns_section() {
        var node = new StructuredReturnsNode(List.of(
                new StructuredReturnsNode.Entry("SUCCESS", List.of(new TextNode("Done")))));
        assertEquals("<structured_returns>\n- **SUCCESS**: Done\n</structured_returns>\n", body(node));
    }

    @Test
    void agent_output_type_generates_output_format() {
        var type = TypeReference.named("Result", Path.of("result.ts"), null);
        var shape = new TypeShape("Result", List.of(
                new FieldInfo("status", "'SUCCESS' | 'ERROR'", true, List.of("SUCCESS", "ERROR")),
                new FieldInfo("message", "string", false, List.of()),
                new FieldInfo("files", "string[]", true, List.of()),
                new FieldInfo("count", "number", false, List.of()),
                new FieldInfo("mode", "'a' | 'b'", true, List.of("a", "b"))), null);
        var fm = new AgentFrontmatter("a", "d", null, null, null, null, type, null);

        String out = new MarkdownEmitter(t -> Optional.of(shape)).emit(new AgentDocument(fm, List.of(p("Body"))));

        assertTrue(out.contains("""
                ```yaml
                status: SUCCESS | BLOCKED | NOT_FOUND | ERROR | CHECKPOINT
                message: "Human-readable status message"
                files: [...]
                count: 0  # optional
                mode: <a | b>
                ```"""));
        assertTrue(out.contains("- **NOT_FOUND**: Requested resource not found"));
        assertTrue(out.endsWith("</structured_returns>\n"));
    }

    @Test
    void unresolvable_output_type_fails() {
        var type = TypeReference.named("Missing", Path.of("a.tsx"), SourceLocation.of(Path.of("a.tsx"), 3, 5));
        var fm = new AgentFrontmatter("a", "d", null, null, null, null, type, null);
        var ex = assertThrows(EmitException.class, () -> new MarkdownEmitter().emit(new AgentDocument(fm, List.of())));
        assertEquals("a.tsx:3:5: Cannot resolve output type 'Missing' of agent 'a'", ex.getMessage());
    }

    @Test
    void type_hints() {
        assertEquals("\"...\"", MarkdownEmitter.typeHint("string"));
        assertEquals("true | false", MarkdownEmitter.typeHint("boolean"));
        assertEquals("[...]", MarkdownEmitter.typeHint("Array<string>"));
        assertEquals("<Other>", MarkdownEmitter.typeHint("Other"));
    }
}
