package agentic.compiler;

import agentic.diag.CompilationException;
import agentic.emitter.EmitException;
import agentic.ir.*;
import agentic.sema.ResolveException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentCompilerTest {

    @TempDir
    Path dir;

    private TestProject project;

    @BeforeEach
    void setUp() {
        project = new TestProject(dir);
    }

    @Test
    void compile_command_with_markdown_elements() {
        project.write("build.tsx", """
            export default function Build() {
              return (
                <Command name="build" description="Builds things" allowedTools={['Read', 'Bash']}>
                  <h2>Steps</h2>
                  <p>Run the <b>build</b> now.</p>
                  <ol>
                    <li>First</li>
                    <li>Second</li>
                  </ol>
                </Command>
              );
            }
            """);

        var doc = (CommandDocument) project.compile("build.tsx");
        assertEquals("build", doc.frontmatter().name());
        assertEquals(2, doc.frontmatter().allowedTools().size());
        assertEquals(3, doc.children().size());

        assertEquals("## Steps\n\nRun the **build** now.\n\n1. First\n2. Second\n", project.body("build.tsx"));
    }

    @Test
    void spread_attributes_apply_in_order() {
        project.write("cmd.tsx", """
            const base = { name: 'base', description: 'From spread' };
            export default () => (
              <Command {...base} name="override">
                <p>x</p>
              </Command>
            );
            """);
        var doc = (CommandDocument) project.compile("cmd.tsx");
        assertEquals("override", doc.frontmatter().name());
        assertEquals("From spread", doc.frontmatter().description());
    }

    @Test
    void spread_of_call_result_is_rejected() {
        project.write("cmd.tsx", """
            export default () => (
              <Command {...makeProps()} name="c" description="d">
                <p>x</p>
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertTrue(ex.detail().startsWith("Spread of a function call result is not supported"), ex.detail());
    }

    @Test
    void render_function_receives_document_values() {
        project.write("cmd.tsx", """
            export default function Cmd() {
              return (
                <Command name="deploy" description="Deploys" folder="ops">
                  {(ctx) => <p>Writes to {ctx.outputPath} as {ctx.name}</p>}
                </Command>
              );
            }
            """);
        assertEquals("Writes to .claude/commands/ops/deploy.md as deploy\n", project.body("cmd.tsx"));
    }

    @Test
    void unknown_render_property_is_an_error() {
        project.write("cmd.tsx", """
            export default () => (
              <Command name="deploy" description="Deploys">
                {(ctx) => <p>{ctx.nope}</p>}
              </Command>
            );
            """);
        var ex = assertThrows(CompilationException.class, () -> project.compile("cmd.tsx"));
        assertTrue(ex.getMessage().contains("Unknown render context property 'nope'"));
    }

    @Test
    void runtime_variables_drive_conditions() {
        project.write("cmd.tsx", """
            interface Ctx { ready: boolean; count: number; }
            export default function Cmd() {
              const ctx = useRuntimeVar<Ctx>('CTX');
              return (
                <Command name="check" description="Checks">
                  <If condition={ctx.ready && ctx.count > 2}>
                    <p>Go</p>
                  </If>
                  <Else>
                    <p>Wait</p>
                  </Else>
                </Command>
              );
            }
            """);
        var doc = (CommandDocument) project.compile("cmd.tsx");
        assertTrue(doc.children().get(0) instanceof RuntimeVarDeclNode);

        assertEquals("**If $CTX.ready && $CTX.count > 2:**\n\nGo\n\n**Otherwise:**\n\nWait\n",
                project.body("cmd.tsx"));
    }

    @Test
    void else_must_follow_if() {
        project.write("cmd.tsx", """
            export default () => (
              <Command name="c" description="d">
                <p>text</p>
                <Else><p>no</p></Else>
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Else must immediately follow an If", ex.detail());
        assertEquals(4, ex.location().line());
    }

    @Test
    void break_must_be_inside_loop() {
        project.write("cmd.tsx", """
            export default () => (
              <Command name="c" description="d">
                <Break message="stop" />
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Break must be inside a Loop", ex.detail());
    }

    @Test
    void loop_with_break_and_counter() {
        project.write("cmd.tsx", """
            export default function Cmd() {
              const i = useRuntimeVar<number>('I');
              return (
                <Command name="c" description="d">
                  <Loop max={3} counter={i}>
                    <Break message="done" />
                  </Loop>
                </Command>
              );
            }
            """);
        assertEquals("**Loop up to 3 times (counter: $I):**\n\n**Break loop:** done\n", project.body("cmd.tsx"));
    }

    @Test
    void loop_max_must_be_positive() {
        project.write("cmd.tsx", """
            export default () => (
              <Command name="c" description="d">
                <Loop max={0}><p>x</p></Loop>
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Loop max must be a positive integer", ex.detail());
    }

    @Test
    void loop_max_outside_int_range_is_rejected() {
        project.write("cmd.tsx", """
            export default () => (
              <Command name="c" description="d">
                <Loop max={4294967297}><p>x</p></Loop>
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("<Loop> attribute 'max' is out of range: 4294967297", ex.detail());
    }

    @Test
    void list_start_outside_int_range_is_rejected() {
        project.write("cmd.tsx", """
            export default () => (
              <Command name="c" description="d">
                <ol start={99999999999}><li>a</li></ol>
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("<ol> attribute 'start' is out of range: 99999999999", ex.detail());
    }

    @Test
    void negative_index_on_runtime_variable_is_rejected() {
        project.write("cmd.tsx", """
            export default function Cmd() {
              const v = useRuntimeVar<string[]>('V');
              return (
                <Command name="c" description="d">
                  <p>{v[-1]}</p>
                </Command>
              );
            }
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Index out of range: v[-1]", ex.detail());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "<ReadState state=\"k\" into={v.a.b} />",
            "<Fn.Call args={{ x: 1 }} output={v.items[0]} />",
            "<SpawnAgent agent=\"a\" model=\"m\" description=\"d\" prompt=\"p\" output={v.res} />",
            "<AskUser question=\"Which?\" options={[{ value: 'a', label: 'A' }]} output={v.answer} />",
            "<Loop max={2} counter={v.i}><p>x</p></Loop>"
    })
    void store_targets_must_be_whole_variables(String element) {
        project.write("cmd.tsx", """
            function helper(args: { x: number }) { return args; }
            const Fn = runtimeFn(helper);
            export default function Cmd() {
              const v = useRuntimeVar<string>('V');
              return (
                <Command name="c" description="d">
                  %s
                </Command>
              );
            }
            """.formatted(element));
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertTrue(ex.detail().endsWith("must be a declared runtime variable, not a property path"), ex.detail());
        assertEquals(7, ex.location().line());
    }

    @Test
    void step_variant_is_validated() {
        project.write("cmd.tsx", """
            export default () => (
              <Command name="c" description="d">
                <Step number="1" name="Go" variant="fancy"><p>x</p></Step>
              </Command>
            );
            """);
        var ex = assertThrows(CompilationException.class, () -> project.compile("cmd.tsx"));
        assertTrue(ex.getMessage().contains("Step variant must be one of heading, bold, xml, got 'fancy'"));
    }

    @Test
    void spawn_agent_input_must_satisfy_contract() {
        project.write("cmd.tsx", """
            interface PlanInput {
              phase: string;
              goal: string;
              notes?: string;
            }
            export default () => (
              <Command name="plan" description="Plans">
                <SpawnAgent<PlanInput> agent="planner" model="sonnet" description="Plan" input={{ phase: '1' }} />
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertTrue(ex.detail().startsWith("SpawnAgent input missing required properties: goal. "
                + "Interface 'PlanInput' requires: phase, goal"), ex.detail());
    }

    @Test
    void spawn_agent_with_output_and_status_handler() {
        project.write("cmd.tsx", """
            export default function Plan() {
              const result = useRuntimeVar<string>('RESULT');
              const out = useOutput('planner');
              return (
                <Command name="plan" description="Plans">
                  <SpawnAgent agent="planner" model="sonnet" description="Plan it" prompt="Make a plan" output={result} />
                  <OnStatus output={out} status="SUCCESS">
                    <p>Planned</p>
                  </OnStatus>
                </Command>
              );
            }
            """);
        String body = project.body("cmd.tsx");
        assertTrue(body.contains("subagent_type=\"planner\""));
        assertTrue(body.contains("Store the agent's result in `$RESULT`."));
        assertTrue(body.endsWith("**On SUCCESS:**\n\nPlanned\n"));
    }

    @Test
    void agent_contract_sections_and_output_format() {
        project.write("types.ts", """
            export interface PlanResult {
              status: 'SUCCESS' | 'ERROR';
              message?: string;
              plan: string;
            }
            """);
        project.write("planner.tsx", """
            import type { PlanResult } from './types';
            export default () => (
              <Agent<any, PlanResult> name="planner" description="Plans work" tools={['Read', 'Grep']}>
                <Role>You plan.</Role>
                <Methodology>Think first.</Methodology>
              </Agent>
            );
            """);
        var doc = (AgentDocument) project.compile("planner.tsx");
        assertEquals("Read Grep", doc.frontmatter().tools());

        String md = project.markdown("planner.tsx");
        assertTrue(md.contains("<role>\nYou plan.\n</role>\n\n<methodology>\nThink first.\n</methodology>"));
        assertTrue(md.contains("plan: \"...\""));
        assertTrue(md.contains("message: \"Human-readable status message\""));
    }

    @Test
    void unresolvable_agent_output_type_reports_its_location() {
        project.write("agent.tsx", """
            export default () => (
              <Agent<any, Missing> name="a" description="d">
                <p>Body</p>
              </Agent>
            );
            """);
        var ex = assertThrows(EmitException.class, () -> project.markdown("agent.tsx"));
        assertEquals("Cannot resolve output type 'Missing' of agent 'a'", ex.detail());
        assertEquals(2, ex.location().line());
        assertTrue(ex.getMessage().startsWith("agent.tsx:2:"), ex.getMessage());
    }

    @Test
    void contract_sections_out_of_order_fail() {
        project.write("agent.tsx", """
            export default () => (
              <Agent name="a" description="d">
                <Methodology>Later</Methodology>
                <Role>Earlier</Role>
              </Agent>
            );
            """);
        var ex = assertThrows(CompilationException.class, () -> project.compile("agent.tsx"));
        assertTrue(ex.getMessage().contains("<Role> must appear in order"));
    }

    @Test
    void components_are_inlined_from_imports() {
        project.write("parts/intro.tsx", """
            export const Intro = () => (
              <>
                <h2>Intro</h2>
                <p>Shared text</p>
              </>
            );
            """);
        project.write("cmd.tsx", """
            import { Intro } from './parts/intro';
            export default () => (
              <Command name="c" description="d">
                <Intro />
                <p>After</p>
              </Command>
            );
            """);
        assertEquals("## Intro\n\nShared text\n\nAfter\n", project.body("cmd.tsx"));
    }

    @Test
    void component_parameters_are_rejected() {
        project.write("cmd.tsx", """
            function Intro() {
              return <p>Hi</p>;
            }
            export default () => (
              <Command name="c" description="d">
                <Intro title="x" />
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Component <Intro>: parameters not supported", ex.detail());
    }

    @Test
    void component_children_are_rejected() {
        project.write("cmd.tsx", """
            function Intro() {
              return <p>Hi</p>;
            }
            export default () => (
              <Command name="c" description="d">
                <Intro><p>Nested</p></Intro>
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Component <Intro>: children not supported", ex.detail());
    }

    @Test
    void non_static_attribute_values_are_rejected() {
        project.write("cmd.tsx", """
            export default () => (
              <Command name={makeName()} description="d">
                <p>Body</p>
              </Command>
            );
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Cannot evaluate makeName() at compile time", ex.detail());
    }

    @Test
    void runtime_controls_are_rejected_inside_components() {
        project.write("cmd.tsx", """
            function Inner() {
              return (
                <Loop max={2}>
                  <p>again</p>
                </Loop>
              );
            }
            export default () => (
              <Command name="c" description="d">
                <Inner />
              </Command>
            );
            """);
        var ex = assertThrows(CompilationException.class, () -> project.compile("cmd.tsx"));
        assertTrue(ex.getMessage().contains("<loop> is not allowed in sub-component content"), ex.getMessage());
    }

    @Test
    void table_and_state_elements() {
        project.write("cmd.tsx", """
            export default function Cmd() {
              const state = useRuntimeVar<string>('STATE');
              return (
                <Command name="c" description="d">
                  <Table headers={['A', 'B']} rows={[['1', 'x|y']]} align={['left', 'right']} />
                  <ReadState state="project" into={state} field="phase" />
                  <WriteState state="project" field="phase" value="2" />
                </Command>
              );
            }
            """);
        String body = project.body("cmd.tsx");
        assertTrue(body.startsWith("| A | B |\n| :--- | ---: |\n| 1 | x\\|y |"));
        assertTrue(body.contains("Use skill `/react-agentic:state-read project --field \"phase\"` and store result in `STATE`."));
        assertTrue(body.contains("state-write project --field \"phase\" --value \"2\""));
    }

    @Test
    void shell_variables_are_assigned_in_bash_blocks() {
        project.write("cmd.tsx", """
            function Setup() {
              const phase = useVariable('PHASE');
              return <Assign var={phase} env="PHASE_NUMBER" />;
            }
            export default function Cmd() {
              const phaseDir = useVariable('PHASE_DIR');
              const out = useVariable('OUT');
              const user = useVariable('USER_NAME');
              return (
                <Command name="c" description="d">
                  <Setup />
                  <Assign var={phaseDir} bash="ls -d .planning/phases" comment="Find the phase" />
                  <AssignGroup>
                    <Assign var={out} value="/tmp/out.md" />
                    <br />
                    <Assign var={user} env="USER" />
                  </AssignGroup>
                  <p>Write to {out}</p>
                </Command>
              );
            }
            """);
        assertEquals("""
                ```bash
                PHASE=$PHASE_NUMBER
                ```

                ```bash
                # Find the phase
                PHASE_DIR=$(ls -d .planning/phases)
                ```

                ```bash
                OUT=/tmp/out.md

                USER_NAME=$USER
                ```

                Write to $OUT
                """, project.body("cmd.tsx"));
    }

    @Test
    void assign_requires_exactly_one_source() {
        project.write("cmd.tsx", """
            export default function Cmd() {
              const v = useVariable('V');
              return (
                <Command name="c" description="d">
                  <Assign var={v} value="a" env="B" />
                </Command>
              );
            }
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("<Assign> takes exactly one of 'bash', 'value' or 'env'", ex.detail());
    }

    @Test
    void assign_group_rejects_other_elements() {
        project.write("cmd.tsx", """
            export default function Cmd() {
              const v = useVariable('V');
              return (
                <Command name="c" description="d">
                  <AssignGroup>
                    <Assign var={v} value="a" />
                    <p>no</p>
                  </AssignGroup>
                </Command>
              );
            }
            """);
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("AssignGroup can only contain Assign or br elements, found: p", ex.detail());
    }

    @Test
    void runtime_function_calls() {
        project.write("cmd.tsx", """
            function init(args: { name: string }) { return args; }
            const Init = runtimeFn(init);
            export default function Cmd() {
              const out = useRuntimeVar<string>('OUT');
              return (
                <Command name="c" description="d">
                  <Init.Call args={{ name: "it's" }} output={out} />
                </Command>
              );
            }
            """);
        assertTrue(project.body("cmd.tsx").contains("OUT=$(node runtime.js init '{\"name\":\"it'\"'\"'s\"}')"));
    }

    @Test
    void mcp_config_document() {
        project.write("mcp.tsx", """
            export default () => (
              <MCPConfig>
                <MCPStdioServer name="fs" command="npx" args={['-y', 'server-fs']} />
                <MCPHTTPServer name="api" url="https://api" headers={{ Authorization: process.env.API_TOKEN }} />
              </MCPConfig>
            );
            """);
        var doc = (McpConfigDocument) project.compile("mcp.tsx");
        assertEquals(2, doc.servers().size());
        var api = doc.servers().get(1);
        assertEquals(McpTransport.HTTP, api.transport());
        assertEquals(new ConfigValue.Env("API_TOKEN"), api.headers().get("Authorization"));
    }

    @Test
    void root_must_be_a_document_element() {
        project.write("cmd.tsx", "export default () => <p>hi</p>;");
        assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
    }
}
