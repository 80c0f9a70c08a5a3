package agentic.cli;

import agentic.emitter.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BuildDriverTest {

    @TempDir
    Path src;

    @TempDir
    Path out;

    private Path write(String name, String source) throws Exception {
        Path file = src.resolve(name);
        Files.writeString(file, source);
        return file;
    }

    private static final String COMMAND = """
        export default () => (
          <Command name="deploy" description="Deploys" folder="ops">
            <p>Ship it</p>
          </Command>
        );
        """;

    private static final String AGENT = """
        export default () => (
          <Agent name="helper" description="Helps">
            <p>Help</p>
          </Agent>
        );
        """;

    private static final String MCP = """
        export default () => (
          <MCPConfig>
            <MCPHTTPServer name="api" url="https://api" headers={{ Authorization: process.env.API_TOKEN }} />
          </MCPConfig>
        );
        """;

    @Test
    void writes_commands_and_agents_under_claude_dir() throws Exception {
        var options = BuildOptions.of(List.of(write("deploy.tsx", COMMAND), write("helper.tsx", AGENT)), out);
        var report = new BuildDriver(options).run();

        assertTrue(report.ok());
        Path command = out.resolve(".claude/commands/ops/deploy.md");
        Path agent = out.resolve(".claude/agents/helper.md");
        assertTrue(Files.readString(command).endsWith("Ship it\n"));
        assertTrue(Files.readString(agent).startsWith("---\nname: helper\n"));
        assertEquals(command, report.units().get(0).output());
    }

    @Test
    void failing_unit_does_not_stop_others() throws Exception {
        var broken = write("broken.tsx", "export default () => <Command name=\"x\">;");
        var options = BuildOptions.of(List.of(broken, write("deploy.tsx", COMMAND)), out);
        var report = new BuildDriver(options).run();

        assertFalse(report.ok());
        assertEquals(1, report.failures());
        assertFalse(report.units().get(0).ok());
        assertTrue(Files.exists(out.resolve(".claude/commands/ops/deploy.md")));
    }

    @Test
    void missing_environment_variable_fails_the_unit() throws Exception {
        var options = BuildOptions.of(List.of(write("mcp.tsx", MCP)), out).withEnvironment(name -> null);
        var report = new BuildDriver(options).run();

        assertEquals(1, report.failures());
        assertTrue(report.units().get(0).error().contains("API_TOKEN"));
        assertFalse(Files.exists(out.resolve(".claude/settings.json")));
    }

    @Test
    void servers_merge_into_existing_settings() throws Exception {
        Path settings = out.resolve(".claude/settings.json");
        Files.createDirectories(settings.getParent());
        Files.writeString(settings, """
                { "model": "opus", "mcpServers": { "old": { "command": "x" } } }
                """);

        var options = BuildOptions.of(List.of(write("mcp.tsx", MCP)), out)
                .withEnvironment(Map.of("API_TOKEN", "Bearer t")::get);
        var report = new BuildDriver(options).run();

        assertTrue(report.ok());
        var json = Json.mapper().readTree(Files.readString(settings));
        assertEquals("opus", json.get("model").asText());
        assertEquals("x", json.get("mcpServers").get("old").get("command").asText());
        var api = json.get("mcpServers").get("api");
        assertEquals("http", api.get("type").asText());
        assertEquals("Bearer t", api.get("headers").get("Authorization").asText());
    }

    @Test
    void later_units_override_earlier_servers() throws Exception {
        var first = write("one.tsx", """
            export default () => (
              <MCPConfig>
                <MCPStdioServer name="fs" command="first" />
              </MCPConfig>
            );
            """);
        var second = write("two.tsx", """
            export default () => (
              <MCPConfig>
                <MCPStdioServer name="fs" command="second" />
              </MCPConfig>
            );
            """);
        var report = new BuildDriver(BuildOptions.of(List.of(first, second), out)).run();

        assertTrue(report.ok());
        var json = Json.mapper().readTree(Files.readString(out.resolve(".claude/settings.json")));
        assertEquals("second", json.get("mcpServers").get("fs").get("command").asText());
    }

    @Test
    void parse_command_line() {
        var options = BuildOptions.parse(new String[]{"build", "a.tsx", "b.tsx", "--out", "dist", "--settings", "s.json"});
        assertEquals(List.of(Path.of("a.tsx"), Path.of("b.tsx")), options.inputs());
        assertEquals(Path.of("dist"), options.outRoot());
        assertEquals(Path.of("s.json"), options.settingsPath());

        var defaults = BuildOptions.parse(new String[]{"build", "a.tsx"});
        assertEquals(Path.of(".", ".claude", "settings.json"), defaults.settingsPath());

        assertThrows(IllegalArgumentException.class, () -> BuildOptions.parse(new String[]{"build"}));
        assertThrows(IllegalArgumentException.class, () -> BuildOptions.parse(new String[]{"run", "a.tsx"}));
        assertThrows(IllegalArgumentException.class, () -> BuildOptions.parse(new String[]{"build", "a.tsx", "--out"}));
    }
}
