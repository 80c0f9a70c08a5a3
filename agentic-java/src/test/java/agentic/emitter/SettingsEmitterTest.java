package agentic.emitter;

import agentic.ir.ConfigValue;
import agentic.ir.McpConfigDocument;
import agentic.ir.McpServerNode;
import agentic.ir.McpTransport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SettingsEmitterTest {

    private static ConfigValue lit(String s) {
        return ConfigValue.literal(s);
    }

    @Test
    void stdio_server_omits_type_and_empty_fields() {
        var server = new McpServerNode("fs", McpTransport.STDIO, lit("npx"),
                List.of(lit("-y"), lit("server-fs")), null, null, Map.of());
        var json = new SettingsEmitter(name -> null).server(server);
        assertEquals("{\"command\":\"npx\",\"args\":[\"-y\",\"server-fs\"]}", json.toString());
    }

    @Test
    void http_server_has_type_url_and_headers() {
        var server = new McpServerNode("api", McpTransport.HTTP, null, null, lit("https://api"),
                Map.of("Authorization", new ConfigValue.Env("TOKEN")), null);
        var json = new SettingsEmitter(Map.of("TOKEN", "Bearer x")::get).server(server);
        assertEquals("{\"type\":\"http\",\"url\":\"https://api\",\"headers\":{\"Authorization\":\"Bearer x\"}}",
                json.toString());
    }

    @Test
    void unset_environment_variable_fails() {
        var server = new McpServerNode("fs", McpTransport.STDIO, lit("npx"), null, null, null,
                Map.of("KEY", new ConfigValue.Env("MISSING_KEY")));
        var doc = new McpConfigDocument(List.of(server));
        var ex = assertThrows(EmitException.class, () -> new SettingsEmitter(name -> null).servers(doc));
        assertTrue(ex.getMessage().contains("MISSING_KEY"));
    }
}
