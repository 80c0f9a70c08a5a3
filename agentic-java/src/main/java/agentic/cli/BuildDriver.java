package agentic.cli;

import agentic.compiler.DocumentCompiler;
import agentic.diag.CompilationException;
import agentic.emitter.MarkdownEmitter;
import agentic.emitter.McpConfigMerger;
import agentic.emitter.SettingsEmitter;
import agentic.ir.AgentDocument;
import agentic.ir.CommandDocument;
import agentic.ir.DocumentNode;
import agentic.ir.McpConfigDocument;
import agentic.sema.ImportResolver;
import agentic.sema.ModuleRegistry;
import agentic.sema.TypeResolver;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Compiles a set of entry files. Each unit succeeds or fails on its own; MCP server entries of
 * all successful units are merged into the settings file with a single write at the end.
 */
public final class BuildDriver {
    private static final Logger log = LoggerFactory.getLogger(BuildDriver.class);

    public record UnitResult(Path input, Path output, String error) {
        public boolean ok() {
            return error == null;
        }
    }

    public record Report(List<UnitResult> units) {
        public Report {
            units = List.copyOf(units);
        }

        public long failures() {
            return units.stream().filter(u -> !u.ok()).count();
        }

        public boolean ok() {
            return failures() == 0;
        }
    }

    private final BuildOptions options;
    private final ModuleRegistry registry = new ModuleRegistry();
    private final TypeResolver types;
    private final DocumentCompiler compiler;
    private final Function<String, String> environment;

    public BuildDriver(BuildOptions options) {
        this.options = options;
        ImportResolver imports = new ImportResolver(registry);
        this.types = new TypeResolver(imports);
        this.compiler = new DocumentCompiler(imports, types);
        this.environment = name -> {
            String value = options.environment().apply(name);
            if (value == null) throw new BuildException("Environment variable '" + name + "' is not set");
            return value;
        };
    }

    public Report run() {
        List<UnitResult> results = new ArrayList<>();
        Map<String, ObjectNode> servers = new LinkedHashMap<>();
        boolean mcpContributed = false;

        for (Path input : options.inputs()) {
            try {
                DocumentNode document = compiler.compile(registry.load(input));
                Path output;
                if (document instanceof McpConfigDocument mcp) {
                    servers.putAll(new SettingsEmitter(environment).servers(mcp));
                    mcpContributed = true;
                    output = options.settingsPath();
                } else {
                    output = writeMarkdown(document);
                }
                log.info("Built {} -> {}", input, output);
                results.add(new UnitResult(input, output, null));
            } catch (CompilationException | BuildException e) {
                log.error("Failed {}: {}", input, e.getMessage());
                results.add(new UnitResult(input, null, e.getMessage()));
            }
        }

        if (mcpContributed) {
            try {
                McpConfigMerger.write(options.settingsPath(), servers);
                log.info("Updated {} with {} MCP server(s)", options.settingsPath(), servers.size());
            } catch (IOException e) {
                String message = "Cannot write " + options.settingsPath() + ": " + e.getMessage();
                log.error(message);
                results.add(new UnitResult(options.settingsPath(), null, message));
            }
        }
        return new Report(results);
    }

    private Path writeMarkdown(DocumentNode document) {
        MarkdownEmitter emitter = new MarkdownEmitter(types::resolve);
        String text;
        Path output;
        if (document instanceof CommandDocument command) {
            text = emitter.emit(command);
            output = outputPath("commands", command.frontmatter().folder(), command.frontmatter().name());
        } else {
            AgentDocument agent = (AgentDocument) document;
            text = emitter.emit(agent);
            output = outputPath("agents", agent.frontmatter().folder(), agent.frontmatter().name());
        }
        try {
            Files.createDirectories(output.getParent());
            Files.writeString(output, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BuildException("Cannot write " + output + ": " + e.getMessage(), e);
        }
        return output;
    }

    Path outputPath(String kind, String folder, String name) {
        Path dir = options.outRoot().resolve(".claude").resolve(kind);
        if (folder != null && !folder.isEmpty()) dir = dir.resolve(folder);
        return dir.resolve(name + ".md");
    }
}
