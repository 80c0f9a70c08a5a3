package agentic.compiler;

import agentic.emitter.MarkdownEmitter;
import agentic.ir.AgentDocument;
import agentic.ir.CommandDocument;
import agentic.ir.DocumentNode;
import agentic.sema.ImportResolver;
import agentic.sema.ModuleRegistry;
import agentic.sema.TypeResolver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Source files written under a temporary directory and compiled with a shared registry. */
public final class TestProject {
    private final Path root;
    private final ModuleRegistry registry = new ModuleRegistry();
    private final TypeResolver types;
    private final DocumentCompiler compiler;

    public TestProject(Path root) {
        this.root = root;
        ImportResolver imports = new ImportResolver(registry);
        this.types = new TypeResolver(imports);
        this.compiler = new DocumentCompiler(imports, types);
    }

    public Path write(String name, String source) {
        Path file = root.resolve(name);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, source);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    public DocumentNode compile(String name) {
        return compiler.compile(registry.load(root.resolve(name)));
    }

    public String markdown(String name) {
        DocumentNode doc = compile(name);
        MarkdownEmitter emitter = new MarkdownEmitter(types::resolve);
        if (doc instanceof CommandDocument c) return emitter.emit(c);
        return emitter.emit((AgentDocument) doc);
    }

    /** Markdown after the closing frontmatter line. */
    public String body(String name) {
        String full = markdown(name);
        return full.substring(full.indexOf("---\n\n", 4) + 5);
    }
}
