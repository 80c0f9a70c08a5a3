package agentic.sema;

import agentic.ast.Module;
import agentic.diag.SourceLocation;
import agentic.lexer.Lexer;
import agentic.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and parses modules once per build, keyed by normalized absolute path.
 */
public final class ModuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

    private static final List<String> EXTENSIONS = List.of(".tsx", ".ts");

    private final Map<Path, Module> modules = new HashMap<>();

    public Module load(Path path) {
        Path key = normalize(path);
        Module cached = modules.get(key);
        if (cached != null) return cached;

        String source;
        try {
            source = Files.readString(key);
        } catch (IOException e) {
            throw new ResolveException("Cannot read module " + key + ": " + e.getMessage(), null, e);
        }
        return register(key, source);
    }

    /** Parses {@code source} as the module at {@code path}, replacing any cached copy. */
    public Module register(Path path, String source) {
        Path key = normalize(path);
        var tokens = new Lexer(source, key).tokenize();
        Module module = new Parser(tokens, key).parseModule();
        modules.put(key, module);
        log.debug("Loaded module {} ({} declarations)", key, module.declarations().size());
        return module;
    }

    /**
     * Resolves a relative import specifier against the importing file. Tries the exact path,
     * {@code .js} swapped for a TypeScript extension, an appended extension, then an index file.
     */
    public Path resolveImport(Path fromFile, String specifier, SourceLocation loc) {
        Path base = normalize(fromFile).getParent().resolve(specifier).normalize();
        String raw = base.toString();

        if (Files.isRegularFile(base)) return base;
        if (raw.endsWith(".js")) {
            String stem = raw.substring(0, raw.length() - 3);
            for (String ext : EXTENSIONS) {
                Path p = Path.of(stem + ext);
                if (Files.isRegularFile(p)) return p;
            }
        }
        for (String ext : EXTENSIONS) {
            Path p = Path.of(raw + ext);
            if (Files.isRegularFile(p)) return p;
        }
        for (String ext : EXTENSIONS) {
            Path p = base.resolve("index" + ext);
            if (Files.isRegularFile(p)) return p;
        }
        throw new ResolveException("Cannot resolve import '" + specifier + "'", loc);
    }

    static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
