package agentic.diag;

import java.nio.file.Path;

/**
 * Position of a construct in a source module. {@code file} may be null for sources
 * that were compiled from a string.
 */
public record SourceLocation(Path file, int line, int column) {

    public static SourceLocation of(Path file, int line, int column) {
        return new SourceLocation(file, line, column);
    }

    public String render() {
        String f = file == null ? "<input>" : file.getFileName().toString();
        return f + ":" + line + ":" + column;
    }

    @Override
    public String toString() {
        return render();
    }
}
