package agentic.ast;

import agentic.ast.decl.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public record Module(
        Path path,
        List<Decl> declarations
) {
    public List<ImportDecl> imports() {
        return declarations.stream()
                .filter(d -> d instanceof ImportDecl)
                .map(d -> (ImportDecl) d)
                .toList();
    }

    public Optional<ExportDefaultDecl> defaultExport() {
        return declarations.stream()
                .filter(d -> d instanceof ExportDefaultDecl)
                .map(d -> (ExportDefaultDecl) d)
                .findFirst();
    }

    public Optional<FunctionDecl> defaultFunction() {
        return declarations.stream()
                .filter(d -> d instanceof FunctionDecl f && f.isDefault())
                .map(d -> (FunctionDecl) d)
                .findFirst();
    }
}
