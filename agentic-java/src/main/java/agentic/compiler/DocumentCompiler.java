package agentic.compiler;

import agentic.ast.Module;
import agentic.ast.expr.Expr;
import agentic.ast.expr.JsxElement;
import agentic.ir.*;
import agentic.sema.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles one module into the document its root element describes.
 */
public final class DocumentCompiler {
    private static final Logger log = LoggerFactory.getLogger(DocumentCompiler.class);

    private final ImportResolver imports;
    private final TypeResolver types;

    public DocumentCompiler(ImportResolver imports, TypeResolver types) {
        this.imports = imports;
        this.types = types;
    }

    public DocumentNode compile(Module module) {
        FunctionBody root = DocumentLocator.locate(module);
        if (!(root.jsx() instanceof JsxElement rootElement)) {
            throw new ResolveException("Document root must be <Command>, <Agent> or <MCPConfig>", root.jsx().loc());
        }

        TransformContext ctx = new TransformContext(imports, types, module);
        DocumentNode doc = ctx.<DocumentNode>inFunctionScope(root.locals(), null, null, () -> switch (rootElement.name()) {
            case "Command" -> command(rootElement, ctx);
            case "Agent" -> agent(rootElement, ctx);
            case "MCPConfig" -> new McpCompiler(ctx).config(rootElement);
            default -> throw new ResolveException("Document root must be <Command>, <Agent> or <MCPConfig>, got <"
                    + rootElement.name() + ">", rootElement.loc());
        });
        log.debug("Compiled {} as {}", module.path(), doc.kind().tag());
        return doc;
    }

    private CommandDocument command(JsxElement el, TransformContext ctx) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        CommandFrontmatter fm = IrErrors.at(el.loc(), () -> new CommandFrontmatter(
                attrs.string("name"),
                attrs.string("description"),
                attrs.string("argumentHint"),
                attrs.string("agent"),
                attrs.stringList("allowedTools"),
                attrs.string("folder")));

        Map<String, String> renderValues = new LinkedHashMap<>();
        renderValues.put("name", fm.name());
        renderValues.put("description", fm.description());
        renderValues.put("outputPath", outputPath("commands", fm.folder(), fm.name()));
        renderValues.put("sourcePath", sourcePath(ctx.module().path()));

        List<BlockNode> body = body(el, renderValues, ctx);
        List<CommandContent> children = new ArrayList<>();
        for (BlockNode n : body) children.add((CommandContent) n);
        return IrErrors.at(el.loc(), () -> new CommandDocument(fm, children));
    }

    private AgentDocument agent(JsxElement el, TransformContext ctx) {
        AttributeReader attrs = new AttributeReader(el, ctx);
        Object tools = attrs.value("tools");
        String toolText = tools instanceof List<?> list
                ? String.join(" ", list.stream().map(Object::toString).toList())
                : attrs.string("tools");
        AgentFrontmatter fm = IrErrors.at(el.loc(), () -> new AgentFrontmatter(
                attrs.string("name"),
                attrs.string("description"),
                toolText,
                attrs.string("color"),
                attrs.string("model"),
                VariableCompiler.typeReference(el.typeArgs(), 0, el.loc(), ctx),
                VariableCompiler.typeReference(el.typeArgs(), 1, el.loc(), ctx),
                attrs.string("folder")));

        Map<String, String> renderValues = new LinkedHashMap<>();
        renderValues.put("name", fm.name());
        renderValues.put("description", fm.description());
        renderValues.put("outputPath", outputPath("agents", fm.folder(), fm.name()));
        renderValues.put("sourcePath", sourcePath(ctx.module().path()));
        renderValues.put("tools", fm.tools() == null ? "" : fm.tools());
        renderValues.put("model", fm.model() == null ? "" : fm.model());

        List<BlockNode> body = ctx.inContent(ContentContext.AGENT, () -> body(el, renderValues, ctx));
        List<AgentContent> children = new ArrayList<>();
        for (BlockNode n : body) children.add((AgentContent) n);
        return IrErrors.at(el.loc(), () -> new AgentDocument(fm, children));
    }

    private List<BlockNode> body(JsxElement root, Map<String, String> renderValues, TransformContext ctx) {
        BlockCompiler blocks = new BlockCompiler(ctx);
        DocumentContent content = RenderFunctionDetector.detect(root);
        List<BlockNode> compiled;
        if (content instanceof DocumentContent.Deferred deferred) {
            Symbol param = deferred.param() == null ? null : new Symbol.RenderContext(deferred.param(), renderValues);
            compiled = ctx.inFunctionScope(deferred.body().locals(), param, root.loc(),
                    () -> blocks.compileChildren(childrenOf(deferred.body().jsx())));
        } else {
            compiled = blocks.compileChildren(((DocumentContent.Literal) content).children());
        }
        List<BlockNode> out = new ArrayList<>(ctx.declarations());
        out.addAll(compiled);
        return out;
    }

    private static List<Expr> childrenOf(Expr jsx) {
        return CompositionCompiler.childrenOf(jsx);
    }

    static String outputPath(String kind, String folder, String name) {
        String dir = ".claude/" + kind + "/" + (folder == null || folder.isEmpty() ? "" : folder + "/");
        return dir + name + ".md";
    }

    private static String sourcePath(Path path) {
        if (path == null) return "";
        Path cwd = Path.of("").toAbsolutePath();
        return path.startsWith(cwd) ? cwd.relativize(path).toString() : path.toString();
    }
}
