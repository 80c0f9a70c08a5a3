package agentic.compiler;

import agentic.ast.expr.*;
import agentic.ir.*;
import agentic.sema.ExprText;
import agentic.sema.ResolveException;
import agentic.sema.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps JSX children to block nodes. Runs of text and inline elements become paragraphs;
 * every other element is dispatched by name.
 */
public final class BlockCompiler {
    private final TransformContext ctx;
    private final InlineCompiler inline;
    private final ControlFlowCompiler control;
    private final StructureCompiler structure;
    private final ContractCompiler contract;
    private final SpawnCompiler spawn;
    private final CompositionCompiler composition;

    public BlockCompiler(TransformContext ctx) {
        this.ctx = ctx;
        this.inline = new InlineCompiler(ctx);
        this.control = new ControlFlowCompiler(ctx, this);
        this.structure = new StructureCompiler(ctx, this);
        this.contract = new ContractCompiler(ctx, this);
        this.spawn = new SpawnCompiler(ctx, this);
        this.composition = new CompositionCompiler(ctx, this);
    }

    InlineCompiler inline() {
        return inline;
    }

    public List<BlockNode> compileChildren(List<Expr> children) {
        List<BlockNode> out = new ArrayList<>();
        List<Expr> run = new ArrayList<>();
        boolean afterIf = false;

        for (Expr child : children) {
            if (child instanceof JsxText t && t.isBlank()) {
                if (!run.isEmpty()) run.add(child);
                continue;
            }
            if (child instanceof JsxExpressionContainer c && c.isEmpty()) continue;
            if (InlineCompiler.isInline(child)) {
                run.add(child);
                afterIf = false;
                continue;
            }
            flush(run, out);

            Expr node = child instanceof JsxExpressionContainer c ? c.expression() : child;
            if (node instanceof JsxFragment f) {
                out.addAll(compileChildren(f.children()));
                afterIf = false;
                continue;
            }
            if (!(node instanceof JsxElement el)) {
                throw new ResolveException("Unexpected content: " + ExprText.describe(node), node.loc());
            }
            if (el.name().equals("Else") && !afterIf) {
                throw new ResolveException("Else must immediately follow an If", el.loc());
            }
            out.addAll(compileElement(el));
            afterIf = el.name().equals("If");
        }
        flush(run, out);
        return out;
    }

    private void flush(List<Expr> run, List<BlockNode> out) {
        if (run.isEmpty()) return;
        List<InlineNode> content = inline.compile(run);
        if (!content.isEmpty()) out.add(new ParagraphNode(content));
        run.clear();
    }

    List<BlockNode> compileElement(JsxElement el) {
        return IrErrors.at(el.loc(), () -> dispatch(el));
    }

    private List<BlockNode> dispatch(JsxElement el) {
        String name = el.name();
        if (name.endsWith(".Call")) {
            String fn = name.substring(0, name.length() - ".Call".length());
            if (!(ctx.symbols().lookup(fn) instanceof Symbol.RuntimeFunction rf)) {
                throw new ResolveException("'" + fn + "' is not a runtime function declared with runtimeFn", el.loc());
            }
            return List.of(VariableCompiler.runtimeCall(el, rf, ctx));
        }
        return switch (name) {
            case "h1", "h2", "h3", "h4", "h5", "h6" ->
                    List.of(new HeadingNode(name.charAt(1) - '0', inline.compile(el.children())));
            case "p" -> List.of(new ParagraphNode(inline.compile(el.children())));
            case "ul", "ol" -> List.of(list(el));
            case "li" -> throw new ResolveException("<li> must be inside <ul> or <ol>", el.loc());
            case "pre" -> List.of(codeBlock(el));
            case "blockquote" -> List.of(new BlockquoteNode(compileChildren(el.children())));
            case "hr" -> List.of(new ThematicBreakNode());
            case "div" -> List.of(new GroupNode(compileChildren(el.children())));
            case "Table" -> List.of(structure.table(el));
            case "XmlBlock" -> List.of(structure.xmlBlock(el));
            case "Markdown" -> List.of(new RawNode(inline.rawText(el.children())));
            case "Indent" -> List.of(structure.indent(el));
            case "Step" -> List.of(structure.step(el));
            case "ExecutionContext" -> List.of(structure.executionContext(el));
            case "SuccessCriteria" -> List.of(structure.successCriteria(el));
            case "OfferNext" -> List.of(structure.offerNext(el));
            case "Role", "UpstreamInput", "DownstreamConsumer", "Methodology" ->
                    List.of(contract.section(el, ContractSection.fromComponent(name)));
            case "StructuredReturns" -> List.of(contract.structuredReturns(el));
            case "ReturnStatus" ->
                    throw new ResolveException("ReturnStatus can only be used inside StructuredReturns", el.loc());
            case "ReadState" -> List.of(VariableCompiler.readState(el, ctx));
            case "WriteState" -> List.of(VariableCompiler.writeState(el, ctx));
            case "Assign" -> List.of(VariableCompiler.assign(el, ctx));
            case "AssignGroup" -> List.of(VariableCompiler.assignGroup(el, ctx));
            case "SpawnAgent" -> List.of(spawn.spawnAgent(el));
            case "OnStatus" -> List.of(spawn.onStatus(el));
            case "If" -> List.of(control.ifBlock(el));
            case "Else" -> List.of(control.elseBlock(el));
            case "Loop" -> List.of(control.loop(el));
            case "Break" -> List.of(control.breakLoop(el));
            case "Return" -> List.of(control.returnNode(el));
            case "AskUser" -> List.of(control.askUser(el));
            case "Command", "Agent", "MCPConfig", "MCPServer", "MCPStdioServer", "MCPHTTPServer" ->
                    throw new ResolveException("<" + name + "> can only be used as the document root", el.loc());
            default -> {
                if (el.isIntrinsic()) {
                    throw new ResolveException("Unsupported element <" + name + ">", el.loc());
                }
                yield composition.compose(el);
            }
        };
    }

    private ListNode list(JsxElement el) {
        boolean ordered = el.name().equals("ol");
        Integer start = new AttributeReader(el, ctx).integer("start");
        List<ListItemNode> items = new ArrayList<>();
        for (Expr child : el.children()) {
            if (child instanceof JsxText t && t.isBlank()) continue;
            if (child instanceof JsxExpressionContainer c && c.isEmpty()) continue;
            if (!(child instanceof JsxElement li) || !li.name().equals("li")) {
                throw new ResolveException("<" + el.name() + "> can only contain <li>", child.loc());
            }
            items.add(new ListItemNode(compileChildren(li.children())));
        }
        return new ListNode(ordered, start == null ? 1 : start, items);
    }

    private CodeBlockNode codeBlock(JsxElement pre) {
        List<Expr> significant = new ArrayList<>();
        for (Expr child : pre.children()) {
            if (child instanceof JsxText t && t.isBlank()) continue;
            significant.add(child);
        }
        if (significant.size() == 1 && significant.get(0) instanceof JsxElement code && code.name().equals("code")) {
            String className = new AttributeReader(code, ctx).string("className");
            String language = className != null && className.startsWith("language-")
                    ? className.substring("language-".length())
                    : null;
            return new CodeBlockNode(language, inline.rawText(code.children()));
        }
        return new CodeBlockNode(new AttributeReader(pre, ctx).string("language"), inline.rawText(pre.children()));
    }
}
