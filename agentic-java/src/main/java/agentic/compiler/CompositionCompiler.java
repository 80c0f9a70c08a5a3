package agentic.compiler;

import agentic.ast.decl.Decl;
import agentic.ast.decl.FunctionDecl;
import agentic.ast.decl.VarDecl;
import agentic.ast.expr.*;
import agentic.ir.BlockNode;
import agentic.ir.ContentContext;
import agentic.ir.SubComponentBody;
import agentic.sema.FunctionBody;
import agentic.sema.ImportResolver;
import agentic.sema.ResolveException;
import agentic.sema.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Inlines parameterless components declared in this module or reached through relative imports.
 * Their content is compiled as sub-component content.
 */
final class CompositionCompiler {
    private static final Logger log = LoggerFactory.getLogger(CompositionCompiler.class);

    private final TransformContext ctx;
    private final BlockCompiler blocks;

    CompositionCompiler(TransformContext ctx, BlockCompiler blocks) {
        this.ctx = ctx;
        this.blocks = blocks;
    }

    List<BlockNode> compose(JsxElement el) {
        String name = el.name();
        if (!el.attributes().isEmpty()) {
            throw new ResolveException("Component <" + name + ">: parameters not supported", el.loc());
        }
        for (Expr child : el.children()) {
            boolean blank = child instanceof JsxText t && t.isBlank()
                    || child instanceof JsxExpressionContainer c && c.isEmpty();
            if (!blank) {
                throw new ResolveException("Component <" + name + ">: children not supported", el.loc());
            }
        }

        ImportResolver.Resolved resolved = resolve(el);
        FunctionBody body = bodyOf(resolved.decl(), name);
        String key = resolved.module().path().getFileName() + ":" + name;
        log.debug("Inlining component {} from {}", name, resolved.module().path());

        return ctx.inComponent(key, el.loc(), () ->
                ctx.inModule(resolved.module(), () ->
                        ctx.inFunctionScope(body.locals(), null, null, () ->
                                ctx.inContent(ContentContext.SUB_COMPONENT, () -> {
                                    List<BlockNode> nodes = blocks.compileChildren(childrenOf(body.jsx()));
                                    return new ArrayList<BlockNode>(SubComponentBody.of(nodes).children());
                                }))));
    }

    private ImportResolver.Resolved resolve(JsxElement el) {
        Symbol sym = ctx.symbols().lookup(el.name());
        if (sym instanceof Symbol.Local local && isComponent(local.decl())) {
            return new ImportResolver.Resolved(ctx.module(), local.decl());
        }
        ImportResolver.Resolved found = ctx.imports().resolveLocal(
                ctx.module(), el.name(), CompositionCompiler::isComponent, ctx.chain(), el.loc());
        if (found == null) {
            throw new ResolveException("Unknown component <" + el.name() + ">", el.loc());
        }
        return found;
    }

    static boolean isComponent(Decl d) {
        if (d instanceof FunctionDecl) return true;
        return d instanceof VarDecl v && (v.initializer() instanceof ArrowFunction
                || v.initializer() instanceof JsxElement || v.initializer() instanceof JsxFragment);
    }

    private static FunctionBody bodyOf(Decl d, String name) {
        String what = "Component <" + name + ">";
        if (d instanceof FunctionDecl f) {
            return FunctionBody.ofBlock(f.body(), what, f.loc());
        }
        Expr init = ((VarDecl) d).initializer();
        if (init instanceof ArrowFunction fn) {
            return fn.blockBody() != null
                    ? FunctionBody.ofBlock(fn.blockBody(), what, fn.loc())
                    : FunctionBody.ofExpression(fn.expressionBody(), what);
        }
        return FunctionBody.ofExpression(init, what);
    }

    static List<Expr> childrenOf(Expr jsx) {
        if (jsx instanceof JsxFragment f) return f.children();
        return List.of(jsx);
    }
}
