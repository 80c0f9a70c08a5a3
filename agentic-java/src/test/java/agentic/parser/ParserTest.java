package agentic.parser;

import agentic.ast.Module;
import agentic.ast.decl.*;
import agentic.ast.expr.*;
import agentic.ast.stmt.*;
import agentic.ast.type.*;
import agentic.lexer.Lexer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Module parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parseModule();
    }

    private static JsxElement returnedElement(FunctionDecl fn) {
        var stmts = fn.body().statements();
        var ret = (ReturnStmt) stmts.get(stmts.size() - 1);
        return (JsxElement) ret.value();
    }

    @Test
    void parse_imports_with_default_named_and_type_specifiers() {
        var m = parse("""
            import Base, { Foo, Bar as Baz } from './parts';
            import type { Shape } from './types';
            """);
        assertEquals(2, m.imports().size());

        var first = m.imports().get(0);
        assertEquals("./parts", first.source());
        assertEquals("Base", first.defaultBinding());
        assertEquals("Bar", first.findLocal("Baz").name());
        assertTrue(first.isRelative());

        assertTrue(m.imports().get(1).typeOnly());
    }

    @Test
    void parse_interface_with_parents_and_optional_fields() {
        var m = parse("""
            export interface Result extends Base {
              status: 'SUCCESS' | 'BLOCKED';
              files?: string[];
            }
            """);
        var iface = (InterfaceDecl) m.declarations().get(0);
        assertEquals("Result", iface.name());
        assertTrue(iface.exported());
        assertEquals(1, iface.parents().size());
        assertEquals(2, iface.fields().size());

        var status = iface.fields().get(0);
        assertTrue(status.type() instanceof UnionTypeRef);
        var files = iface.fields().get(1);
        assertTrue(files.optional());
        assertTrue(files.type() instanceof ArrayTypeRef);
        assertEquals("string[]", files.type().text());
    }

    @Test
    void parse_default_function_returning_jsx() {
        var m = parse("""
            export default function Build() {
              const ctx = useRuntimeVar<Ctx>('CTX');
              return (
                <Command name="build" description="Builds things">
                  <h2>Title</h2>
                </Command>
              );
            }
            """);
        var fn = m.defaultFunction().orElseThrow();
        assertEquals("Build", fn.name());
        assertEquals(2, fn.body().statements().size());

        var decl = ((VarDeclStmt) fn.body().statements().get(0)).decl();
        var call = (CallExpr) decl.initializer();
        assertEquals("useRuntimeVar", call.calleeName());
        assertEquals(1, call.typeArgs().size());

        var root = returnedElement(fn);
        assertEquals("Command", root.name());
        assertEquals(2, root.attributes().size());
    }

    @Test
    void parse_member_element_names_and_spread_attributes() {
        var m = parse("""
            const props = { a: 1 };
            export default () => <Init.Call {...props} output={out} bare />;
            """);
        var def = m.defaultExport().orElseThrow();
        var arrow = (ArrowFunction) def.value();
        var el = (JsxElement) arrow.expressionBody();
        assertEquals("Init.Call", el.name());
        assertTrue(el.selfClosing());
        assertTrue(el.attributes().get(0) instanceof JsxAttribute.Spread);
        var bare = (JsxAttribute.Named) el.attributes().get(2);
        assertEquals("bare", bare.name());
        assertNull(bare.value());
    }

    @Test
    void loose_and_strict_equality_parse_the_same() {
        var m = parse("""
            const a = x == 1;
            const b = x === 1;
            const c = !flag && y !== 'z';
            """);
        var a = (BinaryExpr) ((VarDecl) m.declarations().get(0)).initializer();
        var b = (BinaryExpr) ((VarDecl) m.declarations().get(1)).initializer();
        assertEquals(BinaryExpr.Operator.EQ, a.op());
        assertEquals(BinaryExpr.Operator.EQ, b.op());

        var c = (BinaryExpr) ((VarDecl) m.declarations().get(2)).initializer();
        assertEquals(BinaryExpr.Operator.AND, c.op());
        assertTrue(c.left() instanceof UnaryExpr);
    }

    @Test
    void parse_re_exports() {
        var m = parse("""
            export { A, B as C } from './x';
            export * from './y';
            export { D };
            """);
        var from = (ExportFromDecl) m.declarations().get(0);
        assertEquals("./x", from.source());
        assertEquals("C", from.specifiers().get(1).alias());
        assertFalse(from.star());
        assertTrue(((ExportFromDecl) m.declarations().get(1)).star());
        assertTrue(m.declarations().get(2) instanceof ExportListDecl);
    }

    @Test
    void parse_object_literal_with_shorthand_and_spread() {
        var m = parse("const o = { ...base, name, count: 2 };");
        var obj = (ObjectLiteral) ((VarDecl) m.declarations().get(0)).initializer();
        assertEquals(3, obj.members().size());
        assertTrue(obj.members().get(0) instanceof ObjectLiteral.Spread);
        var shorthand = (ObjectLiteral.KeyValue) obj.members().get(1);
        assertEquals("name", shorthand.key());
        assertTrue(shorthand.value() instanceof Identifier);
    }

    @Test
    void mismatched_closing_tag_is_an_error() {
        assertThrows(ParseException.class, () -> parse("const x = <p>text</div>;"));
    }
}
