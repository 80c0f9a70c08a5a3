package agentic.sema;

import agentic.compiler.TestProject;
import agentic.ir.CommandDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ImportResolverTest {

    @TempDir
    Path dir;

    private TestProject project;

    @BeforeEach
    void setUp() {
        project = new TestProject(dir);
    }

    private void writeEntry(String importLine) {
        project.write("cmd.tsx", importLine + """

            export default () => (
              <Command name="c" description="d">
                <Foo />
              </Command>
            );
            """);
    }

    @Test
    void circular_re_exports_are_detected() {
        project.write("a.tsx", "export { Foo } from './b';\n");
        project.write("b.tsx", "export { Foo } from './a';\n");
        writeEntry("import { Foo } from './a';");

        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Circular import detected: a.tsx -> b.tsx -> a.tsx", ex.detail());
    }

    @Test
    void package_imports_are_unsupported() {
        writeEntry("import { Foo } from 'some-package';");
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("package imports unsupported: 'some-package'", ex.detail());
    }

    @Test
    void missing_export_is_reported() {
        project.write("parts.tsx", "export const Bar = () => <p>bar</p>;\n");
        writeEntry("import { Foo } from './parts';");
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Module './parts' does not export 'Foo'", ex.detail());
    }

    @Test
    void unresolvable_path_is_reported() {
        writeEntry("import { Foo } from './nowhere';");
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertEquals("Cannot resolve import './nowhere'", ex.detail());
    }

    @Test
    void star_and_aliased_re_exports_resolve() {
        project.write("impl.tsx", "export function Inner() { return <p>from impl</p>; }\n");
        project.write("mid.tsx", "export { Inner as Foo } from './impl';\n");
        project.write("index.ts", "export * from './mid';\n");
        writeEntry("import { Foo } from './index.js';");

        var doc = (CommandDocument) project.compile("cmd.tsx");
        assertEquals(1, doc.children().size());
        assertEquals("from impl\n", project.body("cmd.tsx"));
    }

    @Test
    void default_import_resolves_default_export() {
        project.write("foo.tsx", """
            const Foo = () => <p>default</p>;
            export default Foo;
            """);
        writeEntry("import Foo from './foo';");
        assertEquals("default\n", project.body("cmd.tsx"));
    }

    @Test
    void cross_module_composition_cycle_is_detected() {
        project.write("a.tsx", """
            import { Bar } from './b';
            export function Foo() { return <Bar />; }
            """);
        project.write("b.tsx", """
            import { Foo } from './a';
            export function Bar() { return <Foo />; }
            """);
        writeEntry("import { Foo } from './a';");

        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertTrue(ex.detail().startsWith("Circular"), ex.detail());
        assertTrue(ex.detail().contains("a.tsx -> b.tsx -> a.tsx"), ex.detail());
    }

    @Test
    void self_composition_is_a_cycle() {
        project.write("loop.tsx", "export function Foo() { return <Foo />; }\n");
        writeEntry("import { Foo } from './loop';");
        var ex = assertThrows(ResolveException.class, () -> project.compile("cmd.tsx"));
        assertTrue(ex.detail().startsWith("Circular component composition"), ex.detail());
    }
}
