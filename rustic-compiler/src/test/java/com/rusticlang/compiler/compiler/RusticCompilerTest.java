package com.rusticlang.compiler.compiler;

import com.rusticlang.compiler.codegen.GeneratorConfig;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;
import com.rusticlang.compiler.stdlib.MappingTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 编译器门面测试
 */
class RusticCompilerTest {

    private final RusticCompiler compiler = new RusticCompiler();

    private CompileException compileError(String source) {
        return assertThrows(CompileException.class, () -> compiler.compile(source, "broken"));
    }

    @Nested
    @DisplayName("完整流水线")
    class PipelineTests {

        @Test
        @DisplayName("编译完整程序")
        void testCompileProgram() {
            String output = compiler.compile("import io\n"
                    + "struct Counter { name: string, hits: int }\n"
                    + "const START: int = 0\n"
                    + "fn bump(c: Counter) -> Counter {\n"
                    + "  return Counter { name: c.name, hits: c.hits + 1 }\n"
                    + "}\n"
                    + "fn main() {\n"
                    + "  var c: Counter = Counter { name: \"clicks\", hits: START }\n"
                    + "  var i: int = 0\n"
                    + "  while i < 3 {\n"
                    + "    c = bump(c)\n"
                    + "    i = i + 1\n"
                    + "  }\n"
                    + "  io.println(c.name)\n"
                    + "}\n", "counter");

            assertTrue(output.startsWith("// Generated by the Rustic compiler. Do not edit.\n// Source module: counter\n"));
            assertTrue(output.contains("pub struct Counter {"));
            assertTrue(output.contains("pub const START: i64 = 0;"));
            assertTrue(output.contains("pub fn bump(c: &Counter) -> Counter {"));
            assertTrue(output.contains("return Counter { name: c.name.clone(), hits: c.hits + 1 };"));
            assertTrue(output.contains("let mut c: Counter = Counter { name: \"clicks\".to_string(), hits: START };"));
            assertTrue(output.contains("c = bump(&c);"));
            assertTrue(output.contains("println!(\"{}\", &c.name);"));
        }

        @Test
        @DisplayName("单元文件名决定诊断中的文件")
        void testUnitFileName() {
            CompilationUnit unit = CompilationUnit.of("src/app/main.rsc", "fn main() { let x: int = y }");
            assertEquals("main", unit.getModuleName());

            CompileException e = assertThrows(CompileException.class, () -> compiler.compile(unit));
            assertEquals(ErrorKind.UNRESOLVED_NAME, e.getKind());
            assertEquals("src/app/main.rsc", e.getLocation().getFile());
        }

        @Test
        @DisplayName("生成配置")
        void testConfig() {
            GeneratorConfig config = new GeneratorConfig();
            config.setHeaderComment(null);
            String output = new RusticCompiler(MappingTable.standard(), config).compile("fn f() {}", "m");
            assertTrue(output.startsWith("#![allow(dead_code, unused_parens)]"));
        }
    }

    @Nested
    @DisplayName("错误传递")
    class ErrorTests {

        @Test
        @DisplayName("各阶段的错误种类")
        void testErrorKinds() {
            assertEquals(ErrorKind.LEX, compileError("fn f() { let s: string = \"abc }").getKind());
            assertEquals(ErrorKind.PARSE, compileError("fn (").getKind());
            assertEquals(ErrorKind.TYPE_MISMATCH, compileError("fn f() { let x: int = \"a\" }").getKind());
            assertEquals(ErrorKind.UNKNOWN_BUILTIN, compileError("fn f() { io.shout(\"a\") }").getKind());
            assertEquals(ErrorKind.AMBIGUOUS_OWNERSHIP, compileError("fn both(a: list[int], b: list[int]) {\n"
                    + "  list.push(a, 1)\n"
                    + "  list.push(b, 2)\n"
                    + "}\n"
                    + "fn main() {\n"
                    + "  let xs: list[int] = [1]\n"
                    + "  both(xs, xs)\n"
                    + "}").getKind());
        }

        @Test
        @DisplayName("tryCompile 把错误包装为结果")
        void testTryCompile() {
            CompilationUnit ok = CompilationUnit.of("ok.rsc", "fn f() -> int { return 1 }");
            CompilationResult success = compiler.tryCompile(ok);
            assertTrue(success.isSuccess());
            assertNull(success.getError());
            assertTrue(success.getOutput().contains("pub fn f() -> i64 {"));

            CompilationUnit bad = CompilationUnit.of("bad.rsc", "fn f() -> int { }");
            CompilationResult failure = compiler.tryCompile(bad);
            assertFalse(failure.isSuccess());
            assertNull(failure.getOutput());
            assertSame(bad, failure.getUnit());
            assertEquals(ErrorKind.TYPE_MISMATCH, failure.getError().getKind());
        }
    }
}
