package com.rusticlang.compiler.compiler;

import com.rusticlang.compiler.diagnostic.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 并行编译测试
 */
class ParallelCompilerTest {

    private final RusticCompiler compiler = new RusticCompiler();

    @Test
    @DisplayName("结果按输入顺序返回")
    void testResultOrder() throws InterruptedException {
        List<CompilationUnit> units = new ArrayList<CompilationUnit>();
        for (int i = 0; i < 20; i++) {
            units.add(CompilationUnit.of("unit" + i + ".rsc",
                    "fn value" + i + "() -> int { return " + i + " }"));
        }

        try (ParallelCompiler parallel = new ParallelCompiler(compiler, 4)) {
            List<CompilationResult> results = parallel.compileAll(units);
            assertEquals(units.size(), results.size());
            for (int i = 0; i < units.size(); i++) {
                CompilationResult result = results.get(i);
                assertSame(units.get(i), result.getUnit());
                assertTrue(result.isSuccess());
                assertTrue(result.getOutput().contains("pub fn value" + i + "() -> i64 {\n    return " + i + ";\n}"));
            }
        }
    }

    @Test
    @DisplayName("一个单元失败不影响其他单元")
    void testFailureIsolated() throws InterruptedException {
        CompilationUnit first = CompilationUnit.of("first.rsc", "fn f() -> string { return \"a\" }");
        CompilationUnit broken = CompilationUnit.of("broken.rsc", "fn g() { let x: int = missing }");
        CompilationUnit last = CompilationUnit.of("last.rsc", "fn h() -> bool { return true }");

        try (ParallelCompiler parallel = new ParallelCompiler(compiler, 2)) {
            List<CompilationResult> results = parallel.compileAll(Arrays.asList(first, broken, last));
            assertTrue(results.get(0).isSuccess());
            assertFalse(results.get(1).isSuccess());
            assertEquals(ErrorKind.UNRESOLVED_NAME, results.get(1).getError().getKind());
            assertEquals("broken.rsc", results.get(1).getError().getLocation().getFile());
            assertTrue(results.get(2).isSuccess());
        }
    }

    @Test
    @DisplayName("并行与串行输出一致")
    void testMatchesSequential() throws InterruptedException {
        String source = "struct Item { label: string, qty: int }\n"
                + "fn total(items: list[Item]) -> int {\n"
                + "  var sum: int = 0\n"
                + "  for item in items { sum = sum + item.qty }\n"
                + "  return sum\n"
                + "}\n";
        List<CompilationUnit> units = new ArrayList<CompilationUnit>();
        for (int i = 0; i < 8; i++) {
            units.add(CompilationUnit.of("inventory" + i + ".rsc", source));
        }
        try (ParallelCompiler parallel = new ParallelCompiler(compiler, 8)) {
            for (CompilationResult result : parallel.compileAll(units)) {
                assertEquals(compiler.compile(result.getUnit()), result.getOutput());
            }
        }
    }

    @Test
    @DisplayName("线程数必须为正")
    void testInvalidThreads() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelCompiler(compiler, 0));
    }
}
