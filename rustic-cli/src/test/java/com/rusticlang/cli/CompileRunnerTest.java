package com.rusticlang.cli;

import com.rusticlang.compiler.compiler.CompilationUnit;
import com.rusticlang.compiler.compiler.RusticCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 编译执行器测试
 */
class CompileRunnerTest {

    @TempDir
    Path tempDir;

    private final StringWriter err = new StringWriter();
    private final CompileRunner runner = new CompileRunner(new RusticCompiler(), 2,
            new PrintWriter(new StringWriter()), new PrintWriter(err));

    @Test
    @DisplayName("文件名转换为合法的 Rust 模块名")
    void testModuleName() {
        assertThat(CompileRunner.moduleName("geometry.rsc")).isEqualTo("geometry");
        assertThat(CompileRunner.moduleName("my-module.rsc")).isEqualTo("my_module");
        assertThat(CompileRunner.moduleName("2d shapes.rsc")).isEqualTo("_2d_shapes");
        assertThat(CompileRunner.moduleName("type.rsc")).isEqualTo("type_");
        assertThat(CompileRunner.moduleName("lib.rsc")).isEqualTo("lib_");
        assertThat(CompileRunner.moduleName("main.rsc")).isEqualTo("main_");
        assertThat(CompileRunner.moduleName("self.rsc")).isEqualTo("self_");
        assertThat(CompileRunner.moduleName("std.rsc")).isEqualTo("std_");
        assertThat(CompileRunner.moduleName("日志.rsc")).isEqualTo("__");
    }

    @Test
    @DisplayName("按路径顺序收集目录中的源文件")
    void testCollectUnits() throws IOException {
        Files.createDirectories(tempDir.resolve("b"));
        Files.write(tempDir.resolve("b/zeta.rsc"), "fn z() {}".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("alpha.rsc"), "fn a() {}".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("README.md"), "# docs".getBytes(StandardCharsets.UTF_8));

        List<CompilationUnit> units = runner.collectUnits(tempDir);

        assertThat(units).extracting(CompilationUnit::getModuleName).containsExactly("alpha", "zeta");
        assertThat(units.get(0).getFileName()).isEqualTo("alpha.rsc");
        assertThat(units.get(0).getSource()).isEqualTo("fn a() {}");
    }

    @Test
    @DisplayName("多个单元失败时逐个报告")
    void testReportsEveryFailure() throws IOException {
        Files.write(tempDir.resolve("one.rsc"), "fn f() -> int { }".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("two.rsc"), "fn g( {".getBytes(StandardCharsets.UTF_8));
        Path output = tempDir.resolve("out");

        assertThat(runner.compile(tempDir, output)).isEqualTo(Main.EXIT_COMPILE_ERROR);
        assertThat(err.toString())
                .contains("one.rsc:1:")
                .contains("two.rsc:1:")
                .contains("编译失败: 2 个错误");
        assertThat(output).doesNotExist();
    }
}
