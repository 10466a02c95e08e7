package com.rusticlang.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 命令行端到端测试
 */
@DisplayName("rustic 命令行")
class MainTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("编译成功")
    class SuccessTests {

        @Test
        @DisplayName("编译目录：每个模块一个 .rs 文件，外加 lib.rs")
        void testCompileDirectory() throws IOException {
            write("src/geometry.rsc", "struct Point { x: float, y: float }\n"
                    + "fn norm(p: Point) -> float { return math.sqrt(p.x * p.x + p.y * p.y) }\n");
            write("src/nested/util.rsc", "fn twice(n: int) -> int { return n * 2 }\n");
            write("src/notes.txt", "not a source file");
            Path output = tempDir.resolve("out");

            int code = run(tempDir.resolve("src").toString(), "-o", output.toString(), "-j", "2");

            assertThat(code).isEqualTo(0);
            assertThat(err.toString()).isEmpty();
            assertThat(out.toString()).contains("编译成功！2 个模块");
            assertThat(read(output.resolve("geometry.rs")))
                    .startsWith("// Generated by the Rustic compiler. Do not edit.\n// Source module: geometry\n")
                    .contains("pub fn norm(p: &Point) -> f64 {");
            assertThat(read(output.resolve("util.rs"))).contains("pub fn twice(n: i64) -> i64 {");
            assertThat(read(output.resolve("lib.rs"))).isEqualTo("pub mod geometry;\npub mod util;\n");
        }

        @Test
        @DisplayName("编译单个文件，模块名与 Rust 关键字冲突时改名")
        void testCompileSingleFile() throws IOException {
            Path file = write("match.rsc", "fn f() {}\n");
            Path output = tempDir.resolve("out");

            assertThat(run(file.toString(), "--output", output.toString())).isEqualTo(0);
            assertThat(output.resolve("match_.rs")).exists();
            assertThat(read(output.resolve("lib.rs"))).isEqualTo("pub mod match_;\n");
        }

        @Test
        @DisplayName("--version")
        void testVersion() {
            assertThat(run("--version")).isEqualTo(0);
            assertThat(out.toString()).contains("Rustic v0.1.0");
        }
    }

    @Nested
    @DisplayName("编译失败")
    class FailureTests {

        @Test
        @DisplayName("编译错误：退出码 1，输出诊断，不写任何文件")
        void testCompileError() throws IOException {
            write("src/good.rsc", "fn f() -> int { return 1 }\n");
            write("src/bad.rsc", "fn main() {\n  let x: int = y\n}\n");
            Path output = tempDir.resolve("out");

            int code = run(tempDir.resolve("src").toString(), "-o", output.toString());

            assertThat(code).isEqualTo(1);
            assertThat(err.toString())
                    .contains("bad.rsc:2:16: error[UnresolvedNameError]: ")
                    .contains("   2 |   let x: int = y\n     |                ^\n")
                    .contains("编译失败: 1 个错误");
            assertThat(output).doesNotExist();
        }

        @Test
        @DisplayName("文件不存在")
        void testMissingInput() {
            assertThat(run(tempDir.resolve("nope.rsc").toString())).isEqualTo(1);
            assertThat(err.toString()).contains("错误: 文件不存在");
        }

        @Test
        @DisplayName("目录中没有源文件")
        void testEmptyDirectory() throws IOException {
            Files.createDirectories(tempDir.resolve("empty"));
            assertThat(run(tempDir.resolve("empty").toString())).isEqualTo(1);
            assertThat(err.toString()).contains("没有找到 .rsc 源文件");
        }

        @Test
        @DisplayName("不同目录下的同名模块")
        void testDuplicateModules() throws IOException {
            write("src/a/shapes.rsc", "fn f() {}\n");
            write("src/b/shapes.rsc", "fn g() {}\n");
            assertThat(run(tempDir.resolve("src").toString(), "-o", tempDir.resolve("out").toString()))
                    .isEqualTo(1);
            assertThat(err.toString()).contains("模块名重复 'shapes'");
        }
    }

    @Nested
    @DisplayName("配置错误")
    class ConfigTests {

        @Test
        @DisplayName("映射表无效：退出码 2")
        void testBadMapping() throws IOException {
            Path source = write("app.rsc", "fn f() {}\n");
            Path mapping = write("mapping.json", "[]");
            assertThat(run(source.toString(), "--mapping", mapping.toString())).isEqualTo(2);
            assertThat(err.toString()).contains("错误: 映射表无效");
        }

        @Test
        @DisplayName("映射表文件不存在：退出码 2")
        void testMissingMapping() throws IOException {
            Path source = write("app.rsc", "fn f() {}\n");
            assertThat(run(source.toString(), "--mapping", tempDir.resolve("none.json").toString())).isEqualTo(2);
            assertThat(err.toString()).contains("错误: 无法读取映射表");
        }

        @Test
        @DisplayName("自定义映射表中缺少的内置函数")
        void testCustomMapping() throws IOException {
            Path source = write("app.rsc", "fn f(x: float) -> float {\n  return math.sqrt(x)\n}\n");
            Path mapping = write("mapping.json", "{ \"formatVersion\": 1, \"version\": \"test\", \"modules\": {\n"
                    + "  \"math\": [ { \"name\": \"abs\", \"params\": [\"float\"], \"returns\": \"float\", \"target\": \"f64::abs\" } ]\n"
                    + "} }");
            assertThat(run(source.toString(), "--mapping", mapping.toString(), "-o", tempDir.resolve("out").toString()))
                    .isEqualTo(1);
            assertThat(err.toString()).contains("app.rsc:2:").contains("error[UnknownBuiltinError]");
        }

        @Test
        @DisplayName("线程数必须为正")
        void testBadJobs() throws IOException {
            Path source = write("app.rsc", "fn f() {}\n");
            assertThat(run(source.toString(), "-j", "0")).isEqualTo(2);
        }
    }
}
