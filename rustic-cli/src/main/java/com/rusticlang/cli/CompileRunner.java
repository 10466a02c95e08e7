package com.rusticlang.cli;

import com.rusticlang.compiler.codegen.RustNames;
import com.rusticlang.compiler.compiler.CompilationResult;
import com.rusticlang.compiler.compiler.CompilationUnit;
import com.rusticlang.compiler.compiler.ParallelCompiler;
import com.rusticlang.compiler.compiler.RusticCompiler;
import com.rusticlang.compiler.parser.Parser;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 编译执行器：收集源文件、并行编译、写出 .rs 文件与 lib.rs
 *
 * <p>任何一个单元编译失败时不写出任何文件。</p>
 */
public class CompileRunner {

    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    static final String SOURCE_EXTENSION = ".rsc";

    private final RusticCompiler compiler;
    private final int threads;
    private final PrintWriter out;
    private final PrintWriter err;

    public CompileRunner(RusticCompiler compiler, int threads, PrintWriter out, PrintWriter err) {
        this.compiler = compiler;
        this.threads = threads;
        this.out = out;
        this.err = err;
    }

    /**
     * 编译文件或目录
     *
     * @return 进程退出码
     */
    public int compile(Path input, Path outputDir) {
        if (!Files.exists(input)) {
            err.println("错误: 文件不存在 - " + input);
            return Main.EXIT_COMPILE_ERROR;
        }

        List<CompilationUnit> units;
        try {
            units = collectUnits(input);
        } catch (IOException e) {
            err.println("错误: 无法读取源文件 - " + e.getMessage());
            return Main.EXIT_COMPILE_ERROR;
        }
        if (units.isEmpty()) {
            err.println("错误: 没有找到 " + SOURCE_EXTENSION + " 源文件 - " + input);
            return Main.EXIT_COMPILE_ERROR;
        }

        Map<String, CompilationUnit> byModule = new HashMap<String, CompilationUnit>();
        for (CompilationUnit unit : units) {
            CompilationUnit previous = byModule.put(unit.getModuleName(), unit);
            if (previous != null) {
                err.println("错误: 模块名重复 '" + unit.getModuleName() + "' - "
                        + previous.getFileName() + ", " + unit.getFileName());
                return Main.EXIT_COMPILE_ERROR;
            }
        }

        List<CompilationResult> results;
        try (ParallelCompiler parallel = new ParallelCompiler(compiler, Math.min(threads, units.size()))) {
            results = parallel.compileAll(units);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("错误: 编译被中断");
            return Main.EXIT_COMPILE_ERROR;
        }

        int failures = 0;
        for (CompilationResult result : results) {
            if (!result.isSuccess()) {
                failures++;
                err.print(DiagnosticRenderer.render(result.getError(), result.getUnit().getSource()));
            }
        }
        if (failures > 0) {
            err.println("编译失败: " + failures + " 个错误");
            err.flush();
            return Main.EXIT_COMPILE_ERROR;
        }

        try {
            writeOutputs(results, outputDir);
        } catch (IOException e) {
            err.println("错误: 无法写入输出 - " + e.getMessage());
            return Main.EXIT_COMPILE_ERROR;
        }
        out.println("编译成功！" + results.size() + " 个模块 -> " + outputDir);
        out.flush();
        return Main.EXIT_OK;
    }

    List<CompilationUnit> collectUnits(Path input) throws IOException {
        List<Path> files;
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                files = stream
                        .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(SOURCE_EXTENSION))
                        .sorted()
                        .collect(Collectors.toList());
            }
        } else {
            files = Collections.singletonList(input);
        }

        List<CompilationUnit> units = new ArrayList<CompilationUnit>();
        for (Path file : files) {
            String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            String fileName = file.getFileName().toString();
            units.add(new CompilationUnit(moduleName(fileName), fileName, source));
            LOG.fine("  编译: " + file);
        }
        return units;
    }

    private void writeOutputs(List<CompilationResult> results, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        StringBuilder lib = new StringBuilder();
        for (CompilationResult result : results) {
            String module = result.getUnit().getModuleName();
            Path target = outputDir.resolve(module + ".rs");
            Files.write(target, result.getOutput().getBytes(StandardCharsets.UTF_8));
            lib.append("pub mod ").append(module).append(";\n");
            LOG.info("Wrote " + target);
        }
        Files.write(outputDir.resolve("lib.rs"), lib.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 由文件名得到 Rust 模块名：非标识符字符替换为下划线，数字开头加前缀，与关键字、预置名字或 lib / main 冲突时加后缀
     */
    static String moduleName(String fileName) {
        String base = Parser.moduleNameOf(fileName);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(ok ? c : '_');
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        String name = sb.toString();
        if (RustNames.isKeyword(name) || RustNames.isReserved(name) || "lib".equals(name) || "main".equals(name)) {
            name = name + "_";
        }
        return name;
    }
}
