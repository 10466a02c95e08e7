package com.rusticlang.cli;

import com.rusticlang.compiler.codegen.GeneratorConfig;
import com.rusticlang.compiler.compiler.RusticCompiler;
import com.rusticlang.compiler.stdlib.MappingTable;
import com.rusticlang.compiler.stdlib.MappingTableException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Rustic CLI 入口点（picocli）
 *
 * <p>退出码：0 成功，1 编译错误或 I/O 错误，2 映射表配置错误。</p>
 */
@Command(name = "rustic", version = "Rustic v0.1.0",
         mixinStandardHelpOptions = true,
         description = "把 Rustic 源码（.rsc）编译为 Rust 源码（.rs）")
public class Main implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源文件或源码目录")
    Path input;

    @Option(names = {"-o", "--output"}, defaultValue = "target/generated",
            description = "输出目录（默认 target/generated）")
    Path outputDir;

    @Option(names = {"-v", "--verbose"}, description = "输出详细日志")
    boolean verbose;

    @Option(names = "--mapping", description = "自定义标准库映射表（JSON）")
    Path mappingFile;

    @Option(names = {"-j", "--jobs"}, description = "并行编译线程数（默认为处理器数）")
    int jobs = Runtime.getRuntime().availableProcessors();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        configureLogging(verbose ? Level.FINE : Level.WARNING);

        if (jobs < 1) {
            err.println("错误: 线程数必须为正数 - " + jobs);
            return EXIT_CONFIG_ERROR;
        }

        MappingTable table;
        try {
            table = loadMapping(mappingFile);
        } catch (MappingTableException e) {
            err.println("错误: 映射表无效 - " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            err.println("错误: 无法读取映射表 - " + mappingFile);
            return EXIT_CONFIG_ERROR;
        }

        RusticCompiler compiler = new RusticCompiler(table, new GeneratorConfig());
        return new CompileRunner(compiler, jobs, out, err).compile(input, outputDir);
    }

    static MappingTable loadMapping(Path file) throws IOException {
        if (file == null) {
            return MappingTable.standard();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return MappingTable.load(reader);
        }
    }

    /**
     * 日志输出到 stderr，级别由 -v 控制
     */
    static void configureLogging(Level level) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new ConsoleHandler();
        stderrHandler.setFormatter(new SimpleFormatter());
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
        Logger.getLogger("com.rusticlang").setLevel(level);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
