package com.rusticlang.compiler.compiler;

import com.rusticlang.compiler.analysis.Resolver;
import com.rusticlang.compiler.analysis.SymbolTable;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.codegen.GeneratorConfig;
import com.rusticlang.compiler.codegen.RustGenerator;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.lexer.Lexer;
import com.rusticlang.compiler.ownership.MoveChecker;
import com.rusticlang.compiler.ownership.OwnershipAnalyzer;
import com.rusticlang.compiler.ownership.OwnershipTable;
import com.rusticlang.compiler.parser.Parser;
import com.rusticlang.compiler.stdlib.MappingTable;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 编译器门面：词法 → 语法 → 解析 → 所有权分析 → 移动检查 → 代码生成
 *
 * <p>实例不持有单元之间的可变状态，可以在多个线程中共享；
 * 每次编译都创建自己的词法器、语法器、解析器、分析器与生成器。</p>
 */
public class RusticCompiler {

    private static final Logger LOG = Logger.getLogger(RusticCompiler.class.getName());

    private final MappingTable mappingTable;
    private final GeneratorConfig config;

    public RusticCompiler() {
        this(MappingTable.standard(), new GeneratorConfig());
    }

    public RusticCompiler(MappingTable mappingTable, GeneratorConfig config) {
        this.mappingTable = mappingTable;
        this.config = config;
    }

    public MappingTable getMappingTable() {
        return mappingTable;
    }

    /**
     * 编译一个模块
     *
     * @param source     源码
     * @param moduleName 模块名（生成的 .rs 文件名）
     * @return 生成的 Rust 源码
     * @throws CompileException 第一个编译错误
     */
    public String compile(String source, String moduleName) {
        return compile(new CompilationUnit(moduleName, moduleName + ".rsc", source));
    }

    /**
     * 编译一个单元
     */
    public String compile(CompilationUnit unit) {
        long start = System.nanoTime();

        Lexer lexer = new Lexer(unit.getSource(), unit.getFileName());
        Module module = new Parser(lexer, unit.getModuleName()).parse();
        LOG.fine("Parsed " + unit + ": " + module.getDeclarations().size() + " declarations");

        SymbolTable symbols = new Resolver(mappingTable).resolve(module);
        OwnershipTable ownership = new OwnershipAnalyzer(symbols).analyze(module);
        new MoveChecker(symbols, ownership).check(module);
        String output = new RustGenerator(symbols, ownership).generate(module, config);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Compiled " + unit + " in " + (System.nanoTime() - start) / 1_000_000 + " ms");
        }
        return output;
    }

    /**
     * 编译并把错误包装为结果对象
     */
    public CompilationResult tryCompile(CompilationUnit unit) {
        try {
            return CompilationResult.success(unit, compile(unit));
        } catch (CompileException e) {
            LOG.fine("Compilation of " + unit + " failed: " + e.getMessage());
            return CompilationResult.failure(unit, e);
        }
    }
}
