package com.rusticlang.compiler.compiler;

import com.rusticlang.compiler.parser.Parser;

/**
 * 一个编译单元：源码文本、模块名与用于诊断的文件名
 */
public final class CompilationUnit {
    private final String moduleName;
    private final String fileName;
    private final String source;

    public CompilationUnit(String moduleName, String fileName, String source) {
        this.moduleName = moduleName;
        this.fileName = fileName;
        this.source = source;
    }

    /**
     * 由文件名推导模块名（去掉目录与扩展名）
     */
    public static CompilationUnit of(String fileName, String source) {
        return new CompilationUnit(Parser.moduleNameOf(fileName), fileName, source);
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getFileName() {
        return fileName;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return moduleName + " (" + fileName + ")";
    }
}
