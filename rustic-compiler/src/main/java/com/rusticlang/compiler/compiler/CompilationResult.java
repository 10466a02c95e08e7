package com.rusticlang.compiler.compiler;

import com.rusticlang.compiler.diagnostic.CompileException;

/**
 * 单元编译结果：生成的 Rust 源码，或终止编译的第一个错误
 */
public final class CompilationResult {
    private final CompilationUnit unit;
    private final String output;
    private final CompileException error;

    private CompilationResult(CompilationUnit unit, String output, CompileException error) {
        this.unit = unit;
        this.output = output;
        this.error = error;
    }

    public static CompilationResult success(CompilationUnit unit, String output) {
        return new CompilationResult(unit, output, null);
    }

    public static CompilationResult failure(CompilationUnit unit, CompileException error) {
        return new CompilationResult(unit, null, error);
    }

    public CompilationUnit getUnit() {
        return unit;
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** 生成的源码，失败时为 null */
    public String getOutput() {
        return output;
    }

    /** 编译错误，成功时为 null */
    public CompileException getError() {
        return error;
    }
}
