package com.rusticlang.compiler.codegen;

/**
 * Rust 代码生成配置
 */
public class GeneratorConfig {
    public static final String DEFAULT_HEADER = "Generated by the Rustic compiler. Do not edit.";

    private int indentSize = 4;
    private boolean useSpaces = true;
    private String headerComment = DEFAULT_HEADER;

    public GeneratorConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 1) {
            throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    public String getHeaderComment() {
        return headerComment;
    }

    /**
     * 文件头注释（不含 "// " 前缀），null 或空串表示不输出
     */
    public void setHeaderComment(String headerComment) {
        this.headerComment = headerComment;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
