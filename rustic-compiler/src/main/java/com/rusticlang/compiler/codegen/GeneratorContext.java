package com.rusticlang.compiler.codegen;

/**
 * 生成上下文，跟踪输出缓冲区和缩进层级
 */
public class GeneratorContext {
    private final StringBuilder output = new StringBuilder();
    private final GeneratorConfig config;
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public GeneratorContext(GeneratorConfig config) {
        this.config = config;
        this.indentUnit = config.getIndentString();
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 追加一整行
     */
    public void line(String text) {
        append(text);
        newLine();
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 追加空行（避免连续多个空行）
     */
    public void blankLine() {
        int len = output.length();
        if (len == 0 || (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n')) {
            return;
        }
        if (output.charAt(len - 1) != '\n') {
            output.append("\n");
        }
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }
}
