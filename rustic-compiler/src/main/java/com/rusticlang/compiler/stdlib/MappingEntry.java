package com.rusticlang.compiler.stdlib;

import com.rusticlang.compiler.analysis.types.RusticType;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 映射表条目：一个内置函数到 Rust 表达式模板的映射（不可变）
 *
 * <p>模板中的 {@code {0}}、{@code {1}} 等占位符按位置替换为生成后的实参；
 * 其他花括号原样保留（如 {@code println!("{}", {0})}）。</p>
 */
public final class MappingEntry {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)}");

    private final String module;
    private final String name;
    private final List<RusticType> paramTypes;
    private final RusticType returnType;
    private final List<ArgMode> argModes;
    private final String target;
    private final String template;

    public MappingEntry(String module, String name, List<RusticType> paramTypes, RusticType returnType,
                        List<ArgMode> argModes, String target, String template) {
        this.module = module;
        this.name = name;
        this.paramTypes = Collections.unmodifiableList(paramTypes);
        this.returnType = returnType;
        this.argModes = Collections.unmodifiableList(argModes);
        this.target = target;
        this.template = template;
    }

    public String getModule() {
        return module;
    }

    public String getName() {
        return name;
    }

    public String getQualifiedName() {
        return module + "." + name;
    }

    public int getArity() {
        return paramTypes.size();
    }

    public List<RusticType> getParamTypes() {
        return paramTypes;
    }

    public RusticType getReturnType() {
        return returnType;
    }

    public List<ArgMode> getArgModes() {
        return argModes;
    }

    public ArgMode getArgMode(int index) {
        return argModes.get(index);
    }

    /** Rust 侧的目标名（如 f64::sqrt） */
    public String getTarget() {
        return target;
    }

    public String getTemplate() {
        return template;
    }

    /**
     * 展开模板
     *
     * @param args 已生成的实参文本，按位置排列
     */
    public String expand(List<String> args) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            sb.append(template, last, m.start());
            int index = Integer.parseInt(m.group(1));
            sb.append(args.get(index));
            last = m.end();
        }
        sb.append(template.substring(last));
        return sb.toString();
    }

    /** 模板中引用到的最大占位符下标，无占位符返回 -1 */
    int maxPlaceholder() {
        Matcher m = PLACEHOLDER.matcher(template);
        int max = -1;
        while (m.find()) {
            max = Math.max(max, Integer.parseInt(m.group(1)));
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MappingEntry)) return false;
        MappingEntry that = (MappingEntry) o;
        return module.equals(that.module) && name.equals(that.name) && paramTypes.equals(that.paramTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, name, paramTypes);
    }

    @Override
    public String toString() {
        return getQualifiedName() + "/" + getArity() + " -> " + target;
    }
}
