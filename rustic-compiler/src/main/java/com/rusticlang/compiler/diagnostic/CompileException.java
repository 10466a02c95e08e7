package com.rusticlang.compiler.diagnostic;

import com.rusticlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译异常：携带错误分类和一个或多个源码位置。
 *
 * <p>编译器核心遇到第一个错误即抛出，不做恢复，也不产生部分输出。</p>
 */
public class CompileException extends RuntimeException {
    private final ErrorKind kind;
    private final String detail;
    private final List<SourceLocation> locations;

    public CompileException(ErrorKind kind, String detail, SourceLocation... locations) {
        super(detail);
        this.kind = kind;
        this.detail = detail;
        List<SourceLocation> list = new ArrayList<SourceLocation>();
        for (SourceLocation loc : locations) {
            if (loc != null) list.add(loc);
        }
        this.locations = Collections.unmodifiableList(list);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** 不含位置信息的错误描述 */
    public String getDetail() {
        return detail;
    }

    public List<SourceLocation> getLocations() {
        return locations;
    }

    /** 主位置（第一个位置），无位置时返回 null */
    public SourceLocation getLocation() {
        return locations.isEmpty() ? null : locations.get(0);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.getDisplayName()).append(": ").append(detail);
        if (!locations.isEmpty()) {
            sb.append(" at ");
            for (int i = 0; i < locations.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(locations.get(i));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getMessage() + "]";
    }
}
