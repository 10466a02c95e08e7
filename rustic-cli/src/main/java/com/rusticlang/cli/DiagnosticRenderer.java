package com.rusticlang.cli;

import com.rusticlang.compiler.ast.SourceLocation;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.parser.ParseException;

import java.util.List;

/**
 * 把编译错误渲染为终端诊断：
 *
 * <pre>
 * geometry.rsc:4:9: error[UseAfterMoveError]: 'a' 在所有权转移之后被使用
 *    4 |     print(a)
 *      |           ^
 *   note: geometry.rsc:3:21
 * </pre>
 */
final class DiagnosticRenderer {

    private DiagnosticRenderer() {
    }

    static String render(CompileException e, String source) {
        StringBuilder sb = new StringBuilder();
        SourceLocation primary = e.getLocation();
        if (primary != null) {
            sb.append(primary).append(": ");
        }
        sb.append("error[").append(e.getKind().getDisplayName()).append("]: ").append(message(e)).append('\n');

        if (primary != null && source != null) {
            appendSnippet(sb, primary, source);
        }
        List<SourceLocation> locations = e.getLocations();
        for (int i = 1; i < locations.size(); i++) {
            sb.append("  note: ").append(locations.get(i)).append('\n');
        }
        return sb.toString();
    }

    private static String message(CompileException e) {
        if (!(e instanceof ParseException)) {
            return e.getDetail();
        }
        ParseException pe = (ParseException) e;
        StringBuilder sb = new StringBuilder(pe.getDetail());
        if (pe.getToken() != null) {
            sb.append(" (found ").append(pe.getFound()).append(')');
        }
        if (pe.getExpected() != null) {
            sb.append(", expected: ").append(pe.getExpected());
        }
        return sb.toString();
    }

    private static void appendSnippet(StringBuilder sb, SourceLocation location, String source) {
        String[] lines = source.split("\r?\n", -1);
        int lineIndex = location.getLine() - 1;
        if (lineIndex < 0 || lineIndex >= lines.length) {
            return;
        }
        String text = lines[lineIndex];
        String gutter = String.format("%4d | ", location.getLine());
        sb.append(gutter).append(text).append('\n');

        int col = Math.max(location.getColumn() - 1, 0);
        int width = Math.max(1, Math.min(location.getLength(), text.length() - col));
        StringBuilder marker = new StringBuilder();
        for (int i = 0; i < gutter.length() - 2; i++) marker.append(' ');
        marker.append("| ");
        for (int i = 0; i < col && i < text.length(); i++) {
            marker.append(text.charAt(i) == '\t' ? '\t' : ' ');
        }
        for (int i = 0; i < width; i++) marker.append('^');
        sb.append(marker).append('\n');
    }
}
