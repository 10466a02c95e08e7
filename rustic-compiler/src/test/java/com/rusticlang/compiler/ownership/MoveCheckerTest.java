package com.rusticlang.compiler.ownership;

import com.rusticlang.compiler.analysis.Resolver;
import com.rusticlang.compiler.analysis.SymbolTable;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.ast.expr.Expression;
import com.rusticlang.compiler.ast.expr.Identifier;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;
import com.rusticlang.compiler.lexer.Lexer;
import com.rusticlang.compiler.parser.Parser;
import com.rusticlang.compiler.stdlib.MappingTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 移动安全检查测试
 *
 * <p>先用分析器得到决策表，再把指定使用点改为 MOVE，验证检查器能发现移动后使用。</p>
 */
class MoveCheckerTest {

    private Module module;
    private SymbolTable symbols;
    private OwnershipTable analyzed;

    private void analyze(String source) {
        module = new Parser(new Lexer(source, "test.rsc")).parse();
        symbols = new Resolver(MappingTable.standard()).resolve(module);
        analyzed = new OwnershipAnalyzer(symbols).analyze(module);
    }

    /** 名为 name 的标识符使用点，按源码顺序 */
    private List<Identifier> uses(String name) {
        List<Identifier> result = new ArrayList<Identifier>();
        for (Expression e : analyzed.getDecisions().keySet()) {
            if (e instanceof Identifier && ((Identifier) e).getName().equals(name)) {
                result.add((Identifier) e);
            }
        }
        Collections.sort(result, Comparator.comparingInt(id -> id.getLocation().getOffset()));
        return result;
    }

    /** 复制分析结果，并把 override 的使用点改为 MOVE */
    private OwnershipTable tableWithMove(Identifier override) {
        OwnershipTable table = new OwnershipTable();
        for (Map.Entry<Expression, OwnershipDecision> e : analyzed.getDecisions().entrySet()) {
            table.record(e.getKey(), e.getValue());
        }
        table.record(override, OwnershipDecision.MOVE);
        return table;
    }

    private void check(OwnershipTable table) {
        new MoveChecker(symbols, table).check(module);
    }

    private CompileException checkError(OwnershipTable table) {
        return assertThrows(CompileException.class, () -> check(table));
    }

    @Nested
    @DisplayName("直线代码")
    class StraightLineTests {

        private static final String SOURCE = "fn main() {\n"
                + "  let s: string = \"x\"\n"
                + "  let a: string = s\n"
                + "  io.println(s)\n"
                + "}";

        @Test
        @DisplayName("分析器的结果总能通过检查")
        void testAnalyzedTablePasses() {
            analyze(SOURCE);
            check(analyzed);
            assertEquals(OwnershipDecision.CLONE, analyzed.getDecision(uses("s").get(0)));
        }

        @Test
        @DisplayName("移动之后再使用，报告两处位置")
        void testUseAfterMove() {
            analyze(SOURCE);
            CompileException e = checkError(tableWithMove(uses("s").get(0)));
            assertEquals(ErrorKind.USE_AFTER_MOVE, e.getKind());
            assertEquals(2, e.getLocations().size());
            assertEquals(4, e.getLocations().get(0).getLine());
            assertEquals(3, e.getLocations().get(1).getLine());
        }

        @Test
        @DisplayName("重新赋值后可以再次使用")
        void testReinitialization() {
            analyze("fn main() {\n"
                    + "  var s: string = \"x\"\n"
                    + "  let a: string = s\n"
                    + "  s = \"y\"\n"
                    + "  io.println(s)\n"
                    + "}");
            assertEquals(OwnershipDecision.MOVE, analyzed.getDecision(uses("s").get(0)));
            check(analyzed);
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("分支内移动，汇合后使用")
        void testMoveInBranch() {
            analyze("fn main(flag: bool) {\n"
                    + "  let s: string = \"x\"\n"
                    + "  if flag {\n"
                    + "    let t: string = s\n"
                    + "  }\n"
                    + "  io.println(s)\n"
                    + "}");
            check(analyzed);
            assertEquals(ErrorKind.USE_AFTER_MOVE, checkError(tableWithMove(uses("s").get(0))).getKind());
        }

        @Test
        @DisplayName("分支内移动后 return，汇合后使用是安全的")
        void testMoveThenReturn() {
            analyze("fn main(flag: bool) {\n"
                    + "  let s: string = \"x\"\n"
                    + "  if flag {\n"
                    + "    let t: string = s\n"
                    + "    return\n"
                    + "  }\n"
                    + "  io.println(s)\n"
                    + "}");
            assertEquals(OwnershipDecision.MOVE, analyzed.getDecision(uses("s").get(0)));
            check(analyzed);
        }

        @Test
        @DisplayName("循环体内移动在下一次迭代被发现")
        void testMoveInLoop() {
            analyze("fn main() {\n"
                    + "  let s: string = \"x\"\n"
                    + "  var i: int = 0\n"
                    + "  while i < 3 {\n"
                    + "    let t: string = s\n"
                    + "    i = i + 1\n"
                    + "  }\n"
                    + "}");
            check(analyzed);
            CompileException e = checkError(tableWithMove(uses("s").get(0)));
            assertEquals(ErrorKind.USE_AFTER_MOVE, e.getKind());
            assertEquals(5, e.getLocation().getLine());
        }

        @Test
        @DisplayName("for 循环变量每次迭代重新绑定")
        void testLoopVariable() {
            analyze("fn main(xs: list[string]) {\n"
                    + "  for x in xs {\n"
                    + "    let t: string = x\n"
                    + "  }\n"
                    + "}");
            assertEquals(OwnershipDecision.MOVE, analyzed.getDecision(uses("x").get(0)));
            check(analyzed);
        }
    }
}
