package com.rusticlang.compiler.stdlib;

import com.rusticlang.compiler.analysis.Resolver;
import com.rusticlang.compiler.analysis.types.ListType;
import com.rusticlang.compiler.analysis.types.TypeVariable;
import com.rusticlang.compiler.analysis.types.Types;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.diagnostic.CompileException;
import com.rusticlang.compiler.diagnostic.ErrorKind;
import com.rusticlang.compiler.lexer.Lexer;
import com.rusticlang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 标准库映射表测试
 */
class MappingTableTest {

    /** 只有 math.abs 的最小映射表 */
    private static final String MINIMAL = "{ \"formatVersion\": 1, \"version\": \"test\", \"modules\": {"
            + " \"math\": [ { \"name\": \"abs\", \"params\": [\"float\"], \"returns\": \"float\", \"target\": \"f64::abs\" } ] } }";

    private MappingTable load(String json) {
        return MappingTable.load(new StringReader(json));
    }

    private MappingTableException loadError(String json) {
        return assertThrows(MappingTableException.class, () -> load(json));
    }

    /** 用一个映射条目构造 JSON */
    private String withEntry(String entry) {
        return "{ \"formatVersion\": 1, \"modules\": { \"m\": [ " + entry + " ] } }";
    }

    @Nested
    @DisplayName("标准映射表")
    class StandardTableTests {

        @Test
        @DisplayName("包含 io、math、string、list 模块")
        void testModules() {
            MappingTable table = MappingTable.standard();
            assertTrue(table.getModules().containsAll(Arrays.asList("io", "math", "string", "list")));
            assertEquals("2024.1", table.getVersion());
            assertSame(table, MappingTable.standard());
        }

        @Test
        @DisplayName("按 (模块, 函数, 参数个数) 查找")
        void testLookup() {
            MappingTable table = MappingTable.standard();
            MappingEntry sqrt = table.lookup("math", "sqrt", 1);
            assertNotNull(sqrt);
            assertEquals("f64::sqrt", sqrt.getTarget());
            assertEquals(Types.FLOAT, sqrt.getReturnType());
            assertEquals(ArgMode.VALUE, sqrt.getArgMode(0));
            assertNull(table.lookup("math", "sqrt", 2));

            assertNotNull(table.lookup("io", "println", 0));
            assertNotNull(table.lookup("io", "println", 1));
            assertEquals(2, table.overloads("io", "println").size());
        }

        @Test
        @DisplayName("泛型签名")
        void testGenericSignature() {
            MappingEntry push = MappingTable.standard().lookup("list", "push", 2);
            assertTrue(push.getParamTypes().get(0) instanceof ListType);
            assertTrue(push.getParamTypes().get(1) instanceof TypeVariable);
            assertEquals(ArgMode.RECEIVER_MUT, push.getArgMode(0));
            assertTrue(push.getArgMode(0).isExclusive());
        }

        @Test
        @DisplayName("模板展开")
        void testExpand() {
            MappingTable table = MappingTable.standard();
            assertEquals("f64::sqrt(x)", table.lookup("math", "sqrt", 1).expand(Arrays.asList("x")));
            assertEquals("xs.push(1)", table.lookup("list", "push", 2).expand(Arrays.asList("xs", "1")));
            assertEquals("(s.len() as i64)", table.lookup("string", "len", 1).expand(Arrays.asList("s")));
        }
    }

    @Nested
    @DisplayName("自定义映射表")
    class CustomTableTests {

        @Test
        @DisplayName("缺少的内置函数报告 UnknownBuiltinError")
        void testMissingBuiltin() {
            MappingTable table = load(MINIMAL);
            Module module = new Parser(new Lexer("fn f(x: float) -> float {\n  return math.sqrt(x)\n}", "t.rsc")).parse();
            CompileException e = assertThrows(CompileException.class, () -> new Resolver(table).resolve(module));
            assertEquals(ErrorKind.UNKNOWN_BUILTIN, e.getKind());
            assertEquals(2, e.getLocation().getLine());
        }

        @Test
        @DisplayName("默认模板按函数调用展开")
        void testDefaultTemplate() {
            MappingEntry abs = load(MINIMAL).lookup("math", "abs", 1);
            assertEquals("f64::abs({0})", abs.getTemplate());
            assertEquals("test", load(MINIMAL).getVersion());
        }

        @Test
        @DisplayName("不支持的格式版本")
        void testFormatVersion() {
            loadError("{ \"formatVersion\": 2, \"modules\": {} }");
            loadError("{ \"modules\": {} }");
        }

        @Test
        @DisplayName("非法内容")
        void testInvalidContent() {
            loadError("not json {");
            loadError("[]");
            loadError("{ \"formatVersion\": 1 }");
            loadError(withEntry("{ \"name\": \"f\", \"params\": [\"int\"], \"args\": [\"BORROW\"], \"target\": \"f\" }"));
            loadError(withEntry("{ \"name\": \"f\", \"params\": [\"int\"], \"args\": [], \"target\": \"f\" }"));
            loadError(withEntry("{ \"name\": \"f\", \"params\": [\"matrix\"], \"target\": \"f\" }"));
            loadError(withEntry("{ \"name\": \"f\", \"params\": [], \"target\": \"f\", \"template\": \"f({0})\" }"));
        }

        @Test
        @DisplayName("重复条目")
        void testDuplicateEntry() {
            String entry = "{ \"name\": \"f\", \"params\": [], \"target\": \"f\" }";
            loadError(withEntry(entry + ", " + entry));
        }
    }
}
