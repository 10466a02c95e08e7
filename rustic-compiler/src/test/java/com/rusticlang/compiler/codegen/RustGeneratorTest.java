package com.rusticlang.compiler.codegen;

import com.rusticlang.compiler.analysis.Resolver;
import com.rusticlang.compiler.analysis.SymbolTable;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.lexer.Lexer;
import com.rusticlang.compiler.ownership.MoveChecker;
import com.rusticlang.compiler.ownership.OwnershipAnalyzer;
import com.rusticlang.compiler.ownership.OwnershipTable;
import com.rusticlang.compiler.parser.Parser;
import com.rusticlang.compiler.stdlib.MappingTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rust 代码生成测试
 */
class RustGeneratorTest {

    private String generate(String source, GeneratorConfig config) {
        Module module = new Parser(new Lexer(source, "geometry.rsc")).parse();
        SymbolTable symbols = new Resolver(MappingTable.standard()).resolve(module);
        OwnershipTable ownership = new OwnershipAnalyzer(symbols).analyze(module);
        new MoveChecker(symbols, ownership).check(module);
        return new RustGenerator(symbols, ownership).generate(module, config);
    }

    private String generate(String source) {
        return generate(source, new GeneratorConfig());
    }

    private void assertContains(String output, String... fragments) {
        for (String fragment : fragments) {
            assertTrue(output.contains(fragment), "missing:\n" + fragment + "\n--- in ---\n" + output);
        }
    }

    // ================================================================
    // 整体结构
    // ================================================================

    @Nested
    @DisplayName("整体结构")
    class LayoutTests {

        private static final String GEOMETRY = "struct Point { x: float, y: float }\n"
                + "fn norm(p: Point) -> float {\n"
                + "  return math.sqrt(p.x * p.x + p.y * p.y)\n"
                + "}\n";

        @Test
        @DisplayName("完整输出")
        void testFullOutput() {
            String expected = "// Generated by the Rustic compiler. Do not edit.\n"
                    + "// Source module: geometry\n"
                    + "\n"
                    + "#![allow(dead_code, unused_parens)]\n"
                    + "\n"
                    + "#[derive(Debug, Clone, PartialEq)]\n"
                    + "pub struct Point {\n"
                    + "    pub x: f64,\n"
                    + "    pub y: f64,\n"
                    + "}\n"
                    + "\n"
                    + "pub fn norm(p: &Point) -> f64 {\n"
                    + "    return f64::sqrt((p.x * p.x + p.y * p.y));\n"
                    + "}\n";
            assertEquals(expected, generate(GEOMETRY));
        }

        @Test
        @DisplayName("相同输入得到逐字节相同的输出")
        void testDeterminism() {
            String source = GEOMETRY
                    + "fn describe(p: Point) -> string { return \"(\" + string.from_float(p.x) + \")\" }\n"
                    + "fn main() {\n"
                    + "  let pts: list[Point] = [Point { x: 1.0, y: 2.0 }]\n"
                    + "  for p in pts { io.println(describe(p)) }\n"
                    + "}\n";
            assertEquals(generate(source), generate(source));
        }

        @Test
        @DisplayName("结构体字段按声明顺序输出")
        void testStructFieldOrder() {
            String output = generate("struct Line { end: Point, start: Point, label: string, tags: list[string] }\n"
                    + "struct Point { x: int, y: int }\n"
                    + "struct Empty {}");
            assertContains(output,
                    "pub struct Line {\n    pub end: Point,\n    pub start: Point,\n    pub label: String,\n"
                            + "    pub tags: Vec<String>,\n}\n",
                    "pub struct Empty {}\n");
            assertTrue(output.indexOf("pub struct Line") < output.indexOf("pub struct Point"));
        }

        @Test
        @DisplayName("常量")
        void testConst() {
            assertContains(generate("const LIMIT: int = -5\nconst RATE: float = 2\nconst ON: bool = true"),
                    "pub const LIMIT: i64 = -5;", "pub const RATE: f64 = 2.0;", "pub const ON: bool = true;");
        }

        @Test
        @DisplayName("缩进与文件头可配置")
        void testConfig() {
            GeneratorConfig config = new GeneratorConfig();
            config.setIndentSize(2);
            config.setHeaderComment(null);
            String output = generate("fn f() -> int { return 1 }", config);
            assertEquals("#![allow(dead_code, unused_parens)]\n\npub fn f() -> i64 {\n  return 1;\n}\n", output);

            config.setUseSpaces(false);
            assertContains(generate("fn f() -> int { return 1 }", config), "\treturn 1;");
            assertThrows(IllegalArgumentException.class, () -> config.setIndentSize(0));
        }
    }

    // ================================================================
    // 所有权标记
    // ================================================================

    @Nested
    @DisplayName("所有权标记")
    class OwnershipMarkerTests {

        @Test
        @DisplayName("MOVE 与 CLONE")
        void testMoveAndClone() {
            String output = generate("fn take(s: string) -> string { return s }\n"
                    + "fn main() {\n"
                    + "  let x: string = \"hi\"\n"
                    + "  let a: string = take(x)\n"
                    + "  let b: string = take(x)\n"
                    + "}");
            assertContains(output,
                    "pub fn take(s: String) -> String {\n    return s;\n}",
                    "    let x: String = \"hi\".to_string();\n",
                    "    let a: String = take(x.clone());\n",
                    "    let b: String = take(x);\n");
        }

        @Test
        @DisplayName("共享借用：&str 参数与 & 实参")
        void testSharedBorrow() {
            String output = generate("fn show(s: string) { io.println(s) }\n"
                    + "fn main() {\n"
                    + "  let name: string = \"bob\"\n"
                    + "  show(name)\n"
                    + "  show(\"lit\")\n"
                    + "}");
            assertContains(output,
                    "pub fn show(s: &str) {\n    println!(\"{}\", s);\n}",
                    "    show(&name);\n",
                    "    show(\"lit\");\n");
        }

        @Test
        @DisplayName("独占借用：&mut 参数、&mut 实参与 let mut")
        void testExclusiveBorrow() {
            String output = generate("fn fill(xs: list[int]) { list.push(xs, 1) }\n"
                    + "fn main() {\n"
                    + "  let xs: list[int] = []\n"
                    + "  fill(xs)\n"
                    + "}");
            assertContains(output,
                    "pub fn fill(xs: &mut Vec<i64>) {\n    xs.push(1);\n}",
                    "    let mut xs: Vec<i64> = Vec::new();\n",
                    "    fill(&mut xs);\n");
        }

        @Test
        @DisplayName("字段路径与结构体字面量")
        void testFieldPaths() {
            String output = generate("struct Person { name: string, age: int }\n"
                    + "fn rename(p: Person, name: string) -> Person { return Person { name: name, age: p.age } }\n"
                    + "fn name_of(p: Person) -> string { return p.name }");
            assertContains(output,
                    "pub fn rename(p: &Person, name: String) -> Person {\n"
                            + "    return Person { name: name, age: p.age };\n}",
                    "pub fn name_of(p: &Person) -> String {\n    return p.name.clone();\n}");
        }

        @Test
        @DisplayName("同一结构体的不同字段分别借用")
        void testDisjointFieldBorrows() {
            String output = generate("struct Pair { xs: list[int], ys: list[int] }\n"
                    + "fn append(dst: list[int], src: list[int]) {\n"
                    + "  list.push(dst, list.len(src))\n"
                    + "}\n"
                    + "fn main() {\n"
                    + "  let p: Pair = Pair { xs: [1], ys: [2] }\n"
                    + "  append(p.xs, p.ys)\n"
                    + "}");
            assertContains(output,
                    "    let mut p: Pair = Pair { xs: vec![1], ys: vec![2] };\n",
                    "    append(&mut p.xs, &p.ys);\n");
        }

        @Test
        @DisplayName("for 循环消费列表参数")
        void testForLoop() {
            String output = generate("fn total(xs: list[int]) -> int {\n"
                    + "  var sum: int = 0\n"
                    + "  for x in xs { sum = sum + x }\n"
                    + "  return sum\n"
                    + "}");
            assertContains(output,
                    "pub fn total(xs: Vec<i64>) -> i64 {\n"
                            + "    let mut sum: i64 = 0;\n"
                            + "    for x in xs {\n"
                            + "        sum = sum + x;\n"
                            + "    }\n"
                            + "    return sum;\n"
                            + "}\n");
        }
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("字符串拼接生成 format!")
        void testConcat() {
            assertContains(generate("fn greet(name: string) -> string { return \"Hello, {\" + name + \"}!\" }"),
                    "pub fn greet(name: &str) -> String {\n    return format!(\"Hello, {{{}}}!\", name);\n}");
        }

        @Test
        @DisplayName("字符串比较")
        void testStringComparison() {
            assertContains(generate("fn same(a: string, b: string) -> bool { return a == b }"),
                    "    return a == b;\n");
            assertContains(generate("fn f() -> bool {\n  let s: string = \"x\"\n  return s == \"x\"\n}"),
                    "    return s.as_str() == \"x\";\n");
        }

        @Test
        @DisplayName("int 拓宽为 float")
        void testWidening() {
            String output = generate("fn half(x: float) -> float { return x / 2.0 }\n"
                    + "fn main() {\n"
                    + "  let n: int = 3\n"
                    + "  let h: float = half(n)\n"
                    + "  let k: float = half(4)\n"
                    + "}");
            assertContains(output, "    let h: f64 = half((n as f64));\n", "    let k: f64 = half(4.0);\n");
        }

        @Test
        @DisplayName("复合表达式拓宽时整体加括号")
        void testWideningCompound() {
            assertContains(generate("fn f(n: int) -> float {\n  let x: float = n + 1\n  return x\n}"),
                    "    let x: f64 = ((n + 1) as f64);\n");
            assertContains(generate("fn g(x: float) -> float { return x }\n"
                            + "fn h(n: int) -> float { return g(n * 2) }"),
                    "    return g(((n * 2) as f64));\n");
            assertContains(generate("fn neg(n: int) -> float { return -n }"),
                    "    return ((-n) as f64);\n");
        }

        @Test
        @DisplayName("省略的参数展开为默认值")
        void testDefaultArguments() {
            String output = generate("fn scale(x: float, k: float = 2) -> float { return x * k }\n"
                    + "fn greet(name: string = \"world\") -> string { return \"hi \" + name }\n"
                    + "fn main() {\n"
                    + "  let a: float = scale(1.0)\n"
                    + "  let g: string = greet()\n"
                    + "}");
            assertContains(output,
                    "pub fn scale(x: f64, k: f64) -> f64 {\n",
                    "pub fn greet(name: &str) -> String {\n",
                    "    let a: f64 = scale(1.0, 2.0);\n",
                    "    let g: String = greet(\"world\");\n");
        }

        @Test
        @DisplayName("i64 最小值字面量")
        void testMinIntLiteral() {
            String output = generate("const MIN: int = -9223372036854775808\n"
                    + "fn f() -> int {\n  let x: int = -9223372036854775808\n  return x\n}");
            assertContains(output,
                    "pub const MIN: i64 = -9223372036854775808;\n",
                    "    let x: i64 = -9223372036854775808;\n");
        }

        @Test
        @DisplayName("括号按优先级保留")
        void testParentheses() {
            assertContains(generate("fn f(a: int, b: int, c: int) -> int { return (a + b) * c - (a - b) }"),
                    "    return (a + b) * c - (a - b);\n");
            assertContains(generate("fn g(a: bool, b: bool) -> bool { return !(a && b) }"),
                    "    return !(a && b);\n");
        }

        @Test
        @DisplayName("else if 链")
        void testElseIf() {
            assertContains(generate("fn sign(n: int) -> int {\n"
                            + "  if n > 0 { return 1 } else if n < 0 { return -1 } else { return 0 }\n"
                            + "}"),
                    "    if n > 0 {\n        return 1;\n    } else if n < 0 {\n        return -1;\n"
                            + "    } else {\n        return 0;\n    }\n");
        }

        @Test
        @DisplayName("列表字面量与 Rust 关键字")
        void testListsAndKeywords() {
            assertContains(generate("fn names() -> list[string] { return [\"a\", \"b\"] }"),
                    "    return vec![\"a\".to_string(), \"b\".to_string()];\n");
            assertContains(generate("fn match(type: int) -> int { return type }"),
                    "pub fn r#match(r#type: i64) -> i64 {\n    return r#type;\n}");
        }

        @Test
        @DisplayName("改名后的标识符互不冲突")
        void testReservedNames() {
            assertContains(generate("fn f(self: int, self_: int) -> int { return self + self_ }"),
                    "pub fn f(self_: i64, self__: i64) -> i64 {\n    return self_ + self__;\n}");
        }

        @Test
        @DisplayName("与 Rust 标准类型同名的结构体")
        void testStructShadowingStdTypes() {
            String output = generate("struct String { x: int }\n"
                    + "struct Vec { n: int }\n"
                    + "fn f(s: string) -> string { return s }\n"
                    + "fn h() -> list[Vec] { return [Vec { n: 1 }] }\n"
                    + "fn w(v: String) -> int { return v.x }");
            assertContains(output,
                    "pub struct String_ {\n",
                    "pub struct Vec_ {\n",
                    "pub fn f(s: String) -> String {\n",
                    "pub fn h() -> Vec<Vec_> {\n    return vec![Vec_ { n: 1 }];\n}",
                    "pub fn w(v: &String_) -> i64 {\n");
        }

        @Test
        @DisplayName("字符串转义")
        void testEscapes() {
            assertContains(generate("fn f() { io.println(\"a\\\"b\\n\") }"),
                    "    println!(\"{}\", \"a\\\"b\\n\");\n");
        }
    }
}
