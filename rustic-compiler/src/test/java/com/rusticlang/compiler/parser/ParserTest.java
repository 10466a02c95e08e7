package com.rusticlang.compiler.parser;

import com.rusticlang.compiler.ast.decl.*;
import com.rusticlang.compiler.ast.decl.Module;
import com.rusticlang.compiler.ast.expr.*;
import com.rusticlang.compiler.ast.stmt.*;
import com.rusticlang.compiler.ast.type.ListTypeRef;
import com.rusticlang.compiler.ast.type.NamedTypeRef;
import com.rusticlang.compiler.diagnostic.ErrorKind;
import com.rusticlang.compiler.lexer.LexException;
import com.rusticlang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Module parse(String source) {
        return new Parser(new Lexer(source, "test.rsc")).parse();
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    /** 解析 fn main() { ... } 的函数体 */
    private Block body(String statements) {
        return parse("fn main() {\n" + statements + "\n}").getFunctions().get(0).getBody();
    }

    /** 解析单个表达式（作为 return 的值） */
    private Expression expr(String expression) {
        Statement stmt = body("return " + expression).getStatements().get(0);
        return ((ReturnStmt) stmt).getValue();
    }

    // ================================================================
    // 声明
    // ================================================================

    @Nested
    @DisplayName("顶层声明")
    class DeclarationTests {

        @Test
        @DisplayName("模块名取自文件名")
        void testModuleName() {
            Module module = new Parser(new Lexer("", "src/geometry.rsc")).parse();
            assertEquals("geometry", module.getName());
            assertEquals("c", Parser.moduleNameOf("a\\b\\c.rsc"));
        }

        @Test
        @DisplayName("import 路径")
        void testImport() {
            Module module = parse("import std.io\nimport math");
            assertEquals(2, module.getImports().size());
            assertEquals(Arrays.asList("std", "io"), module.getImports().get(0).getParts());
            assertEquals("math", module.getImports().get(1).getFullName());
        }

        @Test
        @DisplayName("结构体字段可用逗号或换行分隔")
        void testStruct() {
            Module module = parse("struct Line {\n  start: Point,\n  end: Point\n  tags: list[string]\n}");
            StructDecl decl = module.getStructs().get(0);
            assertEquals("Line", decl.getName());
            assertEquals(3, decl.getFields().size());
            assertEquals("end", decl.getFields().get(1).getName());
            assertTrue(decl.getFields().get(2).getType() instanceof ListTypeRef);
            assertEquals("Point", ((NamedTypeRef) decl.getFields().get(0).getType()).getName());
        }

        @Test
        @DisplayName("负数常量")
        void testConst() {
            ConstDecl decl = (ConstDecl) parse("const MIN: int = -5").getDeclarations().get(0);
            assertEquals("MIN", decl.getName());
            assertTrue(decl.getValue() instanceof UnaryExpr);
        }

        @Test
        @DisplayName("i64 最小值折叠为一个字面量")
        void testMinIntConst() {
            ConstDecl decl = (ConstDecl) parse("const MIN: int = -9223372036854775808").getDeclarations().get(0);
            Literal value = (Literal) decl.getValue();
            assertEquals(Long.MIN_VALUE, value.getValue());
            assertEquals("-9223372036854775808", value.getLexeme());
            assertEquals(18, value.getLocation().getColumn());
        }

        @Test
        @DisplayName("参数默认值")
        void testParamDefaults() {
            FnDecl fn = parse("fn pad(s: string, width: int = 8, fill: string = \" \", shift: float = -0.5) {}")
                    .getFunctions().get(0);
            assertFalse(fn.getParams().get(0).hasDefault());
            assertEquals(8L, ((Literal) fn.getParams().get(1).getDefaultValue()).getValue());
            assertEquals(" ", ((Literal) fn.getParams().get(2).getDefaultValue()).getValue());
            assertTrue(fn.getParams().get(3).getDefaultValue() instanceof UnaryExpr);
        }

        @Test
        @DisplayName("函数签名")
        void testFunction() {
            FnDecl fn = parse("fn area(w: float, h: float) -> float {\n  return w * h\n}").getFunctions().get(0);
            assertEquals("area", fn.getName());
            assertEquals(2, fn.getParams().size());
            assertEquals("h", fn.getParams().get(1).getName());
            assertTrue(fn.hasReturnType());
            assertEquals(1, fn.getBody().getStatements().size());
        }

        @Test
        @DisplayName("声明顺序保持不变")
        void testDeclarationOrder() {
            Module module = parse("fn a() {}\nstruct B {}\nconst C: int = 1\nfn d() {}");
            assertEquals("a", module.getDeclarations().get(0).getName());
            assertEquals("B", module.getDeclarations().get(1).getName());
            assertEquals("C", module.getDeclarations().get(2).getName());
            assertEquals("d", module.getDeclarations().get(3).getName());
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("let 与 var")
        void testLetAndVar() {
            Block block = body("let a: int = 1\nvar b: string = \"x\"");
            LetStmt a = (LetStmt) block.getStatements().get(0);
            LetStmt b = (LetStmt) block.getStatements().get(1);
            assertFalse(a.isReassignable());
            assertTrue(b.isReassignable());
            assertEquals("b", b.getName());
        }

        @Test
        @DisplayName("分号分隔同一行的语句")
        void testSemicolons() {
            assertEquals(3, body("let a: int = 1; let b: int = 2; a = b").getStatements().size());
        }

        @Test
        @DisplayName("字段赋值")
        void testFieldAssignment() {
            AssignStmt stmt = (AssignStmt) body("p.start.x = 1.0").getStatements().get(0);
            assertTrue(stmt.getTarget() instanceof FieldAccessExpr);
            assertEquals("p", ((FieldAccessExpr) stmt.getTarget()).getRoot().getName());
        }

        @Test
        @DisplayName("else if 链")
        void testElseIfChain() {
            IfStmt stmt = (IfStmt) body("if a { f() } else if b { g() }\nelse { h() }").getStatements().get(0);
            assertTrue(stmt.getElseBranch() instanceof IfStmt);
            IfStmt inner = (IfStmt) stmt.getElseBranch();
            assertTrue(inner.getElseBranch() instanceof Block);
        }

        @Test
        @DisplayName("for 与 while")
        void testLoops() {
            Block block = body("for x in xs { f(x) }\nwhile i < 10 { i = i + 1 }");
            ForStmt loop = (ForStmt) block.getStatements().get(0);
            assertEquals("x", loop.getVariable());
            assertTrue(loop.getIterable() instanceof Identifier);
            assertTrue(block.getStatements().get(1) instanceof WhileStmt);
        }

        @Test
        @DisplayName("无值 return")
        void testBareReturn() {
            ReturnStmt stmt = (ReturnStmt) body("return").getStatements().get(0);
            assertFalse(stmt.hasValue());
        }
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testArithmeticPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("1 + 2 * 3");
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("|| 的优先级最低")
        void testLogicalPrecedence() {
            BinaryExpr or = (BinaryExpr) expr("a || b && c == d");
            assertEquals(BinaryExpr.BinaryOp.OR, or.getOperator());
            BinaryExpr and = (BinaryExpr) or.getRight();
            assertEquals(BinaryExpr.BinaryOp.AND, and.getOperator());
            assertEquals(BinaryExpr.BinaryOp.EQ, ((BinaryExpr) and.getRight()).getOperator());
        }

        @Test
        @DisplayName("左结合")
        void testLeftAssociative() {
            BinaryExpr sub = (BinaryExpr) expr("10 - 3 - 2");
            assertTrue(sub.getLeft() instanceof BinaryExpr);
            assertTrue(sub.getRight() instanceof Literal);
        }

        @Test
        @DisplayName("一元运算与括号")
        void testUnaryAndGrouping() {
            UnaryExpr neg = (UnaryExpr) expr("-(a + b)");
            assertEquals(UnaryExpr.UnaryOp.NEG, neg.getOperator());
            assertTrue(neg.getOperand() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("内置模块调用")
        void testBuiltinCalls() {
            CallExpr println = (CallExpr) expr("io.println(\"hi\")");
            assertEquals("io", println.getModule());
            assertEquals("println", println.getName());
            assertTrue(println.isBuiltinCall());

            CallExpr len = (CallExpr) expr("string.len(s)");
            assertEquals("string", len.getModule());
            CallExpr push = (CallExpr) expr("list.push(xs, 1)");
            assertEquals("list", push.getModule());
            assertEquals(2, push.getArgs().size());
        }

        @Test
        @DisplayName("用户函数调用与字段访问")
        void testCallAndFieldAccess() {
            CallExpr call = (CallExpr) expr("area(w, h)");
            assertFalse(call.isBuiltinCall());
            assertEquals(2, call.getArgs().size());

            FieldAccessExpr access = (FieldAccessExpr) expr("line.start.x");
            assertEquals("x", access.getField());
            assertEquals("line", access.getRoot().getName());
        }

        @Test
        @DisplayName("结构体与列表字面量")
        void testLiterals() {
            StructLiteralExpr point = (StructLiteralExpr) expr("Point { x: 1.0, y: 2.0 }");
            assertEquals("Point", point.getStructName());
            assertEquals(2, point.getFields().size());

            ListLiteralExpr list = (ListLiteralExpr) expr("[1, 2, 3,]");
            assertEquals(3, list.getElements().size());
            assertTrue(((ListLiteralExpr) expr("[]")).isEmpty());
        }
    }

    // ================================================================
    // 错误
    // ================================================================

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少右括号")
        void testMissingParen() {
            ParseException e = parseError("fn f() {\n  g(1\n}");
            assertEquals(ErrorKind.PARSE, e.getKind());
            assertEquals("')'", e.getExpected());
            assertEquals(3, e.getLocation().getLine());
        }

        @Test
        @DisplayName("顶层只允许声明")
        void testTopLevelStatement() {
            ParseException e = parseError("let x: int = 1");
            assertEquals("'import', 'struct', 'const' or 'fn'", e.getExpected());
        }

        @Test
        @DisplayName("非法赋值目标")
        void testInvalidAssignment() {
            parseError("fn f() { g() = 1 }");
        }

        @Test
        @DisplayName("if 头部不允许结构体字面量")
        void testStructLiteralInHeader() {
            parseError("fn f() { if p == Point { x: 1 } { } }");
        }

        @Test
        @DisplayName("不支持方法调用")
        void testMethodCallRejected() {
            parseError("fn f() { g().h() }");
        }

        @Test
        @DisplayName("let 必须带类型")
        void testLetWithoutType() {
            assertEquals("':'", parseError("fn f() { let x = 1 }").getExpected());
        }

        @Test
        @DisplayName("默认值之后的参数也必须有默认值")
        void testDefaultOrder() {
            assertEquals("'='", parseError("fn f(a: int = 1, b: int) {}").getExpected());
            assertEquals("literal", parseError("fn f(a: int = g()) {}").getExpected());
        }

        @Test
        @DisplayName("i64 最小值的绝对值只能跟在负号后")
        void testMinIntMagnitude() {
            Literal min = (Literal) expr("-9223372036854775808");
            assertEquals(Long.MIN_VALUE, min.getValue());
            assertThrows(LexException.class, () -> parse("fn f() -> int { return 9223372036854775808 }"));
            assertThrows(LexException.class, () -> parse("fn f(n: int) -> int { return n - 9223372036854775808 }"));
        }

        @Test
        @DisplayName("词法错误直接向上抛出")
        void testLexErrorPropagates() {
            assertThrows(LexException.class, () -> parse("fn f() { let s: string = \"abc }"));
        }
    }
}
