package com.tinytalk.compiler.parser;

import com.tinytalk.compiler.ast.AstPrinter;
import com.tinytalk.compiler.ast.decl.FnDecl;
import com.tinytalk.compiler.ast.decl.Program;
import com.tinytalk.compiler.ast.decl.StructDecl;
import com.tinytalk.compiler.ast.expr.LambdaExpr;
import com.tinytalk.compiler.ast.expr.StepChainExpr;
import com.tinytalk.compiler.ast.stmt.*;
import com.tinytalk.compiler.lexer.Lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parse();
    }

    /** 解析并以 S 表达式输出（去掉末尾换行） */
    private String sexpr(String source) {
        return new AstPrinter().print(parse(source)).trim();
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    // ============ 表达式优先级 ============

    @Nested
    @DisplayName("表达式优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testMultiplicative() {
            assertEquals("(+ 1 (* 2 3))", sexpr("1 + 2 * 3"));
        }

        @Test
        @DisplayName("幂运算右结合")
        void testPowerRightAssociative() {
            assertEquals("(** 2 (** 3 2))", sexpr("2 ** 3 ** 2"));
        }

        @Test
        @DisplayName("括号内整除")
        void testFloorDiv() {
            assertEquals("(let y (// 10 3))", sexpr("let y = (10 // 3)"));
        }

        @Test
        @DisplayName("逻辑与比较")
        void testLogical() {
            assertEquals("(or (and (> a 1) (< b 2)) (not c))", sexpr("a > 1 and b < 2 or not c"));
        }

        @Test
        @DisplayName("自然语言比较")
        void testNaturalComparisons() {
            assertEquals("(is x 1)", sexpr("x is 1"));
            assertEquals("(has xs 2)", sexpr("xs has 2"));
            assertEquals("(islike name \"A*\")", sexpr("name islike \"A*\""));
        }

        @Test
        @DisplayName("三元与管道")
        void testTernaryAndPipe() {
            assertEquals("(? (> x 0) \"pos\" \"neg\")", sexpr("x > 0 ? \"pos\" : \"neg\""));
            assertEquals("(|> xs f)", sexpr("xs |> f"));
        }

        @Test
        @DisplayName("区间与位运算")
        void testRangeAndBitwise() {
            assertEquals("(.. 1 (+ n 1))", sexpr("1..n + 1"));
            assertEquals("(..= 1 5)", sexpr("1..=5"));
            assertEquals("(| a (& b c))", sexpr("a | b & c"));
            assertEquals("(<< 1 4)", sexpr("1 << 4"));
        }

        @Test
        @DisplayName("一元运算")
        void testUnary() {
            assertEquals("(- (- x))", sexpr("- -x"));
            assertEquals("(~ 5)", sexpr("~5"));
        }
    }

    // ============ 后缀与基本表达式 ============

    @Nested
    @DisplayName("后缀与基本表达式")
    class PostfixTests {

        @Test
        @DisplayName("调用、下标与成员")
        void testCallIndexMember() {
            assertEquals("(call (. (index xs 0) name) 1 2)", sexpr("xs[0].name(1, 2)"));
        }

        @Test
        @DisplayName("空格分隔的参数")
        void testSpaceSeparatedArgs() {
            assertEquals("(call show a b)", sexpr("show(a b)"));
        }

        @Test
        @DisplayName("参数末尾的 ! 与 ? 并入名字")
        void testTrailingPunctuation() {
            assertEquals("(call show Hello world!)", sexpr("show(Hello, world!)"));
            assertEquals("(call show ready?)", sexpr("show(ready?)"));
        }

        @Test
        @DisplayName("类型关键词可作为名字与成员")
        void testTypeKeywordAsName() {
            assertEquals("(call str 5)", sexpr("str(5)"));
            assertEquals("(. x map)", sexpr("x.map"));
        }

        @Test
        @DisplayName("括号 lambda")
        void testParenLambda() {
            assertEquals("(lambda (x) (+ x 1))", sexpr("(x) => x + 1"));
            assertEquals("(lambda () 42)", sexpr("() => 42"));
            assertEquals("(lambda (a b=2) (* a b))", sexpr("(a, b = 2) => a * b"));
        }

        @Test
        @DisplayName("括号表达式不会误判为 lambda")
        void testParenthesized() {
            assertEquals("(* (+ a b) c)", sexpr("(a + b) * c"));
            assertEquals("x", sexpr("(x)"));
        }

        @Test
        @DisplayName("竖线 lambda")
        void testBarLambda() {
            assertEquals("(lambda (a b) (+ a b))", sexpr("|a, b| a + b"));
        }

        @Test
        @DisplayName("lambda 体：代码块与映射字面量")
        void testLambdaBodies() {
            Program program = parse("let f = (x) => { return x }");
            LetStmt let = (LetStmt) program.getStatements().get(0);
            assertTrue(((LambdaExpr) let.getInitializer()).hasBlockBody());

            assertEquals("(let g (lambda (x) (map (\"v\" x))))", sexpr("let g = (x) => {\"v\": x}"));
            assertEquals("(let h (lambda (x) (map (\"v\" x))))", sexpr("let h = (x) => { v: x }"));
        }

        @Test
        @DisplayName("数组与映射字面量")
        void testCollections() {
            assertEquals("(list 1 2 3)", sexpr("[1, 2, 3,]"));
            assertEquals("(let m (map (\"id\" 1) (\"name\" \"A\")))", sexpr("let m = {id: 1, \"name\": \"A\"}"));
            assertEquals("(list (map (\"a\" 1)) (map))", sexpr("[\n  {a: 1},\n  {}\n]"));
            assertEquals("(block x)", sexpr("{ x }"));
        }

        @Test
        @DisplayName("字符串插值")
        void testInterpolation() {
            assertEquals("(interp \"Hi \" name \"!\")", sexpr("\"Hi {name}!\""));
            assertEquals("(interp (+ a b))", sexpr("\"{a + b}\""));
        }

        @Test
        @DisplayName("嵌套插值")
        void testNestedInterpolation() {
            assertEquals("(interp \"a \" (call f (interp \"b \" x)) \" c\")",
                    sexpr("\"a {f(\"b {x}\")} c\""));
        }

        @Test
        @DisplayName("match 表达式")
        void testMatch() {
            assertEquals("(match x (1 => \"one\") (_ => \"other\"))",
                    sexpr("match x {\n  1 => \"one\",\n  _ => \"other\"\n}"));
        }
    }

    // ============ 步骤链 ============

    @Nested
    @DisplayName("步骤链")
    class StepChainTests {

        @Test
        @DisplayName("裸动词链")
        void testBareSteps() {
            assertEquals("(chain xs (_filter (lambda (x) (> x 1))) (_sort))",
                    sexpr("xs _filter((x) => x > 1) _sort"));
        }

        @Test
        @DisplayName("点号动词")
        void testDotSteps() {
            assertEquals("(index (index (chain users (_join scores (lambda (r) (index r \"id\")))) 0) \"score\")",
                    sexpr("users._join(scores,(r)=>r[\"id\"])[0][\"score\"]"));
        }

        @Test
        @DisplayName("跨行书写的链")
        void testMultiLineChain() {
            Program program = parse("let top = xs\n  _sort\n  _reverse\n  _take(3)\nshow(top)");
            assertEquals(2, program.getStatements().size());
            LetStmt let = (LetStmt) program.getStatements().get(0);
            StepChainExpr chain = (StepChainExpr) let.getInitializer();
            assertThat(chain.getSteps()).extracting(StepChainExpr.Step::getVerb)
                    .containsExactly("_sort", "_reverse", "_take");
        }

        @Test
        @DisplayName("别名动词使用规范名")
        void testAliasVerb() {
            assertEquals("(chain rows (_groupBy f))", sexpr("rows _group_by(f)"));
        }

        @Test
        @DisplayName("动词不能开始一个表达式")
        void testStepWithoutSource() {
            ParseException e = parseError("_sort");
            assertEquals("Step '_sort' needs a value before it", e.getRawMessage());
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("let 带类型标注")
        void testLetWithType() {
            LetStmt let = (LetStmt) parse("let xs: list[int] = []").getStatements().get(0);
            assertEquals("xs", let.getName());
            assertEquals("list[int]", let.getTypeHint());
        }

        @Test
        @DisplayName("可选类型")
        void testOptionalTypeHint() {
            assertEquals("(let a:?str null)", sexpr("let a: ?str = null"));
            assertEquals("(let b:?int)", sexpr("let b: int?"));
        }

        @Test
        @DisplayName("分号分隔语句")
        void testSemicolons() {
            assertEquals(4, parse("let a = [1,2]; let b = a; append(b, 3); show(a)").getStatements().size());
        }

        @Test
        @DisplayName("赋值与复合赋值")
        void testAssignments() {
            assertEquals("(= x 1)", sexpr("x = 1"));
            assertEquals("(+= x 1)", sexpr("x += 1"));
            assertEquals("(= (index m \"k\") 2)", sexpr("m[\"k\"] = 2"));
            assertEquals("(= (. p x) 3)", sexpr("p.x := 3"));
        }

        @Test
        @DisplayName("非法赋值目标")
        void testInvalidAssignTarget() {
            ParseException e = parseError("1 = 2");
            assertEquals("Invalid assignment target", e.getRawMessage());
        }

        @Test
        @DisplayName("if / elif / else if / else")
        void testIfChain() {
            String source = "if a { x }\nelif b { y }\nelse if c { z }\nelse { w }";
            assertEquals("(if a (block x) (elif b (block y)) (elif c (block z)) (else (block w)))", sexpr(source));
        }

        @Test
        @DisplayName("if 之后的语句不被吞掉")
        void testIfWithoutElse() {
            Program program = parse("if a { x }\nshow(1)");
            assertEquals(2, program.getStatements().size());
            assertFalse(((IfStmt) program.getStatements().get(0)).hasElse());
        }

        @Test
        @DisplayName("循环与跳转")
        void testLoops() {
            assertEquals("(for i (.. 0 3) (block (break)))", sexpr("for i in 0..3 { break }"));
            assertEquals("(while (> n 0) (block (continue)))", sexpr("while n > 0 {\n continue\n}"));
        }

        @Test
        @DisplayName("无值 return")
        void testBareReturn() {
            assertEquals("(fn f () (block (return)))", sexpr("fn f() { return }"));
        }

        @Test
        @DisplayName("导入")
        void testImports() {
            assertEquals("(import \"lib\" use a,b)", sexpr("from \"lib\" use {a, b}"));
            assertEquals("(import \"lib\" use a,b)", sexpr("from \"lib\" use a, b"));
            assertEquals("(import \"util.tt\" as u)", sexpr("import \"util.tt\" as u"));
        }

        @Test
        @DisplayName("try / catch / throw")
        void testTryCatch() {
            assertEquals("(try (block (call risky)) (catch e (block (call show e))))",
                    sexpr("try { risky() } catch (e) { show(e) }"));
            assertEquals("(throw \"boom\")", sexpr("throw \"boom\""));
        }

        @Test
        @DisplayName("结构体与枚举")
        void testStructAndEnum() {
            Program program = parse("struct P { x: int, y = 0 }\nenum Color { Red, Green = 5 }");
            StructDecl struct = (StructDecl) program.getStatements().get(0);
            assertEquals(2, struct.getFields().size());
            assertEquals("int", struct.getFields().get(0).getTypeHint());
            assertEquals("(enum Color Red Green=5)", new AstPrinter().print(program.getStatements().get(1)));
        }

        @Test
        @DisplayName("函数返回类型")
        void testReturnType() {
            FnDecl fn = (FnDecl) parse("fn add(a: int, b: int) -> int { return a + b }").getStatements().get(0);
            assertEquals("int", fn.getReturnType());
            assertEquals("int", fn.getParams().get(0).getTypeHint());
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("错误带行列信息")
        void testErrorLocation() {
            ParseException e = parseError("let a = 1\nlet = 5");
            assertEquals(2, e.getLine());
            assertEquals("Expected variable name", e.getRawMessage());
            assertThat(e.getMessage()).contains("line 2").contains("'='");
        }

        @Test
        @DisplayName("词法错误经由解析器报告")
        void testLexicalError() {
            ParseException e = parseError("let s = \"abc");
            assertEquals("Unterminated string", e.getRawMessage());
        }

        @Test
        @DisplayName("缺少右花括号")
        void testMissingBrace() {
            ParseException e = parseError("fn f() {\n  return 1\n");
            assertEquals("Expected '}'", e.getRawMessage());
        }

        @Test
        @DisplayName("容错解析收集多个错误")
        void testTolerantParse() {
            ParseResult result = new Parser(new Lexer("let = 1\nlet y = 2\nlet = 3")).parseTolerant();
            assertTrue(result.hasErrors());
            assertEquals(2, result.getErrors().size());
            assertEquals(1, result.getProgram().getStatements().size());
            assertEquals(3, result.getErrors().get(1).getLine());
        }
    }
}
