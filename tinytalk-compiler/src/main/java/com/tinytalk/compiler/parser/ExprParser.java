package com.tinytalk.compiler.parser;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.decl.Parameter;
import com.tinytalk.compiler.ast.expr.*;
import com.tinytalk.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.tinytalk.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.tinytalk.compiler.lexer.Token;
import com.tinytalk.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.tinytalk.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类（优先级爬升）
 *
 * <p>优先级从低到高：管道、三元、or、and、相等、比较、区间、|、^、&、移位、
 * 加减、乘除、幂（右结合）、一元、后缀。</p>
 */
class ExprParser {

    /** 可以开始一个表达式的记号，用于空格分隔的调用参数 */
    private static final Set<TokenType> EXPR_START = EnumSet.of(
            NUMBER, STRING, BOOLEAN, NULL, IDENTIFIER, LPAREN, LBRACKET, LBRACE,
            MINUS, NOT, BIT_NOT, INTERP_START);

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parsePipe();
    }

    // ============ 二元运算 ============

    private Expression parsePipe() {
        Expression left = parseTernary();
        while (parser.check(PIPE)) {
            Token op = parser.advance();
            parser.skipNewlines();
            Expression right = parseTernary();
            left = new PipeExpr(parser.locationOf(op), left, right);
        }
        return left;
    }

    private Expression parseTernary() {
        Expression condition = parseOr();
        // 紧跟分隔符的 '?' 留给参数尾部标点处理
        if (parser.check(QUESTION) && !isArgumentEnd(parser.peek(1))) {
            Token op = parser.advance();
            Expression thenExpr = parseExpression();
            parser.expect(COLON, "Expected ':' in ternary");
            Expression elseExpr = parseExpression();
            return new ConditionalExpr(parser.locationOf(op), condition, thenExpr, elseExpr);
        }
        return condition;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (parser.check(OR)) {
            Token op = parser.advance();
            Expression right = parseAnd();
            left = new BinaryExpr(parser.locationOf(op), left, BinaryOp.OR, right);
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseEquality();
        while (parser.check(AND)) {
            Token op = parser.advance();
            Expression right = parseEquality();
            left = new BinaryExpr(parser.locationOf(op), left, BinaryOp.AND, right);
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseComparison();
        while (true) {
            BinaryOp op = equalityOp(parser.current().getType());
            if (op == null) break;
            Token token = parser.advance();
            Expression right = parseComparison();
            left = new BinaryExpr(parser.locationOf(token), left, op, right);
        }
        return left;
    }

    private Expression parseComparison() {
        Expression left = parseRange();
        while (true) {
            BinaryOp op = comparisonOp(parser.current().getType());
            if (op == null) break;
            Token token = parser.advance();
            Expression right = parseRange();
            left = new BinaryExpr(parser.locationOf(token), left, op, right);
        }
        return left;
    }

    /**
     * 区间不结合：a..b..c 是语法错误
     */
    private Expression parseRange() {
        Expression left = parseBitOr();
        if (parser.checkAny(RANGE, RANGE_INCL)) {
            Token op = parser.advance();
            Expression right = parseBitOr();
            return new RangeExpr(parser.locationOf(op), left, right, op.is(RANGE_INCL));
        }
        return left;
    }

    private Expression parseBitOr() {
        Expression left = parseBitXor();
        while (parser.check(BIT_OR)) {
            Token op = parser.advance();
            Expression right = parseBitXor();
            left = new BinaryExpr(parser.locationOf(op), left, BinaryOp.BIT_OR, right);
        }
        return left;
    }

    private Expression parseBitXor() {
        Expression left = parseBitAnd();
        while (parser.check(BIT_XOR)) {
            Token op = parser.advance();
            Expression right = parseBitAnd();
            left = new BinaryExpr(parser.locationOf(op), left, BinaryOp.BIT_XOR, right);
        }
        return left;
    }

    private Expression parseBitAnd() {
        Expression left = parseShift();
        while (parser.check(BIT_AND)) {
            Token op = parser.advance();
            Expression right = parseShift();
            left = new BinaryExpr(parser.locationOf(op), left, BinaryOp.BIT_AND, right);
        }
        return left;
    }

    private Expression parseShift() {
        Expression left = parseAdditive();
        while (parser.checkAny(SHL, SHR)) {
            Token op = parser.advance();
            Expression right = parseAdditive();
            left = new BinaryExpr(parser.locationOf(op), left,
                    op.is(SHL) ? BinaryOp.SHL : BinaryOp.SHR, right);
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            Expression right = parseMultiplicative();
            left = new BinaryExpr(parser.locationOf(op), left,
                    op.is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB, right);
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parsePower();
        while (true) {
            BinaryOp op;
            switch (parser.current().getType()) {
                case STAR:      op = BinaryOp.MUL; break;
                case SLASH:     op = BinaryOp.DIV; break;
                case PERCENT:   op = BinaryOp.MOD; break;
                case FLOOR_DIV: op = BinaryOp.FLOOR_DIV; break;
                default:        op = null; break;
            }
            if (op == null) break;
            Token token = parser.advance();
            Expression right = parsePower();
            left = new BinaryExpr(parser.locationOf(token), left, op, right);
        }
        return left;
    }

    private Expression parsePower() {
        Expression left = parseUnary();
        if (parser.check(POWER)) {
            Token op = parser.advance();
            Expression right = parsePower();
            return new BinaryExpr(parser.locationOf(op), left, BinaryOp.POW, right);
        }
        return left;
    }

    private Expression parseUnary() {
        if (parser.checkAny(MINUS, NOT, BIT_NOT)) {
            Token op = parser.advance();
            UnaryOp unary = op.is(MINUS) ? UnaryOp.NEG : op.is(NOT) ? UnaryOp.NOT : UnaryOp.BIT_NOT;
            Expression operand = parseUnary();
            return new UnaryExpr(parser.locationOf(op), unary, operand);
        }
        return parsePostfix();
    }

    private static BinaryOp equalityOp(TokenType type) {
        switch (type) {
            case EQ:        return BinaryOp.EQ;
            case NE:        return BinaryOp.NE;
            case KW_IS:     return BinaryOp.IS;
            case KW_ISNT:   return BinaryOp.ISNT;
            case KW_HAS:    return BinaryOp.HAS;
            case KW_HASNT:  return BinaryOp.HASNT;
            case KW_ISIN:   return BinaryOp.ISIN;
            case KW_ISLIKE: return BinaryOp.ISLIKE;
            default:        return null;
        }
    }

    private static BinaryOp comparisonOp(TokenType type) {
        switch (type) {
            case LT: return BinaryOp.LT;
            case GT: return BinaryOp.GT;
            case LE: return BinaryOp.LE;
            case GE: return BinaryOp.GE;
            default: return null;
        }
    }

    // ============ 后缀：调用、下标、成员、步骤链 ============

    private Expression parsePostfix() {
        Expression expr = parsePrimary();

        while (true) {
            if (parser.check(LPAREN) && !(expr instanceof Literal)) {
                Token open = parser.advance();
                List<Expression> args = parseCallArgs();
                expr = new CallExpr(parser.locationOf(open), expr, args);
            } else if (parser.check(LBRACKET)) {
                Token open = parser.advance();
                parser.skipNewlines();
                Expression index = parseExpression();
                parser.skipNewlines();
                parser.expect(RBRACKET, "Expected ']'");
                expr = new IndexExpr(parser.locationOf(open), expr, index);
            } else if (parser.check(DOT)) {
                Token dot = parser.advance();
                Token member = parser.current();
                if (member.is(IDENTIFIER) || member.getType().isTypeKeyword()) {
                    parser.advance();
                    expr = new MemberExpr(parser.locationOf(dot), expr, member.getLexeme());
                } else if (member.isStep()) {
                    expr = extendChain(expr, dot);
                } else {
                    throw parser.error("Expected field name after '.'", "IDENTIFIER");
                }
            } else if (parser.checkStep()) {
                expr = extendChain(expr, parser.current());
            } else {
                // 步骤链可以跨行书写：跳过换行后若不是步骤动词则恢复位置
                int saved = parser.mark();
                parser.skipNewlines();
                if (parser.checkStep()) {
                    expr = extendChain(expr, parser.current());
                } else {
                    parser.reset(saved);
                    break;
                }
            }
        }
        return expr;
    }

    /**
     * 收集连续的步骤；已经是步骤链时追加到同一条链上
     */
    private Expression extendChain(Expression source, Token at) {
        List<StepChainExpr.Step> steps = collectSteps();
        if (source instanceof StepChainExpr) {
            StepChainExpr chain = (StepChainExpr) source;
            List<StepChainExpr.Step> merged = new ArrayList<StepChainExpr.Step>(chain.getSteps());
            merged.addAll(steps);
            return new StepChainExpr(chain.getLocation(), chain.getSource(), merged);
        }
        return new StepChainExpr(parser.locationOf(at), source, steps);
    }

    private List<StepChainExpr.Step> collectSteps() {
        List<StepChainExpr.Step> steps = new ArrayList<StepChainExpr.Step>();
        while (parser.checkStep()) {
            Token verb = parser.advance();
            List<Expression> args = new ArrayList<Expression>();
            if (parser.match(LPAREN)) {
                args = parseCallArgs();
            }
            steps.add(new StepChainExpr.Step(parser.locationOf(verb), verb.getVerb(), args));
        }
        return steps;
    }

    /**
     * 调用参数（'(' 已消费），消费到 ')'
     */
    private List<Expression> parseCallArgs() {
        parser.skipNewlines();
        List<Expression> args = new ArrayList<Expression>();
        if (!parser.check(RPAREN)) {
            args = parseArgs();
        }
        parser.skipNewlines();
        parser.expect(RPAREN, "Expected ')'");
        return args;
    }

    /**
     * 逗号或空格分隔的参数
     */
    private List<Expression> parseArgs() {
        List<Expression> args = new ArrayList<Expression>();
        args.add(absorbTrailingPunct(parseExpression()));
        while (true) {
            if (parser.match(COMMA)) {
                parser.skipNewlines();
                args.add(absorbTrailingPunct(parseExpression()));
            } else if (EXPR_START.contains(parser.current().getType())) {
                args.add(absorbTrailingPunct(parseExpression()));
            } else {
                break;
            }
        }
        return args;
    }

    /**
     * 标识符参数后紧跟分隔符的 '!' 或 '?' 并入名字，如 show(Hello, world!)
     */
    private Expression absorbTrailingPunct(Expression arg) {
        if (!(arg instanceof Identifier)) {
            return arg;
        }
        Identifier id = (Identifier) arg;
        String name = id.getName();
        boolean absorbed = false;
        while (parser.checkAny(NOT, QUESTION) && isArgumentEnd(parser.peek(1))) {
            name += parser.advance().is(NOT) ? "!" : "?";
            absorbed = true;
        }
        return absorbed ? new Identifier(id.getLocation(), name) : arg;
    }

    private static boolean isArgumentEnd(Token token) {
        return token.isOneOf(COMMA, RPAREN, NEWLINE, EOF);
    }

    // ============ 基本表达式 ============

    private Expression parsePrimary() {
        Token token = parser.current();
        SourceLocation loc = parser.locationOf(token);

        switch (token.getType()) {
            case NUMBER:
                parser.advance();
                if (token.getLiteral() instanceof Double) {
                    return new Literal(loc, token.getLiteral(), Literal.LiteralKind.FLOAT);
                }
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.INT);
            case STRING:
                parser.advance();
                return Literal.ofString(loc, token.getText());
            case BOOLEAN:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.BOOLEAN);
            case NULL:
                parser.advance();
                return new Literal(loc, null, Literal.LiteralKind.NULL);
            case INTERP_START:
                return parseInterpolation();
            case IDENTIFIER:
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case LPAREN:
                return parseParenOrLambda();
            case LBRACKET:
                return parseArrayLiteral();
            case LBRACE:
                return parseMapLiteral();
            case KW_MATCH:
                return parseMatch();
            case BIT_OR:
                return parsePipeLambda();
            case OR:
                // || 是无参 lambda
                parser.advance();
                return new LambdaExpr(loc, new ArrayList<Parameter>(), parseLambdaBody());
            default:
                break;
        }

        if (token.getType().isTypeKeyword()) {
            parser.advance();
            return new Identifier(loc, token.getLexeme());
        }
        if (token.isStep()) {
            throw new ParseException("Step '" + token.getVerb() + "' needs a value before it", token);
        }
        if (token.is(EOF)) {
            throw parser.error("Unexpected end of input");
        }
        throw parser.error("Unexpected token '" + token.getLexeme() + "' (" + token.getType() + ")");
    }

    /**
     * 插值字符串：文本片段与子表达式交替。子表达式的记号由子解析器解析，
     * 嵌套的插值字符串按 START/END 配对计数
     */
    private Expression parseInterpolation() {
        Token start = parser.advance();
        List<Expression> parts = new ArrayList<Expression>();
        addText(parts, start);

        List<Token> exprTokens = new ArrayList<Token>();
        int depth = 0;
        while (!parser.isAtEnd()) {
            Token token = parser.advance();
            if (depth == 0 && token.isOneOf(INTERP_MID, INTERP_END)) {
                addExpression(parts, exprTokens);
                exprTokens = new ArrayList<Token>();
                addText(parts, token);
                if (token.is(INTERP_END)) {
                    return new StringInterpolation(parser.locationOf(start), parts);
                }
                continue;
            }
            if (token.is(INTERP_START)) {
                depth++;
            } else if (token.is(INTERP_END)) {
                depth--;
            }
            exprTokens.add(token);
        }
        throw parser.error("Unterminated string interpolation");
    }

    private void addText(List<Expression> parts, Token token) {
        String text = token.getText();
        if (!text.isEmpty()) {
            parts.add(Literal.ofString(parser.locationOf(token), text));
        }
    }

    private void addExpression(List<Expression> parts, List<Token> exprTokens) {
        if (exprTokens.isEmpty()) {
            return;
        }
        Parser sub = new Parser(exprTokens, parser.fileName);
        parts.add(sub.parseExpressionOnly());
    }

    /**
     * '(' 之后若能匹配到 ')' 且紧跟 '=>'，按 lambda 解析；否则恢复位置解析括号表达式
     */
    private Expression parseParenOrLambda() {
        Token open = parser.advance();
        if (parser.checkAny(RPAREN, IDENTIFIER) || parser.current().getType().isTypeKeyword()) {
            int saved = parser.mark();
            boolean lambda = skipToClosingParen() && parser.check(FAT_ARROW);
            parser.reset(saved);
            if (lambda) {
                List<Parameter> params = parser.declParser.parseParams();
                parser.expect(RPAREN, "Expected ')' after lambda parameters");
                parser.expect(FAT_ARROW, "Expected '=>'");
                return new LambdaExpr(parser.locationOf(open), params, parseLambdaBody());
            }
        }
        parser.skipNewlines();
        Expression expr = parseExpression();
        parser.skipNewlines();
        parser.expect(RPAREN, "Expected ')'");
        return expr;
    }

    /**
     * 前进到与已消费的 '(' 匹配的 ')' 之后
     */
    private boolean skipToClosingParen() {
        int depth = 1;
        while (!parser.isAtEnd()) {
            Token token = parser.advance();
            if (token.is(LPAREN)) {
                depth++;
            } else if (token.is(RPAREN)) {
                depth--;
                if (depth == 0) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * |a, b| body
     */
    private Expression parsePipeLambda() {
        Token open = parser.advance();
        List<Parameter> params = new ArrayList<Parameter>();
        if (!parser.check(BIT_OR)) {
            do {
                Token name = parser.current();
                params.add(new Parameter(parser.locationOf(name),
                        parser.expectName("Expected parameter name"), null, null));
            } while (parser.match(COMMA));
        }
        parser.expect(BIT_OR, "Expected '|' after lambda parameters");
        return new LambdaExpr(parser.locationOf(open), params, parseLambdaBody());
    }

    /**
     * lambda 体：'{' 后是 key ':' 或 '}' 时为映射字面量，否则为代码块；其余为单个表达式
     */
    private AstNode parseLambdaBody() {
        parser.skipNewlines();
        if (parser.check(LBRACE) && !looksLikeMap()) {
            return parser.stmtParser.parseBlock();
        }
        return parseExpression();
    }

    private boolean looksLikeMap() {
        int i = 1;
        while (parser.peek(i).is(NEWLINE)) {
            i++;
        }
        Token first = parser.peek(i);
        if (first.is(RBRACE)) {
            return true;
        }
        return first.isOneOf(STRING, IDENTIFIER, NUMBER) && parser.peek(i + 1).is(COLON);
    }

    private Expression parseArrayLiteral() {
        Token open = parser.advance();
        List<Expression> elements = new ArrayList<Expression>();
        parser.skipNewlines();
        if (!parser.check(RBRACKET)) {
            elements.add(parseExpression());
            parser.skipNewlines();
            while (parser.match(COMMA)) {
                parser.skipNewlines();
                if (parser.check(RBRACKET)) break;
                elements.add(parseExpression());
                parser.skipNewlines();
            }
        }
        parser.expect(RBRACKET, "Expected ']'");
        return new ArrayLiteral(parser.locationOf(open), elements);
    }

    /**
     * {k: v, ...}；裸标识符键视为字符串
     */
    private Expression parseMapLiteral() {
        Token open = parser.advance();
        List<MapLiteral.Entry> entries = new ArrayList<MapLiteral.Entry>();
        parser.skipNewlines();
        if (!parser.check(RBRACE)) {
            entries.add(parseMapEntry());
            parser.skipNewlines();
            while (parser.match(COMMA)) {
                parser.skipNewlines();
                if (parser.check(RBRACE)) break;
                entries.add(parseMapEntry());
                parser.skipNewlines();
            }
        }
        parser.expect(RBRACE, "Expected '}'");
        return new MapLiteral(parser.locationOf(open), entries);
    }

    private MapLiteral.Entry parseMapEntry() {
        Token keyToken = parser.current();
        Expression key;
        if ((keyToken.is(IDENTIFIER) || keyToken.getType().isTypeKeyword()) && parser.peek(1).is(COLON)) {
            parser.advance();
            key = Literal.ofString(parser.locationOf(keyToken), keyToken.getLexeme());
        } else {
            key = parseExpression();
        }
        parser.expect(COLON, "Expected ':' after map key");
        parser.skipNewlines();
        Expression value = parseExpression();
        return new MapLiteral.Entry(key, value);
    }

    /**
     * match subject { pattern => body, ... }
     */
    private Expression parseMatch() {
        Token keyword = parser.advance();
        Expression subject = parseExpression();
        parser.skipNewlines();
        parser.expect(LBRACE, "Expected '{' after match subject");

        List<MatchExpr.MatchCase> cases = new ArrayList<MatchExpr.MatchCase>();
        parser.skipNewlines();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            Expression pattern = parseExpression();
            parser.expect(FAT_ARROW, "Expected '=>' after match pattern");
            AstNode body = parseLambdaBody();
            cases.add(new MatchExpr.MatchCase(pattern, body));
            parser.skipNewlines();
            parser.match(COMMA);
            parser.skipNewlines();
        }
        parser.expect(RBRACE, "Expected '}' after match cases");
        return new MatchExpr(parser.locationOf(keyword), subject, cases);
    }
}
