package com.tinytalk.cli;

import com.tinytalk.compiler.analysis.ChainTypeChecker;
import com.tinytalk.compiler.analysis.ChainTypeError;
import com.tinytalk.compiler.ast.AstPrinter;
import com.tinytalk.compiler.ast.decl.Program;
import com.tinytalk.compiler.lexer.Lexer;
import com.tinytalk.compiler.lexer.Token;
import com.tinytalk.compiler.lexer.TokenType;
import com.tinytalk.compiler.parser.ParseError;
import com.tinytalk.compiler.parser.ParseException;
import com.tinytalk.compiler.parser.ParseResult;
import com.tinytalk.compiler.parser.Parser;

import java.io.PrintStream;
import java.util.List;

/**
 * --tokens、--ast、--check：只做前端分析，不执行
 */
public class SourceInspector {

    private final PrintStream out;
    private final PrintStream err;

    public SourceInspector(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 每行一个词法单元；出现 ERROR 单元时返回 1
     */
    public int printTokens(String source, String fileName) {
        int status = 0;
        for (Token token : new Lexer(source, fileName).tokenize()) {
            out.println(token);
            if (token.is(TokenType.ERROR)) {
                status = 1;
            }
        }
        return status;
    }

    public int printAst(String source, String fileName) {
        try {
            Program program = new Parser(new Lexer(source, fileName)).parse();
            String text = new AstPrinter().print(program);
            out.print(text.endsWith("\n") || text.isEmpty() ? text : text + "\n");
            return 0;
        } catch (ParseException e) {
            err.println("Syntax error: " + e.getRawMessage());
            ScriptRunner.printSourceLocation(err, source, fileName, e.getLine(), e.getColumn(),
                    e.getToken() != null ? e.getToken().getLexeme().length() : 1);
            return 1;
        }
    }

    /**
     * 容错解析后运行步骤链类型检查：语法错误为 error，类型问题为 warning
     *
     * @return 有语法错误时为 1
     */
    public int check(String source, String fileName) {
        ParseResult result = new Parser(new Lexer(source, fileName)).parseTolerant();
        for (ParseError error : result.getErrors()) {
            err.println(fileName + ":" + error.getLine() + ":" + error.getColumn() + ": error: " + error.getMessage());
        }
        List<ChainTypeError> warnings = new ChainTypeChecker().check(result.getProgram());
        for (ChainTypeError warning : warnings) {
            err.println(fileName + ":" + warning.getLine() + ": warning: step " + (warning.getStepIndex() + 1)
                    + " (" + warning.getVerb() + "): " + warning.getMessage());
        }
        if (!result.hasErrors() && warnings.isEmpty()) {
            out.println(fileName + ": OK");
        } else {
            out.println(fileName + ": " + result.getErrors().size() + " error(s), " + warnings.size() + " warning(s)");
        }
        return result.hasErrors() ? 1 : 0;
    }
}
