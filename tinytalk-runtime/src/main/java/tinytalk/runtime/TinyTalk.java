package tinytalk.runtime;

import com.tinytalk.compiler.ast.decl.Program;
import com.tinytalk.compiler.lexer.Lexer;
import com.tinytalk.compiler.parser.ParseException;
import com.tinytalk.compiler.parser.Parser;
import tinytalk.runtime.interpreter.AssertionFailure;
import tinytalk.runtime.interpreter.ExecutionBounds;
import tinytalk.runtime.interpreter.Interpreter;
import tinytalk.runtime.interpreter.LanguageError;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TinyTalk 便捷 API：一次调用完成词法、语法分析与执行，捕获输出，错误转为失败结果
 *
 * <pre>
 * RunResult r = TinyTalk.run("show([3, 1, 2] _sort)");
 * r.getOutput();   // "[1, 2, 3]\n"
 * </pre>
 */
public final class TinyTalk {

    private static final Logger LOG = Logger.getLogger(TinyTalk.class.getName());

    private TinyTalk() {}

    public static RunResult run(String source) {
        return run(source, ExecutionBounds.defaults());
    }

    public static RunResult run(String source, ExecutionBounds bounds) {
        return run(source, bounds, Paths.get("").toAbsolutePath());
    }

    /**
     * @param sourceDir 相对导入的基准目录
     */
    public static RunResult run(String source, ExecutionBounds bounds, Path sourceDir) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        Interpreter interpreter = new Interpreter(bounds, sourceDir);
        interpreter.setStdout(out);
        try {
            Program program = new Parser(new Lexer(source, "<input>")).parse();
            TinyValue value = interpreter.execute(program);
            return new RunResult(true, value, captured(buffer, out), null, 0, interpreter.getOpCount());
        } catch (ParseException e) {
            return failure(buffer, out, "Syntax error: " + e.getMessage(), e.getLine(), interpreter);
        } catch (LanguageError e) {
            LOG.log(Level.FINE, "Run failed: {0}", e.getMessage());
            return failure(buffer, out, e.getMessage(), e.getLine(), interpreter);
        } catch (AssertionFailure e) {
            return failure(buffer, out, e.getMessage(), 0, interpreter);
        } catch (TinyTalkException e) {
            return failure(buffer, out, e.getMessage(), 0, interpreter);
        }
    }

    private static RunResult failure(ByteArrayOutputStream buffer, PrintStream out, String error,
                                     int line, Interpreter interpreter) {
        return new RunResult(false, TinyNull.NULL, captured(buffer, out), error, line, interpreter.getOpCount());
    }

    private static String captured(ByteArrayOutputStream buffer, PrintStream out) {
        out.flush();
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }
}
