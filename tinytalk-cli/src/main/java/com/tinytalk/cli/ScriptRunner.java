package com.tinytalk.cli;

import com.tinytalk.compiler.parser.ParseException;
import tinytalk.runtime.TinyTalkException;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.AssertionFailure;
import tinytalk.runtime.interpreter.ExecutionBounds;
import tinytalk.runtime.interpreter.Interpreter;
import tinytalk.runtime.interpreter.LanguageError;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 脚本和表达式执行器，返回进程退出码
 */
public class ScriptRunner {

    private static final Logger LOG = Logger.getLogger(ScriptRunner.class.getName());

    private final ExecutionBounds bounds;
    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(ExecutionBounds bounds, PrintStream out, PrintStream err) {
        this.bounds = bounds;
        this.out = out;
        this.err = err;
    }

    /**
     * 执行脚本文件，相对导入以脚本所在目录为基准
     */
    public int runScript(Path path, List<String> scriptArgs) {
        String source = readSource(path);
        if (source == null) {
            return 1;
        }
        Path scriptDir = path.toAbsolutePath().getParent();
        return run(source, path.toString(), scriptDir, scriptArgs, false);
    }

    /**
     * 执行单个表达式，非 null 结果打印到标准输出
     */
    public int runExpression(String expression) {
        return run(expression, "<cmdline>", Paths.get("").toAbsolutePath(),
                Collections.<String>emptyList(), true);
    }

    /**
     * @return 源码文本，读取失败时报告错误并返回 null
     */
    String readSource(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Cannot read " + path, e);
            err.println("Error: cannot read file - " + path + ": " + e.getMessage());
            return null;
        }
    }

    int run(String source, String fileName, Path sourceDir, List<String> scriptArgs, boolean printResult) {
        Interpreter interpreter = new Interpreter(bounds, sourceDir);
        interpreter.setStdout(out);
        interpreter.setScriptArgs(scriptArgs);
        try {
            TinyValue result = interpreter.eval(source, fileName);
            if (printResult && !result.isNull()) {
                out.println(result.asString());
            }
            return 0;
        } catch (ParseException e) {
            LOG.log(Level.FINE, "Syntax error in {0}: {1}", new Object[]{fileName, e.getMessage()});
            err.println("Syntax error: " + e.getRawMessage());
            if (e.getToken() != null) {
                printSourceLocation(err, source, fileName, e.getLine(), e.getColumn(),
                        e.getToken().getLexeme().length());
            }
            return 1;
        } catch (LanguageError e) {
            LOG.log(Level.FINE, "Runtime error in {0}: {1}", new Object[]{fileName, e.getMessage()});
            err.println("Runtime error: " + e.getRawMessage());
            if (e.hasLine()) {
                printSourceLocation(err, source, fileName, e.getLine(), 0, 0);
            }
            return 1;
        } catch (AssertionFailure e) {
            err.println(e.getMessage());
            return 1;
        } catch (TinyTalkException e) {
            err.println("Runtime error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Internal error while running " + fileName, e);
            err.println("Internal error: " + e);
            return 1;
        } finally {
            out.flush();
        }
    }

    /**
     * 打印源码位置指示（文件名:行[:列] + 源码行 + 列指针）
     *
     * @param column 从 1 开始；0 表示只显示行
     */
    static void printSourceLocation(PrintStream err, String source, String fileName,
                                    int line, int column, int length) {
        err.println("  --> " + fileName + ":" + line + (column > 0 ? ":" + column : ""));
        String[] lines = source.split("\n", -1);
        if (line < 1 || line > lines.length) {
            return;
        }
        String lineNum = String.valueOf(line);
        err.println("   |");
        err.println(" " + lineNum + " | " + lines[line - 1].replace("\r", ""));
        if (column > 0) {
            StringBuilder pointer = new StringBuilder();
            for (int i = 0; i < lineNum.length() + 1; i++) pointer.append(' ');
            pointer.append("| ");
            for (int i = 1; i < column; i++) pointer.append(' ');
            for (int i = 0; i < Math.max(1, length); i++) pointer.append('^');
            err.println(pointer.toString());
        }
    }
}
