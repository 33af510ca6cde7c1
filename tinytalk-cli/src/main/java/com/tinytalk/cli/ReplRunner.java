package com.tinytalk.cli;

import com.tinytalk.compiler.parser.ParseException;
import tinytalk.runtime.TinyTalkException;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.ExecutionBounds;
import tinytalk.runtime.interpreter.Interpreter;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * jline REPL 交互模式
 *
 * <p>所有输入共享同一个解释器，前面定义的变量和函数在后续输入中可见。</p>
 */
public class ReplRunner {

    private static final Logger LOG = Logger.getLogger(ReplRunner.class.getName());

    private static final String VERSION = "0.1.0";
    private static final String PROMPT = "tinytalk> ";
    private static final String CONTINUATION = "... ";

    private final ExecutionBounds bounds;
    private final PrintStream out;
    private final PrintStream err;
    private Interpreter interpreter;

    private final StringBuilder multilineBuffer = new StringBuilder();

    public ReplRunner(ExecutionBounds bounds, PrintStream out, PrintStream err) {
        this.bounds = bounds;
        this.out = out;
        this.err = err;
        this.interpreter = newInterpreter();
    }

    private Interpreter newInterpreter() {
        Interpreter interp = new Interpreter(bounds, Paths.get("").toAbsolutePath());
        interp.setStdout(out);
        return interp;
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        printBanner();
        out.println("Type :help for help, :quit to exit");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, CONTINUATION)
                    .build();
            runLoop(reader);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Terminal initialization failed, using plain input", e);
            runPlain(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }

        out.println();
        out.println("Bye!");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(multilineBuffer.length() > 0 ? CONTINUATION : PROMPT);
                if (line == null || !accept(line)) {
                    break;
                }
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                multilineBuffer.setLength(0);
            } catch (EndOfFileException e) {
                break;
            }
        }
    }

    /**
     * 不带行编辑的循环（jline 不可用或输入被重定向时）
     */
    void runPlain(BufferedReader reader) {
        while (true) {
            out.print(multilineBuffer.length() > 0 ? CONTINUATION : PROMPT);
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                err.println("Error reading input: " + e.getMessage());
                break;
            }
            if (line == null || !accept(line)) {
                break;
            }
        }
    }

    /**
     * 处理一行输入：命令、续行或求值
     *
     * @return false 表示退出
     */
    boolean accept(String line) {
        if (multilineBuffer.length() == 0 && line.startsWith(":")) {
            return handleCommand(line.trim());
        }

        // 反斜杠续行
        if (line.endsWith("\\")) {
            multilineBuffer.append(line, 0, line.length() - 1).append("\n");
            return true;
        }

        // 未闭合括号自动续行
        if (hasUnclosedBrackets(multilineBuffer + line)) {
            multilineBuffer.append(line).append("\n");
            return true;
        }

        String source = multilineBuffer.append(line).toString();
        multilineBuffer.setLength(0);
        if (!source.trim().isEmpty()) {
            evaluateAndPrint(source);
        }
        return true;
    }

    /**
     * 检查是否有未闭合的括号（忽略字符串与注释中的括号）
     */
    static boolean hasUnclosedBrackets(String text) {
        int depth = 0;
        boolean inString = false;
        char stringChar = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == stringChar) {
                    inString = false;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                inString = true;
                stringChar = c;
                continue;
            }
            if (c == '#') {
                int newline = text.indexOf('\n', i);
                if (newline < 0) break;
                i = newline;
                continue;
            }

            switch (c) {
                case '{': case '(': case '[': depth++; break;
                case '}': case ')': case ']': depth--; break;
                default: break;
            }
        }

        return depth > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    boolean handleCommand(String command) {
        switch (command) {
            case ":quit":
            case ":q":
            case ":exit":
                return false;
            case ":help":
            case ":h":
                printHelp();
                return true;
            case ":clear":
            case ":c":
                out.print("\033[H\033[2J");
                out.flush();
                return true;
            case ":version":
                out.println("TinyTalk v" + VERSION);
                out.println("Java: " + System.getProperty("java.version"));
                return true;
            case ":bounds":
                out.println(bounds);
                return true;
            case ":reset":
                interpreter = newInterpreter();
                out.println("Environment reset");
                return true;
            case ":env":
                for (Map.Entry<String, TinyValue> e : interpreter.getGlobals().getVariables().entrySet()) {
                    out.println(e.getKey() + " = " + display(e.getValue()));
                }
                return true;
            default:
                out.println("Unknown command: " + command);
                out.println("Type :help for help");
                return true;
        }
    }

    /**
     * 求值并打印结果；错误只打印，不结束会话
     */
    void evaluateAndPrint(String source) {
        try {
            TinyValue result = interpreter.eval(source, "<repl>");
            if (!result.isNull()) {
                out.println(display(result));
            }
        } catch (ParseException e) {
            err.println("Syntax error: " + e.getMessage());
        } catch (TinyTalkException e) {
            err.println("Error: " + e.getMessage());
        }
    }

    private static String display(TinyValue value) {
        return value.isString() ? "\"" + value.asString() + "\"" : value.asString();
    }

    Interpreter getInterpreter() {
        return interpreter;
    }

    private void printBanner() {
        out.println("TinyTalk v" + VERSION + " - step chains on the JVM");
        out.println("Limits: " + bounds);
    }

    private void printHelp() {
        out.println("REPL commands:");
        out.println("  :help, :h         show this help");
        out.println("  :quit, :q, :exit  leave the REPL");
        out.println("  :clear, :c        clear the screen");
        out.println("  :version          show version");
        out.println("  :bounds           show execution limits");
        out.println("  :reset            reset the environment");
        out.println("  :env              list global variables");
        out.println();
        out.println("Examples:");
        out.println("  let xs = [3, 1, 2]");
        out.println("  xs _sort _reverse");
        out.println("  fn double(x) { return x * 2 }");
        out.println();
        out.println("A trailing \\ or an unclosed bracket continues the input on the next line.");
    }
}
