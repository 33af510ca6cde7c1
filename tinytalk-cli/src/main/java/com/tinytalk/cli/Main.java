package com.tinytalk.cli;

import tinytalk.runtime.interpreter.ExecutionBounds;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * TinyTalk CLI 入口点（picocli）
 *
 * <pre>
 * tinytalk script.tt a b          执行脚本，参数绑定到 args
 * tinytalk -e 'show(1 + 2)'       执行表达式
 * tinytalk --check script.tt      容错解析并报告步骤链类型问题
 * tinytalk                        进入 REPL
 * </pre>
 */
@Command(name = "tinytalk", version = "TinyTalk v0.1.0",
         mixinStandardHelpOptions = true,
         description = "Run TinyTalk scripts, expressions or an interactive REPL.")
public class Main implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    @Option(names = "-e", paramLabel = "<expr>", description = "执行表达式并打印结果")
    String expression;

    @Option(names = "--bounds", paramLabel = "<profile>", defaultValue = "default",
            description = "执行限制档位（default, api），默认 ${DEFAULT-VALUE}")
    String bounds;

    @Option(names = "--max-ops", paramLabel = "<n>", description = "覆盖操作数上限")
    Long maxOps;

    @Option(names = "--max-iterations", paramLabel = "<n>", description = "覆盖循环迭代上限")
    Long maxIterations;

    @Option(names = "--max-recursion", paramLabel = "<n>", description = "覆盖递归深度上限")
    Integer maxRecursion;

    @Option(names = "--timeout", paramLabel = "<seconds>", description = "覆盖超时秒数")
    Double timeout;

    @Option(names = "--ast", description = "打印语法树而不执行")
    boolean ast;

    @Option(names = "--tokens", description = "打印词法单元而不执行")
    boolean tokens;

    @Option(names = "--check", description = "容错解析并报告步骤链类型警告")
    boolean check;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Parameters(paramLabel = "FILE", description = "脚本文件及参数")
    String[] params;

    private final PrintStream out;
    private final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        configureLogging(verbose);

        ExecutionBounds resolved;
        try {
            resolved = resolveBounds();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        LOG.log(Level.FINE, "Using {0}", resolved);

        boolean inspect = tokens || ast || check;
        if (expression != null) {
            if (inspect) {
                return inspect(expression, "<cmdline>");
            }
            return new ScriptRunner(resolved, out, err).runExpression(expression);
        }
        if (params != null && params.length > 0) {
            Path path = Paths.get(params[0]);
            if (!Files.isRegularFile(path)) {
                err.println("Error: file not found - " + params[0]);
                return 1;
            }
            List<String> scriptArgs = params.length > 1
                    ? Arrays.asList(params).subList(1, params.length)
                    : Collections.<String>emptyList();
            ScriptRunner runner = new ScriptRunner(resolved, out, err);
            if (inspect) {
                String source = runner.readSource(path);
                return source == null ? 1 : inspect(source, params[0]);
            }
            return runner.runScript(path, scriptArgs);
        }
        if (inspect) {
            err.println("Error: --tokens, --ast and --check need a FILE or -e");
            return 1;
        }
        new ReplRunner(resolved, out, err).run();
        return 0;
    }

    /**
     * 档位加单项覆盖
     */
    ExecutionBounds resolveBounds() {
        ExecutionBounds base = ExecutionBounds.named(bounds);
        if (maxOps == null && maxIterations == null && maxRecursion == null && timeout == null) {
            return base;
        }
        ExecutionBounds.Builder builder = base.toBuilder();
        if (maxOps != null) builder.maxOps(maxOps);
        if (maxIterations != null) builder.maxIterations(maxIterations);
        if (maxRecursion != null) builder.maxRecursion(maxRecursion);
        if (timeout != null) builder.timeoutSeconds(timeout);
        return builder.build();
    }

    private int inspect(String source, String fileName) {
        SourceInspector inspector = new SourceInspector(out, err);
        int status = 0;
        if (tokens) status = Math.max(status, inspector.printTokens(source, fileName));
        if (ast) status = Math.max(status, inspector.printAst(source, fileName));
        if (check) status = Math.max(status, inspector.check(source, fileName));
        return status;
    }

    /**
     * 从类路径加载 logging.properties
     */
    static void configureLogging(boolean verbose) {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Warning: cannot load logging.properties: " + e.getMessage());
        }
        if (verbose) {
            Logger root = Logger.getLogger("");
            root.setLevel(Level.FINE);
            for (Handler handler : root.getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }

    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        int exitCode = commandLine(new Main(out, err)).execute(args);
        System.exit(exitCode);
    }

    /**
     * 第一个位置参数之后的内容全部作为脚本参数
     */
    static CommandLine commandLine(Main main) {
        CommandLine cmd = new CommandLine(main);
        cmd.setStopAtPositional(true);
        return cmd;
    }
}
