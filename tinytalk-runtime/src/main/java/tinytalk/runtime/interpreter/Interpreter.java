package tinytalk.runtime.interpreter;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.decl.Parameter;
import com.tinytalk.compiler.ast.decl.Program;
import com.tinytalk.compiler.ast.decl.StructDecl;
import com.tinytalk.compiler.ast.expr.Expression;
import com.tinytalk.compiler.ast.stmt.Block;
import com.tinytalk.compiler.ast.stmt.Statement;
import com.tinytalk.compiler.lexer.Lexer;
import com.tinytalk.compiler.parser.Parser;
import tinytalk.runtime.ExecutionContext;
import tinytalk.runtime.TinyCallable;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyTalkException;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.step.StepChainEngine;
import tinytalk.runtime.interpreter.stdlib.Builtins;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TinyTalk 树遍历解释器
 *
 * <p>每个实例持有独立的全局作用域、结构体与枚举注册表、模块缓存与执行计量，
 * 多个解释器可以在同一进程中并存。内建函数位于封闭的根作用域。</p>
 *
 * <pre>
 * Interpreter interp = new Interpreter(ExecutionBounds.api());
 * TinyValue result = interp.eval("let x = [3, 1, 2] _sort\nx");
 * </pre>
 */
public class Interpreter implements ExecutionContext {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    private final ExecutionBounds bounds;
    private final ExecutionMeter meter;
    private final Scope builtins;
    private final Scope globals;
    private final Map<String, StructType> structs = new LinkedHashMap<String, StructType>();
    private final Map<String, EnumType> enums = new LinkedHashMap<String, EnumType>();

    final ExpressionEvaluator expressions;
    final StatementExecutor statements;
    final StepChainEngine steps;
    final ModuleLoader modules;

    private PrintStream stdout = System.out;
    private Path sourceDir;

    public Interpreter() {
        this(ExecutionBounds.defaults());
    }

    public Interpreter(ExecutionBounds bounds) {
        this(bounds, Paths.get("").toAbsolutePath());
    }

    /**
     * @param sourceDir 相对导入路径的基准目录
     */
    public Interpreter(ExecutionBounds bounds, Path sourceDir) {
        this.bounds = bounds;
        this.meter = new ExecutionMeter(bounds);
        this.builtins = Scope.sealedRoot(Builtins.table());
        this.globals = new Scope(builtins);
        this.sourceDir = sourceDir.toAbsolutePath().normalize();
        this.expressions = new ExpressionEvaluator(this);
        this.statements = new StatementExecutor(this);
        this.steps = new StepChainEngine(this);
        this.modules = new ModuleLoader(this);
        meter.reset();
    }

    // ============ 配置 ============

    public PrintStream getStdout() { return stdout; }

    public void setStdout(PrintStream stdout) { this.stdout = stdout; }

    public ExecutionBounds getBounds() { return bounds; }

    public Path getSourceDir() { return sourceDir; }

    public void setSourceDir(Path sourceDir) { this.sourceDir = sourceDir.toAbsolutePath().normalize(); }

    public Scope getGlobals() { return globals; }

    public Map<String, StructType> getStructs() { return Collections.unmodifiableMap(structs); }

    public Map<String, EnumType> getEnums() { return Collections.unmodifiableMap(enums); }

    /** 本次执行的操作计数 */
    public long getOpCount() { return meter.getOpCount(); }

    /**
     * 定义全局变量（如脚本参数 {@code args}）
     */
    public void defineGlobal(String name, TinyValue value) {
        globals.define(name, value);
    }

    /**
     * 将脚本参数绑定为全局 {@code args} 列表
     */
    public void setScriptArgs(List<String> args) {
        TinyList list = new TinyList();
        for (String arg : args) {
            list.add(TinyString.of(arg));
        }
        globals.define("args", list);
    }

    // ============ 执行入口 ============

    /**
     * 解析并执行源码，返回最后一条语句的值
     *
     * @throws com.tinytalk.compiler.parser.ParseException 语法错误
     * @throws LanguageError 运行时错误
     */
    public TinyValue eval(String source) {
        return eval(source, "<input>");
    }

    public TinyValue eval(String source, String fileName) {
        Program program = new Parser(new Lexer(source, fileName)).parse();
        return execute(program);
    }

    /**
     * 执行程序：重置计量，在全局作用域中依次执行语句
     */
    public TinyValue execute(Program program) {
        meter.reset();
        try {
            return runProgram(program, globals);
        } catch (StackOverflowError e) {
            LOG.log(Level.FINE, "Java stack exhausted at depth {0}", meter.getRecursionDepth());
            throw meter.recursionExceeded(0);
        }
    }

    /**
     * 在给定作用域执行顶层语句，顶层 return 结束执行
     */
    TinyValue runProgram(Program program, Scope scope) {
        TinyValue result = TinyNull.NULL;
        for (Statement stmt : program.getStatements()) {
            ControlSignal signal = execute(stmt, scope);
            switch (signal.getKind()) {
                case RETURN:
                    return signal.getValue();
                case BREAK:
                    throw new LanguageError("'break' outside loop", stmt.getLine());
                case CONTINUE:
                    throw new LanguageError("'continue' outside loop", stmt.getLine());
                default:
                    result = signal.getValue();
            }
        }
        return result;
    }

    // ============ 分派 ============

    ControlSignal execute(Statement stmt, Scope scope) {
        meter.tick(stmt.getLine());
        try {
            return stmt.accept(statements, scope);
        } catch (TinyTalkException e) {
            throw located(e, stmt);
        }
    }

    TinyValue evaluate(Expression expr, Scope scope) {
        meter.tick(expr.getLine());
        try {
            return expr.accept(expressions, scope);
        } catch (TinyTalkException e) {
            throw located(e, expr);
        }
    }

    /**
     * 为缺少行号的错误补充位置；值层面的 {@link TinyTalkException} 转为可捕获的 {@link LanguageError}
     */
    private static TinyTalkException located(TinyTalkException e, AstNode node) {
        if (e instanceof LanguageError) {
            LanguageError error = (LanguageError) e;
            return error.hasLine() || node.getLine() <= 0 ? error : error.withLine(node.getLine());
        }
        if (e instanceof AssertionFailure) {
            return e;
        }
        return new LanguageError(e.getRawMessage(), node.getLine(), e);
    }

    /**
     * 依次执行代码块中的语句（不新建作用域），遇到控制信号立即返回
     */
    ControlSignal executeBlock(Block block, Scope scope) {
        TinyValue last = TinyNull.NULL;
        for (Statement stmt : block.getStatements()) {
            ControlSignal signal = execute(stmt, scope);
            if (!signal.isNormal()) {
                return signal;
            }
            last = signal.getValue();
        }
        return ControlSignal.normal(last);
    }

    ExecutionMeter meter() {
        return meter;
    }

    /**
     * 内建函数一次性生成 count 个元素前的检查，超过迭代上限时报错
     */
    public void checkAllocation(long count) {
        meter.checkAllocation(count, 0);
    }

    void registerStruct(StructType type) {
        structs.put(type.getName(), type);
    }

    void registerEnum(EnumType type) {
        enums.put(type.getName(), type);
    }

    // ============ 调用 ============

    @Override
    public TinyValue invoke(TinyValue callee, List<TinyValue> args) {
        if (callee instanceof TinyFunction) {
            return callFunction((TinyFunction) callee, args, null);
        }
        if (callee instanceof BoundMethod) {
            BoundMethod bound = (BoundMethod) callee;
            return callFunction(bound.getMethod(), args, bound.getReceiver());
        }
        if (callee instanceof StructType) {
            return construct((StructType) callee, args);
        }
        if (callee instanceof TinyCallable) {
            return callNative((TinyCallable) callee, args);
        }
        throw new LanguageError("Cannot call " + callee.getTypeName());
    }

    @Override
    public void emit(String text) {
        stdout.print(text);
        stdout.flush();
    }

    private TinyValue callNative(TinyCallable fn, List<TinyValue> args) {
        meter.enterCall(0);
        try {
            return fn.call(this, args);
        } catch (TinyTalkException e) {
            throw e;
        } catch (ArithmeticException | IllegalArgumentException | IndexOutOfBoundsException | ClassCastException e) {
            throw new LanguageError("Error in '" + fn.getName() + "': " + e.getMessage(), 0, e);
        } finally {
            meter.exitCall();
        }
    }

    /**
     * 调用用户函数：缺省参数在闭包中求值，参数与返回值按标注检查
     */
    TinyValue callFunction(TinyFunction fn, List<TinyValue> args, StructInstance self) {
        meter.enterCall(fn.getBody().getLine());
        try {
            Scope fnScope = new Scope(fn.getClosure());
            if (self != null) {
                fnScope.define("self", self);
            }
            List<Parameter> params = fn.getParams();
            for (int i = 0; i < params.size(); i++) {
                Parameter param = params.get(i);
                TinyValue value;
                if (i < args.size()) {
                    value = args.get(i);
                    TypeChecks.check(value, param.getTypeHint(),
                            "parameter '" + param.getName() + "' of '" + fn.getName() + "'");
                } else if (param.hasDefaultValue()) {
                    value = evaluate(param.getDefaultValue(), fn.getClosure());
                } else {
                    value = TinyNull.NULL;
                }
                fnScope.define(param.getName(), value);
            }

            TinyValue result = runBody(fn.getBody(), fnScope);
            TypeChecks.check(result, fn.getReturnType(), "return value of '" + fn.getName() + "'");
            return result;
        } finally {
            meter.exitCall();
        }
    }

    private TinyValue runBody(AstNode body, Scope fnScope) {
        if (!(body instanceof Block)) {
            return evaluate((Expression) body, fnScope);
        }
        ControlSignal signal = executeBlock((Block) body, fnScope);
        switch (signal.getKind()) {
            case BREAK:
                throw new LanguageError("'break' outside loop", body.getLine());
            case CONTINUE:
                throw new LanguageError("'continue' outside loop", body.getLine());
            default:
                return signal.getValue();
        }
    }

    /**
     * 结构体构造：按位置赋值字段，缺省值在全局作用域求值
     */
    TinyValue construct(StructType type, List<TinyValue> args) {
        StructInstance instance = new StructInstance(type);
        for (int i = 0; i < type.getFields().size(); i++) {
            StructDecl.FieldDecl field = type.getFields().get(i);
            TinyValue value;
            if (i < args.size()) {
                value = args.get(i);
            } else if (field.getDefaultValue() != null) {
                value = evaluate(field.getDefaultValue(), globals);
            } else {
                value = TinyNull.NULL;
            }
            instance.setField(field.getName(), value);
        }
        return instance;
    }
}
