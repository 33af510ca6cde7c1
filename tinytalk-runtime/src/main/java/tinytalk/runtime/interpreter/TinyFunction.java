package tinytalk.runtime.interpreter;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.decl.Parameter;
import tinytalk.runtime.ExecutionContext;
import tinytalk.runtime.TinyCallable;
import tinytalk.runtime.TinyValue;

import java.util.List;

/**
 * 用户定义的函数或 lambda，捕获定义处的作用域
 */
public final class TinyFunction extends TinyCallable {

    private final String name;
    private final List<Parameter> params;
    private final AstNode body;
    private final Scope closure;
    private final String returnType;

    /**
     * @param body 代码块或单个表达式（表达式体 lambda）
     */
    public TinyFunction(String name, List<Parameter> params, AstNode body, Scope closure, String returnType) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
        this.returnType = returnType;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return params.size();
    }

    public List<Parameter> getParams() {
        return params;
    }

    public AstNode getBody() {
        return body;
    }

    public Scope getClosure() {
        return closure;
    }

    /** 返回类型标注，可为 null */
    public String getReturnType() {
        return returnType;
    }

    @Override
    public TinyValue call(ExecutionContext ctx, List<TinyValue> args) {
        return ctx.invoke(this, args);
    }

    @Override
    public String toString() {
        return "<function>";
    }
}
