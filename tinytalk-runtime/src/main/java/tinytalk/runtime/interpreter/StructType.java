package tinytalk.runtime.interpreter;

import com.tinytalk.compiler.ast.decl.StructDecl;
import tinytalk.runtime.ExecutionContext;
import tinytalk.runtime.TinyCallable;
import tinytalk.runtime.TinyValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 结构体类型，同时是它的构造函数（按位置接收字段值）
 */
public final class StructType extends TinyCallable {

    private final String name;
    private final List<StructDecl.FieldDecl> fields;
    private final Map<String, TinyFunction> methods = new LinkedHashMap<String, TinyFunction>();

    public StructType(String name, List<StructDecl.FieldDecl> fields) {
        this.name = name;
        this.fields = fields;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return fields.size();
    }

    public List<StructDecl.FieldDecl> getFields() {
        return fields;
    }

    public void addMethod(TinyFunction method) {
        methods.put(method.getName(), method);
    }

    public TinyFunction getMethod(String methodName) {
        return methods.get(methodName);
    }

    public Map<String, TinyFunction> getMethods() {
        return Collections.unmodifiableMap(methods);
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
