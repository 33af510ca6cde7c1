package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyValue;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 作用域帧：名字到值的绑定加常量标记，通过父指针形成链
 *
 * <p>内建函数位于封闭的根帧，它是全局帧的父帧：用户代码可以用 let 遮蔽内建名，
 * 但不能对其重新赋值。</p>
 */
public final class Scope {

    private final Scope parent;
    private final Map<String, TinyValue> variables = new LinkedHashMap<String, TinyValue>();
    private final Set<String> constants = new HashSet<String>();
    private boolean sealed;

    public Scope(Scope parent) {
        this.parent = parent;
    }

    /**
     * 创建封闭的内建根帧，所有条目均为常量
     */
    public static Scope sealedRoot(Map<String, TinyValue> builtins) {
        Scope root = new Scope(null);
        for (Map.Entry<String, TinyValue> e : builtins.entrySet()) {
            root.defineConstant(e.getKey(), e.getValue());
        }
        root.sealed = true;
        return root;
    }

    public Scope getParent() {
        return parent;
    }

    public boolean isSealed() {
        return sealed;
    }

    public void define(String name, TinyValue value) {
        checkOpen(name);
        variables.put(name, value);
    }

    public void defineConstant(String name, TinyValue value) {
        checkOpen(name);
        variables.put(name, value);
        constants.add(name);
    }

    private void checkOpen(String name) {
        if (sealed) {
            throw new LanguageError("Cannot define '" + name + "' in the builtin scope");
        }
    }

    /**
     * 沿作用域链查找，未定义返回 null
     */
    public TinyValue lookup(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            TinyValue value = s.variables.get(name);
            if (value != null) return value;
        }
        return null;
    }

    /**
     * 只在当前帧查找
     */
    public TinyValue lookupLocal(String name) {
        return variables.get(name);
    }

    /**
     * 给已有绑定赋值；未找到返回 false
     *
     * @throws LanguageError 绑定为常量
     */
    public boolean assign(String name, TinyValue value) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.variables.containsKey(name)) {
                if (s.constants.contains(name)) {
                    throw new LanguageError("Cannot reassign constant '" + name + "'");
                }
                s.variables.put(name, value);
                return true;
            }
        }
        return false;
    }

    public boolean has(String name) {
        return lookup(name) != null;
    }

    public boolean isConstant(String name) {
        return constants.contains(name);
    }

    /**
     * 当前帧的绑定（只读视图，按定义顺序）
     */
    public Map<String, TinyValue> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    /**
     * 从当前帧可见的全部名字
     */
    public Set<String> collectNames() {
        Set<String> names = new LinkedHashSet<String>();
        for (Scope s = this; s != null; s = s.parent) {
            names.addAll(s.variables.keySet());
        }
        return names;
    }
}
