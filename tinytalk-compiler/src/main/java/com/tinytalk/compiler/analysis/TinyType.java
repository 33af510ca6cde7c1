package com.tinytalk.compiler.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 步骤链类型推断使用的简化类型：标量、list[T]、map[K, V]、any
 */
public final class TinyType {

    public enum Kind {
        INT, FLOAT, STR, BOOL, NULL, LIST, MAP, ANY
    }

    private static final TinyType INT = new TinyType(Kind.INT);
    private static final TinyType FLOAT = new TinyType(Kind.FLOAT);
    private static final TinyType STR = new TinyType(Kind.STR);
    private static final TinyType BOOL = new TinyType(Kind.BOOL);
    private static final TinyType NULL = new TinyType(Kind.NULL);
    private static final TinyType ANY = new TinyType(Kind.ANY);

    private final Kind kind;
    private final List<TinyType> params;

    private TinyType(Kind kind, TinyType... params) {
        this.kind = kind;
        this.params = Collections.unmodifiableList(new ArrayList<TinyType>(Arrays.asList(params)));
    }

    public static TinyType intType() { return INT; }
    public static TinyType floatType() { return FLOAT; }
    public static TinyType strType() { return STR; }
    public static TinyType boolType() { return BOOL; }
    public static TinyType nullType() { return NULL; }
    public static TinyType anyType() { return ANY; }

    public static TinyType listOf(TinyType element) {
        return new TinyType(Kind.LIST, element);
    }

    public static TinyType mapOf(TinyType key, TinyType value) {
        return new TinyType(Kind.MAP, key, value);
    }

    /**
     * 由类型标注文本得到类型，如 "int"、"list[str]"、"?map"；无法识别的名字为 any
     */
    public static TinyType fromHint(String hint) {
        if (hint == null) return ANY;
        String text = hint.startsWith("?") ? hint.substring(1) : hint;
        int bracket = text.indexOf('[');
        String base = bracket >= 0 ? text.substring(0, bracket) : text;
        List<String> inner = bracket >= 0 && text.endsWith("]")
                ? splitTopLevel(text.substring(bracket + 1, text.length() - 1))
                : Collections.<String>emptyList();
        switch (base) {
            case "int":   return INT;
            case "float": return FLOAT;
            case "str":   return STR;
            case "bool":  return BOOL;
            case "list":
                return listOf(inner.isEmpty() ? ANY : fromHint(inner.get(0)));
            case "map":
                if (inner.size() == 2) {
                    return mapOf(fromHint(inner.get(0)), fromHint(inner.get(1)));
                }
                return mapOf(STR, ANY);
            default:
                return ANY;
        }
    }

    private static List<String> splitTopLevel(String s) {
        List<String> parts = new ArrayList<String>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '[') depth++;
            else if (c == ']') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(s.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(s.substring(start).trim());
        return parts;
    }

    public Kind getKind() {
        return kind;
    }

    public List<TinyType> getParams() {
        return params;
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    /**
     * list[T] 的元素类型，未知时为 any
     */
    public TinyType elementType() {
        if (kind == Kind.LIST && !params.isEmpty()) {
            return params.get(0);
        }
        return ANY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TinyType)) return false;
        TinyType that = (TinyType) o;
        return kind == that.kind && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, params);
    }

    @Override
    public String toString() {
        String name = kind.name().toLowerCase();
        if (params.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('[');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i));
        }
        return sb.append(']').toString();
    }
}
