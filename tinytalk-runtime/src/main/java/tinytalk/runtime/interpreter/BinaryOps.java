package tinytalk.runtime.interpreter;

import com.tinytalk.compiler.ast.expr.BinaryExpr.BinaryOp;
import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyFloat;
import tinytalk.runtime.TinyInstance;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;
import tinytalk.runtime.ValueType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 二元运算的统一实现
 *
 * <p>布尔值在算术中视为 0/1。整数运算溢出时报错，不会静默回绕。</p>
 */
public final class BinaryOps {

    private static final double EPSILON = 1e-9;

    /** 按原生顺序比较：数字、字符串、列表（逐元素） */
    public static final Comparator<TinyValue> NATURAL_ORDER = BinaryOps::compare;

    private BinaryOps() {}

    /**
     * 非短路的二元运算分派（and / or 由求值器处理）
     */
    public static TinyValue apply(BinaryOp op, TinyValue left, TinyValue right) {
        switch (op) {
            case ADD:       return add(left, right);
            case SUB:       return sub(left, right);
            case MUL:       return mul(left, right);
            case DIV:       return div(left, right);
            case FLOOR_DIV: return floorDiv(left, right);
            case MOD:       return mod(left, right);
            case POW:       return pow(left, right);
            case EQ:
            case IS:        return TinyBool.of(valuesEqual(left, right));
            case NE:
            case ISNT:      return TinyBool.of(!valuesEqual(left, right));
            case LT:        return TinyBool.of(compare(left, right) < 0);
            case GT:        return TinyBool.of(compare(left, right) > 0);
            case LE:        return TinyBool.of(compare(left, right) <= 0);
            case GE:        return TinyBool.of(compare(left, right) >= 0);
            case HAS:       return TinyBool.of(has(left, right));
            case HASNT:     return TinyBool.of(!has(left, right));
            case ISIN:      return TinyBool.of(has(right, left));
            case ISLIKE:    return TinyBool.of(isLike(left, right));
            case BIT_AND:   return TinyInt.of(bitOperand(left) & bitOperand(right));
            case BIT_OR:    return TinyInt.of(bitOperand(left) | bitOperand(right));
            case BIT_XOR:   return TinyInt.of(bitOperand(left) ^ bitOperand(right));
            case SHL:       return shiftLeft(left, right);
            case SHR:       return shiftRight(left, right);
            default:
                throw new LanguageError("Unknown operator: " + op.getSymbol());
        }
    }

    // ============ 数值辅助 ============

    static boolean isNumeric(TinyValue v) {
        return v.isInt() || v.isFloat() || v.isBool();
    }

    /** int 或 bool */
    static boolean isIntegral(TinyValue v) {
        return v.isInt() || v.isBool();
    }

    private static void checkNull(TinyValue left, TinyValue right) {
        if (left.isNull() || right.isNull()) {
            throw new LanguageError("Cannot perform arithmetic on null");
        }
    }

    private static LanguageError typeError(String operation, TinyValue left, TinyValue right) {
        String message = "Cannot " + operation + " " + left.getTypeName() + " and " + right.getTypeName();
        if (left.isString() || right.isString()) {
            if ("add".equals(operation)) {
                message += ". Convert to string first: value.str";
            } else if ("subtract".equals(operation) || "multiply".equals(operation) || "divide".equals(operation)) {
                message += ". Arithmetic operations require numbers. Use .int or .float to convert.";
            }
        }
        return new LanguageError(message);
    }

    private static void checkNumeric(String operation, TinyValue left, TinyValue right) {
        checkNull(left, right);
        if (!isNumeric(left) || !isNumeric(right)) {
            throw typeError(operation, left, right);
        }
    }

    private static LanguageError overflow() {
        return new LanguageError("Integer overflow");
    }

    // ============ 算术 ============

    public static TinyValue add(TinyValue left, TinyValue right) {
        if (left.isString() || right.isString()) {
            return TinyString.of(left.asString() + right.asString());
        }
        if (left.isList() && right.isList()) {
            return ((TinyList) left).concat((TinyList) right);
        }
        checkNumeric("add", left, right);
        if (isIntegral(left) && isIntegral(right)) {
            try {
                return TinyInt.of(Math.addExact(left.asLong(), right.asLong()));
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }
        return TinyFloat.of(left.asDouble() + right.asDouble());
    }

    public static TinyValue sub(TinyValue left, TinyValue right) {
        checkNumeric("subtract", left, right);
        if (isIntegral(left) && isIntegral(right)) {
            try {
                return TinyInt.of(Math.subtractExact(left.asLong(), right.asLong()));
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }
        return TinyFloat.of(left.asDouble() - right.asDouble());
    }

    public static TinyValue mul(TinyValue left, TinyValue right) {
        if (left.isString() && right.isInt()) {
            return TinyString.of(repeat(((TinyString) left).getValue(), right.asLong()));
        }
        if (left.isInt() && right.isString()) {
            return TinyString.of(repeat(((TinyString) right).getValue(), left.asLong()));
        }
        if (left.isList() && right.isInt()) {
            return repeat((TinyList) left, right.asLong());
        }
        checkNumeric("multiply", left, right);
        if (isIntegral(left) && isIntegral(right)) {
            try {
                return TinyInt.of(Math.multiplyExact(left.asLong(), right.asLong()));
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }
        return TinyFloat.of(left.asDouble() * right.asDouble());
    }

    /**
     * {@code /} 总是产生浮点数
     */
    public static TinyValue div(TinyValue left, TinyValue right) {
        checkNumeric("divide", left, right);
        if (right.asDouble() == 0.0) {
            throw new LanguageError("Division by zero");
        }
        return TinyFloat.of(left.asDouble() / right.asDouble());
    }

    /**
     * {@code //} 向下取整，结果为整数
     */
    public static TinyValue floorDiv(TinyValue left, TinyValue right) {
        checkNumeric("divide", left, right);
        if (right.asDouble() == 0.0) {
            throw new LanguageError("Division by zero");
        }
        if (isIntegral(left) && isIntegral(right)) {
            long a = left.asLong();
            long b = right.asLong();
            if (a == Long.MIN_VALUE && b == -1) {
                throw overflow();
            }
            return TinyInt.of(Math.floorDiv(a, b));
        }
        double result = Math.floor(left.asDouble() / right.asDouble());
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new LanguageError("Cannot convert " + ValueFormatter.formatFloat(result) + " to int");
        }
        return TinyInt.of((long) result);
    }

    /**
     * {@code %} 结果符号与除数相同
     */
    public static TinyValue mod(TinyValue left, TinyValue right) {
        checkNumeric("modulo", left, right);
        if (right.asDouble() == 0.0) {
            throw new LanguageError("Division by zero");
        }
        if (isIntegral(left) && isIntegral(right)) {
            return TinyInt.of(Math.floorMod(left.asLong(), right.asLong()));
        }
        double a = left.asDouble();
        double b = right.asDouble();
        double r = a % b;
        if (r != 0 && (r < 0) != (b < 0)) {
            r += b;
        }
        return TinyFloat.of(r);
    }

    public static TinyValue pow(TinyValue left, TinyValue right) {
        checkNumeric("raise", left, right);
        if (isIntegral(left) && isIntegral(right)) {
            long base = left.asLong();
            long exp = right.asLong();
            if (exp >= 0) {
                return TinyInt.of(powExact(base, exp));
            }
            if (base == 0) {
                throw new LanguageError("Division by zero");
            }
            double result = Math.pow(base, exp);
            return result == Math.rint(result) && !Double.isInfinite(result)
                    ? TinyInt.of((long) result) : TinyFloat.of(result);
        }
        if (left.asDouble() == 0.0 && right.asDouble() < 0) {
            throw new LanguageError("Division by zero");
        }
        return TinyFloat.of(Math.pow(left.asDouble(), right.asDouble()));
    }

    private static long powExact(long base, long exp) {
        long result = 1;
        long b = base;
        long e = exp;
        try {
            while (e > 0) {
                if ((e & 1) == 1) {
                    result = Math.multiplyExact(result, b);
                }
                e >>= 1;
                if (e > 0) {
                    b = Math.multiplyExact(b, b);
                }
            }
        } catch (ArithmeticException ex) {
            throw overflow();
        }
        return result;
    }

    private static String repeat(String s, long times) {
        if (times <= 0 || s.isEmpty()) {
            return "";
        }
        if ((long) s.length() * times > Integer.MAX_VALUE) {
            throw new LanguageError("Repeated string is too large");
        }
        return s.repeat((int) times);
    }

    private static TinyList repeat(TinyList list, long times) {
        TinyList result = new TinyList();
        if (times <= 0 || list.isEmpty()) {
            return result;
        }
        if (repeatedSize(list.size(), times) > Integer.MAX_VALUE) {
            throw new LanguageError("Repeated list is too large");
        }
        for (long i = 0; i < times; i++) {
            result.getElements().addAll(list.getElements());
        }
        return result;
    }

    /**
     * 运算一次性产生的元素数量（{@code list * n}），其他运算为 0
     */
    public static long allocationSize(BinaryOp op, TinyValue left, TinyValue right) {
        if (op == BinaryOp.MUL && left.isList() && right.isInt()) {
            return repeatedSize(((TinyList) left).size(), right.asLong());
        }
        return 0;
    }

    /** 饱和乘法，溢出时为 Long.MAX_VALUE */
    private static long repeatedSize(int size, long times) {
        if (size == 0 || times <= 0) {
            return 0;
        }
        return times > Long.MAX_VALUE / size ? Long.MAX_VALUE : size * times;
    }

    /**
     * 复合赋值：整值浮点结果收缩为整数
     */
    public static TinyValue applyCompound(BinaryOp op, TinyValue left, TinyValue right) {
        TinyValue result = apply(op, left, right);
        if (result.isFloat()) {
            double d = result.asDouble();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.2e18) {
                return TinyInt.of((long) d);
            }
        }
        return result;
    }

    // ============ 位运算 ============

    private static long bitOperand(TinyValue v) {
        if (isIntegral(v)) {
            return v.asLong();
        }
        if (v.isFloat()) {
            return (long) v.asDouble();
        }
        throw new LanguageError("Bitwise operations require integers, got " + v.getTypeName());
    }

    private static TinyValue shiftLeft(TinyValue left, TinyValue right) {
        long value = bitOperand(left);
        long shift = bitOperand(right);
        if (shift < 0) {
            throw new LanguageError("Negative shift count");
        }
        if (value == 0) {
            return TinyInt.ZERO;
        }
        if (shift >= 63 || (value << shift) >> shift != value) {
            throw overflow();
        }
        return TinyInt.of(value << shift);
    }

    private static TinyValue shiftRight(TinyValue left, TinyValue right) {
        long value = bitOperand(left);
        long shift = bitOperand(right);
        if (shift < 0) {
            throw new LanguageError("Negative shift count");
        }
        return TinyInt.of(value >> Math.min(shift, 63));
    }

    // ============ 一元运算 ============

    public static TinyValue negate(TinyValue operand) {
        if (operand.isFloat()) {
            return TinyFloat.of(-operand.asDouble());
        }
        if (isIntegral(operand)) {
            try {
                return TinyInt.of(Math.negateExact(operand.asLong()));
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }
        if (operand.isNull()) {
            throw new LanguageError("Cannot perform arithmetic on null");
        }
        throw new LanguageError("Cannot negate " + operand.getTypeName());
    }

    public static TinyValue bitNot(TinyValue operand) {
        return TinyInt.of(~bitOperand(operand));
    }

    // ============ 相等与比较 ============

    /**
     * 结构相等：浮点数按 1e-9 容差，列表与映射逐项比较，int 与 float 可互相比较
     */
    public static boolean valuesEqual(TinyValue left, TinyValue right) {
        if (left == right) {
            return true;
        }
        ValueType lt = left.getType();
        ValueType rt = right.getType();
        if (lt == rt) {
            switch (lt) {
                case FLOAT:
                    return floatsClose(left.asDouble(), right.asDouble());
                case LIST:
                    return listsEqual((TinyList) left, (TinyList) right);
                case MAP:
                    return mapsEqual((TinyMap) left, (TinyMap) right);
                case INT:
                    return left.asLong() == right.asLong();
                case STRING:
                    return left.asString().equals(right.asString());
                case BOOLEAN:
                    return left.isTruthy() == right.isTruthy();
                case NULL:
                    return true;
                case STRUCT_INSTANCE:
                    return instancesEqual((TinyInstance) left, (TinyInstance) right);
                case ENUM_VARIANT:
                    return left.equals(right);
                default:
                    return false;
            }
        }
        if ((lt == ValueType.INT && rt == ValueType.FLOAT) || (lt == ValueType.FLOAT && rt == ValueType.INT)) {
            double a = left.asDouble();
            double b = right.asDouble();
            return Math.abs(a - b) < EPSILON || a == b;
        }
        return false;
    }

    private static boolean floatsClose(double a, double b) {
        if (a == b) {
            return true;
        }
        double diff = Math.abs(a - b);
        if (diff < EPSILON) {
            return true;
        }
        double max = Math.max(Math.abs(a), Math.abs(b));
        return max > 0 && diff / max < EPSILON;
    }

    private static boolean listsEqual(TinyList a, TinyList b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!valuesEqual(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean mapsEqual(TinyMap a, TinyMap b) {
        if (!a.getEntries().keySet().equals(b.getEntries().keySet())) {
            return false;
        }
        for (Map.Entry<Object, TinyValue> e : a.getEntries().entrySet()) {
            if (!valuesEqual(e.getValue(), b.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean instancesEqual(TinyInstance a, TinyInstance b) {
        if (!a.getStructName().equals(b.getStructName())
                || !a.getFields().keySet().equals(b.getFields().keySet())) {
            return false;
        }
        for (Map.Entry<String, TinyValue> e : a.getFields().entrySet()) {
            if (!valuesEqual(e.getValue(), b.getField(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 原生顺序比较，无法比较的组合报错
     */
    public static int compare(TinyValue left, TinyValue right) {
        if (isNumeric(left) && isNumeric(right)) {
            if (isIntegral(left) && isIntegral(right)) {
                return Long.compare(left.asLong(), right.asLong());
            }
            return Double.compare(left.asDouble(), right.asDouble());
        }
        if (left.isString() && right.isString()) {
            return left.asString().compareTo(right.asString());
        }
        if (left.isList() && right.isList()) {
            List<TinyValue> a = ((TinyList) left).getElements();
            List<TinyValue> b = ((TinyList) right).getElements();
            int n = Math.min(a.size(), b.size());
            for (int i = 0; i < n; i++) {
                if (!valuesEqual(a.get(i), b.get(i))) {
                    return compare(a.get(i), b.get(i));
                }
            }
            return Integer.compare(a.size(), b.size());
        }
        throw new LanguageError("Cannot compare " + left.getTypeName() + " and " + right.getTypeName());
    }

    // ============ 自然语言运算符 ============

    /**
     * 列表按值包含、映射按键包含、字符串按子串包含，其它返回 false
     */
    public static boolean has(TinyValue container, TinyValue item) {
        if (container.isList()) {
            for (TinyValue v : (TinyList) container) {
                if (valuesEqual(item, v)) {
                    return true;
                }
            }
            return false;
        }
        if (container.isMap()) {
            if (!isHashable(item)) {
                return false;
            }
            return ((TinyMap) container).containsKey(item.toKey());
        }
        if (container.isString()) {
            return container.asString().contains(item.asString());
        }
        return false;
    }

    static boolean isHashable(TinyValue v) {
        return v.isNull() || v.isInt() || v.isFloat() || v.isBool() || v.isString();
    }

    /**
     * 通配符匹配（不区分大小写）：{@code *} 匹配任意串，{@code ?} 匹配单个字符
     */
    public static boolean isLike(TinyValue left, TinyValue right) {
        if (!left.isString() || !right.isString()) {
            return false;
        }
        return wildcardPattern(right.asString()).matcher(left.asString()).matches();
    }

    static Pattern wildcardPattern(String wildcard) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < wildcard.length(); i++) {
            char c = wildcard.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    /**
     * 列表的浅拷贝排序结果
     */
    public static List<TinyValue> sorted(List<TinyValue> items) {
        List<TinyValue> copy = new ArrayList<TinyValue>(items);
        copy.sort(NATURAL_ORDER);
        return copy;
    }
}
