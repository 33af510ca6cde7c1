package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 成员访问 {@code obj.name} 的解析
 *
 * <p>顺序：结构体字段、结构体方法（绑定）、映射键（缺失为 null）、通用转换属性、
 * 字符串属性、列表属性。</p>
 */
final class MemberResolver {

    private MemberResolver() {}

    static TinyValue resolve(TinyValue target, String member) {
        if (target instanceof StructInstance) {
            StructInstance instance = (StructInstance) target;
            if (instance.hasField(member)) {
                return instance.getField(member);
            }
            TinyFunction method = instance.getStructType().getMethod(member);
            if (method != null) {
                return new BoundMethod(instance, method);
            }
            throw new LanguageError("Unknown field '" + member + "'");
        }
        if (target.isMap()) {
            TinyMap map = (TinyMap) target;
            if (map.containsKey(member)) {
                return map.get(member);
            }
            TinyValue converted = conversion(target, member);
            return converted != null ? converted : TinyNull.NULL;
        }

        TinyValue converted = conversion(target, member);
        if (converted != null) {
            return converted;
        }
        if (target.isString()) {
            TinyValue result = stringMember((TinyString) target, member);
            if (result != null) return result;
        }
        if (target.isList()) {
            TinyValue result = listMember((TinyList) target, member);
            if (result != null) return result;
        }
        throw new LanguageError("Cannot access '." + member + "' on " + target.getTypeName());
    }

    private static TinyValue conversion(TinyValue target, String member) {
        switch (member) {
            case "str":   return TinyString.of(target.asString());
            case "int":   return Conversions.toInt(target);
            case "float": return Conversions.toFloat(target);
            case "bool":  return TinyBool.of(target.isTruthy());
            case "type":  return TinyString.of(target.getTypeName());
            case "num":   return Conversions.toNumber(target);
            case "len":
                if (target.isString()) return TinyInt.of(((TinyString) target).length());
                if (target.isList()) return TinyInt.of(((TinyList) target).size());
                if (target.isMap()) return TinyInt.of(((TinyMap) target).size());
                return TinyInt.ZERO;
            default:
                return null;
        }
    }

    private static TinyValue stringMember(TinyString s, String member) {
        String value = s.getValue();
        switch (member) {
            case "length":
            case "size":
                return TinyInt.of(s.length());
            case "upper":
            case "upcase":
                return TinyString.of(value.toUpperCase());
            case "lower":
            case "downcase":
                return TinyString.of(value.toLowerCase());
            case "trim":
                return TinyString.of(value.strip());
            case "chars":
                return s.chars();
            case "words":
                return splitWhitespace(value);
            case "lines": {
                TinyList lines = new TinyList();
                value.lines().forEach(line -> lines.add(TinyString.of(line)));
                return lines;
            }
            case "reversed":
                return TinyString.of(new StringBuilder(value).reverse().toString());
            default:
                return null;
        }
    }

    /**
     * 按空白切分并丢弃空段
     */
    static TinyList splitWhitespace(String value) {
        TinyList words = new TinyList();
        String stripped = value.strip();
        if (!stripped.isEmpty()) {
            for (String w : stripped.split("\\s+")) {
                words.add(TinyString.of(w));
            }
        }
        return words;
    }

    private static TinyValue listMember(TinyList list, String member) {
        switch (member) {
            case "length":
            case "size":
                return TinyInt.of(list.size());
            case "first":
                return list.isEmpty() ? TinyNull.NULL : list.get(0);
            case "last":
                return list.isEmpty() ? TinyNull.NULL : list.get(list.size() - 1);
            case "empty":
                return TinyBool.of(list.isEmpty());
            case "reversed": {
                List<TinyValue> copy = new ArrayList<TinyValue>(list.getElements());
                Collections.reverse(copy);
                return new TinyList(copy);
            }
            default:
                return null;
        }
    }
}
