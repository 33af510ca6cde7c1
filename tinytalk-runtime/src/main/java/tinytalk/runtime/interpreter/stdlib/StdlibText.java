package tinytalk.runtime.interpreter.stdlib;

import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;
import tinytalk.runtime.interpreter.LanguageError;
import tinytalk.runtime.interpreter.NativeFunction;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 字符串函数与 format 模板
 */
final class StdlibText {

    private StdlibText() {}

    static void register(Map<String, TinyValue> table) {
        // split(s[, delim])：默认按单个空格切分，保留空段
        Builtins.define(table, NativeFunction.varargs("split", (ctx, args) -> {
            TinyList result = new TinyList();
            if (args.isEmpty() || !args.get(0).isString()) return result;
            String delim = args.size() > 1 && args.get(1).isString() ? args.get(1).asString() : " ";
            if (delim.isEmpty()) {
                throw new LanguageError("split() separator must not be empty");
            }
            for (String part : args.get(0).asString().split(Pattern.quote(delim), -1)) {
                result.add(TinyString.of(part));
            }
            return result;
        }));

        Builtins.define(table, NativeFunction.varargs("join", (ctx, args) -> {
            if (args.isEmpty() || !args.get(0).isList()) return TinyString.EMPTY;
            String delim = args.size() > 1 && args.get(1).isString() ? args.get(1).asString() : "";
            StringBuilder sb = new StringBuilder();
            List<TinyValue> items = ((TinyList) args.get(0)).getElements();
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append(delim);
                sb.append(ValueFormatter.format(items.get(i)));
            }
            return TinyString.of(sb.toString());
        }));

        Builtins.define(table, NativeFunction.varargs("replace", (ctx, args) -> {
            if (args.size() < 3) {
                return args.isEmpty() ? TinyString.EMPTY : TinyString.of(ValueFormatter.format(args.get(0)));
            }
            String s = ValueFormatter.format(args.get(0));
            return TinyString.of(s.replace(ValueFormatter.format(args.get(1)), ValueFormatter.format(args.get(2))));
        }));

        Builtins.define(table, NativeFunction.varargs("trim", (ctx, args) ->
                stringArg(args) ? TinyString.of(args.get(0).asString().strip()) : TinyString.EMPTY));

        Builtins.define(table, NativeFunction.varargs("upcase", (ctx, args) ->
                stringArg(args) ? TinyString.of(args.get(0).asString().toUpperCase(Locale.ROOT)) : TinyString.EMPTY));

        Builtins.define(table, NativeFunction.varargs("downcase", (ctx, args) ->
                stringArg(args) ? TinyString.of(args.get(0).asString().toLowerCase(Locale.ROOT)) : TinyString.EMPTY));

        Builtins.define(table, NativeFunction.varargs("startswith", (ctx, args) ->
                TinyBool.of(args.size() >= 2 && args.get(0).isString() && args.get(1).isString()
                        && args.get(0).asString().startsWith(args.get(1).asString()))));

        Builtins.define(table, NativeFunction.varargs("endswith", (ctx, args) ->
                TinyBool.of(args.size() >= 2 && args.get(0).isString() && args.get(1).isString()
                        && args.get(0).asString().endsWith(args.get(1).asString()))));

        // format("{0} is {1}", a, b) 或 format("{name}", {"name": ..})
        Builtins.define(table, NativeFunction.varargs("format", (ctx, args) -> {
            if (args.isEmpty() || !args.get(0).isString()) {
                throw new LanguageError("format requires a template string");
            }
            TinyMap named = args.size() == 2 && args.get(1).isMap() ? (TinyMap) args.get(1) : null;
            return TinyString.of(format(args.get(0).asString(), args.subList(1, args.size()), named));
        }));
    }

    private static boolean stringArg(List<TinyValue> args) {
        return !args.isEmpty() && args.get(0).isString();
    }

    /**
     * 模板替换：{@code {}} 自动编号，{@code {n}} 按位置，{@code {name}} 按映射键，
     * {@code {{ }}} 转义；字段后可跟 {@code :[填充][<>^]宽度}
     */
    static String format(String template, List<TinyValue> positional, TinyMap named) {
        StringBuilder out = new StringBuilder();
        int auto = 0;
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{') {
                out.append('{');
                i += 2;
                continue;
            }
            if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
                out.append('}');
                i += 2;
                continue;
            }
            if (c == '}') {
                throw new LanguageError("Format error: single '}' encountered in format string");
            }
            if (c != '{') {
                out.append(c);
                i++;
                continue;
            }
            int close = template.indexOf('}', i);
            if (close < 0) {
                throw new LanguageError("Format error: single '{' encountered in format string");
            }
            String field = template.substring(i + 1, close);
            String spec = null;
            int colon = field.indexOf(':');
            if (colon >= 0) {
                spec = field.substring(colon + 1);
                field = field.substring(0, colon);
            }

            String text;
            if (named != null && !field.isEmpty() && !isDigits(field)) {
                if (!named.containsKey(field)) {
                    throw new LanguageError("Format error: '" + field + "'");
                }
                text = ValueFormatter.format(named.get(field));
            } else {
                int index = field.isEmpty() ? auto++ : parseIndex(field);
                if (index >= positional.size()) {
                    throw new LanguageError("Format error: Replacement index " + index
                            + " out of range for positional args tuple");
                }
                text = ValueFormatter.format(positional.get(index));
            }
            out.append(spec != null ? pad(text, spec) : text);
            i = close + 1;
        }
        return out.toString();
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return !s.isEmpty();
    }

    private static int parseIndex(String field) {
        if (!isDigits(field)) {
            throw new LanguageError("Format error: '" + field + "'");
        }
        try {
            return Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new LanguageError("Format error: index too large: " + field);
        }
    }

    /**
     * 对齐说明：可选填充字符加 {@code < > ^}，然后是宽度；字符串默认左对齐
     */
    static String pad(String text, String spec) {
        if (spec.isEmpty()) {
            return text;
        }
        char fill = ' ';
        char align = '<';
        String width = spec;
        if (spec.length() >= 2 && isAlign(spec.charAt(1))) {
            fill = spec.charAt(0);
            align = spec.charAt(1);
            width = spec.substring(2);
        } else if (isAlign(spec.charAt(0))) {
            align = spec.charAt(0);
            width = spec.substring(1);
        }
        if (!isDigits(width)) {
            throw new LanguageError("Format error: Invalid format specifier '" + spec + "'");
        }
        int total = Integer.parseInt(width);
        int missing = total - text.length();
        if (missing <= 0) {
            return text;
        }
        switch (align) {
            case '>':
                return repeat(fill, missing) + text;
            case '^':
                return repeat(fill, missing / 2) + text + repeat(fill, missing - missing / 2);
            default:
                return text + repeat(fill, missing);
        }
    }

    private static boolean isAlign(char c) {
        return c == '<' || c == '>' || c == '^';
    }

    private static String repeat(char c, int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) sb.append(c);
        return sb.toString();
    }
}
