package tinytalk.runtime.interpreter.stdlib;

import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;
import tinytalk.runtime.interpreter.LanguageError;
import tinytalk.runtime.interpreter.NativeFunction;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 正则表达式函数，第一个参数是文本，第二个是模式
 */
final class StdlibRegex {

    private StdlibRegex() {}

    static void register(Map<String, TinyValue> table) {
        Builtins.define(table, new NativeFunction("regex_match", 2, (ctx, args) ->
                TinyBool.of(compile(args.get(1)).matcher(ValueFormatter.format(args.get(0))).matches())));

        // 有捕获组时取第一组
        Builtins.define(table, new NativeFunction("regex_find", 2, (ctx, args) -> {
            Matcher m = compile(args.get(1)).matcher(ValueFormatter.format(args.get(0)));
            TinyList result = new TinyList();
            while (m.find()) {
                String found = m.groupCount() > 0 ? m.group(1) : m.group();
                result.add(TinyString.of(found != null ? found : ""));
            }
            return result;
        }));

        Builtins.define(table, new NativeFunction("regex_replace", 3, (ctx, args) -> {
            Matcher m = compile(args.get(1)).matcher(ValueFormatter.format(args.get(0)));
            String replacement = ValueFormatter.format(args.get(2));
            try {
                return TinyString.of(m.replaceAll(replacement));
            } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                throw new LanguageError("Invalid regex replacement: " + e.getMessage());
            }
        }));

        Builtins.define(table, new NativeFunction("regex_split", 2, (ctx, args) -> {
            TinyList result = new TinyList();
            for (String part : compile(args.get(1)).split(ValueFormatter.format(args.get(0)), -1)) {
                result.add(TinyString.of(part));
            }
            return result;
        }));
    }

    private static Pattern compile(TinyValue pattern) {
        try {
            return Pattern.compile(ValueFormatter.format(pattern));
        } catch (PatternSyntaxException e) {
            throw new LanguageError("Invalid regex: " + e.getDescription());
        }
    }
}
