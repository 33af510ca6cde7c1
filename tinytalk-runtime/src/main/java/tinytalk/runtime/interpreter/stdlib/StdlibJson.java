package tinytalk.runtime.interpreter.stdlib;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyFloat;
import tinytalk.runtime.TinyInstance;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;
import tinytalk.runtime.interpreter.LanguageError;
import tinytalk.runtime.interpreter.NativeFunction;

import java.io.IOException;
import java.io.StringReader;
import java.util.Map;

/**
 * JSON 解析与序列化（Gson）
 */
final class StdlibJson {

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .serializeSpecialFloatingPointValues()
            .disableHtmlEscaping()
            .create();

    private static final TypeAdapter<JsonElement> ELEMENTS = GSON.getAdapter(JsonElement.class);

    private StdlibJson() {}

    static void register(Map<String, TinyValue> table) {
        Builtins.define(table, NativeFunction.varargs("parse_json", (ctx, args) -> {
            if (args.isEmpty() || !args.get(0).isString()) {
                throw new LanguageError("parse_json requires a JSON string");
            }
            return parse(args.get(0).asString());
        }));

        Builtins.define(table, NativeFunction.varargs("to_json", (ctx, args) ->
                args.isEmpty() ? TinyString.of("null") : TinyString.of(GSON.toJson(toJson(args.get(0))))));
    }

    /**
     * 严格模式解析，整段文本必须是一个 JSON 值
     */
    static TinyValue parse(String text) {
        try {
            JsonReader reader = new JsonReader(new StringReader(text));
            reader.setLenient(false);
            JsonElement element = ELEMENTS.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new LanguageError("Invalid JSON: unexpected data after value");
            }
            return fromJson(element);
        } catch (IOException | JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new LanguageError("Invalid JSON: " + e.getMessage());
        }
    }

    static TinyValue fromJson(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return TinyNull.NULL;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive p = element.getAsJsonPrimitive();
            if (p.isBoolean()) return TinyBool.of(p.getAsBoolean());
            if (p.isString()) return TinyString.of(p.getAsString());
            String lexeme = p.getAsNumber().toString();
            if (lexeme.indexOf('.') < 0 && lexeme.indexOf('e') < 0 && lexeme.indexOf('E') < 0) {
                try {
                    return TinyInt.of(Long.parseLong(lexeme));
                } catch (NumberFormatException e) {
                    return TinyFloat.of(Double.parseDouble(lexeme));
                }
            }
            return TinyFloat.of(Double.parseDouble(lexeme));
        }
        if (element.isJsonArray()) {
            TinyList list = new TinyList();
            for (JsonElement item : element.getAsJsonArray()) {
                list.add(fromJson(item));
            }
            return list;
        }
        TinyMap map = new TinyMap();
        for (Map.Entry<String, JsonElement> e : element.getAsJsonObject().entrySet()) {
            map.put(e.getKey(), fromJson(e.getValue()));
        }
        return map;
    }

    /**
     * 结构体实例序列化为对象，函数与枚举变体序列化为其显示形式
     */
    static JsonElement toJson(TinyValue value) {
        if (value.isNull()) return JsonNull.INSTANCE;
        if (value.isBool()) return new JsonPrimitive(((TinyBool) value).getValue());
        if (value.isInt()) return new JsonPrimitive(value.asLong());
        if (value.isFloat()) return new JsonPrimitive(value.asDouble());
        if (value.isString()) return new JsonPrimitive(value.asString());
        if (value.isList()) {
            JsonArray array = new JsonArray();
            for (TinyValue item : (TinyList) value) {
                array.add(toJson(item));
            }
            return array;
        }
        if (value.isMap()) {
            JsonObject object = new JsonObject();
            for (Map.Entry<Object, TinyValue> e : ((TinyMap) value).getEntries().entrySet()) {
                object.add(ValueFormatter.formatKey(e.getKey()), toJson(e.getValue()));
            }
            return object;
        }
        if (value instanceof TinyInstance) {
            JsonObject object = new JsonObject();
            for (Map.Entry<String, TinyValue> e : ((TinyInstance) value).getFields().entrySet()) {
                object.add(e.getKey(), toJson(e.getValue()));
            }
            return object;
        }
        return new JsonPrimitive(ValueFormatter.format(value));
    }
}
