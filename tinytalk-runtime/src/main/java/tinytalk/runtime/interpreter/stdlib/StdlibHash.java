package tinytalk.runtime.interpreter.stdlib;

import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;
import tinytalk.runtime.interpreter.NativeFunction;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

/**
 * 摘要函数：对值的显示形式（UTF-8）求十六进制摘要
 */
final class StdlibHash {

    private StdlibHash() {}

    static void register(Map<String, TinyValue> table) {
        // hash(x)：SHA-256 的前 16 位十六进制
        Builtins.define(table, NativeFunction.varargs("hash", (ctx, args) ->
                args.isEmpty() ? TinyString.EMPTY : TinyString.of(digest("SHA-256", args.get(0)).substring(0, 16))));

        Builtins.define(table, NativeFunction.varargs("md5", (ctx, args) ->
                args.isEmpty() ? TinyString.EMPTY : TinyString.of(digest("MD5", args.get(0)))));

        Builtins.define(table, NativeFunction.varargs("sha256", (ctx, args) ->
                args.isEmpty() ? TinyString.EMPTY : TinyString.of(digest("SHA-256", args.get(0)))));
    }

    static String digest(String algorithm, TinyValue value) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            byte[] hash = md.digest(ValueFormatter.format(value).getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
