package tinytalk.runtime.interpreter;

import com.tinytalk.compiler.ast.decl.Program;
import com.tinytalk.compiler.ast.stmt.ImportStmt;
import com.tinytalk.compiler.lexer.Lexer;
import com.tinytalk.compiler.parser.ParseException;
import com.tinytalk.compiler.parser.Parser;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.cache.BoundedCache;
import tinytalk.runtime.interpreter.cache.CacheStats;
import tinytalk.runtime.interpreter.cache.CaffeineCache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TinyTalk 模块加载器
 *
 * <p>路径相对于当前源文件目录解析，缺少扩展名时补 {@code .tt}。
 * 解析结果按 (绝对路径, 修改时间) 缓存在进程级的 Caffeine 缓存中；
 * 执行结果（模块作用域）按解释器缓存，同一解释器中模块只执行一次，文件修改后重新执行。</p>
 */
public final class ModuleLoader {

    private static final Logger LOG = Logger.getLogger(ModuleLoader.class.getName());

    static final String EXTENSION = ".tt";

    private static final BoundedCache<String, Program> PARSED = new CaffeineCache<String, Program>(256);

    private final Interpreter interpreter;
    private final Map<Path, Scope> moduleScopes = new HashMap<Path, Scope>();
    private final Map<Path, Long> moduleTimestamps = new HashMap<Path, Long>();
    private final Set<Path> loading = new HashSet<Path>();

    ModuleLoader(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /**
     * 进程级解析缓存统计
     */
    public static CacheStats parsedCacheStats() {
        return PARSED.getStats();
    }

    public static void clearParsedCache() {
        PARSED.clear();
    }

    /**
     * 执行 import 语句并把名字绑定到目标作用域
     */
    void importInto(ImportStmt node, Scope target) {
        String module = node.getPath();
        Scope moduleScope = load(module);

        if (!node.getItems().isEmpty()) {
            for (String name : node.getItems()) {
                TinyValue value = moduleScope.lookupLocal(name);
                if (value == null) {
                    throw new LanguageError("Module '" + module + "' does not export '" + name + "'");
                }
                target.define(name, value);
            }
        } else if (node.getAlias() != null) {
            TinyMap namespace = new TinyMap();
            for (Map.Entry<String, TinyValue> e : moduleScope.getVariables().entrySet()) {
                if (!e.getKey().startsWith("_")) {
                    namespace.put(e.getKey(), e.getValue());
                }
            }
            target.define(node.getAlias(), namespace);
        } else {
            for (Map.Entry<String, TinyValue> e : moduleScope.getVariables().entrySet()) {
                if (!e.getKey().startsWith("_")) {
                    target.define(e.getKey(), e.getValue());
                }
            }
        }
    }

    /**
     * 解析模块路径
     */
    Path resolve(String module) {
        String relative = module.endsWith(EXTENSION) ? module : module + EXTENSION;
        return interpreter.getSourceDir().resolve(relative).toAbsolutePath().normalize();
    }

    /**
     * 加载并执行模块，返回模块作用域
     */
    Scope load(String module) {
        Path path = resolve(module);
        if (!Files.isRegularFile(path)) {
            throw new LanguageError("Module not found: '" + module + "'. Looked in: " + path);
        }
        if (loading.contains(path)) {
            throw new LanguageError("Circular import: '" + module + "'");
        }

        long modified = lastModified(path, module);
        Scope cached = moduleScopes.get(path);
        if (cached != null && moduleTimestamps.getOrDefault(path, 0L) >= modified) {
            return cached;
        }

        Program program = parse(path, module, modified);
        Scope moduleScope = new Scope(interpreter.getGlobals());
        Path previousDir = interpreter.getSourceDir();
        loading.add(path);
        interpreter.setSourceDir(path.getParent());
        try {
            LOG.log(Level.FINE, "Executing module {0}", path);
            interpreter.runProgram(program, moduleScope);
            moduleScopes.put(path, moduleScope);
            moduleTimestamps.put(path, modified);
            return moduleScope;
        } catch (RuntimeException e) {
            moduleScopes.remove(path);
            moduleTimestamps.remove(path);
            throw e;
        } finally {
            loading.remove(path);
            interpreter.setSourceDir(previousDir);
        }
    }

    private static long lastModified(Path path, String module) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new LanguageError("Cannot read module '" + module + "': " + e.getMessage(), 0, e);
        }
    }

    private static Program parse(Path path, String module, long modified) {
        String key = path + "@" + modified;
        Program program = PARSED.get(key);
        if (program != null) {
            LOG.log(Level.FINE, "Parsed module cache hit: {0}", path);
            return program;
        }
        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LanguageError("Cannot read module '" + module + "': " + e.getMessage(), 0, e);
        }
        try {
            program = new Parser(new Lexer(source, path.toString())).parse();
        } catch (ParseException e) {
            throw new LanguageError("Syntax error in module '" + module + "': " + e.getMessage(), 0, e);
        }
        PARSED.put(key, program);
        return program;
    }
}
