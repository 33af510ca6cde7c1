package tinytalk.runtime.interpreter.step;

import com.tinytalk.compiler.lexer.Lexer;
import tinytalk.runtime.ExecutionContext;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.LanguageError;
import tinytalk.runtime.interpreter.Suggestions;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 步骤链执行引擎：把一个值依次送过 {@code _verb(args)}
 *
 * <p>参数已在调用方求值；回调通过 {@link ExecutionContext#invoke} 回到解释器，
 * 因此受同一套执行计量约束。</p>
 */
public final class StepChainEngine {

    private static final Logger LOG = Logger.getLogger(StepChainEngine.class.getName());

    private final ExecutionContext ctx;

    public StepChainEngine(ExecutionContext ctx) {
        this.ctx = ctx;
    }

    /**
     * 对数据应用单个步骤
     *
     * @param data 上一步的结果
     * @param verb 动词（可以是别名）
     * @param args 已求值的参数
     * @return 步骤结果
     * @throws LanguageError 未知动词、形状不符或参数错误
     */
    public TinyValue apply(TinyValue data, String verb, List<TinyValue> args) {
        StepVerb step = StepVerb.lookup(verb);
        if (step == null) {
            throw new LanguageError(unknownStep(verb));
        }
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("step " + step + " on " + data.getTypeName() + " with " + args.size() + " arg(s)");
        }
        StepArgs stepArgs = new StepArgs(ctx, step, args);

        if (step.getInput() == StepVerb.Input.MAP) {
            stepArgs.function(0);
            if (!data.isMap()) {
                throw new LanguageError(mismatch(step, data));
            }
            return RelationalSteps.mapValues((TinyMap) data, stepArgs);
        }
        if (step.getInput() == StepVerb.Input.LIST_OR_GROUPED && data.isMap()) {
            return RelationalSteps.summarizeGroups((TinyMap) data, stepArgs);
        }

        TinyList source;
        if (data.isList()) {
            source = (TinyList) data;
        } else if (data.isString()) {
            source = ((TinyString) data).chars();
        } else {
            throw new LanguageError(mismatch(step, data));
        }
        return dispatch(step, source, stepArgs);
    }

    private TinyValue dispatch(StepVerb step, TinyList source, StepArgs args) {
        List<TinyValue> items = source.getElements();
        switch (step) {
            case FILTER:     return ListSteps.filter(items, args);
            case SORT:       return ListSteps.sort(items, args);
            case MAP:        return ListSteps.map(items, args);
            case TAKE:       return ListSteps.take(items, args);
            case DROP:       return ListSteps.drop(items, args);
            case FIRST:      return ListSteps.first(items);
            case LAST:       return ListSteps.last(items);
            case REVERSE:    return ListSteps.reverse(items);
            case UNIQUE:     return ListSteps.unique(items);
            case COUNT:      return ListSteps.count(items, args);
            case SUM:        return ListSteps.sum(items);
            case AVG:        return ListSteps.avg(items);
            case MIN:        return ListSteps.min(items);
            case MAX:        return ListSteps.max(items);
            case GROUP:
            case GROUP_BY:   return RelationalSteps.group(items, args);
            case FLATTEN:    return ListSteps.flatten(items);
            case ZIP:        return ListSteps.zip(items, args);
            case CHUNK:      return ListSteps.chunk(items, args);
            case REDUCE:     return ListSteps.reduce(items, args);
            case SORT_BY:    return ListSteps.sortBy(items, args);
            case JOIN:       return RelationalSteps.join(items, args, false);
            case LEFT_JOIN:  return RelationalSteps.join(items, args, true);
            case EACH:       return ListSteps.each(source, args);
            case SELECT:     return RelationalSteps.select(items, args);
            case MUTATE:     return RelationalSteps.mutate(items, args);
            case SUMMARIZE:  return RelationalSteps.summarize(source, args);
            case RENAME:     return RelationalSteps.rename(items, args);
            case ARRANGE:    return RelationalSteps.arrange(items, args);
            case DISTINCT:   return RelationalSteps.distinct(items, args);
            case SLICE:      return ListSteps.slice(items, args);
            case PULL:       return RelationalSteps.pull(items, args);
            case PIVOT:      return ReshapeSteps.pivot(items, args);
            case UNPIVOT:    return ReshapeSteps.unpivot(items, args);
            case WINDOW:     return ListSteps.window(items, args);
            default:
                throw new LanguageError(unknownStep(step.getVerb()));
        }
    }

    static String unknownStep(String verb) {
        String message = "Unknown step '" + verb + "'";
        String suggestion = Suggestions.closest(verb, Lexer.getStepVerbs());
        if (suggestion != null) {
            message += ". Did you mean '" + suggestion + "'?";
        }
        return message;
    }

    /**
     * 输入形状不符时的提示
     */
    static String mismatch(StepVerb step, TinyValue data) {
        String verb = step.getVerb();
        String actual = data.getTypeName();
        switch (step.getInput()) {
            case MAP: {
                String message = "'" + verb + "' works on maps. You have a " + actual;
                if (data.isList()) {
                    message += " — try converting to a map first with _group, or use _map instead.";
                }
                return message;
            }
            case LIST:
            case LIST_OR_GROUPED: {
                String message = "'" + verb + "' works on lists. You have a " + actual;
                if (data.isMap()) {
                    message += " — try keys(data) " + verb + " or values(data) " + verb + ".";
                } else if (data.isString()) {
                    message += " — try data.chars " + verb + " or data.words " + verb + ".";
                }
                return message;
            }
            default:
                return "Step '" + verb + "' requires a list, got " + actual;
        }
    }
}
