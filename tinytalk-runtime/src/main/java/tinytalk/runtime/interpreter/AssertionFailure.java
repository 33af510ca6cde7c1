package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyTalkException;

/**
 * 断言内建函数失败，不是 {@link LanguageError}，try/catch 不会捕获
 */
public class AssertionFailure extends TinyTalkException {

    public AssertionFailure(String message) {
        super(message);
    }
}
