package com.tinytalk.compiler.analysis;

/**
 * 步骤链类型诊断条目
 */
public final class ChainTypeError {

    private final int stepIndex;
    private final String verb;
    private final String message;
    private final int line;

    public ChainTypeError(int stepIndex, String verb, String message, int line) {
        this.stepIndex = stepIndex;
        this.verb = verb;
        this.message = message;
        this.line = line;
    }

    public int getStepIndex() { return stepIndex; }
    public String getVerb() { return verb; }
    public String getMessage() { return message; }
    public int getLine() { return line; }

    @Override
    public String toString() {
        return line > 0 ? "Line " + line + ": " + message : message;
    }
}
