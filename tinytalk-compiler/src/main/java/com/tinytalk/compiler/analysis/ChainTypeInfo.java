package com.tinytalk.compiler.analysis;

import java.util.List;

/**
 * 一条步骤链的推断结果：输入类型、每一步的输出类型、最终类型和诊断
 */
public final class ChainTypeInfo {

    private final TinyType inputType;
    private final List<TinyType> stepTypes;
    private final TinyType outputType;
    private final List<ChainTypeError> errors;

    public ChainTypeInfo(TinyType inputType, List<TinyType> stepTypes,
                         TinyType outputType, List<ChainTypeError> errors) {
        this.inputType = inputType;
        this.stepTypes = stepTypes;
        this.outputType = outputType;
        this.errors = errors;
    }

    public TinyType getInputType() { return inputType; }
    public List<TinyType> getStepTypes() { return stepTypes; }
    public TinyType getOutputType() { return outputType; }
    public List<ChainTypeError> getErrors() { return errors; }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
