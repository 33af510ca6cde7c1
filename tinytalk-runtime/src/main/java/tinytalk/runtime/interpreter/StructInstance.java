package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyInstance;

/**
 * 结构体实例（可变，按引用共享）
 */
public final class StructInstance extends TinyInstance {

    private final StructType structType;

    public StructInstance(StructType structType) {
        this.structType = structType;
    }

    public StructType getStructType() {
        return structType;
    }

    @Override
    public String getStructName() {
        return structType.getName();
    }
}
