package tinytalk.runtime.interpreter;

import tinytalk.runtime.EnumVariant;
import tinytalk.runtime.TinyMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 枚举类型：名字加有序的变体表
 */
public final class EnumType {

    private final String name;
    private final Map<String, EnumVariant> variants = new LinkedHashMap<String, EnumVariant>();

    public EnumType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void addVariant(EnumVariant variant) {
        variants.put(variant.getVariantName(), variant);
    }

    public EnumVariant getVariant(String variantName) {
        return variants.get(variantName);
    }

    public Map<String, EnumVariant> getVariants() {
        return Collections.unmodifiableMap(variants);
    }

    /**
     * 绑定到枚举名的值：变体名到变体的映射，{@code Color.Red} 通过成员访问取得
     */
    public TinyMap toMap() {
        TinyMap map = new TinyMap();
        for (EnumVariant v : variants.values()) {
            map.put(v.getVariantName(), v);
        }
        return map;
    }
}
