package org.vmapconv.converter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 各向同性材料。
 *
 * @param name            材料名称
 * @param id              材料编号（声明顺序，从 0 开始）
 * @param modulus         弹性模量（缺失时为 null）
 * @param poisson         泊松比（缺失时为 null）
 * @param density         密度（缺失时为 null）
 * @param extraParameters 其它 {@code GENERAL INPUT = DATA} 单值参数（键为 PERMAS 关键字，声明顺序）
 */
public record Material(
        String name,
        int id,
        Double modulus,
        Double poisson,
        Double density,
        Map<String, Double> extraParameters
) {
    public static final String MODULUS = "modulus";
    public static final String POISSON = "poisson";
    public static final String DENSITY = "density";

    public Material {
        extraParameters = extraParameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraParameters));
    }

    /**
     * 全部已知参数，顺序为 modulus、poisson、density，然后是其它参数。
     */
    public Map<String, Double> parameters() {
        Map<String, Double> result = new LinkedHashMap<>();
        if (modulus != null) {
            result.put(MODULUS, modulus);
        }
        if (poisson != null) {
            result.put(POISSON, poisson);
        }
        if (density != null) {
            result.put(DENSITY, density);
        }
        result.putAll(extraParameters);
        return result;
    }
}
