package org.vmapconv.converter.model;

import java.util.List;

/**
 * 结果文件的分析信息。
 *
 * @param kind           分析类型
 * @param stateName      VMAP 状态名称（节径模态分析为 {@code NODDIA_<值>}）
 * @param nodalDiameter  节径数（仅模态分析且模型含 MNODDIA 时非空）
 * @param temporalValues 升序去重后的时间步或频率
 */
public record AnalysisInfo(
        AnalysisKind kind,
        String stateName,
        Double nodalDiameter,
        List<Double> temporalValues
) {
    public static final String NODAL_DIAMETER_PREFIX = "NODDIA_";

    public static AnalysisInfo of(AnalysisKind kind, Double nodalDiameter, List<Double> temporalValues) {
        String stateName = (kind.isModal() && nodalDiameter != null)
                ? NODAL_DIAMETER_PREFIX + nodalDiameter
                : kind.stateName();
        return new AnalysisInfo(kind, stateName, kind.isModal() ? nodalDiameter : null, List.copyOf(temporalValues));
    }

    public boolean isModal() {
        return kind.isModal();
    }
}
