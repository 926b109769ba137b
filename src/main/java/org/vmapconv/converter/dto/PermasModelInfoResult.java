package org.vmapconv.converter.dto;

import java.util.List;

/**
 * PERMAS-HDF 模型信息（不写出任何文件）。
 *
 * @param file              输入文件
 * @param nodeCount         节点数
 * @param hexe8Count        HEXE8 单元数
 * @param tet10Count        TET10 单元数
 * @param parts             部件
 * @param nodeSets          节点集合名称
 * @param surfaceCount      面数量
 * @param surfaceSets       面集合名称
 * @param materials         材料名称
 * @param coordinateSystems 参考坐标系数量
 * @param analysis          分析类型（文件中没有结果时为空）
 * @param stateName         VMAP 状态名称（文件中没有结果时为空）
 * @param temporalValues    时间步或频率
 * @param variables         结果变量名称
 * @param warnings          告警
 */
public record PermasModelInfoResult(
        String file,
        int nodeCount,
        int hexe8Count,
        int tet10Count,
        List<PartSummary> parts,
        List<String> nodeSets,
        int surfaceCount,
        List<String> surfaceSets,
        List<String> materials,
        int coordinateSystems,
        String analysis,
        String stateName,
        List<Double> temporalValues,
        List<String> variables,
        List<String> warnings
) {
}
