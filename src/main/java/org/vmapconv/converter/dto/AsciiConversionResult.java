package org.vmapconv.converter.dto;

import java.util.List;

/**
 * VMAP → PERMAS ASCII 转换结果。
 *
 * @param inputFile      输入 VMAP 文件
 * @param outputFile     输出 PERMAS ASCII 文件
 * @param nodeCount      节点数
 * @param elementCount   单元数
 * @param elementSets    单元集合（部件）名称
 * @param nodeSets       节点集合名称
 * @param surfaceCount   面数量
 * @param materials      材料名称
 * @param resultStates   VMAP 中的结果状态数（结果不写入 ASCII）
 * @param warnings       告警
 */
public record AsciiConversionResult(
        String inputFile,
        String outputFile,
        int nodeCount,
        int elementCount,
        List<String> elementSets,
        List<String> nodeSets,
        int surfaceCount,
        List<String> materials,
        int resultStates,
        List<String> warnings
) {
}
