package org.vmapconv.converter.dto;

import java.util.List;

/**
 * PERMAS-HDF → VMAP 转换结果。
 *
 * @param modelFile      模型输入文件
 * @param resultsFile    结果输入文件（与模型相同时也会给出）
 * @param outputFile     输出 VMAP 文件
 * @param parts          写出的部件
 * @param analysis       分析类型（没有结果时为空）
 * @param stateName      VMAP 状态名称（没有结果时为空）
 * @param temporalValues 写出的时间步或频率
 * @param variables      写出的变量名称
 * @param variableBlocks 写出的变量块数量
 * @param warnings       告警（可恢复的问题）
 */
public record VmapConversionResult(
        String modelFile,
        String resultsFile,
        String outputFile,
        List<PartSummary> parts,
        String analysis,
        String stateName,
        List<Double> temporalValues,
        List<String> variables,
        int variableBlocks,
        List<String> warnings
) {
}
