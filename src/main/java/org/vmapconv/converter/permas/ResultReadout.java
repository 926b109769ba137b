package org.vmapconv.converter.permas;

import org.vmapconv.converter.model.AnalysisInfo;
import org.vmapconv.converter.model.ResultTable;

import java.util.List;

/**
 * 结果读取的输出。
 *
 * @param analysis       分析信息（没有读到任何变量时为 null）
 * @param variableNames  实际读到的变量名称（字母序）
 * @param temporalValues 实际读到的时间值（升序去重）
 * @param table          结果长表
 */
public record ResultReadout(
        AnalysisInfo analysis,
        List<String> variableNames,
        List<Double> temporalValues,
        ResultTable table
) {
    public static ResultReadout empty() {
        return new ResultReadout(null, List.of(), List.of(), ResultTable.empty());
    }

    public boolean isEmpty() {
        return table.isEmpty() || analysis == null;
    }
}
