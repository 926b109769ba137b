package org.vmapconv.converter.vmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.model.AnalysisInfo;
import org.vmapconv.converter.model.ResultColumn;
import org.vmapconv.converter.model.ResultTable;
import org.vmapconv.converter.reconcile.PartAssignment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 写出状态变量：每个（时间值，部件，变量）一个变量块。
 * <p>
 * 说明：
 * <ul>
 *   <li>每个时间值一个状态 {@code STATE-<i>}，每个（状态，部件）都创建变量组，即使没有数据。</li>
 *   <li>变量编号为变量名称在字母序中的序号。</li>
 *   <li>变量只覆盖部件的部分节点时才写 {@code MYGEOMETRYIDS}。</li>
 *   <li>模态分析中相邻两个频率近似相等（相对差小于容差）时，后一个视为前一个复模态的虚部。
 *       这是根据频率推断的约定，结果文件本身没有实部/虚部标记。</li>
 * </ul>
 */
public final class VariableEmitter {

    private static final Logger log = LoggerFactory.getLogger(VariableEmitter.class);

    private VariableEmitter() {
    }

    /**
     * @return 写出的变量块数量
     */
    public static int emit(ResultTable table, PartAssignment assignment, AnalysisInfo analysis,
                           List<PartGeometry> parts, VmapWriter writer, double pairTolerance, List<String> warnings) {
        List<Double> temporalValues = analysis.temporalValues();
        List<String> variableNames = table.variableNames();
        List<ModeComponent> components = classifyComponents(temporalValues, analysis.isModal(), pairTolerance);

        for (int state = 0; state < temporalValues.size(); state++) {
            double value = temporalValues.get(state);
            writer.setVariableStateInformation(state, analysis.stateName(), value, value, VmapLayout.UNSET);
            for (PartGeometry part : parts) {
                writer.createVariablesGroup(state, part.partId());
            }
        }

        Map<Double, Map<String, Integer>> columnIndex = indexColumns(table, warnings);
        int written = 0;
        for (int state = 0; state < temporalValues.size(); state++) {
            double value = temporalValues.get(state);
            ModeComponent component = components.get(state);
            log.info("{} {}：{}", analysis.isModal() ? "频率" : "时间", value, component.description());
            Map<String, Integer> columnsOfState = columnIndex.getOrDefault(value, Map.of());
            for (int p = 0; p < parts.size(); p++) {
                PartGeometry part = parts.get(p);
                for (int j = 0; j < variableNames.size(); j++) {
                    Integer column = columnsOfState.get(variableNames.get(j));
                    if (column == null) {
                        continue;
                    }
                    StateVariable variable = slice(table.columns().get(column), assignment.rowsOf(column, p),
                            part.nodeCount(), j, component);
                    if (variable == null) {
                        continue;
                    }
                    writer.writeVariable(state, part.partId(), variable);
                    written++;
                    log.debug("写出 STATE-{}/{}/{}：{} 行", state, part.partId(), variable.name(), variable.rowCount());
                }
            }
        }
        return written;
    }

    /**
     * 逐个时间值判断实部/虚部。已配成一对之后重新开始配对，三个近似相等的频率得到 实、虚、实。
     */
    public static List<ModeComponent> classifyComponents(List<Double> temporalValues, boolean modal, double tolerance) {
        List<ModeComponent> result = new ArrayList<>(temporalValues.size());
        for (int i = 0; i < temporalValues.size(); i++) {
            boolean imaginary = modal
                    && i > 0
                    && result.get(i - 1) == ModeComponent.REAL
                    && nearlyEqual(temporalValues.get(i - 1), temporalValues.get(i), tolerance);
            result.add(imaginary ? ModeComponent.IMAGINARY : ModeComponent.REAL);
        }
        return result;
    }

    static boolean nearlyEqual(double previous, double current, double tolerance) {
        double scale = Math.max(Math.abs(previous), Math.abs(current));
        if (scale == 0.0) {
            return true;
        }
        return Math.abs(current - previous) / scale < tolerance;
    }

    private static Map<Double, Map<String, Integer>> indexColumns(ResultTable table, List<String> warnings) {
        Map<Double, Map<String, Integer>> index = new HashMap<>();
        List<ResultColumn> columns = table.columns();
        for (int c = 0; c < columns.size(); c++) {
            ResultColumn column = columns.get(c);
            Integer previous = index.computeIfAbsent(column.temporalValue(), k -> new HashMap<>())
                    .putIfAbsent(column.variableName(), c);
            if (previous != null) {
                warnings.add("变量 " + column.variableName() + " 在 " + column.temporalValue() + " 有重复的列，只写出第一列");
            }
        }
        return index;
    }

    private static StateVariable slice(ResultColumn column, int[] rows, int partNodeCount, int identifier,
                                       ModeComponent component) {
        if (rows.length == 0 || column.width() == 0) {
            return null;
        }
        int width = column.width();
        double[] values = new double[rows.length * width];
        int[] ids = new int[rows.length];
        for (int i = 0; i < rows.length; i++) {
            ids[i] = column.ids()[rows[i]];
            System.arraycopy(column.values(), rows[i] * width, values, i * width, width);
        }
        return new StateVariable(
                column.variableName(),
                component.description(),
                identifier,
                width,
                1,
                component.entity(),
                StateVariable.LOCATION_NODE,
                StateVariable.CARTESIAN,
                values,
                rows.length == partNodeCount ? null : ids);
    }
}
