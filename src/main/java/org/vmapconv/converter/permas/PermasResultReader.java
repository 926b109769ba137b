package org.vmapconv.converter.permas;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.ConversionException;
import org.vmapconv.converter.ResultSelection;
import org.vmapconv.converter.hdf.HdfTree;
import org.vmapconv.converter.model.AnalysisInfo;
import org.vmapconv.converter.model.AnalysisKind;
import org.vmapconv.converter.model.ResultColumn;
import org.vmapconv.converter.model.ResultTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 读取 PERMAS-HDF 中的节点结果。
 * <p>
 * 每个变量是 situation 下的一个组，包含：
 * <ul>
 *   <li>{@code .ColDes}：每列对应的时间步或频率；</li>
 *   <li>{@code .RowDes}：每行对应的节点 ID；</li>
 *   <li>{@code Column1..N}：每个时间值一个数据集（行数 = 节点数，列数 = 分量数）。</li>
 * </ul>
 * 请求的变量不存在不是错误（不是每个文件都有所有变量），只记提示；
 * 变量存在但缺少 {@code .Analysis}/{@code .ColDes}/{@code .RowDes}/列数据则无法继续，抛出 {@link ConversionException}。
 */
public final class PermasResultReader {

    private static final Logger log = LoggerFactory.getLogger(PermasResultReader.class);

    private PermasResultReader() {
    }

    /**
     * 按选择范围读取全部变量。分析信息取第一个读到的变量。
     */
    public static ResultReadout read(HdfTree tree, ResultSelection selection, List<String> warnings) {
        if (!selection.readsResults()) {
            log.info("未请求任何结果变量");
            return ResultReadout.empty();
        }
        String situation = PermasHdfLayout.locateSituation(tree, warnings);
        if (situation == null) {
            warnings.add("结果文件中没有 component/situation，不读取结果");
            return ResultReadout.empty();
        }
        Double nodalDiameter = null;
        AnalysisKind kind = null;
        List<ResultColumn> columns = new ArrayList<>();
        for (String variable : selection.variables()) {
            String variablePath = HdfTree.join(situation, variable);
            if (!tree.isGroup(variablePath)) {
                log.info("结果变量 {} 不存在", variable);
                continue;
            }
            AnalysisKind variableKind = readAnalysisKind(tree, situation);
            if (kind == null) {
                kind = variableKind;
                if (kind.isModal()) {
                    nodalDiameter = findNodalDiameter(tree, situation, warnings);
                }
            }
            for (ResultColumn column : readVariable(tree, variablePath, variable)) {
                if (selection.acceptsTemporal(column.temporalValue())) {
                    columns.add(column);
                }
            }
        }
        if (kind == null) {
            return ResultReadout.empty();
        }
        ResultTable table = new ResultTable(columns);
        List<Double> temporalValues = table.temporalValues();
        AnalysisInfo info = AnalysisInfo.of(kind, nodalDiameter, temporalValues);
        log.info("分析类型 {}（状态名 {}），{}：{}", kind.permasName(), info.stateName(),
                kind.category().name().toLowerCase(Locale.ROOT), temporalValues);
        return new ResultReadout(info, table.variableNames(), temporalValues, table);
    }

    /**
     * 读取一个变量组的全部列。
     */
    public static List<ResultColumn> readVariable(HdfTree tree, String variablePath, String variableName) {
        double[] temporal = tree.doubleArray(HdfTree.join(variablePath, PermasHdfLayout.COLUMN_DESCRIPTION));
        if (temporal == null) {
            throw new ConversionException("缺少数据集 " + HdfTree.join(variablePath, PermasHdfLayout.COLUMN_DESCRIPTION));
        }
        int[] nodeIds = tree.intArray(HdfTree.join(variablePath, PermasHdfLayout.ROW_DESCRIPTION));
        if (nodeIds == null) {
            throw new ConversionException("缺少数据集 " + HdfTree.join(variablePath, PermasHdfLayout.ROW_DESCRIPTION));
        }
        List<ResultColumn> columns = new ArrayList<>(temporal.length);
        for (int k = 0; k < temporal.length; k++) {
            String columnPath = HdfTree.join(variablePath, PermasHdfLayout.COLUMN_PREFIX + (k + 1));
            double[][] matrix = tree.doubleMatrix(columnPath);
            if (matrix == null) {
                throw new ConversionException("缺少数据集 " + columnPath);
            }
            if (matrix.length != nodeIds.length) {
                throw new ConversionException(columnPath + " 的行数 " + matrix.length + " 与 .RowDes 的节点数 "
                        + nodeIds.length + " 不一致");
            }
            if (matrix.length == 0) {
                continue;
            }
            int width = matrix[0].length;
            double[] values = new double[matrix.length * width];
            for (int row = 0; row < matrix.length; row++) {
                if (matrix[row].length != width) {
                    throw new ConversionException(columnPath + " 的各行分量数不一致");
                }
                System.arraycopy(matrix[row], 0, values, row * width, width);
            }
            columns.add(new ResultColumn(variableName, temporal[k], nodeIds, width, values));
            log.debug("读取 {}：{} 行 × {} 列", columnPath, matrix.length, width);
        }
        return columns;
    }

    private static AnalysisKind readAnalysisKind(HdfTree tree, String situation) {
        String text = tree.stringValue(HdfTree.join(situation, PermasHdfLayout.ANALYSIS));
        if (text == null) {
            throw new ConversionException("缺少数据集 " + HdfTree.join(situation, PermasHdfLayout.ANALYSIS));
        }
        return AnalysisKind.matchPrefix(text).orElseThrow(() -> new ConversionException(
                "不支持的分析类型 " + text.trim() + "，可用：" + Arrays.stream(AnalysisKind.values())
                        .map(AnalysisKind::permasName).toList()));
    }

    /**
     * 节径模态分析：在同一 situation 的 {@code .Model} 中查找 MNODDIA。没有模型或没有该参数都不是错误。
     */
    private static Double findNodalDiameter(HdfTree tree, String situation, List<String> warnings) {
        String[] lines = tree.stringLines(HdfTree.join(situation, PermasHdfLayout.MODEL));
        if (lines == null) {
            log.info("结果文件中没有 .Model，按普通模态分析处理");
            return null;
        }
        List<String> modelLines = new ArrayList<>();
        for (String line : lines) {
            modelLines.addAll(Arrays.asList(line.split("\\r?\\n")));
        }
        Double value = PermasBlockParsers.findNodalDiameter(modelLines, warnings);
        if (value != null) {
            log.info("找到 MNODDIA = {}", value);
        }
        return value;
    }
}
