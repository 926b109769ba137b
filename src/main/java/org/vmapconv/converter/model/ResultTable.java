package org.vmapconv.converter.model;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * 结果长表：由若干 {@link ResultColumn} 组成，逻辑上每行是一个（节点，时间值，变量）。
 * <p>
 * 按块存储避免逐行装箱。
 */
public final class ResultTable {

    private static final ResultTable EMPTY = new ResultTable(List.of());

    private final List<ResultColumn> columns;

    public ResultTable(List<ResultColumn> columns) {
        this.columns = List.copyOf(columns);
    }

    public static ResultTable empty() {
        return EMPTY;
    }

    public List<ResultColumn> columns() {
        return columns;
    }

    public boolean isEmpty() {
        return rowCount() == 0;
    }

    public int rowCount() {
        int count = 0;
        for (ResultColumn column : columns) {
            count += column.rowCount();
        }
        return count;
    }

    /**
     * 出现过的变量名称（字母序）。
     */
    public List<String> variableNames() {
        TreeSet<String> names = new TreeSet<>();
        for (ResultColumn column : columns) {
            if (column.rowCount() > 0) {
                names.add(column.variableName());
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * 出现过的时间值（升序去重）。
     */
    public List<Double> temporalValues() {
        TreeSet<Double> values = new TreeSet<>();
        for (ResultColumn column : columns) {
            if (column.rowCount() > 0) {
                values.add(column.temporalValue());
            }
        }
        return new ArrayList<>(values);
    }
}
