package org.vmapconv.converter.reconcile;

import org.vmapconv.converter.model.Part;

import java.util.ArrayList;
import java.util.List;

/**
 * 结果行到部件的归属：与 {@code ResultTable.columns()} 一一对应，每列每行一个部件下标。
 */
public final class PartAssignment {

    private final List<Part> parts;
    private final List<int[]> partIndexByColumn;

    PartAssignment(List<Part> parts, List<int[]> partIndexByColumn) {
        this.parts = List.copyOf(parts);
        this.partIndexByColumn = List.copyOf(partIndexByColumn);
    }

    public List<Part> parts() {
        return parts;
    }

    public int partIndex(int column, int row) {
        return partIndexByColumn.get(column)[row];
    }

    public String partName(int column, int row) {
        return parts.get(partIndex(column, row)).name();
    }

    /**
     * 某列中属于指定部件的行号（升序）。
     */
    public int[] rowsOf(int column, int partIndex) {
        int[] indices = partIndexByColumn.get(column);
        List<Integer> rows = new ArrayList<>();
        for (int row = 0; row < indices.length; row++) {
            if (indices[row] == partIndex) {
                rows.add(row);
            }
        }
        return rows.stream().mapToInt(Integer::intValue).toArray();
    }
}
