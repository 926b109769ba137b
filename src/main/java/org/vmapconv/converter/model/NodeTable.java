package org.vmapconv.converter.model;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * 节点表：节点 ID 与三维坐标，按声明顺序保存，并提供 ID 到行号的索引。
 * <p>
 * 重复 ID 只索引第一次出现的行。
 */
public final class NodeTable {

    private final int[] ids;
    private final double[] coordinates;
    private final Map<Integer, Integer> rowById;

    public NodeTable(int[] ids, double[] coordinates) {
        if (coordinates.length != ids.length * 3) {
            throw new IllegalArgumentException("坐标数量与节点数量不匹配：" + ids.length + " 个节点，" + coordinates.length + " 个坐标值");
        }
        this.ids = ids.clone();
        this.coordinates = coordinates.clone();
        this.rowById = new HashMap<>(ids.length * 2);
        for (int row = 0; row < ids.length; row++) {
            rowById.putIfAbsent(ids[row], row);
        }
    }

    public static NodeTable empty() {
        return new NodeTable(new int[0], new double[0]);
    }

    public int size() {
        return ids.length;
    }

    public int id(int row) {
        return ids[row];
    }

    public int[] ids() {
        return ids.clone();
    }

    public double[] coordinates(int row) {
        return Arrays.copyOfRange(coordinates, row * 3, row * 3 + 3);
    }

    /**
     * @return 行号；不存在时返回 -1
     */
    public int rowOf(int id) {
        Integer row = rowById.get(id);
        return row == null ? -1 : row;
    }

    public boolean contains(int id) {
        return rowById.containsKey(id);
    }
}
