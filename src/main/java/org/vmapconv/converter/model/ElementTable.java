package org.vmapconv.converter.model;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 单一拓扑的单元表：单元 ID 与定长连接表（行优先扁平存储）。
 */
public final class ElementTable {

    private final Topology topology;
    private final int[] ids;
    private final int[] connectivity;
    private final Map<Integer, Integer> rowById;

    public ElementTable(Topology topology, int[] ids, int[] connectivity) {
        if (connectivity.length != ids.length * topology.nodeCount()) {
            throw new IllegalArgumentException(topology + " 连接表长度与单元数量不匹配");
        }
        this.topology = topology;
        this.ids = ids.clone();
        this.connectivity = connectivity.clone();
        this.rowById = new HashMap<>(ids.length * 2);
        for (int row = 0; row < ids.length; row++) {
            rowById.putIfAbsent(ids[row], row);
        }
    }

    public static ElementTable empty(Topology topology) {
        return new ElementTable(topology, new int[0], new int[0]);
    }

    public Topology topology() {
        return topology;
    }

    public int size() {
        return ids.length;
    }

    public boolean isEmpty() {
        return ids.length == 0;
    }

    public int id(int row) {
        return ids[row];
    }

    public int[] ids() {
        return ids.clone();
    }

    public int[] connectivity(int row) {
        int width = topology.nodeCount();
        return Arrays.copyOfRange(connectivity, row * width, row * width + width);
    }

    public int rowOf(int id) {
        Integer row = rowById.get(id);
        return row == null ? -1 : row;
    }

    public boolean contains(int id) {
        return rowById.containsKey(id);
    }

    /**
     * 逐行变换连接表，返回新表（原表不变）。
     */
    public ElementTable mapConnectivity(UnaryOperator<int[]> mapping) {
        int width = topology.nodeCount();
        int[] mapped = new int[connectivity.length];
        for (int row = 0; row < ids.length; row++) {
            int[] next = mapping.apply(connectivity(row));
            System.arraycopy(next, 0, mapped, row * width, width);
        }
        return new ElementTable(topology, ids, mapped);
    }
}
