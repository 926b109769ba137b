package org.vmapconv.converter.model;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * 部件：一个满足条件的单元集合，所有成员属于同一拓扑。
 * <p>
 * 节点 ID 为成员单元引用的全部节点（升序去重），并提供 O(1) 的成员判断。
 */
public final class Part {

    private final String name;
    private final Topology topology;
    private final int[] elementIds;
    private final int[] nodeIds;
    private final String materialName;
    private final Set<Integer> elementIdSet;
    private final Set<Integer> nodeIdSet;

    public Part(String name, Topology topology, int[] elementIds, int[] nodeIds, String materialName) {
        this.name = name;
        this.topology = topology;
        this.elementIds = elementIds.clone();
        this.nodeIds = nodeIds.clone();
        this.materialName = materialName;
        this.elementIdSet = toSet(elementIds);
        this.nodeIdSet = toSet(nodeIds);
    }

    public String name() {
        return name;
    }

    public Topology topology() {
        return topology;
    }

    public int[] elementIds() {
        return elementIds.clone();
    }

    public int[] nodeIds() {
        return nodeIds.clone();
    }

    public int elementCount() {
        return elementIds.length;
    }

    public int nodeCount() {
        return nodeIds.length;
    }

    /**
     * @return 材料名称；未通过 {@code $ELPROP} 指定时为 null
     */
    public String materialName() {
        return materialName;
    }

    public boolean containsElement(int id) {
        return elementIdSet.contains(id);
    }

    public boolean containsNode(int id) {
        return nodeIdSet.contains(id);
    }

    private static Set<Integer> toSet(int[] ids) {
        Set<Integer> set = new HashSet<>(ids.length * 2);
        for (int id : ids) {
            set.add(id);
        }
        return set;
    }

    @Override
    public String toString() {
        return "Part{" + name + ", " + topology + ", elements=" + elementIds.length
                + ", nodes=" + nodeIds.length + ", first=" + (elementIds.length > 0 ? elementIds[0] : "-") + "}";
    }

    /**
     * 升序去重。
     */
    public static int[] sortedUnique(int[] values) {
        return Arrays.stream(values).sorted().distinct().toArray();
    }
}
