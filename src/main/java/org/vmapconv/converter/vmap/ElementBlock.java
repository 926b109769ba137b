package org.vmapconv.converter.vmap;

/**
 * 部件的单元块（单一拓扑）。
 *
 * @param ids              单元 ID（单元集合声明顺序）
 * @param elementType      VMAP 单元类型编号
 * @param nodesPerElement  每单元节点数
 * @param connectivity     连接表（ids.length × nodesPerElement，行优先，VMAP 节点顺序）
 * @param materialId       材料编号（未指定时为 {@link VmapLayout#UNSET}）
 * @param coordinateSystem 坐标系编号（{@link VmapLayout#UNSET}）
 */
public record ElementBlock(
        int[] ids,
        int elementType,
        int nodesPerElement,
        int[] connectivity,
        int materialId,
        int coordinateSystem
) {
    public int size() {
        return ids.length;
    }

    public int[] connectivity(int row) {
        int[] result = new int[nodesPerElement];
        System.arraycopy(connectivity, row * nodesPerElement, result, 0, nodesPerElement);
        return result;
    }
}
