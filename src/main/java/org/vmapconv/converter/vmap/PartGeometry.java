package org.vmapconv.converter.vmap;

import org.vmapconv.converter.model.Topology;

import java.util.List;

/**
 * 已写出部件的摘要，后续写结果时用于确定部件编号与节点数。
 *
 * @param partId          VMAP 部件编号
 * @param name            部件名称
 * @param topology        拓扑
 * @param elementCount    单元数
 * @param nodeCount       节点数
 * @param materialId      材料编号（未指定为 -1）
 * @param geometrySetNames 写出的几何集合名称
 */
public record PartGeometry(
        int partId,
        String name,
        Topology topology,
        int elementCount,
        int nodeCount,
        int materialId,
        List<String> geometrySetNames
) {
}
