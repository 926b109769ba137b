package org.vmapconv.converter.model;

import java.util.List;
import java.util.Map;

/**
 * 从 VMAP 文件重建的扁平 PERMAS 模型，用于生成 PERMAS ASCII 输入。
 *
 * @param nodes          节点表（按 ID 去重）
 * @param elements       按拓扑的单元表（PERMAS 节点顺序）
 * @param parts          部件对应的单元集合
 * @param partMaterials  部件名称到材料名称（只包含能识别材料的部件）
 * @param nodeSets       节点集合（按名称排序）
 * @param surfaces       面定义
 * @param surfaceSets    面集合
 * @param materials      材料
 */
public record FlatPermasModel(
        NodeTable nodes,
        Map<Topology, ElementTable> elements,
        List<ElementSet> parts,
        Map<String, String> partMaterials,
        List<NodeSet> nodeSets,
        List<Surface> surfaces,
        List<SurfaceSet> surfaceSets,
        List<Material> materials
) {
    public ElementTable elementTable(Topology topology) {
        ElementTable table = elements.get(topology);
        return table == null ? ElementTable.empty(topology) : table;
    }
}
