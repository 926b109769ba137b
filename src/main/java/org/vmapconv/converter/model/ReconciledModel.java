package org.vmapconv.converter.model;

import java.util.List;
import java.util.Map;

/**
 * 后处理完成的模型：TET10 已置换为 VMAP 顺序，单元集合已分类为部件，引用完整性已校验。
 *
 * @param nodes             节点表
 * @param elements          按拓扑的单元表（TET10 为 VMAP 节点顺序）
 * @param parts             部件（单元集合声明顺序）
 * @param nodeSets          非空节点集合（声明顺序，下标即 VMAP 几何集合编号）
 * @param surfaces          面定义
 * @param surfaceSets       面集合
 * @param materials         材料
 * @param coordinateSystems 参考坐标系
 * @param nodalDiameter     模态分析的节径数（MNODDIA；没有时为 null）
 * @param warnings          解析与后处理过程中的告警
 */
public record ReconciledModel(
        NodeTable nodes,
        Map<Topology, ElementTable> elements,
        List<Part> parts,
        List<NodeSet> nodeSets,
        List<Surface> surfaces,
        List<SurfaceSet> surfaceSets,
        List<Material> materials,
        List<CoordinateSystem> coordinateSystems,
        Double nodalDiameter,
        List<String> warnings
) {
    public ElementTable elementTable(Topology topology) {
        ElementTable table = elements.get(topology);
        return table == null ? ElementTable.empty(topology) : table;
    }
}
