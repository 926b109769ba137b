package org.vmapconv.converter.permas;

import org.vmapconv.converter.model.CoordinateSystem;
import org.vmapconv.converter.model.ElementSet;
import org.vmapconv.converter.model.ElementTable;
import org.vmapconv.converter.model.Material;
import org.vmapconv.converter.model.NodeSet;
import org.vmapconv.converter.model.NodeTable;
import org.vmapconv.converter.model.Surface;
import org.vmapconv.converter.model.SurfaceSet;

import java.util.List;
import java.util.Map;

/**
 * PERMAS 模型文本的解析结果（尚未后处理：TET10 仍为 PERMAS 节点顺序，单元集合尚未分类）。
 *
 * @param nodes               节点表
 * @param hexe8               HEXE8 单元表
 * @param tet10               TET10 单元表（PERMAS 节点顺序）
 * @param elementSets         单元集合（声明顺序，已展平）
 * @param nodeSets            节点集合
 * @param surfaces            面定义
 * @param surfaceSets         面集合
 * @param materials           材料
 * @param elementSetMaterials 单元集合名称到材料名称（来自 {@code $ELPROP}）
 * @param coordinateSystems   参考坐标系
 * @param nodalDiameter       MNODDIA 参数（没有时为 null）
 * @param positions           复杂块位置
 * @param warnings            解析告警
 */
public record RawPermasModel(
        NodeTable nodes,
        ElementTable hexe8,
        ElementTable tet10,
        List<ElementSet> elementSets,
        List<NodeSet> nodeSets,
        List<Surface> surfaces,
        List<SurfaceSet> surfaceSets,
        List<Material> materials,
        Map<String, String> elementSetMaterials,
        List<CoordinateSystem> coordinateSystems,
        Double nodalDiameter,
        BlockPositions positions,
        List<String> warnings
) {
}
