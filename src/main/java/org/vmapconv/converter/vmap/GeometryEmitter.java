package org.vmapconv.converter.vmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.model.ElementTable;
import org.vmapconv.converter.model.Material;
import org.vmapconv.converter.model.NodeSet;
import org.vmapconv.converter.model.NodeTable;
import org.vmapconv.converter.model.Part;
import org.vmapconv.converter.model.ReconciledModel;
import org.vmapconv.converter.model.Surface;
import org.vmapconv.converter.model.SurfaceSet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 逐部件写出几何：单元块、点块与几何集合。
 * <ul>
 *   <li>单元块保持单元集合中的声明顺序；点块为部件引用的节点（升序）。</li>
 *   <li>首个成员属于该部件的节点集合写为节点几何集合，编号为节点集合的序号。</li>
 *   <li>首个单元属于该部件的面，对每个包含它的面集合写一个（单元，面号）对集合，名称为 {@code <sfset>_<surfid>}。</li>
 * </ul>
 */
public final class GeometryEmitter {

    private static final Logger log = LoggerFactory.getLogger(GeometryEmitter.class);

    private GeometryEmitter() {
    }

    public static List<PartGeometry> emit(ReconciledModel model, VmapWriter writer, List<String> warnings) {
        Map<String, Integer> materialIds = new HashMap<>();
        for (Material material : model.materials()) {
            materialIds.putIfAbsent(material.name(), material.id());
        }
        Map<Integer, List<String>> surfaceSetsBySurface = new HashMap<>();
        for (SurfaceSet set : model.surfaceSets()) {
            for (int id : set.surfaceIds()) {
                surfaceSetsBySurface.computeIfAbsent(id, k -> new ArrayList<>()).add(set.name());
            }
        }

        List<PartGeometry> result = new ArrayList<>();
        List<Part> parts = model.parts();
        for (int partId = 0; partId < parts.size(); partId++) {
            result.add(emitPart(partId, parts.get(partId), model, materialIds, surfaceSetsBySurface, writer, warnings));
        }
        return result;
    }

    private static PartGeometry emitPart(int partId, Part part, ReconciledModel model, Map<String, Integer> materialIds,
                                         Map<Integer, List<String>> surfaceSetsBySurface, VmapWriter writer,
                                         List<String> warnings) {
        log.info("部件 {}：{}，单元 {}，节点 {}", part.name(), part.topology(), part.elementCount(), part.nodeCount());
        writer.createGeometryGroup(partId, part.name());

        int materialId = resolveMaterial(part, materialIds, warnings);
        writer.writeElementsBlock(partId, elementBlock(part, model.elementTable(part.topology()), materialId));
        writer.writePointsBlock(partId, pointsBlock(part, model.nodes()));

        List<GeometrySet> sets = new ArrayList<>();
        List<NodeSet> nodeSets = model.nodeSets();
        for (int k = 0; k < nodeSets.size(); k++) {
            NodeSet set = nodeSets.get(k);
            if (part.containsNode(set.firstNodeId())) {
                sets.add(GeometrySet.nodes(set.name(), k, set.nodeIds()));
            }
        }
        for (Surface surface : model.surfaces()) {
            if (!part.containsElement(surface.firstElementId())) {
                continue;
            }
            List<String> owners = surfaceSetsBySurface.get(surface.id());
            if (owners == null) {
                warnings.add("面 " + surface.id() + " 不属于任何面集合，未写出");
                continue;
            }
            for (String owner : owners) {
                sets.add(GeometrySet.elementFaces(owner + "_" + surface.id(), surface.id(), surface.pairs()));
            }
        }
        if (!sets.isEmpty()) {
            writer.writeGeometrySets(partId, sets);
        }
        return new PartGeometry(partId, part.name(), part.topology(), part.elementCount(), part.nodeCount(), materialId,
                sets.stream().map(GeometrySet::name).toList());
    }

    private static int resolveMaterial(Part part, Map<String, Integer> materialIds, List<String> warnings) {
        Integer id = part.materialName() == null ? null : materialIds.get(part.materialName());
        if (id == null) {
            warnings.add("部件 " + part.name() + " 没有可用的材料定义，材料编号记为 -1");
            return VmapLayout.UNSET;
        }
        return id;
    }

    static ElementBlock elementBlock(Part part, ElementTable table, int materialId) {
        int[] ids = part.elementIds();
        int width = part.topology().nodeCount();
        int[] connectivity = new int[ids.length * width];
        for (int i = 0; i < ids.length; i++) {
            System.arraycopy(table.connectivity(table.rowOf(ids[i])), 0, connectivity, i * width, width);
        }
        return new ElementBlock(ids, part.topology().vmapTypeId(), width, connectivity, materialId, VmapLayout.UNSET);
    }

    static PointsBlock pointsBlock(Part part, NodeTable nodes) {
        int[] ids = part.nodeIds();
        double[] coordinates = new double[ids.length * 3];
        for (int i = 0; i < ids.length; i++) {
            System.arraycopy(nodes.coordinates(nodes.rowOf(ids[i])), 0, coordinates, i * 3, 3);
        }
        return new PointsBlock(ids, coordinates);
    }
}
