package org.vmapconv.converter.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.ConversionException;
import org.vmapconv.converter.model.ElementSet;
import org.vmapconv.converter.model.ElementTable;
import org.vmapconv.converter.model.NodeSet;
import org.vmapconv.converter.model.NodeTable;
import org.vmapconv.converter.model.Part;
import org.vmapconv.converter.model.ReconciledModel;
import org.vmapconv.converter.model.Surface;
import org.vmapconv.converter.model.Tet10Permutation;
import org.vmapconv.converter.model.Topology;
import org.vmapconv.converter.permas.RawPermasModel;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 模型后处理：把解析出的原始记录整理为可写出的部件模型。
 * <ol>
 *   <li>TET10 连接表置换为 VMAP 节点顺序。</li>
 *   <li>单元集合分类：首个单元在 HEXE8 表中则为 HEXE8 部件，否则在 TET10 表中则为 TET10 部件，
 *       都不在则不是部件（只记提示）。分类后校验全部成员属于同一拓扑。</li>
 *   <li>部件引用的节点必须都在节点表中。</li>
 *   <li>每个面的首个单元必须恰好属于一个部件（不支持跨部件的面）。</li>
 * </ol>
 * 违反 2～4 中的校验属于不可恢复错误，抛出 {@link ConversionException}。
 */
public final class ModelReconciler {

    private static final Logger log = LoggerFactory.getLogger(ModelReconciler.class);

    private ModelReconciler() {
    }

    public static ReconciledModel reconcile(RawPermasModel raw) {
        List<String> warnings = new ArrayList<>(raw.warnings());

        Map<Topology, ElementTable> elements = new EnumMap<>(Topology.class);
        elements.put(Topology.HEXE8, raw.hexe8());
        elements.put(Topology.TET10, raw.tet10().mapConnectivity(Tet10Permutation::toVmap));

        List<Part> parts = new ArrayList<>();
        for (ElementSet set : raw.elementSets()) {
            Topology topology = classify(set, elements);
            if (topology == null) {
                log.info("单元集合 {} 不是部件（不含 HEXE8/TET10 单元），已跳过", set.name());
                continue;
            }
            parts.add(buildPart(set, topology, elements.get(topology), raw.nodes(), raw.elementSetMaterials().get(set.name())));
        }
        if (parts.isEmpty()) {
            warnings.add("模型中没有任何部件（ESET 的首个单元均不是 HEXE8/TET10 单元）");
        }

        List<NodeSet> nodeSets = new ArrayList<>();
        for (NodeSet set : raw.nodeSets()) {
            if (set.isEmpty()) {
                warnings.add("节点集合 " + set.name() + " 为空，已跳过");
            } else {
                nodeSets.add(set);
            }
        }

        verifySurfaces(raw.surfaces(), parts);

        for (Part part : parts) {
            log.debug("部件 {}", part);
        }
        log.info("模型后处理完成：部件 {}，节点集合 {}，面 {}", parts.size(), nodeSets.size(), raw.surfaces().size());
        return new ReconciledModel(
                raw.nodes(),
                elements,
                List.copyOf(parts),
                List.copyOf(nodeSets),
                raw.surfaces(),
                raw.surfaceSets(),
                raw.materials(),
                raw.coordinateSystems(),
                raw.nodalDiameter(),
                List.copyOf(warnings)
        );
    }

    /**
     * 按首个单元判断拓扑，HEXE8 优先。空集合或首个单元不在任何表中返回 null。
     */
    static Topology classify(ElementSet set, Map<Topology, ElementTable> elements) {
        if (set.isEmpty()) {
            return null;
        }
        int first = set.firstElementId();
        for (Topology topology : List.of(Topology.HEXE8, Topology.TET10)) {
            if (elements.get(topology).contains(first)) {
                return topology;
            }
        }
        return null;
    }

    private static Part buildPart(ElementSet set, Topology topology, ElementTable table, NodeTable nodes, String material) {
        int[] elementIds = set.elementIds();
        int[] referenced = new int[elementIds.length * topology.nodeCount()];
        int cursor = 0;
        for (int id : elementIds) {
            int row = table.rowOf(id);
            if (row < 0) {
                throw new ConversionException("部件 " + set.name() + "（" + topology + "）包含不属于该拓扑的单元 " + id
                        + "，不支持混合拓扑的单元集合");
            }
            for (int node : table.connectivity(row)) {
                referenced[cursor++] = node;
            }
        }
        int[] nodeIds = Part.sortedUnique(referenced);
        for (int node : nodeIds) {
            if (!nodes.contains(node)) {
                throw new ConversionException("部件 " + set.name() + " 引用了不存在的节点 " + node);
            }
        }
        return new Part(set.name(), topology, elementIds, nodeIds, material);
    }

    private static void verifySurfaces(List<Surface> surfaces, List<Part> parts) {
        for (Surface surface : surfaces) {
            int owners = 0;
            for (Part part : parts) {
                if (part.containsElement(surface.firstElementId())) {
                    owners++;
                }
            }
            if (owners == 0) {
                throw new ConversionException("面 " + surface.id() + " 的首个单元 " + surface.firstElementId()
                        + " 不属于任何部件");
            }
            if (owners > 1) {
                throw new ConversionException("面 " + surface.id() + " 的首个单元 " + surface.firstElementId()
                        + " 同时属于 " + owners + " 个部件（不支持跨部件的面）");
            }
        }
    }
}
