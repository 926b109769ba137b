package org.vmapconv.converter.vmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.hdf.HdfTree;
import org.vmapconv.converter.model.ElementSet;
import org.vmapconv.converter.model.ElementTable;
import org.vmapconv.converter.model.FlatPermasModel;
import org.vmapconv.converter.model.Material;
import org.vmapconv.converter.model.NodeSet;
import org.vmapconv.converter.model.NodeTable;
import org.vmapconv.converter.model.ResultColumn;
import org.vmapconv.converter.model.ResultTable;
import org.vmapconv.converter.model.Surface;
import org.vmapconv.converter.model.SurfaceSet;
import org.vmapconv.converter.model.Tet10Permutation;
import org.vmapconv.converter.model.Topology;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 从 VMAP 文件重建扁平的 PERMAS 模型（反向转换）。
 * <ul>
 *   <li>部件按编号升序读取；各部件的点合并，同一节点 ID 取第一次出现的坐标。</li>
 *   <li>TET10 连接表恢复为 PERMAS 节点顺序；单元表按 ID 排序去重，部件单元集合保持存储顺序。</li>
 *   <li>同名节点集合合并；（单元，面号）对集合按名称中最后一个 {@code _} 拆分为面集合名称与面 ID。</li>
 * </ul>
 */
public final class VmapModelReader {

    private static final Logger log = LoggerFactory.getLogger(VmapModelReader.class);

    private VmapModelReader() {
    }

    public static FlatPermasModel read(HdfTree tree, List<String> warnings) {
        VmapReader reader = new VmapReader(tree);
        Map<Integer, Integer> nodesPerType = reader.elementTypeNodeCounts();

        Map<Integer, double[]> coordinates = new LinkedHashMap<>();
        Map<Topology, TreeMap<Integer, int[]>> elements = new EnumMap<>(Topology.class);
        List<ElementSet> parts = new ArrayList<>();
        Map<String, Integer> partMaterialIds = new LinkedHashMap<>();
        Map<String, List<int[]>> nodeSets = new TreeMap<>();
        Map<String, Surface> surfaces = new LinkedHashMap<>();

        for (int partId : reader.partIds()) {
            String name = reader.partName(partId);
            PointsBlock points = reader.readPointsBlock(partId);
            for (int i = 0; i < points.size(); i++) {
                coordinates.putIfAbsent(points.ids()[i], Arrays.copyOfRange(points.coordinates(), i * 3, i * 3 + 3));
            }

            ElementBlock block = reader.readElementsBlock(partId);
            Topology topology = topologyOf(block, nodesPerType);
            if (topology == null) {
                warnings.add("部件 " + name + " 的单元类型不受支持（每单元 " + block.nodesPerElement() + " 个节点），已跳过其单元");
            } else {
                TreeMap<Integer, int[]> table = elements.computeIfAbsent(topology, k -> new TreeMap<>());
                for (int row = 0; row < block.size(); row++) {
                    int[] connectivity = block.connectivity(row);
                    table.putIfAbsent(block.ids()[row],
                            topology == Topology.TET10 ? Tet10Permutation.toPermas(connectivity) : connectivity);
                }
                parts.add(new ElementSet(name, block.ids()));
                if (block.materialId() != VmapLayout.UNSET) {
                    partMaterialIds.put(name, block.materialId());
                }
            }

            for (GeometrySet set : reader.readGeometrySets(partId)) {
                if (set.isNodeSet()) {
                    nodeSets.computeIfAbsent(set.name(), k -> new ArrayList<>()).add(set.data());
                } else if (set.isElementFaceSet()) {
                    Surface surface = toSurface(set);
                    surfaces.putIfAbsent(surface.surfaceSetName() + "_" + surface.id(), surface);
                } else {
                    warnings.add("部件 " + name + " 的几何集合 " + set.name() + " 类型不受支持，已跳过");
                }
            }
        }

        List<Material> materials = readMaterials(reader, warnings);
        Map<Integer, String> materialNames = new LinkedHashMap<>();
        for (Material material : materials) {
            materialNames.putIfAbsent(material.id(), material.name());
        }
        Map<String, String> partMaterials = new LinkedHashMap<>();
        partMaterialIds.forEach((part, id) -> {
            String material = materialNames.get(id);
            if (material == null) {
                warnings.add("部件 " + part + " 引用了不存在的材料编号 " + id);
            } else {
                partMaterials.put(part, material);
            }
        });

        FlatPermasModel model = new FlatPermasModel(
                toNodeTable(coordinates),
                toElementTables(elements),
                List.copyOf(parts),
                partMaterials,
                mergeNodeSets(nodeSets),
                List.copyOf(surfaces.values()),
                surfaceSets(surfaces.values()),
                materials);
        log.info("VMAP 模型读取完成：部件 {}，节点 {}，节点集合 {}，面 {}，材料 {}",
                parts.size(), model.nodes().size(), model.nodeSets().size(), model.surfaces().size(), materials.size());
        return model;
    }

    /**
     * 读回状态变量。单元位置且每行 60 个值的 TET10 结果（10 个节点 × 6 分量）恢复为 PERMAS 节点顺序。
     * 没有 {@code MYGEOMETRYIDS} 的变量对应部件的全部节点（或单元）。
     */
    public static ResultTable readResults(HdfTree tree, List<String> warnings) {
        VmapReader reader = new VmapReader(tree);
        Map<Integer, Integer> nodesPerType = reader.elementTypeNodeCounts();
        Map<Integer, int[]> pointIds = new LinkedHashMap<>();
        Map<Integer, ElementBlock> elementBlocks = new LinkedHashMap<>();
        for (int partId : reader.partIds()) {
            pointIds.put(partId, reader.readPointsBlock(partId).ids());
            elementBlocks.put(partId, reader.readElementsBlock(partId));
        }

        List<ResultColumn> columns = new ArrayList<>();
        for (int state : reader.stateIds()) {
            StateInfo info = reader.readStateInformation(state);
            for (int partId : reader.statePartIds(state)) {
                for (String name : reader.variableNames(state, partId)) {
                    StateVariable variable = reader.readVariable(state, partId, name);
                    ResultColumn column = toColumn(variable, info, partId, pointIds, elementBlocks, nodesPerType, warnings);
                    if (column != null) {
                        columns.add(column);
                    }
                }
            }
        }
        return new ResultTable(columns);
    }

    private static ResultColumn toColumn(StateVariable variable, StateInfo info, int partId, Map<Integer, int[]> pointIds,
                                         Map<Integer, ElementBlock> elementBlocks, Map<Integer, Integer> nodesPerType,
                                         List<String> warnings) {
        boolean elementLocated = variable.location() == StateVariable.LOCATION_ELEMENT;
        int[] ids = variable.geometryIds();
        if (ids == null) {
            ElementBlock block = elementBlocks.get(partId);
            ids = elementLocated ? (block == null ? null : block.ids()) : pointIds.get(partId);
        }
        int width = variable.width();
        if (ids == null || width == 0 || variable.values().length != ids.length * width) {
            warnings.add("STATE-" + info.index() + "/" + partId + "/" + variable.name() + " 的数据长度与位置数量不一致，已跳过");
            return null;
        }
        double[] values = variable.values();
        ElementBlock block = elementBlocks.get(partId);
        if (elementLocated && width == Tet10Permutation.NODE_COUNT * 6 && block != null
                && topologyOf(block, nodesPerType) == Topology.TET10) {
            values = values.clone();
            for (int row = 0; row < ids.length; row++) {
                double[] reordered = Tet10Permutation.blocksToPermas(Arrays.copyOfRange(values, row * width, row * width + width), 6);
                System.arraycopy(reordered, 0, values, row * width, width);
            }
        }
        return new ResultColumn(variable.name(), info.totalTime(), ids, width, values);
    }

    private static Topology topologyOf(ElementBlock block, Map<Integer, Integer> nodesPerType) {
        Integer declared = nodesPerType.get(block.elementType());
        if (declared != null && declared != block.nodesPerElement()) {
            return null;
        }
        return Topology.fromNodeCount(block.nodesPerElement()).orElse(null);
    }

    private static Surface toSurface(GeometrySet set) {
        String name = set.name();
        int split = name.lastIndexOf('_');
        String setName = name;
        int id = set.identifier();
        if (split > 0) {
            String suffix = name.substring(split + 1);
            if (!suffix.isEmpty() && suffix.chars().allMatch(Character::isDigit)) {
                setName = name.substring(0, split);
                id = Integer.parseInt(suffix);
            }
        }
        return new Surface(id, setName, set.data());
    }

    private static List<Material> readMaterials(VmapReader reader, List<String> warnings) {
        List<Material> result = new ArrayList<>();
        for (VmapReader.MaterialEntry entry : reader.readMaterials()) {
            Double modulus = null;
            Double poisson = null;
            Double density = null;
            Map<String, Double> extra = new LinkedHashMap<>();
            for (Map.Entry<String, String> parameter : entry.parameters().entrySet()) {
                double value;
                try {
                    value = Double.parseDouble(parameter.getValue().trim());
                } catch (NumberFormatException e) {
                    warnings.add("材料 " + entry.name() + " 的参数 " + parameter.getKey() + " 不是数值，已跳过");
                    continue;
                }
                switch (parameter.getKey().toLowerCase(Locale.ROOT)) {
                    case Material.MODULUS -> modulus = value;
                    case Material.POISSON -> poisson = value;
                    case Material.DENSITY -> density = value;
                    default -> extra.put(parameter.getKey().toUpperCase(Locale.ROOT), value);
                }
            }
            result.add(new Material(entry.name(), entry.id(), modulus, poisson, density, extra));
        }
        return result;
    }

    private static NodeTable toNodeTable(Map<Integer, double[]> coordinates) {
        int[] ids = new int[coordinates.size()];
        double[] xyz = new double[coordinates.size() * 3];
        int i = 0;
        for (Map.Entry<Integer, double[]> entry : coordinates.entrySet()) {
            ids[i] = entry.getKey();
            System.arraycopy(entry.getValue(), 0, xyz, i * 3, 3);
            i++;
        }
        return new NodeTable(ids, xyz);
    }

    private static Map<Topology, ElementTable> toElementTables(Map<Topology, TreeMap<Integer, int[]>> elements) {
        Map<Topology, ElementTable> result = new EnumMap<>(Topology.class);
        elements.forEach((topology, rows) -> {
            int width = topology.nodeCount();
            int[] ids = new int[rows.size()];
            int[] connectivity = new int[rows.size() * width];
            int i = 0;
            for (Map.Entry<Integer, int[]> row : rows.entrySet()) {
                ids[i] = row.getKey();
                System.arraycopy(row.getValue(), 0, connectivity, i * width, width);
                i++;
            }
            result.put(topology, new ElementTable(topology, ids, connectivity));
        });
        return result;
    }

    private static List<NodeSet> mergeNodeSets(Map<String, List<int[]>> nodeSets) {
        List<NodeSet> result = new ArrayList<>();
        nodeSets.forEach((name, chunks) -> {
            int[] merged = chunks.stream().flatMapToInt(Arrays::stream).toArray();
            result.add(new NodeSet(name, merged));
        });
        return result;
    }

    private static List<SurfaceSet> surfaceSets(Iterable<Surface> surfaces) {
        Map<String, List<Integer>> members = new LinkedHashMap<>();
        for (Surface surface : surfaces) {
            List<Integer> ids = members.computeIfAbsent(surface.surfaceSetName(), k -> new ArrayList<>());
            if (!ids.contains(surface.id())) {
                ids.add(surface.id());
            }
        }
        List<SurfaceSet> result = new ArrayList<>();
        members.forEach((name, ids) -> result.add(new SurfaceSet(name, ids.stream().mapToInt(Integer::intValue).toArray())));
        return result;
    }
}
