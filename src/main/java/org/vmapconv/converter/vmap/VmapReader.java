package org.vmapconv.converter.vmap;

import org.vmapconv.converter.ConversionException;
import org.vmapconv.converter.hdf.HdfTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.vmapconv.converter.vmap.VmapLayout.A_COORDINATE_SYSTEM;
import static org.vmapconv.converter.vmap.VmapLayout.A_DIMENSION;
import static org.vmapconv.converter.vmap.VmapLayout.A_ENTITY;
import static org.vmapconv.converter.vmap.VmapLayout.A_IDENTIFIER;
import static org.vmapconv.converter.vmap.VmapLayout.A_INCREMENT_VALUE;
import static org.vmapconv.converter.vmap.VmapLayout.A_LOCATION;
import static org.vmapconv.converter.vmap.VmapLayout.A_MATERIAL_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_MULTIPLICITY;
import static org.vmapconv.converter.vmap.VmapLayout.A_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_NUMBER_OF_NODES;
import static org.vmapconv.converter.vmap.VmapLayout.A_SET_INDEX_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.A_SET_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_SET_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.A_STATE_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_STEP_TIME;
import static org.vmapconv.converter.vmap.VmapLayout.A_TOTAL_TIME;
import static org.vmapconv.converter.vmap.VmapLayout.A_VALUE;
import static org.vmapconv.converter.vmap.VmapLayout.A_VARIABLE_DESCRIPTION;
import static org.vmapconv.converter.vmap.VmapLayout.A_VARIABLE_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.D_CONNECTIVITY;
import static org.vmapconv.converter.vmap.VmapLayout.D_COORDINATES;
import static org.vmapconv.converter.vmap.VmapLayout.D_COORDINATE_SYSTEM;
import static org.vmapconv.converter.vmap.VmapLayout.D_ELEMENT_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.D_GEOMETRY_IDS;
import static org.vmapconv.converter.vmap.VmapLayout.D_GEOMETRY_SET_DATA;
import static org.vmapconv.converter.vmap.VmapLayout.D_IDENTIFIERS;
import static org.vmapconv.converter.vmap.VmapLayout.D_MATERIAL_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.D_VALUES;
import static org.vmapconv.converter.vmap.VmapLayout.ELEMENTS;
import static org.vmapconv.converter.vmap.VmapLayout.ELEMENT_TYPES;
import static org.vmapconv.converter.vmap.VmapLayout.GEOMETRY;
import static org.vmapconv.converter.vmap.VmapLayout.GEOMETRY_SETS;
import static org.vmapconv.converter.vmap.VmapLayout.MATERIAL;
import static org.vmapconv.converter.vmap.VmapLayout.MATERIAL_CARD;
import static org.vmapconv.converter.vmap.VmapLayout.PARAMETERS;
import static org.vmapconv.converter.vmap.VmapLayout.POINTS;
import static org.vmapconv.converter.vmap.VmapLayout.ROOT;
import static org.vmapconv.converter.vmap.VmapLayout.UNSET;
import static org.vmapconv.converter.vmap.VmapLayout.VARIABLES;
import static org.vmapconv.converter.vmap.VmapLayout.part;
import static org.vmapconv.converter.vmap.VmapLayout.stateIndex;
import static org.vmapconv.converter.vmap.VmapLayout.stateVariables;

/**
 * VMAP 读取原语：与 {@link VmapWriter} 对称。
 * <p>
 * 部件与状态按数字编号升序返回，与组的存储顺序无关。
 */
public final class VmapReader {

    private final HdfTree tree;

    public VmapReader(HdfTree tree) {
        if (!tree.isGroup(ROOT)) {
            throw new ConversionException("不是 VMAP 文件：缺少 " + ROOT + " 组");
        }
        this.tree = tree;
    }

    public List<Integer> partIds() {
        return numericChildren(GEOMETRY);
    }

    public String partName(int partId) {
        String name = tree.stringAttribute(part(partId), A_NAME);
        return name == null ? "PART_" + partId : name;
    }

    public PointsBlock readPointsBlock(int partId) {
        String path = HdfTree.join(part(partId), POINTS);
        int[] ids = require(tree.intArray(HdfTree.join(path, D_IDENTIFIERS)), path, D_IDENTIFIERS);
        double[][] coordinates = require(tree.doubleMatrix(HdfTree.join(path, D_COORDINATES)), path, D_COORDINATES);
        if (coordinates.length != ids.length) {
            throw new ConversionException(path + " 的坐标行数与节点数不一致");
        }
        double[] flat = new double[ids.length * 3];
        for (int row = 0; row < ids.length; row++) {
            if (coordinates[row].length < 3) {
                throw new ConversionException(path + " 的坐标不足 3 个分量");
            }
            System.arraycopy(coordinates[row], 0, flat, row * 3, 3);
        }
        return new PointsBlock(ids, flat);
    }

    public ElementBlock readElementsBlock(int partId) {
        String path = HdfTree.join(part(partId), ELEMENTS);
        int[] ids = require(tree.intArray(HdfTree.join(path, D_IDENTIFIERS)), path, D_IDENTIFIERS);
        int[][] connectivity = require(tree.intMatrix(HdfTree.join(path, D_CONNECTIVITY)), path, D_CONNECTIVITY);
        int[] types = tree.intArray(HdfTree.join(path, D_ELEMENT_TYPE));
        int[] materials = tree.intArray(HdfTree.join(path, D_MATERIAL_TYPE));
        int[] systems = tree.intArray(HdfTree.join(path, D_COORDINATE_SYSTEM));
        if (connectivity.length != ids.length) {
            throw new ConversionException(path + " 的连接表行数与单元数不一致");
        }
        int width = connectivity.length == 0 ? 0 : connectivity[0].length;
        int[] flat = new int[ids.length * width];
        for (int row = 0; row < ids.length; row++) {
            if (connectivity[row].length != width) {
                throw new ConversionException(path + " 包含不同节点数的单元");
            }
            System.arraycopy(connectivity[row], 0, flat, row * width, width);
        }
        return new ElementBlock(ids,
                first(types, UNSET),
                width,
                flat,
                first(materials, UNSET),
                first(systems, UNSET));
    }

    public List<GeometrySet> readGeometrySets(int partId) {
        String base = HdfTree.join(part(partId), GEOMETRY_SETS);
        List<GeometrySet> result = new ArrayList<>();
        for (int index : numericChildren(base)) {
            String path = HdfTree.join(base, index);
            int[] data = tree.intArray(HdfTree.join(path, D_GEOMETRY_SET_DATA));
            Integer identifier = tree.intAttribute(path, A_IDENTIFIER);
            Integer setType = tree.intAttribute(path, A_SET_TYPE);
            Integer indexType = tree.intAttribute(path, A_SET_INDEX_TYPE);
            String name = tree.stringAttribute(path, A_SET_NAME);
            result.add(new GeometrySet(
                    name == null ? "SET_" + index : name,
                    identifier == null ? index : identifier,
                    setType == null ? GeometrySet.NODE_LOCATION : setType,
                    indexType == null ? GeometrySet.SINGLE_INDEX : indexType,
                    data == null ? new int[0] : data));
        }
        return result;
    }

    /**
     * 单元类型编号到每单元节点数。
     */
    public Map<Integer, Integer> elementTypeNodeCounts() {
        Map<Integer, Integer> result = new LinkedHashMap<>();
        for (int index : numericChildren(ELEMENT_TYPES)) {
            String path = HdfTree.join(ELEMENT_TYPES, index);
            Integer id = tree.intAttribute(path, A_IDENTIFIER);
            Integer nodes = tree.intAttribute(path, A_NUMBER_OF_NODES);
            if (nodes != null) {
                result.put(id == null ? index : id, nodes);
            }
        }
        return result;
    }

    /**
     * 材料组：编号、名称与参数（参数值保持文本）。
     */
    public List<MaterialEntry> readMaterials() {
        List<MaterialEntry> result = new ArrayList<>();
        for (int index : numericChildren(MATERIAL)) {
            String path = HdfTree.join(MATERIAL, index);
            Integer id = tree.intAttribute(path, A_IDENTIFIER);
            String name = tree.stringAttribute(path, A_MATERIAL_NAME);
            Map<String, String> parameters = new LinkedHashMap<>();
            String parameterBase = HdfTree.join(HdfTree.join(path, MATERIAL_CARD), PARAMETERS);
            for (String child : tree.childNames(parameterBase)) {
                String node = HdfTree.join(parameterBase, child);
                String parameterName = tree.stringAttribute(node, A_NAME);
                String value = tree.stringAttribute(node, A_VALUE);
                if (value != null) {
                    parameters.put(parameterName == null ? child : parameterName, value);
                }
            }
            result.add(new MaterialEntry(id == null ? index : id, name == null ? "MATERIAL_" + index : name, parameters));
        }
        return result;
    }

    public List<Integer> stateIds() {
        List<Integer> result = new ArrayList<>();
        for (String name : tree.childNames(VARIABLES)) {
            int index = stateIndex(name);
            if (index >= 0) {
                result.add(index);
            }
        }
        result.sort(Integer::compare);
        return result;
    }

    public StateInfo readStateInformation(int state) {
        String path = VmapLayout.state(state);
        String name = tree.stringAttribute(path, A_STATE_NAME);
        Double total = tree.doubleAttribute(path, A_TOTAL_TIME);
        Double step = tree.doubleAttribute(path, A_STEP_TIME);
        Integer increment = tree.intAttribute(path, A_INCREMENT_VALUE);
        return new StateInfo(state,
                name == null ? "" : name,
                total == null ? 0.0 : total,
                step == null ? (total == null ? 0.0 : total) : step,
                increment == null ? UNSET : increment);
    }

    public List<Integer> statePartIds(int state) {
        return numericChildren(VmapLayout.state(state));
    }

    public List<String> variableNames(int state, int partId) {
        return tree.childNames(stateVariables(state, partId));
    }

    public StateVariable readVariable(int state, int partId, String variable) {
        String path = HdfTree.join(stateVariables(state, partId), variable);
        double[] values = require(tree.doubleArray(HdfTree.join(path, D_VALUES)), path, D_VALUES);
        String name = tree.stringAttribute(path, A_VARIABLE_NAME);
        String description = tree.stringAttribute(path, A_VARIABLE_DESCRIPTION);
        return new StateVariable(
                name == null ? variable : name,
                description == null ? "" : description,
                intOr(path, A_IDENTIFIER, UNSET),
                intOr(path, A_DIMENSION, 1),
                intOr(path, A_MULTIPLICITY, 1),
                intOr(path, A_ENTITY, StateVariable.ENTITY_REAL),
                intOr(path, A_LOCATION, StateVariable.LOCATION_NODE),
                intOr(path, A_COORDINATE_SYSTEM, StateVariable.CARTESIAN),
                values,
                tree.intArray(HdfTree.join(path, D_GEOMETRY_IDS)));
    }

    private int intOr(String path, String attribute, int fallback) {
        Integer value = tree.intAttribute(path, attribute);
        return value == null ? fallback : value;
    }

    private List<Integer> numericChildren(String path) {
        List<Integer> result = new ArrayList<>();
        for (String name : tree.childNames(path)) {
            // 非数字命名的组不属于编号序列
            if (!name.isEmpty() && name.length() < 10 && name.chars().allMatch(Character::isDigit)) {
                result.add(Integer.parseInt(name));
            }
        }
        result.sort(Integer::compare);
        return result;
    }

    private static int first(int[] values, int fallback) {
        return values == null || values.length == 0 ? fallback : values[0];
    }

    private static <T> T require(T value, String path, String dataset) {
        if (value == null) {
            throw new ConversionException("缺少数据集 " + HdfTree.join(path, dataset));
        }
        return value;
    }

    /**
     * VMAP 文件中的材料记录。
     *
     * @param id         材料编号
     * @param name       材料名称
     * @param parameters 参数名称到文本值
     */
    public record MaterialEntry(int id, String name, Map<String, String> parameters) {
    }
}
