package org.vmapconv.converter.vmap;

import org.vmapconv.converter.hdf.HdfTree;
import org.vmapconv.converter.model.CoordinateSystem;
import org.vmapconv.converter.model.Material;
import org.vmapconv.converter.model.Topology;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.vmapconv.converter.vmap.VmapLayout.A_COORDINATE_SYSTEM;
import static org.vmapconv.converter.vmap.VmapLayout.A_DESCRIPTION;
import static org.vmapconv.converter.vmap.VmapLayout.A_DIMENSION;
import static org.vmapconv.converter.vmap.VmapLayout.A_ENTITY;
import static org.vmapconv.converter.vmap.VmapLayout.A_EXPORTER_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_FILE_DATE;
import static org.vmapconv.converter.vmap.VmapLayout.A_FILE_TIME;
import static org.vmapconv.converter.vmap.VmapLayout.A_IDEALIZATION;
import static org.vmapconv.converter.vmap.VmapLayout.A_IDENTIFIER;
import static org.vmapconv.converter.vmap.VmapLayout.A_INCREMENT_VALUE;
import static org.vmapconv.converter.vmap.VmapLayout.A_INTEGRATION_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.A_INTERPOLATION_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.A_LOCATION;
import static org.vmapconv.converter.vmap.VmapLayout.A_MATERIAL_DESCRIPTION;
import static org.vmapconv.converter.vmap.VmapLayout.A_MATERIAL_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_MATERIAL_STATE;
import static org.vmapconv.converter.vmap.VmapLayout.A_MULTIPLICITY;
import static org.vmapconv.converter.vmap.VmapLayout.A_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_NUMBER_OF_NODES;
import static org.vmapconv.converter.vmap.VmapLayout.A_NUMBER_OF_POINTS;
import static org.vmapconv.converter.vmap.VmapLayout.A_PHYSICS;
import static org.vmapconv.converter.vmap.VmapLayout.A_SET_INDEX_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.A_SET_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_SET_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.A_SI_SCALE;
import static org.vmapconv.converter.vmap.VmapLayout.A_SOLVER;
import static org.vmapconv.converter.vmap.VmapLayout.A_STATE_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_STEP_TIME;
import static org.vmapconv.converter.vmap.VmapLayout.A_TIME_VALUE;
import static org.vmapconv.converter.vmap.VmapLayout.A_TOTAL_TIME;
import static org.vmapconv.converter.vmap.VmapLayout.A_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.A_TYPE_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_UNIT;
import static org.vmapconv.converter.vmap.VmapLayout.A_UNIT_DIMENSION;
import static org.vmapconv.converter.vmap.VmapLayout.A_UNIT_SYMBOL;
import static org.vmapconv.converter.vmap.VmapLayout.A_UNIT_SYSTEM;
import static org.vmapconv.converter.vmap.VmapLayout.A_VALUE;
import static org.vmapconv.converter.vmap.VmapLayout.A_VARIABLE_DESCRIPTION;
import static org.vmapconv.converter.vmap.VmapLayout.A_VARIABLE_NAME;
import static org.vmapconv.converter.vmap.VmapLayout.A_VERSION;
import static org.vmapconv.converter.vmap.VmapLayout.COORDINATE_SYSTEMS;
import static org.vmapconv.converter.vmap.VmapLayout.D_AXIS_VECTORS;
import static org.vmapconv.converter.vmap.VmapLayout.D_CONNECTIVITY;
import static org.vmapconv.converter.vmap.VmapLayout.D_COORDINATES;
import static org.vmapconv.converter.vmap.VmapLayout.D_COORDINATE_SYSTEM;
import static org.vmapconv.converter.vmap.VmapLayout.D_ELEMENT_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.D_GEOMETRY_IDS;
import static org.vmapconv.converter.vmap.VmapLayout.D_GEOMETRY_SET_DATA;
import static org.vmapconv.converter.vmap.VmapLayout.D_IDENTIFIERS;
import static org.vmapconv.converter.vmap.VmapLayout.D_MATERIAL_TYPE;
import static org.vmapconv.converter.vmap.VmapLayout.D_REFERENCE_POINT;
import static org.vmapconv.converter.vmap.VmapLayout.D_VALUES;
import static org.vmapconv.converter.vmap.VmapLayout.ELEMENTS;
import static org.vmapconv.converter.vmap.VmapLayout.ELEMENT_TYPES;
import static org.vmapconv.converter.vmap.VmapLayout.GEOMETRY;
import static org.vmapconv.converter.vmap.VmapLayout.GEOMETRY_SETS;
import static org.vmapconv.converter.vmap.VmapLayout.INTEGRATION_TYPES;
import static org.vmapconv.converter.vmap.VmapLayout.MATERIAL;
import static org.vmapconv.converter.vmap.VmapLayout.MATERIAL_CARD;
import static org.vmapconv.converter.vmap.VmapLayout.PARAMETERS;
import static org.vmapconv.converter.vmap.VmapLayout.POINTS;
import static org.vmapconv.converter.vmap.VmapLayout.ROOT;
import static org.vmapconv.converter.vmap.VmapLayout.SYSTEM;
import static org.vmapconv.converter.vmap.VmapLayout.UNITS;
import static org.vmapconv.converter.vmap.VmapLayout.UNIT_SYSTEM;
import static org.vmapconv.converter.vmap.VmapLayout.UNSET;
import static org.vmapconv.converter.vmap.VmapLayout.VARIABLES;
import static org.vmapconv.converter.vmap.VmapLayout.VERSION;
import static org.vmapconv.converter.vmap.VmapLayout.part;
import static org.vmapconv.converter.vmap.VmapLayout.stateVariables;

/**
 * VMAP 写出原语：把各类记录写入 {@link HdfTree}。
 * <p>
 * 构造时创建 {@code /VMAP} 下的四个顶层组，因此即使没有任何结果，{@code VARIABLES} 组也存在。
 */
public final class VmapWriter {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("H:m:s");

    private final HdfTree tree;

    public VmapWriter(HdfTree tree) {
        this.tree = tree;
        tree.putGroup(GEOMETRY);
        tree.putGroup(SYSTEM);
        tree.putGroup(VARIABLES);
        tree.putGroup(MATERIAL);
    }

    public HdfTree tree() {
        return tree;
    }

    public void writeMetaInformation(String exporterName, LocalDateTime now) {
        tree.putAttribute(ROOT, A_VERSION, VERSION);
        tree.putAttribute(ROOT, A_EXPORTER_NAME, exporterName);
        tree.putAttribute(ROOT, A_FILE_DATE, now.format(DATE));
        tree.putAttribute(ROOT, A_FILE_TIME, now.format(TIME));
    }

    /**
     * 单位制：mm、t、s、A、K、mol、cd，以及派生单位 N、mm^2、MPa、mJ、mW。
     */
    public void writeUnitSystem() {
        baseUnit("LENGTH", "mm", 0.001);
        baseUnit("MASS", "t", 1000.0);
        baseUnit("TIME", "s", 1.0);
        baseUnit("CURRENT", "A", 1.0);
        baseUnit("TEMPERATURE", "K", 1.0);
        baseUnit("AMOUNTOFSUBSTANCE", "mol", 1.0);
        baseUnit("LUMINOUSINTENSITY", "cd", 1.0);

        derivedUnit(8, "N", new int[]{1, 1, -2, 0, 0, 0, 0});
        derivedUnit(9, "mm^2", new int[]{2, 0, 0, 0, 0, 0, 0});
        derivedUnit(10, "MPa", new int[]{-1, 1, -2, 0, 0, 0, 0});
        derivedUnit(11, "mJ", new int[]{2, 1, -2, 0, 0, 0, 0});
        derivedUnit(12, "mW", new int[]{2, 1, -3, 0, 0, 0, 0});
    }

    public void writeElementTypes(Collection<Topology> topologies) {
        for (Topology topology : topologies) {
            String type = HdfTree.join(ELEMENT_TYPES, topology.vmapTypeId());
            tree.putGroup(type);
            tree.putAttribute(type, A_IDENTIFIER, topology.vmapTypeId());
            tree.putAttribute(type, A_TYPE_NAME, topology.vmapTypeName());
            tree.putAttribute(type, A_NUMBER_OF_NODES, topology.nodeCount());
            tree.putAttribute(type, A_DIMENSION, topology.dimension());
            tree.putAttribute(type, A_INTERPOLATION_TYPE, topology.interpolationType());
            tree.putAttribute(type, A_INTEGRATION_TYPE, topology.vmapTypeId());

            String integration = HdfTree.join(INTEGRATION_TYPES, topology.vmapTypeId());
            tree.putGroup(integration);
            tree.putAttribute(integration, A_IDENTIFIER, topology.vmapTypeId());
            tree.putAttribute(integration, A_TYPE_NAME, topology.integrationType());
            tree.putAttribute(integration, A_NUMBER_OF_POINTS, topology.integrationPointCount());
        }
    }

    public void writeCoordinateSystems(List<CoordinateSystem> systems) {
        for (int k = 0; k < systems.size(); k++) {
            CoordinateSystem system = systems.get(k);
            String path = HdfTree.join(COORDINATE_SYSTEMS, k);
            tree.putGroup(path);
            tree.putAttribute(path, A_IDENTIFIER, system.id());
            tree.putAttribute(path, A_TYPE, "NON_ORTHOGONAL");
            tree.putDataset(HdfTree.join(path, D_REFERENCE_POINT), system.referencePoint().clone());
            tree.putDataset(HdfTree.join(path, D_AXIS_VECTORS),
                    new double[][]{system.firstAxis().clone(), system.secondAxis().clone()});
        }
    }

    /**
     * 材料：编号、名称、状态 solid，材料卡（isotropic / solid mechanics / PERMAS）与标量参数。
     */
    public void writeMaterials(List<Material> materials) {
        for (int k = 0; k < materials.size(); k++) {
            Material material = materials.get(k);
            String path = HdfTree.join(MATERIAL, k);
            tree.putGroup(path);
            tree.putAttribute(path, A_IDENTIFIER, material.id());
            tree.putAttribute(path, A_MATERIAL_NAME, material.name());
            tree.putAttribute(path, A_MATERIAL_STATE, "solid");
            tree.putAttribute(path, A_MATERIAL_DESCRIPTION, "-");

            String card = HdfTree.join(path, MATERIAL_CARD);
            tree.putGroup(card);
            tree.putAttribute(card, A_IDENTIFIER, material.name());
            tree.putAttribute(card, A_IDEALIZATION, "isotropic");
            tree.putAttribute(card, A_PHYSICS, "solid mechanics");
            tree.putAttribute(card, A_SOLVER, "PERMAS");
            tree.putAttribute(card, A_UNIT_SYSTEM, UNIT_SYSTEM);

            for (Map.Entry<String, Double> parameter : material.parameters().entrySet()) {
                String node = HdfTree.join(HdfTree.join(card, PARAMETERS), parameter.getKey());
                tree.putGroup(node);
                tree.putAttribute(node, A_NAME, parameter.getKey());
                tree.putAttribute(node, A_VALUE, String.valueOf(parameter.getValue()));
                tree.putAttribute(node, A_DESCRIPTION, "-");
            }
        }
    }

    public void createGeometryGroup(int partId, String name) {
        tree.putGroup(part(partId));
        tree.putAttribute(part(partId), A_NAME, name);
    }

    public void writePointsBlock(int partId, PointsBlock points) {
        String path = HdfTree.join(part(partId), POINTS);
        tree.putGroup(path);
        tree.putDataset(HdfTree.join(path, D_IDENTIFIERS), points.ids().clone());
        tree.putDataset(HdfTree.join(path, D_COORDINATES), rows(points.coordinates(), 3));
    }

    public void writeElementsBlock(int partId, ElementBlock elements) {
        String path = HdfTree.join(part(partId), ELEMENTS);
        int count = elements.size();
        tree.putGroup(path);
        tree.putDataset(HdfTree.join(path, D_IDENTIFIERS), elements.ids().clone());
        tree.putDataset(HdfTree.join(path, D_ELEMENT_TYPE), filled(count, elements.elementType()));
        tree.putDataset(HdfTree.join(path, D_COORDINATE_SYSTEM), filled(count, elements.coordinateSystem()));
        tree.putDataset(HdfTree.join(path, D_MATERIAL_TYPE), filled(count, elements.materialId()));
        int[][] connectivity = new int[count][];
        for (int row = 0; row < count; row++) {
            connectivity[row] = elements.connectivity(row);
        }
        tree.putDataset(HdfTree.join(path, D_CONNECTIVITY), connectivity);
    }

    public void writeGeometrySets(int partId, List<GeometrySet> sets) {
        String base = HdfTree.join(part(partId), GEOMETRY_SETS);
        tree.putGroup(base);
        for (int k = 0; k < sets.size(); k++) {
            GeometrySet set = sets.get(k);
            String path = HdfTree.join(base, k);
            tree.putGroup(path);
            tree.putAttribute(path, A_SET_NAME, set.name());
            tree.putAttribute(path, A_IDENTIFIER, set.identifier());
            tree.putAttribute(path, A_SET_TYPE, set.setType());
            tree.putAttribute(path, A_SET_INDEX_TYPE, set.indexType());
            Object data = set.indexType() == GeometrySet.PAIR_INDEX
                    ? pairRows(set.data())
                    : set.data().clone();
            tree.putDataset(HdfTree.join(path, D_GEOMETRY_SET_DATA), data);
        }
    }

    public void setVariableStateInformation(int state, String name, double totalTime, double stepTime, int incrementValue) {
        String path = VmapLayout.state(state);
        tree.putGroup(path);
        tree.putAttribute(path, A_STATE_NAME, name);
        tree.putAttribute(path, A_TOTAL_TIME, totalTime);
        tree.putAttribute(path, A_STEP_TIME, stepTime);
        tree.putAttribute(path, A_INCREMENT_VALUE, incrementValue);
    }

    public void createVariablesGroup(int state, int partId) {
        tree.putGroup(stateVariables(state, partId));
    }

    public void writeVariable(int state, int partId, StateVariable variable) {
        String path = HdfTree.join(stateVariables(state, partId), variable.name());
        tree.putGroup(path);
        tree.putAttribute(path, A_VARIABLE_NAME, variable.name());
        tree.putAttribute(path, A_VARIABLE_DESCRIPTION, variable.description());
        tree.putAttribute(path, A_IDENTIFIER, variable.identifier());
        tree.putAttribute(path, A_DIMENSION, variable.dimension());
        tree.putAttribute(path, A_MULTIPLICITY, variable.multiplicity());
        tree.putAttribute(path, A_ENTITY, variable.entity());
        tree.putAttribute(path, A_LOCATION, variable.location());
        tree.putAttribute(path, A_COORDINATE_SYSTEM, variable.coordinateSystem());
        tree.putAttribute(path, A_TIME_VALUE, UNSET);
        tree.putAttribute(path, A_INCREMENT_VALUE, UNSET);
        tree.putAttribute(path, A_UNIT, UNSET);
        tree.putDataset(HdfTree.join(path, D_VALUES), rows(variable.values(), variable.width()));
        if (variable.geometryIds() != null) {
            tree.putDataset(HdfTree.join(path, D_GEOMETRY_IDS), variable.geometryIds().clone());
        }
    }

    private void baseUnit(String quantity, String symbol, double siScale) {
        String path = HdfTree.join(UNIT_SYSTEM, quantity);
        tree.putGroup(path);
        tree.putAttribute(path, A_UNIT_SYMBOL, symbol);
        tree.putAttribute(path, A_SI_SCALE, siScale);
    }

    private void derivedUnit(int id, String symbol, int[] dimension) {
        String path = HdfTree.join(UNITS, id);
        tree.putGroup(path);
        tree.putAttribute(path, A_IDENTIFIER, id);
        tree.putAttribute(path, A_UNIT_SYMBOL, symbol);
        tree.putAttribute(path, A_UNIT_DIMENSION, dimension);
    }

    private static int[] filled(int count, int value) {
        int[] result = new int[count];
        Arrays.fill(result, value);
        return result;
    }

    private static double[][] rows(double[] flat, int width) {
        int count = width == 0 ? 0 : flat.length / width;
        double[][] result = new double[count][];
        for (int row = 0; row < count; row++) {
            result[row] = Arrays.copyOfRange(flat, row * width, row * width + width);
        }
        return result;
    }

    private static int[][] pairRows(int[] flat) {
        int[][] result = new int[flat.length / 2][];
        for (int row = 0; row < result.length; row++) {
            result[row] = new int[]{flat[row * 2], flat[row * 2 + 1]};
        }
        return result;
    }
}
