package org.vmapconv.converter.vmap;

import org.vmapconv.converter.hdf.HdfTree;

/**
 * VMAP 文件的组、数据集与属性名称。
 */
public final class VmapLayout {

    public static final String ROOT = "/VMAP";
    public static final String GEOMETRY = ROOT + "/GEOMETRY";
    public static final String SYSTEM = ROOT + "/SYSTEM";
    public static final String VARIABLES = ROOT + "/VARIABLES";
    public static final String MATERIAL = ROOT + "/MATERIAL";

    public static final String UNIT_SYSTEM = SYSTEM + "/UNITSYSTEM";
    public static final String UNITS = SYSTEM + "/UNITS";
    public static final String ELEMENT_TYPES = SYSTEM + "/ELEMENTTYPES";
    public static final String INTEGRATION_TYPES = SYSTEM + "/INTEGRATIONTYPES";
    public static final String COORDINATE_SYSTEMS = SYSTEM + "/COORDINATESYSTEMS";

    public static final String VERSION = "0.5";
    public static final String STATE_PREFIX = "STATE-";

    public static final String POINTS = "POINTS";
    public static final String ELEMENTS = "ELEMENTS";
    public static final String GEOMETRY_SETS = "GEOMETRYSETS";
    public static final String MATERIAL_CARD = "MATERIALCARD";
    public static final String PARAMETERS = "PARAMETERS";

    // 属性与数据集
    public static final String A_VERSION = "VERSION";
    public static final String A_EXPORTER_NAME = "MYEXPORTERNAME";
    public static final String A_FILE_DATE = "MYFILEDATE";
    public static final String A_FILE_TIME = "MYFILETIME";
    public static final String A_NAME = "MYNAME";
    public static final String A_IDENTIFIER = "MYIDENTIFIER";
    public static final String A_UNIT_SYMBOL = "MYUNITSYMBOL";
    public static final String A_SI_SCALE = "MYSISCALE";
    public static final String A_UNIT_DIMENSION = "MYUNITDIMENSION";
    public static final String A_TYPE_NAME = "MYTYPENAME";
    public static final String A_NUMBER_OF_NODES = "MYNUMBEROFNODES";
    public static final String A_NUMBER_OF_POINTS = "MYNUMBEROFPOINTS";
    public static final String A_DIMENSION = "MYDIMENSION";
    public static final String A_INTERPOLATION_TYPE = "MYINTERPOLATIONTYPE";
    public static final String A_INTEGRATION_TYPE = "MYINTEGRATIONTYPE";
    public static final String A_TYPE = "MYTYPE";
    public static final String D_REFERENCE_POINT = "MYREFERENCEPOINT";
    public static final String D_AXIS_VECTORS = "MYAXISVECTORS";
    public static final String A_MATERIAL_NAME = "MYMATERIALNAME";
    public static final String A_MATERIAL_STATE = "MYMATERIALSTATE";
    public static final String A_MATERIAL_DESCRIPTION = "MYMATERIALDESCRIPTION";
    public static final String A_IDEALIZATION = "MYIDEALIZATION";
    public static final String A_PHYSICS = "MYPHYSICS";
    public static final String A_SOLVER = "MYSOLVER";
    public static final String A_UNIT_SYSTEM = "MYUNITSYSTEM";
    public static final String A_VALUE = "MYVALUE";
    public static final String A_DESCRIPTION = "MYDESCRIPTION";
    public static final String D_IDENTIFIERS = "MYIDENTIFIERS";
    public static final String D_COORDINATES = "MYCOORDINATES";
    public static final String D_ELEMENT_TYPE = "MYELEMENTTYPE";
    public static final String D_COORDINATE_SYSTEM = "MYCOORDINATESYSTEM";
    public static final String D_MATERIAL_TYPE = "MYMATERIALTYPE";
    public static final String D_CONNECTIVITY = "MYCONNECTIVITY";
    public static final String A_SET_NAME = "MYSETNAME";
    public static final String A_SET_TYPE = "MYSETTYPE";
    public static final String A_SET_INDEX_TYPE = "MYSETINDEXTYPE";
    public static final String D_GEOMETRY_SET_DATA = "MYGEOMETRYSETDATA";
    public static final String A_STATE_NAME = "MYSTATENAME";
    public static final String A_TOTAL_TIME = "MYTOTALTIME";
    public static final String A_STEP_TIME = "MYSTEPTIME";
    public static final String A_INCREMENT_VALUE = "MYINCREMENTVALUE";
    public static final String A_VARIABLE_NAME = "MYVARIABLENAME";
    public static final String A_VARIABLE_DESCRIPTION = "MYVARIABLEDESCRIPTION";
    public static final String A_MULTIPLICITY = "MYMULTIPLICITY";
    public static final String A_ENTITY = "MYENTITY";
    public static final String A_LOCATION = "MYLOCATION";
    public static final String A_COORDINATE_SYSTEM = "MYCOORDINATESYSTEM";
    public static final String A_TIME_VALUE = "MYTIMEVALUE";
    public static final String A_UNIT = "MYUNIT";
    public static final String D_VALUES = "MYVALUES";
    public static final String D_GEOMETRY_IDS = "MYGEOMETRYIDS";

    /** 未指定的材料/坐标系等编号。 */
    public static final int UNSET = -1;

    private VmapLayout() {
    }

    public static String part(int partId) {
        return HdfTree.join(GEOMETRY, partId);
    }

    public static String state(int state) {
        return HdfTree.join(VARIABLES, STATE_PREFIX + state);
    }

    public static String stateVariables(int state, int partId) {
        return HdfTree.join(state(state), partId);
    }

    /**
     * 解析 {@code STATE-<i>} 中的序号；不是状态组时返回 -1。
     */
    public static int stateIndex(String groupName) {
        if (!groupName.startsWith(STATE_PREFIX)) {
            return -1;
        }
        try {
            return Integer.parseInt(groupName.substring(STATE_PREFIX.length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
