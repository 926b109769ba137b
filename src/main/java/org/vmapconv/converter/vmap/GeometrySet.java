package org.vmapconv.converter.vmap;

/**
 * 几何集合：节点集合（单值索引）或面（单元，面号）对集合。
 *
 * @param name       集合名称（面集合为 {@code <sfset>_<surfid>}）
 * @param identifier 集合编号
 * @param setType    {@link #NODE_LOCATION} 或 {@link #ELEMENT_LOCATION}
 * @param indexType  {@link #SINGLE_INDEX} 或 {@link #PAIR_INDEX}
 * @param data       成员数据（对集合为扁平存储的对）
 */
public record GeometrySet(
        String name,
        int identifier,
        int setType,
        int indexType,
        int[] data
) {
    public static final int NODE_LOCATION = 0;
    public static final int ELEMENT_LOCATION = 1;
    public static final int SINGLE_INDEX = 1;
    public static final int PAIR_INDEX = 2;

    public static GeometrySet nodes(String name, int identifier, int[] nodeIds) {
        return new GeometrySet(name, identifier, NODE_LOCATION, SINGLE_INDEX, nodeIds);
    }

    public static GeometrySet elementFaces(String name, int identifier, int[] pairs) {
        return new GeometrySet(name, identifier, ELEMENT_LOCATION, PAIR_INDEX, pairs);
    }

    public boolean isNodeSet() {
        return setType == NODE_LOCATION && indexType == SINGLE_INDEX;
    }

    public boolean isElementFaceSet() {
        return setType == ELEMENT_LOCATION && indexType == PAIR_INDEX;
    }
}
