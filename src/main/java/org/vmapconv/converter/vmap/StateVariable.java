package org.vmapconv.converter.vmap;

/**
 * 状态变量块。
 *
 * @param name             变量名称
 * @param description      描述（{@code REAL}/{@code IMAGINARY}）
 * @param identifier       变量编号
 * @param dimension        每个位置的分量数
 * @param multiplicity     重数（节点结果为 1）
 * @param entity           1 实部，2 虚部
 * @param location         1 全局，2 节点，3 单元
 * @param coordinateSystem 坐标系（1 直角坐标）
 * @param values           数值（行优先，行数 × dimension × multiplicity）
 * @param geometryIds      数值对应的节点 ID；覆盖部件全部节点时为 null
 */
public record StateVariable(
        String name,
        String description,
        int identifier,
        int dimension,
        int multiplicity,
        int entity,
        int location,
        int coordinateSystem,
        double[] values,
        int[] geometryIds
) {
    public static final int LOCATION_GLOBAL = 1;
    public static final int LOCATION_NODE = 2;
    public static final int LOCATION_ELEMENT = 3;
    public static final int ENTITY_REAL = 1;
    public static final int ENTITY_IMAGINARY = 2;
    public static final int CARTESIAN = 1;

    public int width() {
        return dimension * multiplicity;
    }

    public int rowCount() {
        return width() == 0 ? 0 : values.length / width();
    }
}
