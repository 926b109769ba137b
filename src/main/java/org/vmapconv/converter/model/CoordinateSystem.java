package org.vmapconv.converter.model;

/**
 * 参考坐标系（PERMAS {@code $RSYS}）：参考点与两根轴方向。
 *
 * @param id             坐标系编号
 * @param referencePoint 参考点（3 个值）
 * @param firstAxis      第一轴方向（3 个值）
 * @param secondAxis     第二轴方向（3 个值）
 */
public record CoordinateSystem(
        int id,
        double[] referencePoint,
        double[] firstAxis,
        double[] secondAxis
) {
}
