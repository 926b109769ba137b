package org.vmapconv.converter.vmap;

/**
 * 部件的点块。
 *
 * @param ids         节点 ID（升序）
 * @param coordinates 坐标（ids.length × 3，行优先）
 */
public record PointsBlock(
        int[] ids,
        double[] coordinates
) {
    public int size() {
        return ids.length;
    }
}
