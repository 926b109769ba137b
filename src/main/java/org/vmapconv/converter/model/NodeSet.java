package org.vmapconv.converter.model;

/**
 * 命名节点集合（PERMAS {@code $NSET}）。
 *
 * @param name    集合名称
 * @param nodeIds 成员节点 ID（声明顺序）
 */
public record NodeSet(
        String name,
        int[] nodeIds
) {
    public boolean isEmpty() {
        return nodeIds.length == 0;
    }

    public int firstNodeId() {
        return nodeIds[0];
    }
}
