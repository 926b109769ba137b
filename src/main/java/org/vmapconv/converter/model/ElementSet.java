package org.vmapconv.converter.model;

/**
 * 命名单元集合（PERMAS {@code $ESET}）。
 *
 * @param name       集合名称
 * @param elementIds 成员单元 ID（声明顺序）
 */
public record ElementSet(
        String name,
        int[] elementIds
) {
    public boolean isEmpty() {
        return elementIds.length == 0;
    }

    public int firstElementId() {
        return elementIds[0];
    }
}
