package org.vmapconv.converter.model;

/**
 * 面定义（PERMAS {@code $SURFACE ELEMENTS}）：一组（单元 ID，面号）对。
 *
 * @param id             面 ID（SURFID）
 * @param surfaceSetName 声明时给出的面集合名称（SFSET）
 * @param pairs          扁平存储的（单元 ID，面号）对，长度为偶数
 */
public record Surface(
        int id,
        String surfaceSetName,
        int[] pairs
) {
    public int pairCount() {
        return pairs.length / 2;
    }

    public int firstElementId() {
        return pairs[0];
    }
}
