package org.vmapconv.converter.model;

/**
 * 面集合（PERMAS {@code $SFSET}）：成员为面 ID。
 *
 * @param name       集合名称
 * @param surfaceIds 成员面 ID
 */
public record SurfaceSet(
        String name,
        int[] surfaceIds
) {
    public boolean contains(int surfaceId) {
        for (int id : surfaceIds) {
            if (id == surfaceId) {
                return true;
            }
        }
        return false;
    }
}
