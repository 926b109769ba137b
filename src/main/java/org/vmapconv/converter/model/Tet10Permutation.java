package org.vmapconv.converter.model;

/**
 * TET10 节点顺序在 PERMAS 与 VMAP 之间的置换。
 * <p>
 * PERMAS 顺序为 角1 棱12 角2 棱23 角3 棱31 棱14 棱24 棱34 角4；
 * VMAP 顺序为 角1 角2 角3 角4 棱12 棱23 棱31 棱14 棱24 棱34。
 * 同一置换也适用于每单元 10 个数据块的单元结果（如 60 个值 = 10 × 6 分量）。
 */
public final class Tet10Permutation {

    /** PERMAS 第 i 个节点在 VMAP 顺序中的位置（0 基）。 */
    private static final int[] VMAP_POSITION_OF_PERMAS = {0, 4, 1, 5, 2, 6, 7, 8, 9, 3};

    public static final int NODE_COUNT = VMAP_POSITION_OF_PERMAS.length;

    private Tet10Permutation() {
    }

    public static int[] toVmap(int[] permas) {
        requireLength(permas.length);
        int[] vmap = new int[NODE_COUNT];
        for (int i = 0; i < NODE_COUNT; i++) {
            vmap[VMAP_POSITION_OF_PERMAS[i]] = permas[i];
        }
        return vmap;
    }

    public static int[] toPermas(int[] vmap) {
        requireLength(vmap.length);
        int[] permas = new int[NODE_COUNT];
        for (int i = 0; i < NODE_COUNT; i++) {
            permas[i] = vmap[VMAP_POSITION_OF_PERMAS[i]];
        }
        return permas;
    }

    /**
     * 按块重排：values 由 10 个长度为 blockSize 的块组成，块的顺序从 VMAP 变为 PERMAS。
     */
    public static double[] blocksToPermas(double[] values, int blockSize) {
        if (values.length != NODE_COUNT * blockSize) {
            throw new IllegalArgumentException("TET10 数据块长度应为 " + (NODE_COUNT * blockSize) + "，实际 " + values.length);
        }
        double[] result = new double[values.length];
        for (int i = 0; i < NODE_COUNT; i++) {
            System.arraycopy(values, VMAP_POSITION_OF_PERMAS[i] * blockSize, result, i * blockSize, blockSize);
        }
        return result;
    }

    private static void requireLength(int length) {
        if (length != NODE_COUNT) {
            throw new IllegalArgumentException("TET10 连接表长度应为 10，实际 " + length);
        }
    }
}
