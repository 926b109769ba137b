package org.vmapconv.converter.dto;

/**
 * 部件摘要。
 *
 * @param name         部件名称（单元集合名称）
 * @param topology     单元拓扑（HEXE8/TET10）
 * @param elementCount 单元数
 * @param nodeCount    节点数
 * @param material     材料名称（未指定时为空）
 */
public record PartSummary(
        String name,
        String topology,
        int elementCount,
        int nodeCount,
        String material
) {
}
