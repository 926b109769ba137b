package org.vmapconv.converter.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 支持的单元拓扑：PERMAS 名称与 VMAP 单元类型描述之间的对应关系。
 */
public enum Topology {

    HEXE8("HEXE8", 8, 1, "VMAP_HEXAHEDRON_8", "TRILINEAR", "GAUSS_HEXAHEDRON_8", 8, 3),
    TET10("TET10", 10, 2, "VMAP_TETRAHEDRON_10", "TRIQUADRATIC", "GAUSS_TETRAHEDRON_4", 4, 3);

    private final String permasName;
    private final int nodeCount;
    private final int vmapTypeId;
    private final String vmapTypeName;
    private final String interpolationType;
    private final String integrationType;
    private final int integrationPointCount;
    private final int dimension;

    Topology(String permasName, int nodeCount, int vmapTypeId, String vmapTypeName,
             String interpolationType, String integrationType, int integrationPointCount, int dimension) {
        this.permasName = permasName;
        this.nodeCount = nodeCount;
        this.vmapTypeId = vmapTypeId;
        this.vmapTypeName = vmapTypeName;
        this.interpolationType = interpolationType;
        this.integrationType = integrationType;
        this.integrationPointCount = integrationPointCount;
        this.dimension = dimension;
    }

    public String permasName() {
        return permasName;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int vmapTypeId() {
        return vmapTypeId;
    }

    public String vmapTypeName() {
        return vmapTypeName;
    }

    public String interpolationType() {
        return interpolationType;
    }

    public String integrationType() {
        return integrationType;
    }

    public int integrationPointCount() {
        return integrationPointCount;
    }

    public int dimension() {
        return dimension;
    }

    public static Optional<Topology> fromPermasName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Topology topology : values()) {
            if (topology.permasName.equals(normalized)) {
                return Optional.of(topology);
            }
        }
        return Optional.empty();
    }

    /**
     * 反向转换时 VMAP 文件只提供每单元节点数，按节点数识别拓扑。
     */
    public static Optional<Topology> fromNodeCount(int count) {
        for (Topology topology : values()) {
            if (topology.nodeCount == count) {
                return Optional.of(topology);
            }
        }
        return Optional.empty();
    }
}
