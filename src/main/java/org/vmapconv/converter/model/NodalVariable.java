package org.vmapconv.converter.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 默认读取的节点结果变量（PERMAS-HDF 中的变量组名称）。
 */
public enum NodalVariable {

    DISPLACEMENT("DISPLACEMENT"),
    CONTACT_STATUS("CONTACT STATUS"),
    NODAL_POINT_STRAIN("NODAL POINT STRAIN"),
    NODAL_POINT_STRESS("NODAL POINT STRESS"),
    GAP_WIDTH("GAP WIDTH"),
    TEMPERATURE("TEMPERATURE");

    private final String permasName;

    NodalVariable(String permasName) {
        this.permasName = permasName;
    }

    public String permasName() {
        return permasName;
    }

    /**
     * 命令行参数中的变量名：下划线等同于空格，大小写不敏感。
     */
    public static Optional<NodalVariable> fromArgument(String argument) {
        if (argument == null) {
            return Optional.empty();
        }
        String normalized = argument.trim().replace('_', ' ').toUpperCase(Locale.ROOT);
        for (NodalVariable variable : values()) {
            if (variable.permasName.equals(normalized)) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }
}
