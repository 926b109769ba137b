package org.vmapconv.converter.vmap;

/**
 * 结果分量：实部或复模态的虚部。
 */
public enum ModeComponent {

    REAL("REAL", StateVariable.ENTITY_REAL),
    IMAGINARY("IMAGINARY", StateVariable.ENTITY_IMAGINARY);

    private final String description;
    private final int entity;

    ModeComponent(String description, int entity) {
        this.description = description;
        this.entity = entity;
    }

    public String description() {
        return description;
    }

    public int entity() {
        return entity;
    }
}
