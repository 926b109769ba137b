package org.vmapconv.converter.permas;

import org.vmapconv.converter.model.Topology;

import java.util.Locale;

/**
 * 扫描 PERMAS ASCII 时的当前块。数据行追加到当前块，指令行决定下一个块。
 */
public sealed interface ActiveBlock {

    /** 不关心的块：其后的数据行被忽略。 */
    record None(String directive) implements ActiveBlock {
    }

    record Coordinates() implements ActiveBlock {
    }

    record Elements(Topology topology) implements ActiveBlock {
    }

    /** 不支持的单元类型：整块跳过。 */
    record UnsupportedElements(String typeName) implements ActiveBlock {
    }

    record ElementSetBlock(String name) implements ActiveBlock {
    }

    record NodeSetBlock(String name) implements ActiveBlock {
    }

    record SurfaceBlock(String surfaceId, String surfaceSetName) implements ActiveBlock {
    }

    record SurfaceSetBlock(String name) implements ActiveBlock {
    }

    /** 由第二遍解析处理的块（材料、单元属性、参考坐标系），只记录位置。 */
    record Deferred(DeferredKind kind) implements ActiveBlock {
    }

    enum DeferredKind {
        MATERIAL,
        ELPROP,
        RSYS
    }

    /**
     * 由指令行（已分词）决定下一个块。
     */
    static ActiveBlock fromDirective(String[] tokens) {
        String keyword = tokens.length == 0 ? "" : tokens[0].toUpperCase(Locale.ROOT);
        return switch (keyword) {
            case "$COOR" -> new Coordinates();
            case "$ELEMENT" -> {
                String typeName = PermasTokens.keywordValue(tokens, "TYPE");
                if (typeName == null) {
                    typeName = PermasTokens.last(tokens);
                }
                String type = typeName;
                yield Topology.fromPermasName(type)
                        .<ActiveBlock>map(Elements::new)
                        .orElseGet(() -> new UnsupportedElements(type));
            }
            case "$ESET" -> new ElementSetBlock(nameOf(tokens));
            case "$NSET" -> new NodeSetBlock(nameOf(tokens));
            case "$SFSET" -> new SurfaceSetBlock(nameOf(tokens));
            case "$SURFACE" -> {
                String id = PermasTokens.keywordValue(tokens, "SURFID");
                if (id == null && tokens.length > 4) {
                    id = tokens[4];
                }
                String setName = PermasTokens.keywordValue(tokens, "SFSET");
                yield new SurfaceBlock(id, setName == null ? PermasTokens.last(tokens) : setName);
            }
            case "$MATERIAL" -> new Deferred(DeferredKind.MATERIAL);
            case "$ELPROP" -> new Deferred(DeferredKind.ELPROP);
            case "$RSYS" -> new Deferred(DeferredKind.RSYS);
            default -> new None(keyword);
        };
    }

    private static String nameOf(String[] tokens) {
        String name = PermasTokens.keywordValue(tokens, "NAME");
        return name == null ? PermasTokens.last(tokens) : name;
    }
}
