package org.vmapconv.converter.permas;

import java.util.List;

/**
 * 第一遍扫描记录下的复杂块起始行号（0 基）。
 *
 * @param materials          {@code $MATERIAL} 行
 * @param elementProperties  {@code $ELPROP} 行
 * @param coordinateSystems  {@code $RSYS} 行
 */
public record BlockPositions(
        List<Integer> materials,
        List<Integer> elementProperties,
        List<Integer> coordinateSystems
) {
}
