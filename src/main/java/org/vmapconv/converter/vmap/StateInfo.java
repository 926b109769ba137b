package org.vmapconv.converter.vmap;

/**
 * 状态组信息。
 *
 * @param index          状态序号
 * @param name           状态名称
 * @param totalTime      总时间（时间步或频率）
 * @param stepTime       步时间
 * @param incrementValue 增量（未使用为 -1）
 */
public record StateInfo(
        int index,
        String name,
        double totalTime,
        double stepTime,
        int incrementValue
) {
}
