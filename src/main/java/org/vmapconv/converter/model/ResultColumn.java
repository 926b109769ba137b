package org.vmapconv.converter.model;

/**
 * 一个变量在一个时间值下的结果块：每行一个节点（或单元），每行 width 个分量，行优先扁平存储。
 *
 * @param variableName  变量名称
 * @param temporalValue 时间步或频率
 * @param ids           每行对应的节点 ID（反向读取单元结果时为单元 ID）
 * @param width         每行分量数
 * @param values        分量值（长度为 ids.length × width）
 */
public record ResultColumn(
        String variableName,
        double temporalValue,
        int[] ids,
        int width,
        double[] values
) {
    public ResultColumn {
        if (values.length != ids.length * width) {
            throw new IllegalArgumentException("结果块 " + variableName + " 的数值长度与行数不匹配");
        }
    }

    public int rowCount() {
        return ids.length;
    }

    public double value(int row, int component) {
        return values[row * width + component];
    }
}
