package org.vmapconv.converter.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.ConversionException;
import org.vmapconv.converter.model.Part;
import org.vmapconv.converter.model.ResultColumn;
import org.vmapconv.converter.model.ResultTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 为每个结果行确定所属部件：取第一个包含该节点的部件（部件声明顺序）。
 * <p>
 * 部件之间共享的节点因此只归属第一个部件。找不到部件的节点说明模型与结果不匹配，属于不可恢复错误。
 * 只有一个部件时不做查找，全部结果行直接归属该部件（被丢弃的单元集合上的节点也一样）。
 */
public final class PartAssigner {

    private static final Logger log = LoggerFactory.getLogger(PartAssigner.class);

    private PartAssigner() {
    }

    public static PartAssignment assign(ResultTable table, List<Part> parts) {
        if (parts.isEmpty() && !table.isEmpty()) {
            throw new ConversionException("模型中没有部件，无法归属结果");
        }
        List<int[]> indexByColumn = new ArrayList<>(table.columns().size());
        // 同一变量的各列共用 .RowDes 数组
        Map<int[], int[]> cache = new IdentityHashMap<>();
        for (ResultColumn column : table.columns()) {
            int[] indices = cache.get(column.ids());
            if (indices == null) {
                indices = assignRows(column.ids(), parts);
                cache.put(column.ids(), indices);
            }
            indexByColumn.add(indices);
        }
        log.debug("结果行部件归属完成：{} 列，{} 个部件", table.columns().size(), parts.size());
        return new PartAssignment(parts, indexByColumn);
    }

    private static int[] assignRows(int[] nodeIds, List<Part> parts) {
        int[] indices = new int[nodeIds.length];
        if (parts.size() == 1) {
            return indices;
        }
        Arrays.fill(indices, -1);
        for (int row = 0; row < nodeIds.length; row++) {
            for (int p = 0; p < parts.size(); p++) {
                if (parts.get(p).containsNode(nodeIds[row])) {
                    indices[row] = p;
                    break;
                }
            }
            if (indices[row] < 0) {
                throw new ConversionException("结果中的节点 " + nodeIds[row] + " 不属于任何部件（模型文件与结果文件不匹配？）");
            }
        }
        return indices;
    }
}
