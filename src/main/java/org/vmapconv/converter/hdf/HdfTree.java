package org.vmapconv.converter.hdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HDF 层级容器的内存表示：组（group）、数据集（dataset）与属性（attribute），统一用 {@code /} 分隔的路径寻址。
 * <p>
 * 说明：
 * <ul>
 *   <li>PERMAS-HDF 与 VMAP 文件在转换前被完整加载为 {@link HdfTree}，转换结束后再整体写出，
 *       因此文件句柄只在 {@link HdfFiles} 内部短暂持有。</li>
 *   <li>子节点与属性保持插入顺序，写出结果是确定性的（同一输入两次写出完全一致）。</li>
 *   <li>数据集的值是原始 Java 数组（{@code int[]}/{@code double[][]}/{@code String[]} 等），
 *       通过 {@code intArray}/{@code doubleMatrix} 等方法按需转换，不关心底层存储宽度。</li>
 * </ul>
 */
public final class HdfTree {

    private final GroupNode root = new GroupNode();

    /**
     * 列出组下的子节点名称（插入顺序）；路径不存在或指向数据集时返回空列表。
     */
    public List<String> childNames(String path) {
        Node node = find(path);
        if (!(node instanceof GroupNode group)) {
            return List.of();
        }
        return List.copyOf(group.children.keySet());
    }

    public boolean exists(String path) {
        return find(path) != null;
    }

    public boolean isGroup(String path) {
        return find(path) instanceof GroupNode;
    }

    public boolean hasDataset(String path) {
        return find(path) instanceof DatasetNode;
    }

    /**
     * 读取数据集原始值；不存在时返回 null。
     */
    public Object dataset(String path) {
        Node node = find(path);
        return (node instanceof DatasetNode dataset) ? dataset.data : null;
    }

    public String[] stringLines(String path) {
        Object data = dataset(path);
        return data == null ? null : HdfArrays.toStringArray(data, path);
    }

    public String stringValue(String path) {
        Object data = dataset(path);
        return data == null ? null : HdfArrays.toSingleString(data, path);
    }

    public int[] intArray(String path) {
        Object data = dataset(path);
        return data == null ? null : HdfArrays.toIntArray(data, path);
    }

    public double[] doubleArray(String path) {
        Object data = dataset(path);
        return data == null ? null : HdfArrays.toDoubleArray(data, path);
    }

    public int[][] intMatrix(String path) {
        Object data = dataset(path);
        return data == null ? null : HdfArrays.toIntMatrix(data, path);
    }

    public double[][] doubleMatrix(String path) {
        Object data = dataset(path);
        return data == null ? null : HdfArrays.toDoubleMatrix(data, path);
    }

    /**
     * 节点属性（只读视图）；节点不存在时返回空 Map。
     */
    public Map<String, Object> attributes(String path) {
        Node node = find(path);
        return node == null ? Map.of() : Collections.unmodifiableMap(node.attributes);
    }

    public Object attribute(String path, String name) {
        Node node = find(path);
        return node == null ? null : node.attributes.get(name);
    }

    public String stringAttribute(String path, String name) {
        Object value = attribute(path, name);
        return value == null ? null : HdfArrays.toSingleString(value, path + "@" + name);
    }

    public Integer intAttribute(String path, String name) {
        Object value = attribute(path, name);
        if (value == null) {
            return null;
        }
        int[] values = HdfArrays.toIntArray(value, path + "@" + name);
        return values.length == 0 ? null : values[0];
    }

    public Double doubleAttribute(String path, String name) {
        Object value = attribute(path, name);
        if (value == null) {
            return null;
        }
        double[] values = HdfArrays.toDoubleArray(value, path + "@" + name);
        return values.length == 0 ? null : values[0];
    }

    /**
     * 创建组（包括缺失的中间组）；已存在时直接返回。
     */
    public HdfTree putGroup(String path) {
        groupAt(segments(path), true);
        return this;
    }

    /**
     * 写入数据集（缺失的父组自动创建）；同名数据集会被覆盖。
     */
    public HdfTree putDataset(String path, Object data) {
        if (data == null) {
            throw new IllegalArgumentException("数据集不能为空：" + path);
        }
        List<String> parts = segments(path);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("数据集路径不能是根路径");
        }
        GroupNode parent = groupAt(parts.subList(0, parts.size() - 1), true);
        String name = parts.get(parts.size() - 1);
        Node existing = parent.children.get(name);
        if (existing instanceof GroupNode) {
            throw new IllegalArgumentException("路径已是组，不能写为数据集：" + path);
        }
        DatasetNode dataset = new DatasetNode(data);
        if (existing != null) {
            dataset.attributes.putAll(existing.attributes);
        }
        parent.children.put(name, dataset);
        return this;
    }

    /**
     * 写入属性；目标节点不存在时按组创建。
     */
    public HdfTree putAttribute(String path, String name, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("属性值不能为空：" + path + "@" + name);
        }
        Node node = find(path);
        if (node == null) {
            node = groupAt(segments(path), true);
        }
        node.attributes.put(name, value);
        return this;
    }

    /**
     * 拼接路径片段，结果总以 {@code /} 开头。
     */
    public static String join(String parent, Object child) {
        String base = (parent == null || parent.isEmpty() || "/".equals(parent)) ? "" : trimSlashes(parent);
        String name = trimSlashes(String.valueOf(child));
        return base.isEmpty() ? "/" + name : "/" + base + "/" + name;
    }

    private Node find(String path) {
        Node current = root;
        for (String segment : segments(path)) {
            if (!(current instanceof GroupNode group)) {
                return null;
            }
            current = group.children.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private GroupNode groupAt(List<String> parts, boolean create) {
        GroupNode current = root;
        for (String segment : parts) {
            Node child = current.children.get(segment);
            if (child == null) {
                if (!create) {
                    return null;
                }
                child = new GroupNode();
                current.children.put(segment, child);
            }
            if (!(child instanceof GroupNode group)) {
                throw new IllegalArgumentException("路径片段已是数据集，不能作为组：" + segment);
            }
            current = group;
        }
        return current;
    }

    private static List<String> segments(String path) {
        List<String> result = new ArrayList<>();
        if (path == null) {
            return result;
        }
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                result.add(part);
            }
        }
        return result;
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }

    private abstract static class Node {
        final Map<String, Object> attributes = new LinkedHashMap<>();
    }

    private static final class GroupNode extends Node {
        final Map<String, Node> children = new LinkedHashMap<>();
    }

    private static final class DatasetNode extends Node {
        final Object data;

        DatasetNode(Object data) {
            this.data = data;
        }
    }
}
