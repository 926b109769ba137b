package org.vmapconv.converter.hdf;

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.api.WritableGroup;
import io.jhdf.api.WritableNode;
import io.jhdf.exceptions.HdfException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

/**
 * HDF 文件与 {@link HdfTree} 之间的装载/写出（基于 jHDF）。
 * <p>
 * 说明：
 * <ul>
 *   <li>读取时跳过链接节点，只复制组、数据集与属性。</li>
 *   <li>写出时整数/浮点标量属性写为长度为 1 的数组，读回由 {@link HdfTree} 的宽松转换处理。</li>
 * </ul>
 */
public final class HdfFiles {

    private static final Logger log = LoggerFactory.getLogger(HdfFiles.class);

    private HdfFiles() {
    }

    public static HdfTree read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        HdfTree tree = new HdfTree();
        try (HdfFile hdf = new HdfFile(file)) {
            copyAttributes(hdf, tree, "/");
            copyGroup(hdf, tree, "/");
        } catch (HdfException e) {
            throw new IOException("无法读取 HDF 文件：" + file + "（" + e.getMessage() + "）", e);
        }
        log.debug("已加载 HDF 文件：{}", file);
        return tree;
    }

    public static void write(HdfTree tree, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (WritableHdfFile hdf = HdfFile.write(file)) {
            writeAttributes(tree, "/", hdf);
            writeGroup(tree, "/", hdf);
        } catch (HdfException e) {
            throw new IOException("无法写出 HDF 文件：" + file + "（" + e.getMessage() + "）", e);
        }
        log.debug("已写出 HDF 文件：{}", file);
    }

    private static void copyGroup(Group group, HdfTree tree, String path) {
        for (Node child : group.getChildren().values()) {
            if (child.isLink()) {
                continue;
            }
            String childPath = HdfTree.join(path, child.getName());
            if (child instanceof Group childGroup) {
                tree.putGroup(childPath);
                copyAttributes(childGroup, tree, childPath);
                copyGroup(childGroup, tree, childPath);
            } else if (child instanceof Dataset dataset) {
                tree.putDataset(childPath, dataset.getData());
                copyAttributes(dataset, tree, childPath);
            }
        }
    }

    private static void copyAttributes(Node node, HdfTree tree, String path) {
        for (Map.Entry<String, Attribute> entry : node.getAttributes().entrySet()) {
            Object value = entry.getValue().getData();
            if (value != null) {
                tree.putAttribute(path, entry.getKey(), value);
            }
        }
    }

    private static void writeGroup(HdfTree tree, String path, WritableGroup target) {
        for (String name : tree.childNames(path)) {
            String childPath = HdfTree.join(path, name);
            if (tree.isGroup(childPath)) {
                WritableGroup group = target.putGroup(name);
                writeAttributes(tree, childPath, group);
                writeGroup(tree, childPath, group);
            } else {
                WritableNode dataset = target.putDataset(name, tree.dataset(childPath));
                writeAttributes(tree, childPath, dataset);
            }
        }
    }

    private static void writeAttributes(HdfTree tree, String path, WritableNode target) {
        for (Map.Entry<String, Object> entry : tree.attributes(path).entrySet()) {
            target.putAttribute(entry.getKey(), toWritable(entry.getValue()));
        }
    }

    private static Object toWritable(Object value) {
        if (value instanceof Integer number) {
            return new int[]{number};
        }
        if (value instanceof Long number) {
            return new long[]{number};
        }
        if (value instanceof Double number) {
            return new double[]{number};
        }
        if (value instanceof Float number) {
            return new float[]{number};
        }
        return value;
    }
}
