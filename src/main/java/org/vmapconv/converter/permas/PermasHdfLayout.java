package org.vmapconv.converter.permas;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.ConversionException;
import org.vmapconv.converter.hdf.HdfTree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * PERMAS-HDF 的层级约定：{@code /<component>/<situation>/...}。
 * <p>
 * 名称以 {@code .} 开头的节点是数据集（如 {@code .Model}、{@code .Analysis}），不是 component/situation。
 * 只处理第一个 component 下的第一个 situation，其余记告警后跳过。
 */
public final class PermasHdfLayout {

    private static final Logger log = LoggerFactory.getLogger(PermasHdfLayout.class);

    public static final String MODEL = ".Model";
    public static final String ANALYSIS = ".Analysis";
    public static final String COLUMN_DESCRIPTION = ".ColDes";
    public static final String ROW_DESCRIPTION = ".RowDes";
    public static final String COLUMN_PREFIX = "Column";

    private PermasHdfLayout() {
    }

    /**
     * 定位第一个 situation 的路径。
     *
     * @return situation 路径；文件中没有任何 situation 时返回 null
     */
    public static String locateSituation(HdfTree tree, List<String> warnings) {
        List<String> components = visibleChildren(tree, "/");
        if (components.isEmpty()) {
            return null;
        }
        for (String skipped : components.subList(1, components.size())) {
            warnings.add("只支持一个 component，已跳过 " + skipped);
        }
        String component = HdfTree.join("/", components.get(0));
        log.debug("component：{}", components.get(0));

        List<String> situations = visibleChildren(tree, component);
        if (situations.isEmpty()) {
            return null;
        }
        for (String skipped : situations.subList(1, situations.size())) {
            warnings.add("只支持一个 situation，已跳过 " + skipped);
        }
        log.debug("situation：{}", situations.get(0));
        return HdfTree.join(component, situations.get(0));
    }

    /**
     * 读取 {@code .Model} 中的模型文本（按行）。
     *
     * @throws ConversionException 文件中没有 situation 或没有 {@code .Model}
     */
    public static List<String> readModelLines(HdfTree tree, List<String> warnings) {
        String situation = locateSituation(tree, warnings);
        if (situation == null) {
            throw new ConversionException("PERMAS-HDF 文件中没有 component/situation");
        }
        String[] lines = tree.stringLines(HdfTree.join(situation, MODEL));
        if (lines == null) {
            throw new ConversionException("没有找到模型数据集 " + HdfTree.join(situation, MODEL));
        }
        List<String> result = new ArrayList<>(lines.length);
        for (String line : lines) {
            // 有的文件把整个模型存为一个字符串
            if (line.indexOf('\n') >= 0) {
                result.addAll(Arrays.asList(line.split("\\r?\\n")));
            } else {
                result.add(line);
            }
        }
        return result;
    }

    private static List<String> visibleChildren(HdfTree tree, String path) {
        List<String> result = new ArrayList<>();
        for (String name : tree.childNames(path)) {
            if (!name.startsWith(".") && tree.isGroup(HdfTree.join(path, name))) {
                result.add(name);
            }
        }
        return result;
    }
}
