package org.vmapconv.converter;

import org.vmapconv.converter.hdf.HdfTree;

import java.util.List;
import java.util.Locale;

/**
 * 测试用的小模型：两个 HEXE8 单元组成 PART_A，一个 TET10 单元组成 PART_B，
 * 另有一个不支持的 QUAD4 单元集合、一个节点集合、一个面与一个材料。
 */
public final class PermasFixtures {

    public static final String COMPONENT = "KOMPO_1";
    public static final String SITUATION = "SIT_1";
    public static final String SITUATION_PATH = "/" + COMPONENT + "/" + SITUATION;

    /** PART_B 的 TET10 连接表（PERMAS 顺序）。 */
    public static final int[] TET10_PERMAS = {13, 14, 15, 16, 17, 18, 19, 20, 21, 22};

    private PermasFixtures() {
    }

    public static String modelText() {
        StringBuilder coordinates = new StringBuilder();
        for (int id = 1; id <= 22; id++) {
            coordinates.append(String.format(Locale.ROOT, "      %d %.1f %.1f %.1f%n", id, id * 1.0, id * 2.0, id * 0.5));
        }
        return """
                $ENTER COMPONENT NAME = KOMPO_1 DOFTYPE = DISP
                  $STRUCTURE
                    $COOR
                """ + coordinates + """
                    $ELEMENT TYPE = HEXE8
                      1 1 2 3 4 5 6 7 8
                      2 5 6 7 8 9 10 11 12
                    $ELEMENT TYPE = TET10
                      3 13 14 15 16 17 18 19 20
                      & 21 22
                    $ELEMENT TYPE = QUAD4
                      4 1 2 3 4
                    $ESET NAME = PART_A
                      1 2
                    $ESET NAME = PART_B
                      3
                    $ESET NAME = SHELLS
                      4
                    $NSET NAME = NS_TOP
                      9 10 11 12
                    $SURFACE ELEMENTS SURFID = 1 SFSET = SF1
                      1 1
                      2 6
                    $SFSET NAME = SF1
                      1
                  $END STRUCTURE
                  $SYSTEM NAME = SYS
                    $ELPROP
                      PART_A MATERIAL = STEEL
                      PART_B MATERIAL = STEEL
                  $END SYSTEM
                  $RSYS
                    7 0.0 0.0 0.0 1.0 0.0 0.0
                    & 0.0 1.0 0.0
                  !
                $EXIT COMPONENT
                $ENTER MATERIAL
                  $MATERIAL NAME = STEEL TYPE = ISO
                    $ELASTIC GENERAL INPUT = DATA
                      210000.0 0.3
                    $DENSITY GENERAL INPUT = DATA
                      7.85E-9
                  $END MATERIAL
                $EXIT MATERIAL
                $FIN
                """;
    }

    public static List<String> modelLines() {
        return modelText().lines().toList();
    }

    /**
     * 只含模型的 PERMAS-HDF 树。
     */
    public static HdfTree modelTree() {
        HdfTree tree = new HdfTree();
        tree.putDataset(SITUATION_PATH + "/.Model", modelLines().toArray(new String[0]));
        return tree;
    }

    /**
     * 模型加静力结果：DISPLACEMENT 覆盖全部节点，TEMPERATURE 只有节点 1～4。两个时间步 1.0 与 2.0。
     */
    public static HdfTree staticResultTree() {
        HdfTree tree = modelTree();
        tree.putDataset(SITUATION_PATH + "/.Analysis", new String[]{"STATIC ANALYSIS"});
        int[] allNodes = new int[22];
        for (int i = 0; i < allNodes.length; i++) {
            allNodes[i] = i + 1;
        }
        putVariable(tree, "DISPLACEMENT", new double[]{1.0, 2.0}, allNodes, 3);
        putVariable(tree, "TEMPERATURE", new double[]{1.0, 2.0}, new int[]{1, 2, 3, 4}, 1);
        return tree;
    }

    /**
     * 写入一个变量组，值为 {@code 节点 ID * 10 + 分量 + 时间值 / 10}。
     */
    public static void putVariable(HdfTree tree, String name, double[] temporal, int[] nodes, int width) {
        String path = SITUATION_PATH + "/" + name;
        tree.putDataset(path + "/.ColDes", temporal.clone());
        tree.putDataset(path + "/.RowDes", nodes.clone());
        for (int k = 0; k < temporal.length; k++) {
            double[][] column = new double[nodes.length][width];
            for (int row = 0; row < nodes.length; row++) {
                for (int c = 0; c < width; c++) {
                    column[row][c] = nodes[row] * 10 + c + temporal[k] / 10;
                }
            }
            tree.putDataset(path + "/Column" + (k + 1), column);
        }
    }

    public static ConverterProperties properties(String dataDir) {
        ConverterProperties properties = new ConverterProperties();
        properties.setDataDir(dataDir);
        return properties;
    }
}
