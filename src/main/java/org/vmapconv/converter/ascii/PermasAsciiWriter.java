package org.vmapconv.converter.ascii;

import org.vmapconv.converter.model.ElementSet;
import org.vmapconv.converter.model.ElementTable;
import org.vmapconv.converter.model.FlatPermasModel;
import org.vmapconv.converter.model.Material;
import org.vmapconv.converter.model.NodeSet;
import org.vmapconv.converter.model.NodeTable;
import org.vmapconv.converter.model.Surface;
import org.vmapconv.converter.model.SurfaceSet;
import org.vmapconv.converter.model.Topology;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 生成 PERMAS ASCII 输入文本。
 * <p>
 * 结构：{@code $ENTER COMPONENT} 中的 {@code $STRUCTURE}（坐标、单元、单元集合、节点集合、面与面集合），
 * 空的 CONSTRAINTS/LOADING/RESULTS 块、含 {@code $ELPROP} 的 SYSTEM 块与 SITUATION 块；
 * 然后是 {@code $ENTER MATERIAL}（有材料时）与 {@code $FIN}。
 * 数据行以 10 个空格缩进，ID 列表每行最多 idsPerLine 个。
 */
public final class PermasAsciiWriter {

    private static final String DATA_INDENT = "          ";

    private PermasAsciiWriter() {
    }

    public static String write(FlatPermasModel model, int idsPerLine) {
        return String.join("\n", lines(model, idsPerLine)) + "\n";
    }

    public static List<String> lines(FlatPermasModel model, int idsPerLine) {
        if (idsPerLine < 1) {
            throw new IllegalArgumentException("每行 ID 数必须大于 0");
        }
        List<String> out = new ArrayList<>();
        out.add("$ENTER COMPONENT  NAME = MIXED  DOFTYPE = DISP TEMP");
        out.add("   $STRUCTURE");
        writeCoordinates(out, model.nodes());
        writeElements(out, model.elementTable(Topology.TET10));
        writeElements(out, model.elementTable(Topology.HEXE8));
        for (ElementSet part : model.parts()) {
            out.add("      $ESET NAME = " + part.name());
            writeIds(out, part.elementIds(), idsPerLine);
        }
        for (NodeSet set : model.nodeSets()) {
            out.add("      $NSET NAME = " + set.name());
            writeIds(out, set.nodeIds(), idsPerLine);
        }
        for (Surface surface : model.surfaces()) {
            out.add("      $SURFACE ELEMENTS  SURFID = " + surface.id() + "  SFSET = " + surface.surfaceSetName());
            int[] pairs = surface.pairs();
            for (int i = 0; i + 1 < pairs.length; i += 2) {
                out.add(DATA_INDENT + formatIds(new int[]{pairs[i], pairs[i + 1]}));
            }
        }
        for (SurfaceSet set : model.surfaceSets()) {
            out.add("      $SFSET NAME = " + set.name());
            writeIds(out, set.surfaceIds(), idsPerLine);
        }
        out.add("   $END STRUCTURE");
        out.add("   $CONSTRAINTS NAME = MYCONSTRAINTS");
        out.add("   $END CONSTRAINTS");
        out.add("   $SYSTEM NAME = MYSYSTEM");
        writeElementProperties(out, model.partMaterials());
        out.add("   $END SYSTEM");
        out.add("   $LOADING NAME = MYLOADING");
        out.add("   $END LOADING");
        out.add("   $RESULTS NAME = MYRESULTS");
        out.add("   $END RESULTS");
        out.add("   $SITUATION NAME = MYSITUATION");
        out.add("      CONSTRAINTS=MYCONSTRAINTS   SYSTEM=MYSYSTEM   LOADING=MYLOADING   RESULTS=MYRESULTS");
        out.add("   $END SITUATION");
        out.add("$EXIT COMPONENT");
        if (!model.materials().isEmpty()) {
            out.add("$ENTER MATERIAL");
            for (Material material : model.materials()) {
                writeMaterial(out, material);
            }
            out.add("$EXIT MATERIAL");
        }
        out.add("$FIN");
        return out;
    }

    /**
     * 把 ID 列表拆为每行 perLine 个的整行，加上一行余数（若有）。
     */
    public static List<int[]> wrapRows(int[] ids, int perLine) {
        List<int[]> rows = new ArrayList<>();
        for (int from = 0; from < ids.length; from += perLine) {
            rows.add(Arrays.copyOfRange(ids, from, Math.min(ids.length, from + perLine)));
        }
        return rows;
    }

    private static void writeCoordinates(List<String> out, NodeTable nodes) {
        out.add("      $COOR");
        for (int row = 0; row < nodes.size(); row++) {
            double[] xyz = nodes.coordinates(row);
            out.add(DATA_INDENT + String.format(Locale.ROOT, "%10d %15.6e %15.6e %15.6e", nodes.id(row), xyz[0], xyz[1], xyz[2]));
        }
        out.add("!");
    }

    private static void writeElements(List<String> out, ElementTable table) {
        if (table.isEmpty()) {
            return;
        }
        out.add("      $ELEMENT TYPE = " + table.topology().permasName());
        for (int row = 0; row < table.size(); row++) {
            int[] line = new int[table.topology().nodeCount() + 1];
            line[0] = table.id(row);
            System.arraycopy(table.connectivity(row), 0, line, 1, table.topology().nodeCount());
            out.add(DATA_INDENT + formatIds(line));
        }
    }

    private static void writeElementProperties(List<String> out, Map<String, String> partMaterials) {
        if (partMaterials.isEmpty()) {
            return;
        }
        out.add("      $ELPROP");
        partMaterials.forEach((part, material) -> out.add("         " + part + " MATERIAL = " + material));
    }

    private static void writeMaterial(List<String> out, Material material) {
        out.add("   $MATERIAL  NAME = " + material.name() + " TYPE = ISO");
        if (material.modulus() != null && material.poisson() != null) {
            out.add("      $ELASTIC  GENERAL  INPUT = DATA");
            out.add("        " + material.modulus() + "  " + material.poisson());
        }
        if (material.density() != null) {
            out.add("      $DENSITY  GENERAL  INPUT = DATA");
            out.add("        " + material.density());
        }
        material.extraParameters().forEach((key, value) -> {
            out.add("      $" + key.toUpperCase(Locale.ROOT) + "  GENERAL  INPUT = DATA");
            out.add("        " + value);
        });
        out.add("   $END MATERIAL");
    }

    private static void writeIds(List<String> out, int[] ids, int perLine) {
        for (int[] row : wrapRows(ids, perLine)) {
            out.add(DATA_INDENT + formatIds(row));
        }
    }

    private static String formatIds(int[] ids) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < ids.length; i++) {
            if (i > 0) {
                line.append(' ');
            }
            line.append(String.format(Locale.ROOT, "%10d", ids[i]));
        }
        return line.toString();
    }
}
