package org.vmapconv.converter.permas;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.model.CoordinateSystem;
import org.vmapconv.converter.model.ElementSet;
import org.vmapconv.converter.model.ElementTable;
import org.vmapconv.converter.model.Material;
import org.vmapconv.converter.model.NodeSet;
import org.vmapconv.converter.model.NodeTable;
import org.vmapconv.converter.model.Surface;
import org.vmapconv.converter.model.SurfaceSet;
import org.vmapconv.converter.model.Topology;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * PERMAS ASCII 模型解析器（尽力而为）。
 * <p>
 * 两遍解析：
 * <ol>
 *   <li>逐行扫描：以数字开头的是数据行，以 {@code &} 开头的是上一条记录的续行，其余为指令行；
 *       数据行按 {@link ActiveBlock} 追加到坐标、单元、集合与面的记录中，
 *       {@code $MATERIAL}/{@code $ELPROP}/{@code $RSYS} 只记录位置。</li>
 *   <li>在记录的位置上解析材料、单元属性与参考坐标系（见 {@link PermasBlockParsers}）。</li>
 * </ol>
 * 格式不正确的记录不会中断解析，而是跳过并记入 warnings。
 */
public final class PermasModelParser {

    private static final Logger log = LoggerFactory.getLogger(PermasModelParser.class);

    private PermasModelParser() {
    }

    public static RawPermasModel parse(List<String> lines) {
        Scan scan = new Scan();
        for (int i = 0; i < lines.size(); i++) {
            scan.accept(PermasTokens.tokenize(lines.get(i)), i);
        }
        List<String> warnings = scan.warnings;

        BlockPositions positions = new BlockPositions(
                List.copyOf(scan.materialLines), List.copyOf(scan.elpropLines), List.copyOf(scan.rsysLines));
        List<Material> materials = PermasBlockParsers.parseMaterials(lines, positions.materials(), warnings);
        Map<String, String> elementSetMaterials =
                PermasBlockParsers.parseElementProperties(lines, positions.elementProperties(), warnings);
        List<CoordinateSystem> coordinateSystems =
                PermasBlockParsers.parseCoordinateSystems(lines, positions.coordinateSystems(), warnings);
        Double nodalDiameter = PermasBlockParsers.findNodalDiameter(lines, warnings);

        NodeTable nodes = scan.buildNodes();
        ElementTable hexe8 = scan.buildElements(Topology.HEXE8);
        ElementTable tet10 = scan.buildElements(Topology.TET10);
        log.info("PERMAS 模型解析完成：节点 {}，HEXE8 {}，TET10 {}，ESET {}，NSET {}，SURFACE {}，SFSET {}，材料 {}",
                nodes.size(), hexe8.size(), tet10.size(), scan.elementSets.size(), scan.nodeSets.size(),
                scan.surfaces.size(), scan.surfaceSets.size(), materials.size());

        return new RawPermasModel(
                nodes,
                hexe8,
                tet10,
                scan.buildElementSets(),
                scan.buildNodeSets(),
                scan.buildSurfaces(),
                scan.buildSurfaceSets(),
                materials,
                elementSetMaterials,
                coordinateSystems,
                nodalDiameter,
                positions,
                List.copyOf(warnings)
        );
    }

    /**
     * 一条记录的全部词（含续行）与起始行号。
     */
    private record RawRecord(List<String> tokens, int line) {
    }

    private record NamedRecords(String name, List<RawRecord> records) {
    }

    private record SurfaceRecords(String surfaceId, String surfaceSetName, int line, List<RawRecord> records) {
    }

    private static final class Scan {

        private final List<String> warnings = new ArrayList<>();
        private final List<RawRecord> coordinates = new ArrayList<>();
        private final Map<Topology, List<RawRecord>> elements = new EnumMap<>(Topology.class);
        private final List<NamedRecords> elementSets = new ArrayList<>();
        private final List<NamedRecords> nodeSets = new ArrayList<>();
        private final List<NamedRecords> surfaceSets = new ArrayList<>();
        private final List<SurfaceRecords> surfaces = new ArrayList<>();
        private final List<Integer> materialLines = new ArrayList<>();
        private final List<Integer> elpropLines = new ArrayList<>();
        private final List<Integer> rsysLines = new ArrayList<>();

        private List<RawRecord> target;

        private Scan() {
            for (Topology topology : Topology.values()) {
                elements.put(topology, new ArrayList<>());
            }
        }

        void accept(String[] tokens, int line) {
            if (tokens.length == 0) {
                return;
            }
            if (PermasTokens.isDataLine(tokens)) {
                if (target != null) {
                    target.add(new RawRecord(new ArrayList<>(Arrays.asList(tokens)), line));
                }
                return;
            }
            if (PermasTokens.isContinuation(tokens)) {
                continueRecord(tokens, line);
                return;
            }
            switchBlock(ActiveBlock.fromDirective(tokens), line);
        }

        private void continueRecord(String[] tokens, int line) {
            if (target == null) {
                return;
            }
            if (target.isEmpty()) {
                warnings.add("第 " + (line + 1) + " 行：续行前没有数据记录，已忽略");
                return;
            }
            List<String> record = target.get(target.size() - 1).tokens();
            String head = tokens[0].substring(1);
            if (!head.isEmpty()) {
                record.add(head);
            }
            record.addAll(Arrays.asList(tokens).subList(1, tokens.length));
        }

        private void switchBlock(ActiveBlock next, int line) {
            target = null;
            if (next instanceof ActiveBlock.Coordinates) {
                log.debug("读取 $COOR（第 {} 行）", line + 1);
                target = coordinates;
            } else if (next instanceof ActiveBlock.Elements block) {
                log.debug("读取 $ELEMENT {}（第 {} 行）", block.topology(), line + 1);
                target = elements.get(block.topology());
            } else if (next instanceof ActiveBlock.UnsupportedElements block) {
                log.info("跳过不支持的单元类型 {}（第 {} 行）", block.typeName(), line + 1);
            } else if (next instanceof ActiveBlock.ElementSetBlock block) {
                target = open(elementSets, block.name());
            } else if (next instanceof ActiveBlock.NodeSetBlock block) {
                target = open(nodeSets, block.name());
            } else if (next instanceof ActiveBlock.SurfaceSetBlock block) {
                target = open(surfaceSets, block.name());
            } else if (next instanceof ActiveBlock.SurfaceBlock block) {
                SurfaceRecords surface = new SurfaceRecords(block.surfaceId(), block.surfaceSetName(), line, new ArrayList<>());
                surfaces.add(surface);
                target = surface.records();
            } else if (next instanceof ActiveBlock.Deferred block) {
                switch (block.kind()) {
                    case MATERIAL -> materialLines.add(line);
                    case ELPROP -> elpropLines.add(line);
                    case RSYS -> rsysLines.add(line);
                }
            }
        }

        private static List<RawRecord> open(List<NamedRecords> sets, String name) {
            NamedRecords set = new NamedRecords(name, new ArrayList<>());
            sets.add(set);
            return set.records();
        }

        NodeTable buildNodes() {
            int[] ids = new int[coordinates.size()];
            double[] xyz = new double[coordinates.size() * 3];
            int count = 0;
            for (RawRecord record : coordinates) {
                List<String> tokens = record.tokens();
                if (tokens.size() < 4) {
                    warnings.add("第 " + (record.line() + 1) + " 行：节点坐标不足 3 个，已跳过");
                    continue;
                }
                try {
                    int id = PermasTokens.parseInt(tokens.get(0));
                    double x = PermasTokens.parseDouble(tokens.get(1));
                    double y = PermasTokens.parseDouble(tokens.get(2));
                    double z = PermasTokens.parseDouble(tokens.get(3));
                    ids[count] = id;
                    xyz[count * 3] = x;
                    xyz[count * 3 + 1] = y;
                    xyz[count * 3 + 2] = z;
                    count++;
                } catch (NumberFormatException e) {
                    warnings.add("第 " + (record.line() + 1) + " 行：节点坐标无法解析，已跳过");
                }
            }
            return new NodeTable(Arrays.copyOf(ids, count), Arrays.copyOf(xyz, count * 3));
        }

        ElementTable buildElements(Topology topology) {
            List<RawRecord> records = elements.get(topology);
            int width = topology.nodeCount();
            int[] ids = new int[records.size()];
            int[] connectivity = new int[records.size() * width];
            int count = 0;
            for (RawRecord record : records) {
                List<String> tokens = record.tokens();
                if (tokens.size() != width + 1) {
                    warnings.add("第 " + (record.line() + 1) + " 行：" + topology + " 单元应有 " + width
                            + " 个节点，实际 " + (tokens.size() - 1) + "，已跳过");
                    continue;
                }
                try {
                    int[] row = new int[width];
                    for (int k = 0; k < width; k++) {
                        row[k] = PermasTokens.parseInt(tokens.get(k + 1));
                    }
                    ids[count] = PermasTokens.parseInt(tokens.get(0));
                    System.arraycopy(row, 0, connectivity, count * width, width);
                    count++;
                } catch (NumberFormatException e) {
                    warnings.add("第 " + (record.line() + 1) + " 行：" + topology + " 单元无法解析，已跳过");
                }
            }
            return new ElementTable(topology, Arrays.copyOf(ids, count), Arrays.copyOf(connectivity, count * width));
        }

        List<ElementSet> buildElementSets() {
            List<ElementSet> result = new ArrayList<>();
            for (NamedRecords set : elementSets) {
                result.add(new ElementSet(set.name(), flatten(set)));
            }
            return result;
        }

        List<NodeSet> buildNodeSets() {
            List<NodeSet> result = new ArrayList<>();
            for (NamedRecords set : nodeSets) {
                result.add(new NodeSet(set.name(), flatten(set)));
            }
            return result;
        }

        List<SurfaceSet> buildSurfaceSets() {
            List<SurfaceSet> result = new ArrayList<>();
            for (NamedRecords set : surfaceSets) {
                result.add(new SurfaceSet(set.name(), flatten(set)));
            }
            return result;
        }

        List<Surface> buildSurfaces() {
            List<Surface> result = new ArrayList<>();
            for (SurfaceRecords surface : surfaces) {
                int id;
                try {
                    id = PermasTokens.parseInt(surface.surfaceId());
                } catch (NumberFormatException | NullPointerException e) {
                    warnings.add("第 " + (surface.line() + 1) + " 行：面缺少有效的 SURFID，已跳过");
                    continue;
                }
                int[] values = flatten(new NamedRecords(surface.surfaceSetName(), surface.records()));
                if (values.length % 2 != 0) {
                    warnings.add("面 " + id + " 的（单元，面号）数据个数为奇数，已丢弃最后一个值");
                    values = Arrays.copyOf(values, values.length - 1);
                }
                if (values.length == 0) {
                    warnings.add("面 " + id + " 没有任何（单元，面号）数据，已跳过");
                    continue;
                }
                result.add(new Surface(id, surface.surfaceSetName(), values));
            }
            return result;
        }

        private int[] flatten(NamedRecords set) {
            int total = 0;
            for (RawRecord record : set.records()) {
                total += record.tokens().size();
            }
            int[] ids = new int[total];
            int count = 0;
            for (RawRecord record : set.records()) {
                for (String token : record.tokens()) {
                    try {
                        ids[count++] = PermasTokens.parseInt(token);
                    } catch (NumberFormatException e) {
                        count--;
                        warnings.add("第 " + (record.line() + 1) + " 行：集合 " + set.name() + " 中的 ID \"" + token
                                + "\" 无法解析，已跳过");
                    }
                }
            }
            return Arrays.copyOf(ids, count);
        }
    }
}
