package org.vmapconv.converter.permas;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.model.CoordinateSystem;
import org.vmapconv.converter.model.Material;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 第二遍解析：从第一遍记录的位置开始，解析材料、单元属性与参考坐标系。
 */
final class PermasBlockParsers {

    private static final Logger log = LoggerFactory.getLogger(PermasBlockParsers.class);

    private PermasBlockParsers() {
    }

    /**
     * 解析 {@code $MATERIAL} 块，直到 {@code $END}。材料编号为该块在全部 {@code $MATERIAL} 中的序号。
     * <p>
     * 识别 {@code $ELASTIC GENERAL INPUT = DATA}（下一行：模量 泊松比）、
     * {@code $DENSITY GENERAL INPUT = DATA}（下一行：密度），
     * 其它 {@code $<KEY> GENERAL INPUT = DATA} 取下一行第一个值作为额外参数。
     */
    static List<Material> parseMaterials(List<String> lines, List<Integer> positions, List<String> warnings) {
        List<Material> materials = new ArrayList<>();
        for (int ordinal = 0; ordinal < positions.size(); ordinal++) {
            int start = positions.get(ordinal);
            String[] header = PermasTokens.tokenize(lines.get(start));
            String name = PermasTokens.keywordValue(header, "NAME");
            if (name == null) {
                warnings.add("材料没有名称，已跳过：" + lines.get(start).trim());
                continue;
            }
            if (!"ISO".equalsIgnoreCase(PermasTokens.keywordValue(header, "TYPE"))) {
                warnings.add("材料 " + name + " 不是 ISO 类型，按各向同性读取");
            }

            Double modulus = null;
            Double poisson = null;
            Double density = null;
            Map<String, Double> extra = new LinkedHashMap<>();
            int i = start + 1;
            while (i < lines.size()) {
                String[] tokens = PermasTokens.tokenize(lines.get(i));
                if (tokens.length == 0) {
                    i++;
                    continue;
                }
                String head = tokens[0].toUpperCase(Locale.ROOT);
                if ("$END".equals(head) || "$MATERIAL".equals(head) || "$EXIT".equals(head)) {
                    break;
                }
                if (head.startsWith("$")) {
                    String key = head.substring(1);
                    boolean generalData = isGeneralInputData(tokens);
                    double[] values = generalData && i + 1 < lines.size()
                            ? numbers(lines.get(i + 1), name, warnings)
                            : new double[0];
                    if (generalData) {
                        i++;
                    }
                    switch (key) {
                        case "ELASTIC" -> {
                            if (values.length >= 2) {
                                modulus = values[0];
                                poisson = values[1];
                            } else {
                                warnings.add("材料 " + name + " 的 $ELASTIC 块无法识别，已忽略");
                            }
                        }
                        case "DENSITY" -> {
                            if (values.length >= 1) {
                                density = values[0];
                            } else {
                                warnings.add("材料 " + name + " 的 $DENSITY 块无法识别，已忽略");
                            }
                        }
                        default -> {
                            if (values.length >= 1) {
                                extra.put(key, values[0]);
                            } else {
                                log.debug("材料 {} 的 {} 块未解析", name, head);
                            }
                        }
                    }
                }
                i++;
            }
            materials.add(new Material(name, ordinal, modulus, poisson, density, extra));
            log.debug("材料 {}：modulus={} poisson={} density={}", name, modulus, poisson, density);
        }
        return materials;
    }

    /**
     * 解析 {@code $ELPROP} 块中的 {@code <ESET> MATERIAL = <名称>} 行，遇到下一个指令或注释行结束。
     */
    static Map<String, String> parseElementProperties(List<String> lines, List<Integer> positions, List<String> warnings) {
        Map<String, String> result = new LinkedHashMap<>();
        for (int start : positions) {
            for (int i = start + 1; i < lines.size(); i++) {
                String[] tokens = PermasTokens.tokenize(lines.get(i));
                if (tokens.length == 0) {
                    continue;
                }
                if (tokens[0].startsWith("$") || tokens[0].startsWith("!")) {
                    break;
                }
                if (tokens.length >= 2 && "MATERIAL".equalsIgnoreCase(tokens[1])) {
                    String previous = result.put(tokens[0], PermasTokens.last(tokens));
                    if (previous != null && !previous.equals(PermasTokens.last(tokens))) {
                        warnings.add("单元集合 " + tokens[0] + " 的材料被重复指定，使用 " + PermasTokens.last(tokens));
                    }
                }
            }
        }
        return result;
    }

    /**
     * 解析 {@code $RSYS} 块：每条记录（含 {@code &} 续行）中的数值依次为编号、参考点、第一轴、第二轴。
     */
    static List<CoordinateSystem> parseCoordinateSystems(List<String> lines, List<Integer> positions, List<String> warnings) {
        List<List<Double>> records = new ArrayList<>();
        for (int start : positions) {
            for (int i = start + 1; i < lines.size(); i++) {
                String[] tokens = PermasTokens.tokenize(lines.get(i));
                if (tokens.length == 0) {
                    continue;
                }
                if (tokens[0].startsWith("$") || tokens[0].startsWith("!")) {
                    break;
                }
                if (PermasTokens.isDataLine(tokens)) {
                    records.add(new ArrayList<>());
                    addNumbers(records.get(records.size() - 1), tokens, 0);
                } else if (PermasTokens.isContinuation(tokens) && !records.isEmpty()) {
                    addNumbers(records.get(records.size() - 1), tokens, 1);
                } else {
                    warnings.add("第 " + (i + 1) + " 行：无法识别的 $RSYS 数据，块结束");
                    break;
                }
            }
        }
        List<CoordinateSystem> result = new ArrayList<>();
        for (List<Double> values : records) {
            if (values.size() < 10) {
                warnings.add("参考坐标系数据不足 10 个值，已跳过：" + values);
                continue;
            }
            result.add(new CoordinateSystem(
                    values.get(0).intValue(),
                    new double[]{values.get(1), values.get(2), values.get(3)},
                    new double[]{values.get(4), values.get(5), values.get(6)},
                    new double[]{values.get(7), values.get(8), values.get(9)}
            ));
        }
        return result;
    }

    /**
     * 查找 {@code MNODDIA} 参数（节径数），取该行最后一个值。
     */
    static Double findNodalDiameter(List<String> lines, List<String> warnings) {
        for (String line : lines) {
            String[] tokens = PermasTokens.tokenize(line);
            if (tokens.length >= 2 && "MNODDIA".equalsIgnoreCase(tokens[0])) {
                try {
                    return PermasTokens.parseDouble(PermasTokens.last(tokens));
                } catch (NumberFormatException e) {
                    warnings.add("MNODDIA 参数无法解析：" + line.trim());
                    return null;
                }
            }
        }
        return null;
    }

    private static boolean isGeneralInputData(String[] tokens) {
        return Arrays.stream(tokens).anyMatch("GENERAL"::equalsIgnoreCase)
                && "DATA".equalsIgnoreCase(PermasTokens.keywordValue(tokens, "INPUT"));
    }

    private static double[] numbers(String line, String material, List<String> warnings) {
        String[] tokens = PermasTokens.tokenize(line);
        double[] values = new double[tokens.length];
        int count = 0;
        for (String token : tokens) {
            try {
                values[count] = PermasTokens.parseDouble(token);
                count++;
            } catch (NumberFormatException e) {
                warnings.add("材料 " + material + " 的参数值无法解析：" + token);
                break;
            }
        }
        return Arrays.copyOf(values, count);
    }

    private static void addNumbers(List<Double> target, String[] tokens, int from) {
        for (int k = from; k < tokens.length; k++) {
            String token = tokens[k];
            if (token.isEmpty() || "+-.".indexOf(token.charAt(0)) < 0 && !Character.isDigit(token.charAt(0))) {
                continue;
            }
            try {
                target.add(PermasTokens.parseDouble(token.endsWith(":") ? token.substring(0, token.length() - 1) : token));
            } catch (NumberFormatException e) {
                log.debug("忽略 $RSYS 中的非数值：{}", token);
            }
        }
    }
}
