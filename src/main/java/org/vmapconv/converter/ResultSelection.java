package org.vmapconv.converter;

import org.vmapconv.converter.model.NodalVariable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 结果读取范围：要读取的节点变量与时间值。
 *
 * @param variables  要读取的变量（PERMAS 名称，声明顺序）；空列表表示不读取任何结果
 * @param timesteps  要保留的时间值；null 表示全部
 */
public record ResultSelection(
        List<String> variables,
        Set<Double> timesteps
) {
    public static final String ALL = "ALL";
    public static final String NONE = "NONE";

    public ResultSelection {
        variables = List.copyOf(variables);
        timesteps = timesteps == null ? null : Set.copyOf(timesteps);
    }

    public static ResultSelection all() {
        return new ResultSelection(allVariables(), null);
    }

    public static ResultSelection none() {
        return new ResultSelection(List.of(), null);
    }

    /**
     * 解析命令行形式的选择：
     * <ul>
     *   <li>timesteps：空或 {@code ALL} 表示全部，{@code NONE} 表示不读取结果，否则为逗号分隔的浮点数。</li>
     *   <li>variables：空或 {@code ALL} 表示全部节点变量，{@code NONE} 表示不读取，
     *       否则为逗号分隔的变量名（下划线代替空格，例如 {@code GAP_WIDTH}）。</li>
     * </ul>
     *
     * @throws IllegalArgumentException 时间值不是数字或变量名不受支持
     */
    public static ResultSelection parse(String timesteps, String variables) {
        String timeText = timesteps == null ? "" : timesteps.trim();
        String variableText = variables == null ? "" : variables.trim();
        if (NONE.equalsIgnoreCase(timeText) || NONE.equalsIgnoreCase(variableText)) {
            return none();
        }

        Set<Double> times = null;
        if (!timeText.isEmpty() && !ALL.equalsIgnoreCase(timeText)) {
            times = new LinkedHashSet<>();
            for (String token : timeText.split(",")) {
                try {
                    times.add(Double.parseDouble(token.trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("timesteps 只能是 ALL、NONE 或逗号分隔的数值，例如 1.0,2.0：" + timesteps, e);
                }
            }
        }

        List<String> names;
        if (variableText.isEmpty() || ALL.equalsIgnoreCase(variableText)) {
            names = allVariables();
        } else {
            Set<String> selected = new LinkedHashSet<>();
            for (String token : variableText.split(",")) {
                NodalVariable variable = NodalVariable.fromArgument(token)
                        .orElseThrow(() -> new IllegalArgumentException("不支持的节点变量：" + token.trim()
                                + "，可用：" + Arrays.toString(NodalVariable.values()).toUpperCase(Locale.ROOT)));
                selected.add(variable.permasName());
            }
            names = new ArrayList<>(selected);
        }
        return new ResultSelection(names, times);
    }

    public boolean readsResults() {
        return !variables.isEmpty();
    }

    public boolean acceptsTemporal(double value) {
        return timesteps == null || timesteps.contains(value);
    }

    private static List<String> allVariables() {
        return Arrays.stream(NodalVariable.values()).map(NodalVariable::permasName).toList();
    }
}
