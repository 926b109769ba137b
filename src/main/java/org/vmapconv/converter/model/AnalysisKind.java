package org.vmapconv.converter.model;

import java.util.Optional;

/**
 * 支持的 PERMAS 分析类型，以及对应的 VMAP 状态名称与时间轴类别。
 */
public enum AnalysisKind {

    STATIC("STATIC", "STATIC_LINEAR", TemporalCategory.TIMESTEPS),
    NLMATERIAL("NLMATERIAL", "STATIC_NONLINEAR", TemporalCategory.TIMESTEPS),
    TEMPERATURE("TEMPERATURE", "STATIC_LINEAR", TemporalCategory.TIMESTEPS),
    NLTEMP("NLTEMP", "STATIC_NONLINEAR", TemporalCategory.TIMESTEPS),
    DIRECT_TEMPERATURE("DIRECT TEMPERATURE", "TRANSIENT_LINEAR", TemporalCategory.TIMESTEPS),
    DIRECT_NLTEMP("DIRECT NLTEMP", "TRANSIENT_NONLINEAR", TemporalCategory.TIMESTEPS),
    VIBRATION_ANALYSIS("VIBRATION ANALYSIS", "MODAL", TemporalCategory.FREQUENCIES);

    /**
     * 时间轴含义：时间步（时间量纲）或频率（1/时间量纲）。
     */
    public enum TemporalCategory {
        TIMESTEPS,
        FREQUENCIES
    }

    private final String permasName;
    private final String stateName;
    private final TemporalCategory category;

    AnalysisKind(String permasName, String stateName, TemporalCategory category) {
        this.permasName = permasName;
        this.stateName = stateName;
        this.category = category;
    }

    public String permasName() {
        return permasName;
    }

    public String stateName() {
        return stateName;
    }

    public TemporalCategory category() {
        return category;
    }

    public boolean isModal() {
        return category == TemporalCategory.FREQUENCIES;
    }

    /**
     * 按前缀匹配 {@code .Analysis} 文本（例如 "STATIC ANALYSIS" 匹配 STATIC）。
     */
    public static Optional<AnalysisKind> matchPrefix(String analysisText) {
        if (analysisText == null) {
            return Optional.empty();
        }
        String text = analysisText.trim();
        for (AnalysisKind kind : values()) {
            if (text.startsWith(kind.permasName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
