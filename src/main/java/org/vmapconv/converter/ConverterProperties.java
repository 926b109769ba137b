package org.vmapconv.converter;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * 转换器配置（{@code app.convert.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>输入文件名相对 {@link #dataDir} 解析，输出文件也写在该目录下，路径不允许逃逸出该目录。</li>
 *   <li>输出文件名 = 输入文件名去掉最后一个后缀 + 输出后缀。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.convert")
public class ConverterProperties {

    /**
     * 输入/输出文件所在目录。
     */
    @NotBlank
    private String dataDir = "./data";

    /**
     * 允许的输入文件后缀（不含点）。
     */
    @NotEmpty
    private List<String> inputSuffixes = List.of("hdf", "h5");

    /**
     * PERMAS-HDF → VMAP 的输出文件后缀。
     */
    @NotBlank
    private String vmapOutputSuffix = "_toVMAP.hdf";

    /**
     * VMAP → PERMAS ASCII 的输出文件后缀。
     */
    @NotBlank
    private String asciiOutputSuffix = "_toPERMASASCII.dat";

    /**
     * 复模态配对的频率相对容差：相邻频率相对差小于该值时，后一个视为虚部。
     */
    @DecimalMin(value = "0.0", inclusive = false)
    private double modalPairTolerance = 1e-6;

    /**
     * PERMAS ASCII 中 ID 列表每行的个数。
     */
    @Min(1)
    @Max(100)
    private int asciiIdsPerLine = 14;

    /**
     * 写入 VMAP 元信息的导出程序名称。
     */
    @NotBlank
    private String exporterName = "Permashdf2Vmap";

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public List<String> getInputSuffixes() {
        return inputSuffixes;
    }

    public void setInputSuffixes(List<String> inputSuffixes) {
        this.inputSuffixes = inputSuffixes;
    }

    public String getVmapOutputSuffix() {
        return vmapOutputSuffix;
    }

    public void setVmapOutputSuffix(String vmapOutputSuffix) {
        this.vmapOutputSuffix = vmapOutputSuffix;
    }

    public String getAsciiOutputSuffix() {
        return asciiOutputSuffix;
    }

    public void setAsciiOutputSuffix(String asciiOutputSuffix) {
        this.asciiOutputSuffix = asciiOutputSuffix;
    }

    public double getModalPairTolerance() {
        return modalPairTolerance;
    }

    public void setModalPairTolerance(double modalPairTolerance) {
        this.modalPairTolerance = modalPairTolerance;
    }

    public int getAsciiIdsPerLine() {
        return asciiIdsPerLine;
    }

    public void setAsciiIdsPerLine(int asciiIdsPerLine) {
        this.asciiIdsPerLine = asciiIdsPerLine;
    }

    public String getExporterName() {
        return exporterName;
    }

    public void setExporterName(String exporterName) {
        this.exporterName = exporterName;
    }
}
