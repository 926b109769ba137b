package org.vmapconv.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.vmapconv.converter.PermasToVmapConverter;
import org.vmapconv.converter.ResultSelection;
import org.vmapconv.converter.VmapToPermasAsciiConverter;
import org.vmapconv.converter.dto.AsciiConversionResult;
import org.vmapconv.converter.dto.PermasModelInfoResult;
import org.vmapconv.converter.dto.VmapConversionResult;

import java.io.IOException;

/**
 * 转换器 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>PERMAS-HDF → VMAP（{@code permas_to_vmap}）。</li>
 *   <li>VMAP → PERMAS ASCII（{@code vmap_to_permas_ascii}）。</li>
 *   <li>只读查看 PERMAS-HDF 模型与结果概况（{@code permas_model_info}）。</li>
 * </ul>
 * <p>
 * 文件名均相对 {@code app.convert.data-dir}，输出文件写入同一目录。
 */
@Component
public class ConversionMcpTools {

    private static final Logger log = LoggerFactory.getLogger(ConversionMcpTools.class);

    private final PermasToVmapConverter permasToVmap;
    private final VmapToPermasAsciiConverter vmapToAscii;

    public ConversionMcpTools(PermasToVmapConverter permasToVmap, VmapToPermasAsciiConverter vmapToAscii) {
        this.permasToVmap = permasToVmap;
        this.vmapToAscii = vmapToAscii;
    }

    @Tool(
            name = "permas_to_vmap",
            description = "把 PERMAS-HDF 模型（可选单独的结果文件）转换为 VMAP 文件，输出文件名为 <模型文件名>_toVMAP.hdf。"
    )
    public VmapConversionResult permasToVmap(
            @ToolParam(description = "PERMAS-HDF 模型文件名（.hdf/.h5，相对数据目录）") String modelFile,
            @ToolParam(required = false, description = "PERMAS-HDF 结果文件名；为空时从模型文件读取结果") String resultsFile,
            @ToolParam(required = false, description = "时间步或频率：ALL（默认）、NONE 或逗号分隔的数值") String timesteps,
            @ToolParam(required = false, description = "节点结果变量：ALL（默认）、NONE 或逗号分隔的变量名（下划线代替空格）") String variables
    ) {
        ResultSelection selection = ResultSelection.parse(timesteps, variables);
        try {
            return permasToVmap.convertFiles(modelFile, resultsFile, selection);
        } catch (IOException e) {
            log.error("PERMAS → VMAP 转换失败：{}", modelFile, e);
            throw new IllegalStateException("读写文件失败：" + modelFile, e);
        }
    }

    @Tool(
            name = "vmap_to_permas_ascii",
            description = "把 VMAP 文件中的模型（节点、单元、集合、面、材料）写成 PERMAS ASCII 输入文件，输出文件名为 <文件名>_toPERMASASCII.dat。结果不转换。"
    )
    public AsciiConversionResult vmapToPermasAscii(
            @ToolParam(description = "VMAP 文件名（.hdf/.h5，相对数据目录）") String file
    ) {
        try {
            return vmapToAscii.convertFile(file);
        } catch (IOException e) {
            log.error("VMAP → PERMAS ASCII 转换失败：{}", file, e);
            throw new IllegalStateException("读写文件失败：" + file, e);
        }
    }

    @Tool(
            name = "permas_model_info",
            description = "只读解析 PERMAS-HDF 文件：节点/单元数量、部件、集合、面、材料、分析类型、时间步与结果变量。不写出任何文件。"
    )
    public PermasModelInfoResult permasModelInfo(
            @ToolParam(description = "PERMAS-HDF 文件名（.hdf/.h5，相对数据目录）") String file
    ) {
        try {
            return permasToVmap.describe(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + file, e);
        }
    }
}
