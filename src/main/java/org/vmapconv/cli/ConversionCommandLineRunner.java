package org.vmapconv.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.vmapconv.converter.ConversionException;
import org.vmapconv.converter.PermasToVmapConverter;
import org.vmapconv.converter.VmapToPermasAsciiConverter;
import org.vmapconv.converter.dto.AsciiConversionResult;
import org.vmapconv.converter.dto.VmapConversionResult;

import java.io.IOException;
import java.util.List;

/**
 * 命令行入口：有位置参数时执行一次转换，并给出进程退出码（成功 0，任何错误 1）。
 * <p>
 * 没有位置参数时什么都不做（例如以 MCP Server 方式运行）。
 */
@Component
public class ConversionCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ConversionCommandLineRunner.class);

    private final PermasToVmapConverter permasToVmap;
    private final VmapToPermasAsciiConverter vmapToAscii;

    private volatile int exitCode;

    public ConversionCommandLineRunner(PermasToVmapConverter permasToVmap, VmapToPermasAsciiConverter vmapToAscii) {
        this.permasToVmap = permasToVmap;
        this.vmapToAscii = vmapToAscii;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return;
        }
        exitCode = execute(positional);
    }

    /**
     * 执行一次命令并返回退出码。
     */
    public int execute(List<String> args) {
        try {
            CommandLineRequest request = CommandLineRequest.parse(args);
            switch (request.command()) {
                case PERMAS2VMAP -> {
                    VmapConversionResult result = permasToVmap.convertFiles(request.modelFile(), request.resultsFile(),
                            request.selection());
                    log.info("完成：{}（{} 个部件，{} 个变量块，{} 条告警）", result.outputFile(), result.parts().size(),
                            result.variableBlocks(), result.warnings().size());
                }
                case VMAP2ASCII -> {
                    AsciiConversionResult result = vmapToAscii.convertFile(request.modelFile());
                    log.info("完成：{}（{} 个节点，{} 个单元，{} 条告警）", result.outputFile(), result.nodeCount(),
                            result.elementCount(), result.warnings().size());
                }
            }
            return 0;
        } catch (IllegalArgumentException e) {
            log.error("参数错误：{}", e.getMessage());
            log.error(CommandLineRequest.USAGE);
            return 1;
        } catch (IOException e) {
            log.error("文件错误：{}", e.getMessage(), e);
            return 1;
        } catch (ConversionException e) {
            log.error("转换失败：{}", e.getMessage());
            return 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
