package org.vmapconv.cli;

import org.vmapconv.converter.ResultSelection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 解析后的命令行请求。
 *
 * @param command     子命令
 * @param modelFile   模型文件（vmap2ascii 时为 VMAP 文件）
 * @param resultsFile 结果文件（可为空）
 * @param selection   结果读取范围（vmap2ascii 时不使用）
 */
public record CommandLineRequest(
        Command command,
        String modelFile,
        String resultsFile,
        ResultSelection selection
) {
    public static final String TIMESTEPS = "timesteps=";
    public static final String VARIABLES = "variables_nodes=";

    public static final String USAGE = String.join(System.lineSeparator(),
            "用法：",
            "  permas2vmap <model.hdf> [<results.hdf>] [timesteps=ALL|NONE|t1,t2,...] [variables_nodes=ALL|NONE|DISPLACEMENT,GAP_WIDTH,...]",
            "  vmap2ascii <model_toVMAP.hdf>",
            "文件名相对 app.convert.data-dir；使用 --spring.profiles.active=mcp 以 MCP Server 方式运行。");

    public enum Command {
        PERMAS2VMAP("permas2vmap"),
        VMAP2ASCII("vmap2ascii");

        private final String argument;

        Command(String argument) {
            this.argument = argument;
        }

        public String argument() {
            return argument;
        }

        static Command fromArgument(String text) {
            for (Command command : values()) {
                if (command.argument.equals(text.toLowerCase(Locale.ROOT))) {
                    return command;
                }
            }
            throw new IllegalArgumentException("未知命令：" + text);
        }
    }

    /**
     * 解析位置参数（不含 {@code --} 开头的 Spring 选项）。
     *
     * @throws IllegalArgumentException 参数缺失、多余或无法识别
     */
    public static CommandLineRequest parse(List<String> args) {
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException("缺少命令");
        }
        Command command = Command.fromArgument(args.get(0));
        List<String> files = new ArrayList<>();
        String timesteps = null;
        String variables = null;
        for (String arg : args.subList(1, args.size())) {
            String lower = arg.toLowerCase(Locale.ROOT);
            if (lower.startsWith(TIMESTEPS) && command == Command.PERMAS2VMAP) {
                if (timesteps != null) {
                    throw new IllegalArgumentException("参数重复：" + arg);
                }
                timesteps = arg.substring(TIMESTEPS.length());
            } else if (lower.startsWith(VARIABLES) && command == Command.PERMAS2VMAP) {
                if (variables != null) {
                    throw new IllegalArgumentException("参数重复：" + arg);
                }
                variables = arg.substring(VARIABLES.length());
            } else if (arg.contains("=")) {
                throw new IllegalArgumentException("未知参数：" + arg);
            } else {
                files.add(arg);
            }
        }

        int maxFiles = command == Command.PERMAS2VMAP ? 2 : 1;
        if (files.isEmpty()) {
            throw new IllegalArgumentException("缺少输入文件");
        }
        if (files.size() > maxFiles) {
            throw new IllegalArgumentException("多余的参数：" + files.subList(maxFiles, files.size()));
        }
        if (command == Command.VMAP2ASCII) {
            return new CommandLineRequest(command, files.get(0), null, ResultSelection.none());
        }
        return new CommandLineRequest(command, files.get(0), files.size() > 1 ? files.get(1) : null,
                ResultSelection.parse(timesteps, variables));
    }
}
