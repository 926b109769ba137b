package org.vmapconv.converter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * 数据目录路径解析：把文件名解析为数据目录内的绝对路径，并确保不会逃逸出数据目录。
 * <p>
 * 注意：
 * <ul>
 *   <li>先做规范化后的 startsWith 校验挡掉 {@code ../}；输入文件存在时再用 realPath 校验链接。</li>
 *   <li>输出文件可能尚不存在，只校验其父目录。</li>
 * </ul>
 */
public class DataPathResolver {

    private final Path root;
    private final List<String> inputSuffixes;

    public DataPathResolver(ConverterProperties properties) {
        this.root = Path.of(properties.getDataDir()).toAbsolutePath().normalize();
        this.inputSuffixes = properties.getInputSuffixes().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }

    public Path root() {
        return root;
    }

    /**
     * 解析输入文件：后缀必须在允许列表中，文件必须存在。
     *
     * @throws IllegalArgumentException 后缀不允许或路径越界
     * @throws NoSuchFileException      文件不存在
     */
    public Path resolveInput(String fileName) throws IOException {
        checkSuffix(fileName);
        Path path = resolve(fileName);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "输入文件不存在");
        }
        Path rootReal = root.toRealPath();
        if (!path.toRealPath().startsWith(rootReal)) {
            throw new IllegalArgumentException("路径通过链接逃逸出数据目录：" + fileName);
        }
        return path;
    }

    /**
     * 输出文件：输入文件名去掉最后一个后缀，加上 outputSuffix，写在数据目录内。
     */
    public Path resolveOutput(String inputFileName, String outputSuffix) {
        return resolve(outputName(inputFileName, outputSuffix));
    }

    public static String outputName(String inputFileName, String outputSuffix) {
        int dot = inputFileName.lastIndexOf('.');
        int slash = Math.max(inputFileName.lastIndexOf('/'), inputFileName.lastIndexOf('\\'));
        String base = dot > slash ? inputFileName.substring(0, dot) : inputFileName;
        return base + outputSuffix;
    }

    public void checkSuffix(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("文件名不能为空");
        }
        int dot = fileName.lastIndexOf('.');
        String suffix = dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!inputSuffixes.contains(suffix)) {
            throw new IllegalArgumentException("文件后缀必须是 " + inputSuffixes + " 之一：" + fileName);
        }
    }

    private Path resolve(String fileName) {
        Path raw = Path.of(fileName);
        Path absolute = raw.isAbsolute() ? raw.normalize() : root.resolve(raw).normalize();
        if (!absolute.startsWith(root)) {
            throw new IllegalArgumentException("路径不在数据目录范围内：" + fileName);
        }
        Path parent = absolute.getParent();
        if (parent != null && Files.isSymbolicLink(parent) && Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不允许通过符号链接目录访问：" + fileName);
        }
        return absolute;
    }
}
