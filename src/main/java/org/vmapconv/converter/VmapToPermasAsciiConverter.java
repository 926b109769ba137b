package org.vmapconv.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.ascii.PermasAsciiWriter;
import org.vmapconv.converter.dto.AsciiConversionResult;
import org.vmapconv.converter.hdf.HdfFiles;
import org.vmapconv.converter.hdf.HdfTree;
import org.vmapconv.converter.model.ElementSet;
import org.vmapconv.converter.model.ElementTable;
import org.vmapconv.converter.model.FlatPermasModel;
import org.vmapconv.converter.model.Material;
import org.vmapconv.converter.model.NodeSet;
import org.vmapconv.converter.vmap.VmapModelReader;
import org.vmapconv.converter.vmap.VmapReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * VMAP → PERMAS ASCII 转换服务：只转换模型（几何、集合、面、材料），结果不转换，只统计 {@code STATE-*} 组的数量。
 */
public class VmapToPermasAsciiConverter {

    private static final Logger log = LoggerFactory.getLogger(VmapToPermasAsciiConverter.class);

    private final ConverterProperties properties;
    private final DataPathResolver resolver;

    public VmapToPermasAsciiConverter(ConverterProperties properties, DataPathResolver resolver) {
        this.properties = properties;
        this.resolver = resolver;
    }

    public AsciiConversionResult convertFile(String inputFile) throws IOException {
        Path input = resolver.resolveInput(inputFile);
        Path output = resolver.resolveOutput(inputFile, properties.getAsciiOutputSuffix());
        log.info("VMAP 输入文件：{}", input);

        HdfTree tree = HdfFiles.read(input);
        List<String> warnings = new ArrayList<>();
        FlatPermasModel model = VmapModelReader.read(tree, warnings);
        int resultStates = new VmapReader(tree).stateIds().size();
        String text = PermasAsciiWriter.write(model, properties.getAsciiIdsPerLine());

        Files.writeString(output, text, StandardCharsets.UTF_8);
        log.info("已写出 PERMAS ASCII 文件：{}", output);

        List<String> distinct = List.copyOf(new LinkedHashSet<>(warnings));
        for (String warning : distinct) {
            log.warn(warning);
        }
        int elementCount = 0;
        for (ElementTable table : model.elements().values()) {
            elementCount += table.size();
        }
        return new AsciiConversionResult(
                input.getFileName().toString(),
                output.getFileName().toString(),
                model.nodes().size(),
                elementCount,
                model.parts().stream().map(ElementSet::name).toList(),
                model.nodeSets().stream().map(NodeSet::name).toList(),
                model.surfaces().size(),
                model.materials().stream().map(Material::name).toList(),
                resultStates,
                distinct
        );
    }

    /**
     * 内存中的转换：VMAP 树 → PERMAS ASCII 文本。
     */
    public String toAscii(HdfTree tree, List<String> warnings) {
        return PermasAsciiWriter.write(VmapModelReader.read(tree, warnings), properties.getAsciiIdsPerLine());
    }
}
