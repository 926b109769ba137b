package org.vmapconv.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vmapconv.converter.dto.PartSummary;
import org.vmapconv.converter.dto.PermasModelInfoResult;
import org.vmapconv.converter.dto.VmapConversionResult;
import org.vmapconv.converter.hdf.HdfFiles;
import org.vmapconv.converter.hdf.HdfTree;
import org.vmapconv.converter.model.Material;
import org.vmapconv.converter.model.NodeSet;
import org.vmapconv.converter.model.Part;
import org.vmapconv.converter.model.ReconciledModel;
import org.vmapconv.converter.model.SurfaceSet;
import org.vmapconv.converter.model.Topology;
import org.vmapconv.converter.permas.PermasHdfLayout;
import org.vmapconv.converter.permas.PermasModelParser;
import org.vmapconv.converter.permas.PermasResultReader;
import org.vmapconv.converter.permas.ResultReadout;
import org.vmapconv.converter.reconcile.ModelReconciler;
import org.vmapconv.converter.reconcile.PartAssigner;
import org.vmapconv.converter.reconcile.PartAssignment;
import org.vmapconv.converter.vmap.GeometryEmitter;
import org.vmapconv.converter.vmap.PartGeometry;
import org.vmapconv.converter.vmap.SystemEmitter;
import org.vmapconv.converter.vmap.VariableEmitter;
import org.vmapconv.converter.vmap.VmapWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * PERMAS-HDF → VMAP 转换服务。
 * <p>
 * 流程：读取 {@code .Model} 文本 → 解析 → 后处理 → 读取结果 → 写出系统信息与几何 → 结果归属部件 → 写出变量。
 * 输入文件在处理前完整读入内存，输出文件在整棵 VMAP 树构建完成后一次写出，
 * 因此不可恢复的错误不会留下半成品输出文件。
 */
public class PermasToVmapConverter {

    private static final Logger log = LoggerFactory.getLogger(PermasToVmapConverter.class);

    private final ConverterProperties properties;
    private final DataPathResolver resolver;
    private final Clock clock;

    public PermasToVmapConverter(ConverterProperties properties, DataPathResolver resolver, Clock clock) {
        this.properties = properties;
        this.resolver = resolver;
        this.clock = clock;
    }

    /**
     * 转换数据目录中的文件。
     *
     * @param modelFile   PERMAS-HDF 模型文件名
     * @param resultsFile PERMAS-HDF 结果文件名；为空时从模型文件读取结果
     * @param selection   结果读取范围
     */
    public VmapConversionResult convertFiles(String modelFile, String resultsFile, ResultSelection selection) throws IOException {
        Path modelPath = resolver.resolveInput(modelFile);
        Path resultsPath = (resultsFile == null || resultsFile.isBlank()) ? modelPath : resolver.resolveInput(resultsFile);
        Path outputPath = resolver.resolveOutput(modelFile, properties.getVmapOutputSuffix());
        log.info("模型输入文件：{}，结果输入文件：{}", modelPath, resultsPath);

        HdfTree modelTree = HdfFiles.read(modelPath);
        HdfTree resultTree = resultsPath.equals(modelPath) ? modelTree : HdfFiles.read(resultsPath);
        Conversion conversion = convert(modelTree, resultTree, selection);

        HdfFiles.write(conversion.vmap(), outputPath);
        log.info("已写出 VMAP 文件：{}", outputPath);

        ResultReadout results = conversion.results();
        return new VmapConversionResult(
                modelPath.getFileName().toString(),
                resultsPath.getFileName().toString(),
                outputPath.getFileName().toString(),
                conversion.model().parts().stream().map(PermasToVmapConverter::summary).toList(),
                results.analysis() == null ? null : results.analysis().kind().permasName(),
                results.analysis() == null ? null : results.analysis().stateName(),
                results.temporalValues(),
                results.variableNames(),
                conversion.variableBlocks(),
                conversion.warnings()
        );
    }

    /**
     * 内存中的转换：不读写任何文件。
     */
    public Conversion convert(HdfTree modelTree, HdfTree resultTree, ResultSelection selection) {
        List<String> warnings = new ArrayList<>();

        log.info("读取 PERMAS 模型");
        List<String> lines = PermasHdfLayout.readModelLines(modelTree, warnings);
        ReconciledModel model = ModelReconciler.reconcile(PermasModelParser.parse(lines));
        warnings.addAll(model.warnings());

        log.info("读取 PERMAS 结果");
        ResultReadout results = PermasResultReader.read(resultTree, selection, warnings);

        log.info("写出 VMAP");
        VmapWriter writer = new VmapWriter(new HdfTree());
        SystemEmitter.emit(model, writer, properties.getExporterName(), LocalDateTime.now(clock));
        List<PartGeometry> geometry = GeometryEmitter.emit(model, writer, warnings);

        int blocks = 0;
        if (results.isEmpty()) {
            log.info("没有结果，不写出 VARIABLES");
        } else {
            PartAssignment assignment = PartAssigner.assign(results.table(), model.parts());
            blocks = VariableEmitter.emit(results.table(), assignment, results.analysis(), geometry, writer,
                    properties.getModalPairTolerance(), warnings);
            log.info("写出 {} 个状态，{} 个变量块", results.temporalValues().size(), blocks);
        }

        List<String> distinct = List.copyOf(new LinkedHashSet<>(warnings));
        for (String warning : distinct) {
            log.warn(warning);
        }
        return new Conversion(writer.tree(), model, geometry, results, blocks, distinct);
    }

    /**
     * 只读取并汇总 PERMAS-HDF 文件的模型与结果信息。
     */
    public PermasModelInfoResult describe(String file) throws IOException {
        Path path = resolver.resolveInput(file);
        HdfTree tree = HdfFiles.read(path);
        List<String> warnings = new ArrayList<>();
        ReconciledModel model = ModelReconciler.reconcile(PermasModelParser.parse(PermasHdfLayout.readModelLines(tree, warnings)));
        warnings.addAll(model.warnings());
        ResultReadout results = PermasResultReader.read(tree, ResultSelection.all(), warnings);
        return new PermasModelInfoResult(
                path.getFileName().toString(),
                model.nodes().size(),
                model.elementTable(Topology.HEXE8).size(),
                model.elementTable(Topology.TET10).size(),
                model.parts().stream().map(PermasToVmapConverter::summary).toList(),
                model.nodeSets().stream().map(NodeSet::name).toList(),
                model.surfaces().size(),
                model.surfaceSets().stream().map(SurfaceSet::name).toList(),
                model.materials().stream().map(Material::name).toList(),
                model.coordinateSystems().size(),
                results.analysis() == null ? null : results.analysis().kind().permasName(),
                results.analysis() == null ? null : results.analysis().stateName(),
                results.temporalValues(),
                results.variableNames(),
                List.copyOf(new LinkedHashSet<>(warnings))
        );
    }

    static PartSummary summary(Part part) {
        return new PartSummary(part.name(), part.topology().permasName(), part.elementCount(), part.nodeCount(),
                part.materialName());
    }

    /**
     * 内存转换的结果。
     *
     * @param vmap           VMAP 树
     * @param model          后处理后的模型
     * @param parts          写出的部件
     * @param results        读取的结果
     * @param variableBlocks 写出的变量块数量
     * @param warnings       告警（去重）
     */
    public record Conversion(
            HdfTree vmap,
            ReconciledModel model,
            List<PartGeometry> parts,
            ResultReadout results,
            int variableBlocks,
            List<String> warnings
    ) {
    }
}
