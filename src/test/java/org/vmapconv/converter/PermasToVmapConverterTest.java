package org.vmapconv.converter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vmapconv.converter.dto.AsciiConversionResult;
import org.vmapconv.converter.dto.PartSummary;
import org.vmapconv.converter.dto.PermasModelInfoResult;
import org.vmapconv.converter.dto.VmapConversionResult;
import org.vmapconv.converter.hdf.HdfFiles;
import org.vmapconv.converter.hdf.HdfTree;
import org.vmapconv.converter.model.AnalysisKind;
import org.vmapconv.converter.model.Part;
import org.vmapconv.converter.model.ReconciledModel;
import org.vmapconv.converter.model.Topology;
import org.vmapconv.converter.permas.PermasModelParser;
import org.vmapconv.converter.reconcile.ModelReconciler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class PermasToVmapConverterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

    private static PermasToVmapConverter converter(ConverterProperties properties) {
        return new PermasToVmapConverter(properties, new DataPathResolver(properties), CLOCK);
    }

    @Test
    void convert_withNoneSelection_writesGeometryAndEmptyVariables() {
        HdfTree tree = PermasFixtures.staticResultTree();

        PermasToVmapConverter.Conversion conversion = converter(PermasFixtures.properties("."))
                .convert(tree, tree, ResultSelection.parse(null, "NONE"));

        HdfTree vmap = conversion.vmap();
        assertThat(vmap.isGroup("/VMAP/VARIABLES")).isTrue();
        assertThat(vmap.childNames("/VMAP/VARIABLES")).isEmpty();
        assertThat(vmap.childNames("/VMAP/GEOMETRY")).containsExactly("0", "1");
        assertThat(conversion.results().isEmpty()).isTrue();
        assertThat(conversion.variableBlocks()).isZero();
    }

    @Test
    void convert_withMissingVariables_writesNoStates() {
        HdfTree tree = PermasFixtures.staticResultTree();

        PermasToVmapConverter.Conversion conversion = converter(PermasFixtures.properties("."))
                .convert(tree, tree, ResultSelection.parse("ALL", "GAP_WIDTH,CONTACT_STATUS"));

        assertThat(conversion.vmap().childNames("/VMAP/VARIABLES")).isEmpty();
        assertThat(conversion.parts()).hasSize(2);
        assertThat(conversion.variableBlocks()).isZero();
    }

    @Test
    void convert_staticResults_writesStatePerTimestepAndBlockPerPart() {
        HdfTree tree = PermasFixtures.staticResultTree();

        PermasToVmapConverter.Conversion conversion = converter(PermasFixtures.properties("."))
                .convert(tree, tree, ResultSelection.all());

        HdfTree vmap = conversion.vmap();
        assertThat(vmap.childNames("/VMAP/VARIABLES")).containsExactly("STATE-0", "STATE-1");
        // TEMPERATURE 只覆盖 PART_A 的节点 1～4
        assertThat(conversion.variableBlocks()).isEqualTo(6);
        assertThat(vmap.childNames("/VMAP/VARIABLES/STATE-0/1")).containsExactly("DISPLACEMENT");
        assertThat(vmap.intArray("/VMAP/VARIABLES/STATE-0/0/TEMPERATURE/MYGEOMETRYIDS")).containsExactly(1, 2, 3, 4);
        assertThat(vmap.stringAttribute("/VMAP", "MYFILEDATE")).isEqualTo("2026-01-02");
        assertThat(conversion.results().analysis().kind()).isEqualTo(AnalysisKind.STATIC);
        assertThat(conversion.warnings()).doesNotHaveDuplicates();
    }

    @Test
    void convert_singlePart_takesResultsOfNodesOutsideThePart() {
        String text = PermasFixtures.modelText().replace("    $ESET NAME = PART_B\n      3\n", "");
        HdfTree tree = new HdfTree();
        tree.putDataset(PermasFixtures.SITUATION_PATH + "/.Model", text.lines().toArray(String[]::new));
        tree.putDataset(PermasFixtures.SITUATION_PATH + "/.Analysis", new String[]{"STATIC ANALYSIS"});
        PermasFixtures.putVariable(tree, "DISPLACEMENT", new double[]{1.0}, new int[]{1, 2, 20}, 3);

        PermasToVmapConverter.Conversion conversion = converter(PermasFixtures.properties("."))
                .convert(tree, tree, ResultSelection.all());

        assertThat(conversion.parts()).hasSize(1);
        assertThat(conversion.variableBlocks()).isEqualTo(1);
        assertThat(conversion.vmap().intArray("/VMAP/VARIABLES/STATE-0/0/DISPLACEMENT/MYGEOMETRYIDS"))
                .containsExactly(1, 2, 20);
    }

    @Test
    void convert_thenAscii_reparsesToSameParts() {
        HdfTree tree = PermasFixtures.staticResultTree();
        ConverterProperties properties = PermasFixtures.properties(".");
        PermasToVmapConverter.Conversion conversion = converter(properties).convert(tree, tree, ResultSelection.all());
        List<String> warnings = new ArrayList<>();

        String ascii = new VmapToPermasAsciiConverter(properties, null).toAscii(conversion.vmap(), warnings);
        ReconciledModel reparsed = ModelReconciler.reconcile(PermasModelParser.parse(ascii.lines().toList()));

        ReconciledModel original = conversion.model();
        assertThat(reparsed.parts()).extracting(Part::name).containsExactly("PART_A", "PART_B");
        for (int i = 0; i < original.parts().size(); i++) {
            Part expected = original.parts().get(i);
            Part actual = reparsed.parts().get(i);
            assertThat(actual.topology()).isEqualTo(expected.topology());
            assertThat(actual.elementIds()).containsExactly(expected.elementIds());
            assertThat(actual.nodeIds()).containsExactly(expected.nodeIds());
            assertThat(actual.materialName()).isEqualTo("STEEL");
        }
        assertThat(reparsed.elementTable(Topology.TET10).connectivity(0))
                .containsExactly(original.elementTable(Topology.TET10).connectivity(0));
        assertThat(ascii.lines()).contains(tet10Line());
        assertThat(reparsed.surfaces()).hasSize(1);
        assertThat(warnings).isEmpty();
    }

    @Test
    void convertFiles_writesVmapNextToModelAndConvertsBackToAscii(@TempDir Path dir) throws Exception {
        HdfFiles.write(PermasFixtures.staticResultTree(), dir.resolve("model.hdf"));
        ConverterProperties properties = PermasFixtures.properties(dir.toString());

        VmapConversionResult result = converter(properties).convertFiles("model.hdf", null, ResultSelection.all());

        assertThat(result.outputFile()).isEqualTo("model_toVMAP.hdf");
        assertThat(result.resultsFile()).isEqualTo("model.hdf");
        assertThat(result.parts()).extracting(PartSummary::name).containsExactly("PART_A", "PART_B");
        assertThat(result.parts()).extracting(PartSummary::topology).containsExactly("HEXE8", "TET10");
        assertThat(result.temporalValues()).containsExactly(1.0, 2.0);
        assertThat(result.variableBlocks()).isEqualTo(6);
        assertThat(dir.resolve("model_toVMAP.hdf")).isRegularFile();

        AsciiConversionResult ascii = new VmapToPermasAsciiConverter(properties, new DataPathResolver(properties))
                .convertFile("model_toVMAP.hdf");

        assertThat(ascii.outputFile()).isEqualTo("model_toVMAP_toPERMASASCII.dat");
        assertThat(ascii.nodeCount()).isEqualTo(22);
        assertThat(ascii.elementCount()).isEqualTo(3);
        assertThat(ascii.elementSets()).containsExactly("PART_A", "PART_B");
        assertThat(ascii.resultStates()).isEqualTo(2);
        assertThat(Files.readString(dir.resolve("model_toVMAP_toPERMASASCII.dat"))).startsWith("$ENTER COMPONENT").contains("$FIN");
    }

    @Test
    void describe_summarizesModelAndResults(@TempDir Path dir) throws Exception {
        HdfFiles.write(PermasFixtures.staticResultTree(), dir.resolve("model.h5"));
        ConverterProperties properties = PermasFixtures.properties(dir.toString());

        PermasModelInfoResult info = converter(properties).describe("model.h5");

        assertThat(info.nodeCount()).isEqualTo(22);
        assertThat(info.hexe8Count()).isEqualTo(2);
        assertThat(info.tet10Count()).isEqualTo(1);
        assertThat(info.nodeSets()).containsExactly("NS_TOP");
        assertThat(info.surfaceSets()).containsExactly("SF1");
        assertThat(info.materials()).containsExactly("STEEL");
        assertThat(info.coordinateSystems()).isEqualTo(1);
        assertThat(info.analysis()).isEqualTo("STATIC");
        assertThat(info.variables()).containsExactly("DISPLACEMENT", "TEMPERATURE");
    }

    private static String tet10Line() {
        StringBuilder line = new StringBuilder("          ").append(String.format(Locale.ROOT, "%10d", 3));
        for (int id : PermasFixtures.TET10_PERMAS) {
            line.append(' ').append(String.format(Locale.ROOT, "%10d", id));
        }
        return line.toString();
    }
}
