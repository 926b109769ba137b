package org.vmapconv.converter.vmap;

import org.junit.jupiter.api.Test;
import org.vmapconv.converter.PermasFixtures;
import org.vmapconv.converter.hdf.HdfTree;
import org.vmapconv.converter.model.AnalysisInfo;
import org.vmapconv.converter.model.AnalysisKind;
import org.vmapconv.converter.model.ReconciledModel;
import org.vmapconv.converter.model.ResultColumn;
import org.vmapconv.converter.model.ResultTable;
import org.vmapconv.converter.permas.PermasModelParser;
import org.vmapconv.converter.reconcile.ModelReconciler;
import org.vmapconv.converter.reconcile.PartAssigner;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.vmapconv.converter.vmap.ModeComponent.IMAGINARY;
import static org.vmapconv.converter.vmap.ModeComponent.REAL;

class VariableEmitterTest {

    private static final int[] PART_A_NODES = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12};

    @Test
    void classifyComponents_pairsNearlyEqualFrequencies() {
        assertThat(VariableEmitter.classifyComponents(List.of(10.0, 10.000001, 25.0), true, 1e-6))
                .containsExactly(REAL, IMAGINARY, REAL);
        assertThat(VariableEmitter.classifyComponents(List.of(10.0, 10.0000001, 10.0000002), true, 1e-6))
                .containsExactly(REAL, IMAGINARY, REAL);
        assertThat(VariableEmitter.classifyComponents(List.of(0.0, 0.0), true, 1e-6))
                .containsExactly(REAL, IMAGINARY);
        assertThat(VariableEmitter.classifyComponents(List.of(1.0, 1.0000001), false, 1e-6))
                .containsExactly(REAL, REAL);
        assertThat(VariableEmitter.classifyComponents(List.of(10.0, 10.1), true, 1e-6))
                .containsExactly(REAL, REAL);
    }

    @Test
    void emit_writesModalStatesWithImaginaryComponents() {
        ReconciledModel model = ModelReconciler.reconcile(PermasModelParser.parse(PermasFixtures.modelLines()));
        VmapWriter writer = new VmapWriter(new HdfTree());
        List<String> warnings = new ArrayList<>();
        List<PartGeometry> parts = GeometryEmitter.emit(model, writer, warnings);

        List<Double> frequencies = List.of(10.0, 10.000001);
        List<ResultColumn> columns = new ArrayList<>();
        for (double frequency : frequencies) {
            columns.add(new ResultColumn("DISPLACEMENT", frequency, PART_A_NODES, 3, new double[PART_A_NODES.length * 3]));
        }
        ResultTable table = new ResultTable(columns);
        AnalysisInfo analysis = AnalysisInfo.of(AnalysisKind.VIBRATION_ANALYSIS, null, frequencies);

        int blocks = VariableEmitter.emit(table, PartAssigner.assign(table, model.parts()), analysis, parts, writer, 1e-6,
                warnings);
        HdfTree tree = writer.tree();

        assertThat(blocks).isEqualTo(2);
        assertThat(tree.stringAttribute("/VMAP/VARIABLES/STATE-0", "MYSTATENAME")).isEqualTo("MODAL");
        assertThat(tree.doubleAttribute("/VMAP/VARIABLES/STATE-1", "MYTOTALTIME")).isEqualTo(10.000001);
        assertThat(tree.stringAttribute("/VMAP/VARIABLES/STATE-0/0/DISPLACEMENT", "MYVARIABLEDESCRIPTION")).isEqualTo("REAL");
        assertThat(tree.stringAttribute("/VMAP/VARIABLES/STATE-1/0/DISPLACEMENT", "MYVARIABLEDESCRIPTION"))
                .isEqualTo("IMAGINARY");
        assertThat(tree.intAttribute("/VMAP/VARIABLES/STATE-1/0/DISPLACEMENT", "MYENTITY"))
                .isEqualTo(StateVariable.ENTITY_IMAGINARY);
        assertThat(tree.isGroup("/VMAP/VARIABLES/STATE-1/1")).isTrue();
        assertThat(tree.childNames("/VMAP/VARIABLES/STATE-1/1")).isEmpty();
        assertThat(warnings).isEmpty();
    }

    @Test
    void emit_writesGeometryIdsOnlyForPartialCoverage() {
        ReconciledModel model = ModelReconciler.reconcile(PermasModelParser.parse(PermasFixtures.modelLines()));
        VmapWriter writer = new VmapWriter(new HdfTree());
        List<String> warnings = new ArrayList<>();
        List<PartGeometry> parts = GeometryEmitter.emit(model, writer, warnings);

        int[] partial = {4, 2};
        ResultTable table = new ResultTable(List.of(
                new ResultColumn("TEMPERATURE", 1.0, partial, 1, new double[]{40.0, 20.0}),
                new ResultColumn("DISPLACEMENT", 1.0, PART_A_NODES, 3, new double[PART_A_NODES.length * 3]),
                new ResultColumn("TEMPERATURE", 1.0, partial, 1, new double[]{0.0, 0.0})));
        AnalysisInfo analysis = AnalysisInfo.of(AnalysisKind.STATIC, null, List.of(1.0));

        VariableEmitter.emit(table, PartAssigner.assign(table, model.parts()), analysis, parts, writer, 1e-6, warnings);
        HdfTree tree = writer.tree();

        String temperature = "/VMAP/VARIABLES/STATE-0/0/TEMPERATURE";
        assertThat(tree.intArray(temperature + "/MYGEOMETRYIDS")).containsExactly(4, 2);
        assertThat(tree.doubleArray(temperature + "/MYVALUES")).containsExactly(40.0, 20.0);
        assertThat(tree.intAttribute(temperature, "MYIDENTIFIER")).isEqualTo(1);
        assertThat(tree.intAttribute(temperature, "MYLOCATION")).isEqualTo(StateVariable.LOCATION_NODE);
        assertThat(tree.hasDataset("/VMAP/VARIABLES/STATE-0/0/DISPLACEMENT/MYGEOMETRYIDS")).isFalse();
        assertThat(tree.intAttribute("/VMAP/VARIABLES/STATE-0/0/DISPLACEMENT", "MYIDENTIFIER")).isZero();
        assertThat(warnings).singleElement().asString().contains("TEMPERATURE");
    }
}
