package org.vmapconv.converter.permas;

import org.junit.jupiter.api.Test;
import org.vmapconv.converter.ConversionException;
import org.vmapconv.converter.PermasFixtures;
import org.vmapconv.converter.ResultSelection;
import org.vmapconv.converter.hdf.HdfTree;
import org.vmapconv.converter.model.AnalysisKind;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermasResultReaderTest {

    @Test
    void read_readsAllSelectedVariables() {
        List<String> warnings = new ArrayList<>();

        ResultReadout readout = PermasResultReader.read(PermasFixtures.staticResultTree(), ResultSelection.all(), warnings);

        assertThat(readout.analysis().kind()).isEqualTo(AnalysisKind.STATIC);
        assertThat(readout.analysis().stateName()).isEqualTo("STATIC_LINEAR");
        assertThat(readout.variableNames()).containsExactly("DISPLACEMENT", "TEMPERATURE");
        assertThat(readout.temporalValues()).containsExactly(1.0, 2.0);
        assertThat(readout.table().columns()).hasSize(4);
        assertThat(readout.table().columns().get(0).value(3, 2)).isEqualTo(4 * 10 + 2 + 0.1);
        assertThat(warnings).isEmpty();
    }

    @Test
    void read_filtersTimesteps() {
        ResultSelection selection = ResultSelection.parse("2.0", "DISPLACEMENT");

        ResultReadout readout = PermasResultReader.read(PermasFixtures.staticResultTree(), selection, new ArrayList<>());

        assertThat(readout.variableNames()).containsExactly("DISPLACEMENT");
        assertThat(readout.temporalValues()).containsExactly(2.0);
        assertThat(readout.analysis().temporalValues()).containsExactly(2.0);
    }

    @Test
    void read_missingVariableYieldsEmptyReadout() {
        ResultSelection selection = ResultSelection.parse(null, "GAP_WIDTH");

        ResultReadout readout = PermasResultReader.read(PermasFixtures.staticResultTree(), selection, new ArrayList<>());

        assertThat(readout.isEmpty()).isTrue();
        assertThat(readout.analysis()).isNull();
        assertThat(readout.table().columns()).isEmpty();
    }

    @Test
    void read_missingColumnDescriptionIsFatal() {
        HdfTree tree = PermasFixtures.modelTree();
        tree.putDataset(PermasFixtures.SITUATION_PATH + "/.Analysis", new String[]{"STATIC"});
        tree.putDataset(PermasFixtures.SITUATION_PATH + "/DISPLACEMENT/.RowDes", new int[]{1});

        assertThatThrownBy(() -> PermasResultReader.read(tree, ResultSelection.all(), new ArrayList<>()))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining(".ColDes");
    }

    @Test
    void read_unknownAnalysisIsFatal() {
        HdfTree tree = PermasFixtures.staticResultTree();
        tree.putDataset(PermasFixtures.SITUATION_PATH + "/.Analysis", new String[]{"BUCKLING"});

        assertThatThrownBy(() -> PermasResultReader.read(tree, ResultSelection.all(), new ArrayList<>()))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("BUCKLING");
    }

    @Test
    void read_modalAnalysisUsesNodalDiameterFromModel() {
        HdfTree tree = new HdfTree();
        tree.putDataset(PermasFixtures.SITUATION_PATH + "/.Model", new String[]{"$PARAMETER\n  MNODDIA 2\n$FIN"});
        tree.putDataset(PermasFixtures.SITUATION_PATH + "/.Analysis", new String[]{"VIBRATION ANALYSIS"});
        PermasFixtures.putVariable(tree, "DISPLACEMENT", new double[]{10.0, 10.000001, 25.0}, new int[]{1, 2}, 3);

        ResultReadout readout = PermasResultReader.read(tree, ResultSelection.all(), new ArrayList<>());

        assertThat(readout.analysis().isModal()).isTrue();
        assertThat(readout.analysis().stateName()).isEqualTo("NODDIA_2.0");
        assertThat(readout.temporalValues()).containsExactly(10.0, 10.000001, 25.0);
        assertThat(readout.table().columns()).hasSize(3);
    }

    @Test
    void locateSituation_warnsAboutExtraComponentsAndSituations() {
        HdfTree tree = PermasFixtures.modelTree();
        tree.putGroup("/" + PermasFixtures.COMPONENT + "/SIT_2");
        tree.putGroup("/KOMPO_2/SIT_1");
        List<String> warnings = new ArrayList<>();

        assertThat(PermasHdfLayout.locateSituation(tree, warnings)).isEqualTo(PermasFixtures.SITUATION_PATH);
        assertThat(warnings).hasSize(2);
    }

    @Test
    void readModelLines_withoutModelIsFatal() {
        HdfTree tree = new HdfTree();
        tree.putGroup(PermasFixtures.SITUATION_PATH);

        assertThatThrownBy(() -> PermasHdfLayout.readModelLines(tree, new ArrayList<>()))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining(".Model");
    }
}
