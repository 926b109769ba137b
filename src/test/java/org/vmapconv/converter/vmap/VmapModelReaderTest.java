package org.vmapconv.converter.vmap;

import org.junit.jupiter.api.Test;
import org.vmapconv.converter.ConversionException;
import org.vmapconv.converter.PermasFixtures;
import org.vmapconv.converter.PermasToVmapConverter;
import org.vmapconv.converter.ResultSelection;
import org.vmapconv.converter.hdf.HdfTree;
import org.vmapconv.converter.model.ElementSet;
import org.vmapconv.converter.model.FlatPermasModel;
import org.vmapconv.converter.model.ResultColumn;
import org.vmapconv.converter.model.ResultTable;
import org.vmapconv.converter.model.Topology;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VmapModelReaderTest {

    private static HdfTree convertFixture() {
        PermasToVmapConverter converter = new PermasToVmapConverter(PermasFixtures.properties("."), null,
                Clock.systemUTC());
        HdfTree results = PermasFixtures.staticResultTree();
        return converter.convert(results, results, ResultSelection.all()).vmap();
    }

    @Test
    void read_restoresPermasModel() {
        List<String> warnings = new ArrayList<>();

        FlatPermasModel model = VmapModelReader.read(convertFixture(), warnings);

        assertThat(model.nodes().size()).isEqualTo(22);
        assertThat(model.elementTable(Topology.HEXE8).ids()).containsExactly(1, 2);
        assertThat(model.elementTable(Topology.TET10).connectivity(0)).containsExactly(PermasFixtures.TET10_PERMAS);
        assertThat(model.parts()).extracting(ElementSet::name).containsExactly("PART_A", "PART_B");
        assertThat(model.partMaterials()).containsEntry("PART_A", "STEEL").containsEntry("PART_B", "STEEL");
        assertThat(model.nodeSets()).singleElement().satisfies(set -> assertThat(set.nodeIds()).containsExactly(9, 10, 11, 12));
        assertThat(model.surfaces()).singleElement().satisfies(surface -> {
            assertThat(surface.id()).isEqualTo(1);
            assertThat(surface.surfaceSetName()).isEqualTo("SF1");
            assertThat(surface.pairs()).containsExactly(1, 1, 2, 6);
        });
        assertThat(model.surfaceSets()).singleElement().satisfies(set -> assertThat(set.name()).isEqualTo("SF1"));
        assertThat(model.materials()).singleElement().satisfies(material -> {
            assertThat(material.modulus()).isEqualTo(210000.0);
            assertThat(material.poisson()).isEqualTo(0.3);
            assertThat(material.density()).isEqualTo(7.85E-9);
        });
        assertThat(warnings).isEmpty();
    }

    @Test
    void readResults_returnsNodalColumnsPerStateAndPart() {
        ResultTable table = VmapModelReader.readResults(convertFixture(), new ArrayList<>());

        assertThat(table.temporalValues()).containsExactly(1.0, 2.0);
        assertThat(table.variableNames()).containsExactly("DISPLACEMENT", "TEMPERATURE");
        assertThat(table.columns()).hasSize(6);
        ResultColumn partB = table.columns().stream()
                .filter(c -> c.variableName().equals("DISPLACEMENT") && c.ids()[0] == 13 && c.temporalValue() == 2.0)
                .findFirst()
                .orElseThrow();
        assertThat(partB.rowCount()).isEqualTo(10);
        assertThat(partB.value(0, 1)).isEqualTo(13 * 10 + 1 + 0.2);
    }

    @Test
    void readResults_reordersElementTet10Blocks() {
        HdfTree tree = convertFixture();
        double[] values = IntStream.range(0, 60).asDoubleStream().toArray();
        new VmapWriter(tree).writeVariable(0, 1, new StateVariable("STRESS", "REAL", 9, 60, 1,
                StateVariable.ENTITY_REAL, StateVariable.LOCATION_ELEMENT, StateVariable.CARTESIAN, values, null));

        ResultColumn column = VmapModelReader.readResults(tree, new ArrayList<>()).columns().stream()
                .filter(c -> c.variableName().equals("STRESS"))
                .findFirst()
                .orElseThrow();

        assertThat(column.ids()).containsExactly(3);
        // PERMAS 第 2 个节点（棱12）在 VMAP 中位于第 5 位
        assertThat(column.value(0, 6)).isEqualTo(24.0);
        assertThat(column.value(0, 59)).isEqualTo(23.0);
    }

    @Test
    void read_rejectsTreeWithoutVmapRoot() {
        assertThatThrownBy(() -> VmapModelReader.read(new HdfTree(), new ArrayList<>()))
                .isInstanceOf(ConversionException.class);
    }
}
