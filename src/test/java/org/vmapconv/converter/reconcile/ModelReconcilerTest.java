package org.vmapconv.converter.reconcile;

import org.junit.jupiter.api.Test;
import org.vmapconv.converter.ConversionException;
import org.vmapconv.converter.PermasFixtures;
import org.vmapconv.converter.model.ElementSet;
import org.vmapconv.converter.model.Part;
import org.vmapconv.converter.model.ReconciledModel;
import org.vmapconv.converter.model.Tet10Permutation;
import org.vmapconv.converter.model.Topology;
import org.vmapconv.converter.permas.PermasModelParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelReconcilerTest {

    private static ReconciledModel reconcile(String text) {
        return ModelReconciler.reconcile(PermasModelParser.parse(text.lines().toList()));
    }

    @Test
    void reconcile_buildsPartsAndDropsUnsupportedSets() {
        ReconciledModel model = ModelReconciler.reconcile(PermasModelParser.parse(PermasFixtures.modelLines()));

        assertThat(model.parts()).extracting(Part::name).containsExactly("PART_A", "PART_B");
        Part partA = model.parts().get(0);
        assertThat(partA.topology()).isEqualTo(Topology.HEXE8);
        assertThat(partA.nodeIds()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);
        assertThat(partA.materialName()).isEqualTo("STEEL");
        Part partB = model.parts().get(1);
        assertThat(partB.topology()).isEqualTo(Topology.TET10);
        assertThat(partB.nodeIds()).hasSize(10);
        assertThat(model.warnings()).isEmpty();
    }

    @Test
    void reconcile_reordersTet10ToVmapOrder() {
        ReconciledModel model = ModelReconciler.reconcile(PermasModelParser.parse(PermasFixtures.modelLines()));

        int[] vmap = model.elementTable(Topology.TET10).connectivity(0);
        assertThat(vmap).containsExactly(13, 15, 17, 22, 14, 16, 18, 19, 20, 21);
        assertThat(Tet10Permutation.toPermas(vmap)).containsExactly(PermasFixtures.TET10_PERMAS);
    }

    @Test
    void reconcile_keepsTet10SetAndDropsSetOutsideBothTables() {
        ReconciledModel model = reconcile("""
                $COOR
                  1 0 0 0
                  2 0 0 0
                  3 0 0 0
                  4 0 0 0
                  5 0 0 0
                  6 0 0 0
                  7 0 0 0
                  8 0 0 0
                  9 0 0 0
                  10 0 0 0
                $ELEMENT TYPE = TET10
                  1 1 2 3 4 5 6 7 8 9 10
                $ESET NAME = X
                  1
                $ESET NAME = Y
                  99
                """);

        assertThat(model.parts()).extracting(Part::name).containsExactly("X");
    }

    @Test
    void reconcile_mixedTopologySetIsFatal() {
        assertThatThrownBy(() -> reconcile(PermasFixtures.modelText().replace("""
                    $ESET NAME = PART_A
                      1 2
                """, """
                    $ESET NAME = PART_A
                      1 2 3
                """)))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("PART_A");
    }

    @Test
    void reconcile_missingNodeIsFatal() {
        assertThatThrownBy(() -> reconcile("""
                $COOR
                  1 0 0 0
                $ELEMENT TYPE = HEXE8
                  1 1 2 3 4 5 6 7 8
                $ESET NAME = P
                  1
                """))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("节点 2");
    }

    @Test
    void reconcile_surfaceInTwoPartsIsFatal() {
        String text = PermasFixtures.modelText().replace("    $ESET NAME = SHELLS\n",
                "    $ESET NAME = PART_C\n      1\n    $ESET NAME = SHELLS\n");

        assertThatThrownBy(() -> reconcile(text))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("面 1")
                .hasMessageContaining("2 个部件");
    }

    @Test
    void reconcile_surfaceOutsideEveryPartIsFatal() {
        String text = PermasFixtures.modelText().replace("""
                      1 1
                      2 6
                """, """
                      4 1
                """);

        assertThatThrownBy(() -> reconcile(text))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("面 1");
    }

    @Test
    void reconcile_emptyNodeSetIsSkippedWithWarning() {
        ReconciledModel model = reconcile(PermasFixtures.modelText().replace("""
                    $NSET NAME = NS_TOP
                      9 10 11 12
                """, """
                    $NSET NAME = NS_TOP
                    $NSET NAME = NS_ONE
                      9
                """));

        assertThat(model.nodeSets()).extracting(s -> s.name()).containsExactly("NS_ONE");
        assertThat(model.warnings()).hasSize(1);
    }

    @Test
    void classify_usesFirstElementHexe8First() {
        ReconciledModel model = ModelReconciler.reconcile(PermasModelParser.parse(PermasFixtures.modelLines()));

        assertThat(ModelReconciler.classify(new ElementSet("E", new int[]{3, 1}), model.elements()))
                .isEqualTo(Topology.TET10);
        assertThat(ModelReconciler.classify(new ElementSet("E", new int[]{4}), model.elements())).isNull();
        assertThat(ModelReconciler.classify(new ElementSet("E", new int[0]), model.elements())).isNull();
    }
}
