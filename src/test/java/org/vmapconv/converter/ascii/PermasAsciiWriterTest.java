package org.vmapconv.converter.ascii;

import org.junit.jupiter.api.Test;
import org.vmapconv.converter.model.ElementSet;
import org.vmapconv.converter.model.ElementTable;
import org.vmapconv.converter.model.FlatPermasModel;
import org.vmapconv.converter.model.Material;
import org.vmapconv.converter.model.NodeSet;
import org.vmapconv.converter.model.NodeTable;
import org.vmapconv.converter.model.Surface;
import org.vmapconv.converter.model.SurfaceSet;
import org.vmapconv.converter.model.Topology;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermasAsciiWriterTest {

    private static FlatPermasModel model() {
        NodeTable nodes = new NodeTable(new int[]{1, 2}, new double[]{0, 0, 0, 1.5, -2, 1e-3});
        Map<Topology, ElementTable> elements = new LinkedHashMap<>();
        elements.put(Topology.HEXE8, new ElementTable(Topology.HEXE8, new int[]{7}, new int[]{1, 2, 1, 2, 1, 2, 1, 2}));
        Map<String, Double> extra = new LinkedHashMap<>();
        extra.put("EXPANSION", 1.2e-5);
        return new FlatPermasModel(
                nodes,
                elements,
                List.of(new ElementSet("BLOCK", new int[]{7})),
                Map.of("BLOCK", "STEEL"),
                List.of(new NodeSet("ALL", new int[]{1, 2, 3, 4, 5})),
                List.of(new Surface(3, "TOP", new int[]{7, 1, 7, 2})),
                List.of(new SurfaceSet("TOP", new int[]{3})),
                List.of(new Material("STEEL", 0, 210000.0, 0.3, null, extra)));
    }

    @Test
    void lines_writesStructureSystemAndMaterials() {
        List<String> lines = PermasAsciiWriter.lines(model(), 2);

        assertThat(lines.get(0)).startsWith("$ENTER COMPONENT");
        assertThat(lines).contains(
                "      $COOR",
                "          " + String.format(Locale.ROOT, "%10d %15.6e %15.6e %15.6e", 2, 1.5, -2.0, 1e-3),
                "      $ELEMENT TYPE = HEXE8",
                "      $ESET NAME = BLOCK",
                "      $NSET NAME = ALL",
                "      $SURFACE ELEMENTS  SURFID = 3  SFSET = TOP",
                "      $SFSET NAME = TOP",
                "      $ELPROP",
                "         BLOCK MATERIAL = STEEL",
                "   $MATERIAL  NAME = STEEL TYPE = ISO",
                "      $EXPANSION  GENERAL  INPUT = DATA");
        assertThat(lines).doesNotContain("      $DENSITY  GENERAL  INPUT = DATA");
        assertThat(lines.get(lines.size() - 1)).isEqualTo("$FIN");

        int nset = lines.indexOf("      $NSET NAME = ALL");
        assertThat(lines.subList(nset + 1, nset + 4))
                .containsExactly("                   1          2", "                   3          4", "                   5");
    }

    @Test
    void wrapRows_splitsIntoFullRowsAndRemainder() {
        assertThat(PermasAsciiWriter.wrapRows(new int[]{1, 2, 3, 4, 5}, 2))
                .containsExactly(new int[]{1, 2}, new int[]{3, 4}, new int[]{5});
        assertThat(PermasAsciiWriter.wrapRows(new int[0], 14)).isEmpty();
    }

    @Test
    void lines_rejectsNonPositiveRowWidth() {
        assertThatThrownBy(() -> PermasAsciiWriter.lines(model(), 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
