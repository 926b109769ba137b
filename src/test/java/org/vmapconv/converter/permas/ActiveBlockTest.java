package org.vmapconv.converter.permas;

import org.junit.jupiter.api.Test;
import org.vmapconv.converter.model.Topology;

import static org.assertj.core.api.Assertions.assertThat;

class ActiveBlockTest {

    private static ActiveBlock directive(String line) {
        return ActiveBlock.fromDirective(PermasTokens.tokenize(line));
    }

    @Test
    void fromDirective_mapsKeywordsToBlocks() {
        assertThat(directive("$COOR")).isEqualTo(new ActiveBlock.Coordinates());
        assertThat(directive("$ELEMENT TYPE = TET10")).isEqualTo(new ActiveBlock.Elements(Topology.TET10));
        assertThat(directive("$element type=hexe8")).isEqualTo(new ActiveBlock.Elements(Topology.HEXE8));
        assertThat(directive("$ELEMENT TYPE = PENTA6")).isEqualTo(new ActiveBlock.UnsupportedElements("PENTA6"));
        assertThat(directive("$ESET NAME = PART_A")).isEqualTo(new ActiveBlock.ElementSetBlock("PART_A"));
        assertThat(directive("$NSET NAME=TOP")).isEqualTo(new ActiveBlock.NodeSetBlock("TOP"));
        assertThat(directive("$SFSET NAME = S1")).isEqualTo(new ActiveBlock.SurfaceSetBlock("S1"));
        assertThat(directive("$SURFACE ELEMENTS SURFID = 4 SFSET = S1"))
                .isEqualTo(new ActiveBlock.SurfaceBlock("4", "S1"));
        assertThat(directive("$MATERIAL NAME = STEEL TYPE = ISO"))
                .isEqualTo(new ActiveBlock.Deferred(ActiveBlock.DeferredKind.MATERIAL));
        assertThat(directive("$ELPROP")).isEqualTo(new ActiveBlock.Deferred(ActiveBlock.DeferredKind.ELPROP));
        assertThat(directive("$RSYS")).isEqualTo(new ActiveBlock.Deferred(ActiveBlock.DeferredKind.RSYS));
        assertThat(directive("$END STRUCTURE")).isEqualTo(new ActiveBlock.None("$END"));
        assertThat(directive("!")).isEqualTo(new ActiveBlock.None("!"));
    }

    @Test
    void tokenize_splitsEqualsSign() {
        assertThat(PermasTokens.tokenize("  $ESET NAME=PART_A ")).containsExactly("$ESET", "NAME", "=", "PART_A");
        assertThat(PermasTokens.keywordValue(new String[]{"$ESET", "NAME", "X"}, "name")).isEqualTo("X");
        assertThat(PermasTokens.isDataLine(PermasTokens.tokenize("12 3"))).isTrue();
        assertThat(PermasTokens.isDataLine(PermasTokens.tokenize("1.5 3"))).isFalse();
        assertThat(PermasTokens.parseDouble("1.5D-3")).isEqualTo(1.5E-3);
    }
}
