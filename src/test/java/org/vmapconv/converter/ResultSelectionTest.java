package org.vmapconv.converter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultSelectionTest {

    @Test
    void parse_defaultsToAllVariablesAndTimesteps() {
        ResultSelection selection = ResultSelection.parse(null, "all");

        assertThat(selection.variables()).containsExactly("DISPLACEMENT", "CONTACT STATUS", "NODAL POINT STRAIN",
                "NODAL POINT STRESS", "GAP WIDTH", "TEMPERATURE");
        assertThat(selection.timesteps()).isNull();
        assertThat(selection.readsResults()).isTrue();
        assertThat(selection.acceptsTemporal(123.0)).isTrue();
    }

    @Test
    void parse_noneInEitherFilter_readsNothing() {
        assertThat(ResultSelection.parse("NONE", "DISPLACEMENT").readsResults()).isFalse();
        assertThat(ResultSelection.parse("1.0", "none").readsResults()).isFalse();
    }

    @Test
    void parse_listsTimestepsAndVariables() {
        ResultSelection selection = ResultSelection.parse(" 1.0, 2.5 ", "gap_width,DISPLACEMENT,GAP_WIDTH");

        assertThat(selection.variables()).containsExactly("GAP WIDTH", "DISPLACEMENT");
        assertThat(selection.acceptsTemporal(2.5)).isTrue();
        assertThat(selection.acceptsTemporal(2.0)).isFalse();
    }

    @Test
    void parse_rejectsUnknownVariableAndBadNumber() {
        assertThatThrownBy(() -> ResultSelection.parse(null, "VELOCITY"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("VELOCITY");
        assertThatThrownBy(() -> ResultSelection.parse("1.0,later", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timesteps");
    }
}
