package org.vmapconv.cli;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandLineRequestTest {

    @Test
    void parse_permas2vmapWithResultsAndFilters() {
        CommandLineRequest request = CommandLineRequest.parse(List.of(
                "permas2vmap", "model.hdf", "results.hdf", "timesteps=1.0,2.0", "variables_nodes=DISPLACEMENT"));

        assertThat(request.command()).isEqualTo(CommandLineRequest.Command.PERMAS2VMAP);
        assertThat(request.modelFile()).isEqualTo("model.hdf");
        assertThat(request.resultsFile()).isEqualTo("results.hdf");
        assertThat(request.selection().variables()).containsExactly("DISPLACEMENT");
        assertThat(request.selection().acceptsTemporal(2.0)).isTrue();
        assertThat(request.selection().acceptsTemporal(3.0)).isFalse();
    }

    @Test
    void parse_permas2vmapWithoutResultsFile() {
        CommandLineRequest request = CommandLineRequest.parse(List.of("PERMAS2VMAP", "model.hdf"));

        assertThat(request.resultsFile()).isNull();
        assertThat(request.selection().readsResults()).isTrue();
    }

    @Test
    void parse_vmap2ascii() {
        CommandLineRequest request = CommandLineRequest.parse(List.of("vmap2ascii", "model_toVMAP.hdf"));

        assertThat(request.command()).isEqualTo(CommandLineRequest.Command.VMAP2ASCII);
        assertThat(request.modelFile()).isEqualTo("model_toVMAP.hdf");
        assertThat(request.selection().readsResults()).isFalse();
    }

    @Test
    void parse_rejectsBadArguments() {
        assertThatThrownBy(() -> CommandLineRequest.parse(List.of()))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("缺少命令");
        assertThatThrownBy(() -> CommandLineRequest.parse(List.of("convert", "a.hdf")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("未知命令");
        assertThatThrownBy(() -> CommandLineRequest.parse(List.of("permas2vmap")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("缺少输入文件");
        assertThatThrownBy(() -> CommandLineRequest.parse(List.of("permas2vmap", "a.hdf", "b.hdf", "c.hdf")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("多余的参数");
        assertThatThrownBy(() -> CommandLineRequest.parse(List.of("permas2vmap", "a.hdf", "timesteps=1", "timesteps=2")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("参数重复");
        assertThatThrownBy(() -> CommandLineRequest.parse(List.of("vmap2ascii", "a.hdf", "timesteps=1")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("未知参数");
    }
}
