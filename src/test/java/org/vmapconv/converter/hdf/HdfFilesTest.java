package org.vmapconv.converter.hdf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HdfFilesTest {

    @Test
    void writeThenRead_keepsGroupsDatasetsAndAttributes(@TempDir Path dir) throws IOException {
        HdfTree tree = new HdfTree()
                .putAttribute("/VMAP", "VERSION", "0.5")
                .putGroup("/VMAP/VARIABLES")
                .putDataset("/VMAP/GEOMETRY/0/POINTS/MYIDENTIFIERS", new int[]{1, 2, 3})
                .putDataset("/VMAP/GEOMETRY/0/POINTS/MYCOORDINATES", new double[][]{{0.0, 0.0, 0.0}, {1.0, 0.5, 0.25}, {2.0, 1.0, 0.5}})
                .putAttribute("/VMAP/GEOMETRY/0", "MYNAME", "PART_A")
                .putAttribute("/VMAP/GEOMETRY/0/POINTS", "MYSIZE", 3)
                .putAttribute("/VMAP/GEOMETRY/0/POINTS", "MYSCALE", 0.001)
                .putDataset("/K/S/.Model", new String[]{"$ENTER COMPONENT NAME = K", "$FIN"});
        Path file = dir.resolve("nested/out.hdf");

        HdfFiles.write(tree, file);
        HdfTree read = HdfFiles.read(file);

        assertThat(Files.isRegularFile(file)).isTrue();
        assertThat(read.childNames("/")).containsExactlyInAnyOrder("VMAP", "K");
        assertThat(read.isGroup("/VMAP/VARIABLES")).isTrue();
        assertThat(read.childNames("/VMAP/VARIABLES")).isEmpty();
        assertThat(read.stringAttribute("/VMAP", "VERSION")).isEqualTo("0.5");
        assertThat(read.intArray("/VMAP/GEOMETRY/0/POINTS/MYIDENTIFIERS")).containsExactly(1, 2, 3);
        assertThat(read.doubleMatrix("/VMAP/GEOMETRY/0/POINTS/MYCOORDINATES")[1]).containsExactly(1.0, 0.5, 0.25);
        assertThat(read.stringAttribute("/VMAP/GEOMETRY/0", "MYNAME")).isEqualTo("PART_A");
        assertThat(read.intAttribute("/VMAP/GEOMETRY/0/POINTS", "MYSIZE")).isEqualTo(3);
        assertThat(read.doubleAttribute("/VMAP/GEOMETRY/0/POINTS", "MYSCALE")).isEqualTo(0.001);
        assertThat(read.stringLines("/K/S/.Model")).containsExactly("$ENTER COMPONENT NAME = K", "$FIN");
    }

    @Test
    void read_missingFile_throwsNoSuchFile(@TempDir Path dir) {
        assertThatThrownBy(() -> HdfFiles.read(dir.resolve("missing.hdf")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void read_notHdf_throwsIoException(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("plain.hdf");
        Files.writeString(file, "not an hdf file");

        assertThatThrownBy(() -> HdfFiles.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("plain.hdf");
    }
}
