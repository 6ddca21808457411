package org.episim.io.formats.netcdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.episim.api.model.DenseArray;
import org.episim.io.formats.LabeledDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link NetCdfCodec}.
 */
@Tag("unit")
@DisplayName("NetCdfCodec Unit Tests")
class NetCdfCodecTest {

    @Test
    @DisplayName("Written file starts with the CDF-2 magic")
    void writesSixtyFourBitOffsetMagic() throws IOException {
        byte[] bytes = encode(sampleDataset());

        assertThat(Arrays.copyOf(bytes, 4)).containsExactly('C', 'D', 'F', 2);
    }

    @Test
    @DisplayName("Variables, labels and attributes can be read back")
    void readsBackWhatWasWritten() throws IOException {
        NetCdfCodec.Reader reader = NetCdfCodec.Reader.of(encode(sampleDataset()));

        assertThat(reader.variableNames()).contains("S", "G_label", "M_label", "T_label");
        assertThat(reader.globalAttributes()).containsEntry("engine", "MMCACovid19");
        assertThat(reader.dimensionsOf("S")).containsExactly("G", "M", "T");
        assertThat(reader.shapeOf("S")).containsExactly(2, 1, 3);
        assertThat(reader.attribute("S", NetCdfCodec.DESCRIPTION)).contains("Susceptible individuals");
        assertThat(reader.readLabels("G_label")).containsExactly("0-19", "20+");
        assertThat(reader.readLabels("T_label")).containsExactly("2020-02-09", "2020-02-10", "2020-02-11");

        DenseArray values = reader.readNumeric("S");
        assertThat(values.data()).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    @DisplayName("Labels of different lengths are padded per dimension")
    void unevenLabels() throws IOException {
        LabeledDataset dataset = LabeledDataset.builder()
                .dimension("M", List.of("a", "much-longer-patch"))
                .variable("x", List.of("M"), DenseArray.wrap(new double[] {0.5, -1.5}, 2), "x")
                .build();

        NetCdfCodec.Reader reader = NetCdfCodec.Reader.of(encode(dataset));

        assertThat(reader.readLabels("M_label")).containsExactly("a", "much-longer-patch");
        assertThat(reader.readNumeric("x").data()).containsExactly(0.5, -1.5);
    }

    @Test
    @DisplayName("Unknown variables and foreign bytes are rejected")
    void rejectsInvalidInput() throws IOException {
        NetCdfCodec.Reader reader = NetCdfCodec.Reader.of(encode(sampleDataset()));

        assertThatThrownBy(() -> reader.readNumeric("Z")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> reader.readNumeric("G_label")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> NetCdfCodec.Reader.of("not a netcdf file".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(IOException.class);
    }

    private static LabeledDataset sampleDataset() {
        return LabeledDataset.builder()
                .dimension("G", List.of("0-19", "20+"))
                .dimension("M", List.of("p1"))
                .dimension("T", List.of("2020-02-09", "2020-02-10", "2020-02-11"))
                .variable("S", List.of("G", "M", "T"),
                        DenseArray.wrap(new double[] {1, 2, 3, 4, 5, 6}, 2, 1, 3), "Susceptible individuals")
                .attribute("engine", "MMCACovid19")
                .build();
    }

    private static byte[] encode(LabeledDataset dataset) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new NetCdfCodec.Writer().write(out, dataset);
        return out.toByteArray();
    }
}
