package org.episim.io.formats;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.episim.api.model.DenseArray;
import org.episim.io.formats.netcdf.NetCdfCodec;

/**
 * NetCDF output ({@code .nc}), the default format.
 * <p>
 * Writes NetCDF classic files with coordinate labels and {@code description} attributes.
 * Reading also accepts NetCDF-4 files: those are HDF5 containers and are delegated to
 * {@link Hdf5Format}.
 */
public class NetCdfFormat implements IArrayFileFormat {

    private static final byte[] HDF5_SIGNATURE = {(byte) 0x89, 'H', 'D', 'F', '\r', '\n', 0x1A, '\n'};

    private final Hdf5Format netCdf4Reader = new Hdf5Format();

    @Override
    public String name() {
        return ArrayFileFormats.NETCDF;
    }

    @Override
    public String extension() {
        return "nc";
    }

    @Override
    public void write(Path file, LabeledDataset dataset) throws IOException {
        AtomicFiles.write(file, tempFile -> {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tempFile))) {
                new NetCdfCodec.Writer().write(out, dataset);
            }
        });
    }

    @Override
    public DenseArray read(Path file, String variable) throws IOException {
        if (isHdf5Container(file)) {
            return netCdf4Reader.read(file, variable);
        }
        return NetCdfCodec.Reader.open(file).readNumeric(variable);
    }

    @Override
    public List<String> readLabels(Path file, String variable, String dimension) throws IOException {
        if (isHdf5Container(file)) {
            return netCdf4Reader.readLabels(file, variable, dimension);
        }
        NetCdfCodec.Reader reader = NetCdfCodec.Reader.open(file);
        if (!reader.dimensionsOf(variable).contains(dimension)) {
            throw new IOException("Variable " + variable + " in " + file + " has no dimension " + dimension);
        }
        return reader.readLabels(dimension + NetCdfCodec.LABEL_SUFFIX);
    }

    @Override
    public Optional<String> readDescription(Path file, String variable) throws IOException {
        if (isHdf5Container(file)) {
            return netCdf4Reader.readDescription(file, variable);
        }
        return NetCdfCodec.Reader.open(file).attribute(variable, NetCdfCodec.DESCRIPTION);
    }

    private static boolean isHdf5Container(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return Arrays.equals(in.readNBytes(HDF5_SIGNATURE.length), HDF5_SIGNATURE);
        }
    }
}
