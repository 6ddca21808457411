package org.episim.io.formats;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.episim.api.model.DenseArray;
import org.episim.io.formats.netcdf.NetCdfCodec;

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.WritableDataset;
import io.jhdf.exceptions.HdfException;

/**
 * HDF5 output ({@code .h5}) backed by jHDF.
 * <p>
 * Every variable becomes a root-level double dataset of the same name and shape. A dataset
 * carries string attributes named as in the NetCDF files: {@code dimensions} lists its dimension
 * names, {@code <dim>_label} holds the coordinate labels of each dimension and
 * {@code description} its description. Global attributes go to the root group.
 */
public class Hdf5Format implements IArrayFileFormat {

    static final String DIMENSIONS_ATTRIBUTE = "dimensions";

    @Override
    public String name() {
        return ArrayFileFormats.HDF5;
    }

    @Override
    public String extension() {
        return "h5";
    }

    @Override
    public void write(Path file, LabeledDataset dataset) throws IOException {
        AtomicFiles.write(file, tempFile -> {
            WritableHdfFile hdfFile = HdfFile.write(tempFile);
            try {
                for (LabeledDataset.Variable variable : dataset.variables()) {
                    WritableDataset written = hdfFile.putDataset(variable.name(), variable.values().toNestedArray());
                    written.putAttribute(DIMENSIONS_ATTRIBUTE, variable.dimensions().toArray(new String[0]));
                    for (String dimension : variable.dimensions()) {
                        written.putAttribute(dimension + NetCdfCodec.LABEL_SUFFIX,
                                dataset.dimension(dimension).labels().toArray(new String[0]));
                    }
                    if (variable.description() != null) {
                        written.putAttribute(NetCdfCodec.DESCRIPTION, variable.description());
                    }
                }
                for (Map.Entry<String, String> attribute : dataset.attributes().entrySet()) {
                    hdfFile.putAttribute(attribute.getKey(), attribute.getValue());
                }
            } catch (HdfException e) {
                throw new IOException("Failed to write HDF5 file " + file + ": " + e.getMessage(), e);
            } finally {
                hdfFile.close();
            }
        });
    }

    @Override
    public DenseArray read(Path file, String variable) throws IOException {
        try (HdfFile hdfFile = new HdfFile(file)) {
            Dataset dataset = hdfFile.getDatasetByPath(variable);
            return DenseArray.fromNestedArray(dataset.getData());
        } catch (HdfException | IllegalArgumentException e) {
            throw new IOException("Cannot read dataset '" + variable + "' from " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> readLabels(Path file, String variable, String dimension) throws IOException {
        try (HdfFile hdfFile = new HdfFile(file)) {
            Dataset dataset = hdfFile.getDatasetByPath(variable);
            if (!strings(dataset, DIMENSIONS_ATTRIBUTE).contains(dimension)) {
                throw new IOException("Dataset " + variable + " in " + file + " has no dimension " + dimension);
            }
            return strings(dataset, dimension + NetCdfCodec.LABEL_SUFFIX);
        } catch (HdfException | IllegalArgumentException e) {
            throw new IOException("Cannot read labels of '" + variable + "' from " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> readDescription(Path file, String variable) throws IOException {
        try (HdfFile hdfFile = new HdfFile(file)) {
            Attribute attribute = hdfFile.getDatasetByPath(variable).getAttribute(NetCdfCodec.DESCRIPTION);
            return attribute == null ? Optional.empty() : Optional.of(String.valueOf(attribute.getData()));
        } catch (HdfException | IllegalArgumentException e) {
            throw new IOException("Cannot read '" + variable + "' from " + file + ": " + e.getMessage(), e);
        }
    }

    private static List<String> strings(Dataset dataset, String name) throws IOException {
        Attribute attribute = dataset.getAttribute(name);
        if (attribute == null) {
            throw new IOException("Dataset " + dataset.getName() + " has no attribute " + name);
        }
        Object data = attribute.getData();
        if (data instanceof String[]) {
            return List.of((String[]) data);
        }
        if (data instanceof String) {
            return List.of((String) data);
        }
        throw new IOException("Attribute " + name + " of " + dataset.getName() + " is not a string array");
    }
}
