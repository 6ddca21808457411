package org.episim.io.formats;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.episim.api.model.DenseArray;

/**
 * A binary container format for labelled arrays.
 * <p>
 * Implementations write a complete {@link LabeledDataset} to a single file and read individual
 * numeric variables back, together with the coordinate labels of their dimensions and their
 * descriptions. Writers always replace the target file.
 */
public interface IArrayFileFormat {

    /**
     * @return the configuration name of the format, e.g. {@code netcdf}
     */
    String name();

    /**
     * @return file extension without the dot
     */
    String extension();

    /**
     * Writes a dataset, replacing any existing file.
     *
     * @param file    target file; its parent directory must exist
     * @param dataset the arrays to write
     * @throws IOException if the file cannot be written
     */
    void write(Path file, LabeledDataset dataset) throws IOException;

    /**
     * Reads one numeric variable.
     *
     * @param file     source file
     * @param variable variable or dataset name
     * @return the values with the shape stored in the file
     * @throws IOException if the file cannot be read, is malformed or lacks the variable
     */
    DenseArray read(Path file, String variable) throws IOException;

    /**
     * Reads the coordinate labels of one dimension of a variable.
     *
     * @throws IOException if the variable does not use {@code dimension} or no labels are stored
     */
    List<String> readLabels(Path file, String variable, String dimension) throws IOException;

    /**
     * @return the {@code description} attribute of a variable, if written
     */
    Optional<String> readDescription(Path file, String variable) throws IOException;
}
