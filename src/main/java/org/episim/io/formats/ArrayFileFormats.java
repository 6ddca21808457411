package org.episim.io.formats;

import java.util.Locale;
import java.util.Map;

import org.episim.api.exceptions.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup of array file formats by configuration name.
 */
public final class ArrayFileFormats {

    private static final Logger log = LoggerFactory.getLogger(ArrayFileFormats.class);

    public static final String NETCDF = "netcdf";
    public static final String HDF5 = "hdf5";

    private static final Map<String, IArrayFileFormat> FORMATS = Map.of(
            NETCDF, new NetCdfFormat(),
            HDF5, new Hdf5Format());

    private ArrayFileFormats() {
    }

    /**
     * Resolves an output format. {@code null} and unknown names select NetCDF.
     *
     * @param name value of {@code simulation.output_format}
     * @return the matching format, NetCDF when unrecognized
     */
    public static IArrayFileFormat forOutput(String name) {
        if (name == null) {
            return FORMATS.get(NETCDF);
        }
        IArrayFileFormat format = FORMATS.get(name.toLowerCase(Locale.ROOT));
        if (format == null) {
            log.warn("Unknown output format '{}', writing {} instead", name, NETCDF);
            return FORMATS.get(NETCDF);
        }
        return format;
    }

    /**
     * Resolves an input format strictly.
     *
     * @param name value of {@code simulation.init_format}; {@code null} selects NetCDF
     * @throws InvalidParameterException if the name is not a known format
     */
    public static IArrayFileFormat forInput(String name) throws InvalidParameterException {
        if (name == null) {
            return FORMATS.get(NETCDF);
        }
        IArrayFileFormat format = FORMATS.get(name.toLowerCase(Locale.ROOT));
        if (format == null) {
            throw new InvalidParameterException("init_format must be one of " + NETCDF + ", " + HDF5 + ": " + name);
        }
        return format;
    }
}
