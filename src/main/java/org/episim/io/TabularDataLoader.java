package org.episim.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.episim.api.exceptions.MissingInputFileException;
import org.episim.api.exceptions.TabularSchemaException;
import org.episim.api.model.MobilityEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

/**
 * Loads the CSV inputs of a model from its data folder.
 * <p>
 * Files are read with Jackson's CSV module as raw string rows; the first row is the header.
 * Columns are located by name, except for the mobility edge list whose first three columns are
 * read by position. Patch indices in files use {@code indexBase} (1 for model folders prepared
 * for the original tool chain) and are converted to 0-based indices.
 * <p>
 * <strong>Thread Safety:</strong> Stateless apart from the shared, thread-safe {@link CsvMapper}.
 */
public class TabularDataLoader {

    private static final Logger log = LoggerFactory.getLogger(TabularDataLoader.class);

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final int indexBase;

    /**
     * @param indexBase value that denotes the first patch in index columns (0 or 1)
     */
    public TabularDataLoader(int indexBase) {
        if (indexBase != 0 && indexBase != 1) {
            throw new IllegalArgumentException("Index base must be 0 or 1: " + indexBase);
        }
        this.indexBase = indexBase;
    }

    /**
     * Loads the metapopulation table.
     *
     * @param file      CSV with columns {@code id}, {@code area}, one column per age label and {@code total}
     * @param ageLabels age labels from {@code population_params.G_labels}
     * @return the typed table; empty age cells are read as 0
     * @throws MissingInputFileException if the file does not exist
     * @throws TabularSchemaException    if a column is missing or a value is not numeric
     * @throws IOException               if the file cannot be read
     */
    public MetapopulationTable loadMetapopulation(Path file, List<String> ageLabels)
            throws MissingInputFileException, TabularSchemaException, IOException {
        Table table = read(file, "metapopulation table");
        int idColumn = table.column("id");
        int areaColumn = table.column("area");
        int totalColumn = table.column("total");
        int[] ageColumnIndices = new int[ageLabels.size()];
        for (int g = 0; g < ageLabels.size(); g++) {
            ageColumnIndices[g] = table.column(ageLabels.get(g));
        }

        int rows = table.rows.size();
        List<String> ids = new ArrayList<>(rows);
        double[] areas = new double[rows];
        double[] totals = new double[rows];
        double[][] ages = new double[ageLabels.size()][rows];
        for (int r = 0; r < rows; r++) {
            ids.add(table.cell(r, idColumn));
            areas[r] = table.number(r, areaColumn, false);
            totals[r] = table.number(r, totalColumn, false);
            for (int g = 0; g < ageLabels.size(); g++) {
                ages[g][r] = table.number(r, ageColumnIndices[g], true);
            }
        }
        Map<String, double[]> ageColumns = new LinkedHashMap<>();
        for (int g = 0; g < ageLabels.size(); g++) {
            ageColumns.put(ageLabels.get(g), ages[g]);
        }
        log.debug("Loaded metapopulation table {} with {} patches", file, rows);
        return new MetapopulationTable(ids, areas, ageColumns, totals);
    }

    /**
     * Loads the mobility edge list. Self-loops are kept here; the population builder drops them.
     *
     * @param file CSV whose first three columns are origin, destination and flow weight
     * @throws TabularSchemaException if a row is short, non-numeric or has a negative index
     */
    public List<MobilityEdge> loadMobility(Path file)
            throws MissingInputFileException, TabularSchemaException, IOException {
        Table table = read(file, "mobility matrix");
        if (table.header.length < 3) {
            throw new TabularSchemaException("Mobility matrix " + file + " needs 3 columns (origin, destination, weight), found "
                    + table.header.length);
        }
        List<MobilityEdge> edges = new ArrayList<>(table.rows.size());
        for (int r = 0; r < table.rows.size(); r++) {
            int origin = table.index(r, 0, indexBase);
            int destination = table.index(r, 1, indexBase);
            edges.add(new MobilityEdge(origin, destination, table.number(r, 2, false)));
        }
        log.debug("Loaded {} mobility edges from {}", edges.size(), file);
        return edges;
    }

    /**
     * Loads a seed table with columns {@code idx} and {@code seed}.
     */
    public SeedTable loadSeeds(Path file) throws MissingInputFileException, TabularSchemaException, IOException {
        Table table = read(file, "seeds table");
        int idxColumn = table.column("idx");
        int seedColumn = table.column("seed");
        int rows = table.rows.size();
        int[] patches = new int[rows];
        double[] seeds = new double[rows];
        for (int r = 0; r < rows; r++) {
            patches[r] = table.index(r, idxColumn, indexBase);
            seeds[r] = table.number(r, seedColumn, false);
        }
        return new SeedTable(patches, seeds);
    }

    /**
     * Loads a mobility reduction series with columns {@code date} (ISO) and {@code reduction}.
     */
    public MobilityReductionSeries loadMobilityReduction(Path file)
            throws MissingInputFileException, TabularSchemaException, IOException {
        Table table = read(file, "mobility reduction series");
        int dateColumn = table.column("date");
        int reductionColumn = table.column("reduction");
        List<LocalDate> dates = new ArrayList<>();
        double[] reductions = new double[table.rows.size()];
        for (int r = 0; r < table.rows.size(); r++) {
            String text = table.cell(r, dateColumn);
            try {
                dates.add(LocalDate.parse(text));
            } catch (DateTimeParseException e) {
                throw new TabularSchemaException(table.where(r, dateColumn) + " is not an ISO date: " + text, e);
            }
            reductions[r] = table.number(r, reductionColumn, false);
        }
        return new MobilityReductionSeries(dates, reductions);
    }

    private Table read(Path file, String description)
            throws MissingInputFileException, TabularSchemaException, IOException {
        if (!Files.isRegularFile(file)) {
            throw new MissingInputFileException(description, file);
        }
        List<String[]> lines;
        try (MappingIterator<String[]> iterator = CSV.readerFor(String[].class).readValues(file.toFile())) {
            lines = iterator.readAll();
        } catch (JsonProcessingException e) {
            throw new TabularSchemaException("Malformed CSV in " + file + ": " + e.getOriginalMessage(), e);
        }
        if (lines.isEmpty()) {
            throw new TabularSchemaException("CSV file " + file + " has no header row");
        }
        return new Table(file, lines.get(0), lines.subList(1, lines.size()));
    }

    /**
     * Header plus data rows of one CSV file, with error messages that point at file, row and column.
     */
    private static final class Table {
        private final Path file;
        private final String[] header;
        private final List<String[]> rows;

        Table(Path file, String[] header, List<String[]> rows) {
            this.file = file;
            this.header = header;
            this.rows = rows;
        }

        int column(String name) throws TabularSchemaException {
            for (int i = 0; i < header.length; i++) {
                if (header[i].equals(name)) {
                    return i;
                }
            }
            throw new TabularSchemaException("Column '" + name + "' missing in " + file
                    + "; found " + Arrays.toString(header));
        }

        String cell(int row, int column) throws TabularSchemaException {
            String[] values = rows.get(row);
            if (column >= values.length) {
                throw new TabularSchemaException(where(row, column) + " is missing (row has "
                        + values.length + " of " + header.length + " columns)");
            }
            return values[column];
        }

        double number(int row, int column, boolean emptyAsZero) throws TabularSchemaException {
            String text = cell(row, column);
            if (text.isEmpty() && emptyAsZero) {
                return 0.0;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new TabularSchemaException(where(row, column) + " is not numeric: '" + text + "'", e);
            }
        }

        int index(int row, int column, int base) throws TabularSchemaException {
            double value = number(row, column, false);
            if (value != Math.rint(value)) {
                throw new TabularSchemaException(where(row, column) + " is not an integer index: " + value);
            }
            int index = (int) value - base;
            if (index < 0) {
                throw new TabularSchemaException(where(row, column) + " is below the index base " + base);
            }
            return index;
        }

        String where(int row, int column) {
            String name = column < header.length ? header[column] : "#" + column;
            return "Value in " + file.getFileName() + " row " + (row + 2) + " column '" + name + "'";
        }
    }
}
