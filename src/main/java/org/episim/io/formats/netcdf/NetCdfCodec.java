package org.episim.io.formats.netcdf;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.episim.api.model.DenseArray;
import org.episim.io.formats.LabeledDataset;

/**
 * Encoder and decoder for the NetCDF classic file format.
 * <p>
 * Provides two components:
 * <ul>
 *   <li>{@link Writer}: writes a {@link LabeledDataset} in the 64-bit offset variant (CDF-2)</li>
 *   <li>{@link Reader}: reads CDF-1 and CDF-2 headers and fixed-size numeric or char variables</li>
 * </ul>
 * <p>
 * Classic files have no string type, so the coordinate labels of a dimension {@code D} are
 * stored as a char variable {@code D_label} with dimensions {@code (D, D_strlen)}. Record
 * (unlimited) dimensions are never written and not supported when reading.
 * <p>
 * All values are big-endian; every header element and every variable is padded to 4 bytes.
 */
public final class NetCdfCodec {

    static final int NC_DIMENSION = 0x0A;
    static final int NC_VARIABLE = 0x0B;
    static final int NC_ATTRIBUTE = 0x0C;

    static final int NC_BYTE = 1;
    static final int NC_CHAR = 2;
    static final int NC_SHORT = 3;
    static final int NC_INT = 4;
    static final int NC_FLOAT = 5;
    static final int NC_DOUBLE = 6;

    private static final byte VERSION_CLASSIC = 1;
    private static final byte VERSION_64BIT_OFFSET = 2;

    public static final String LABEL_SUFFIX = "_label";
    public static final String STRLEN_SUFFIX = "_strlen";
    public static final String DESCRIPTION = "description";

    private NetCdfCodec() {
        // No instantiation - use Writer or Reader
    }

    private record Dim(String name, int length) {
    }

    private record Var(String name, int[] dimIds, Map<String, String> attributes, int type, long begin) {
    }

    // ========================================================================
    // Writer
    // ========================================================================

    /**
     * Serializes datasets as CDF-2 files.
     * <p>
     * <strong>Usage:</strong>
     * <pre>{@code
     * try (OutputStream out = Files.newOutputStream(path)) {
     *     new NetCdfCodec.Writer().write(out, dataset);
     * }
     * }</pre>
     */
    public static final class Writer {

        /**
         * @param out     destination, not closed by this method
         * @param dataset dimensions, labels and double variables to encode
         * @throws IOException if the stream fails
         */
        public void write(OutputStream out, LabeledDataset dataset) throws IOException {
            List<Dim> dims = new ArrayList<>();
            Map<String, Integer> dimIds = new LinkedHashMap<>();
            List<PendingVar> vars = new ArrayList<>();

            for (LabeledDataset.Dimension dimension : dataset.dimensions()) {
                dimIds.put(dimension.name(), dims.size());
                dims.add(new Dim(dimension.name(), dimension.size()));
            }
            for (LabeledDataset.Dimension dimension : dataset.dimensions()) {
                byte[][] encoded = encodeLabels(dimension.labels());
                int strlen = 1;
                for (byte[] label : encoded) {
                    strlen = Math.max(strlen, label.length);
                }
                int strlenId = dims.size();
                dims.add(new Dim(dimension.name() + STRLEN_SUFFIX, strlen));
                byte[] chars = new byte[encoded.length * strlen];
                for (int i = 0; i < encoded.length; i++) {
                    System.arraycopy(encoded[i], 0, chars, i * strlen, encoded[i].length);
                }
                vars.add(new PendingVar(dimension.name() + LABEL_SUFFIX,
                        new int[] {dimIds.get(dimension.name()), strlenId},
                        Map.of(DESCRIPTION, "Labels of dimension " + dimension.name()),
                        NC_CHAR, chars, null));
            }
            for (LabeledDataset.Variable variable : dataset.variables()) {
                int[] ids = variable.dimensions().stream().mapToInt(dimIds::get).toArray();
                Map<String, String> attributes = variable.description() == null
                        ? Map.of()
                        : Map.of(DESCRIPTION, variable.description());
                vars.add(new PendingVar(variable.name(), ids, attributes, NC_DOUBLE, null, variable.values()));
            }

            // The header size does not depend on the begin offsets, so measure it first.
            int headerSize = encodeHeader(dims, dataset.attributes(), vars).length;
            long offset = headerSize;
            for (PendingVar var : vars) {
                var.begin = offset;
                offset += var.paddedSize();
            }

            DataOutputStream data = new DataOutputStream(out);
            data.write(encodeHeader(dims, dataset.attributes(), vars));
            for (PendingVar var : vars) {
                if (var.chars != null) {
                    data.write(var.chars);
                } else {
                    for (double value : var.values.data()) {
                        data.writeDouble(value);
                    }
                }
                for (long pad = var.rawSize(); pad < var.paddedSize(); pad++) {
                    data.writeByte(0);
                }
            }
            data.flush();
        }

        private byte[] encodeHeader(List<Dim> dims, Map<String, String> globalAttributes, List<PendingVar> vars)
                throws IOException {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            DataOutputStream header = new DataOutputStream(bytes);
            header.writeBytes("CDF");
            header.writeByte(VERSION_64BIT_OFFSET);
            header.writeInt(0); // numrecs

            if (dims.isEmpty()) {
                header.writeInt(0);
                header.writeInt(0);
            } else {
                header.writeInt(NC_DIMENSION);
                header.writeInt(dims.size());
                for (Dim dim : dims) {
                    writeName(header, dim.name());
                    header.writeInt(dim.length());
                }
            }

            writeAttributes(header, globalAttributes);

            if (vars.isEmpty()) {
                header.writeInt(0);
                header.writeInt(0);
            } else {
                header.writeInt(NC_VARIABLE);
                header.writeInt(vars.size());
                for (PendingVar var : vars) {
                    writeName(header, var.name);
                    header.writeInt(var.dimIds.length);
                    for (int id : var.dimIds) {
                        header.writeInt(id);
                    }
                    writeAttributes(header, var.attributes);
                    header.writeInt(var.type);
                    // vsize saturates for variables larger than the field can express
                    header.writeInt((int) Math.min(var.paddedSize(), 0xFFFFFFFFL));
                    header.writeLong(var.begin);
                }
            }
            header.flush();
            return bytes.toByteArray();
        }

        private static void writeAttributes(DataOutputStream header, Map<String, String> attributes)
                throws IOException {
            if (attributes.isEmpty()) {
                header.writeInt(0);
                header.writeInt(0);
                return;
            }
            header.writeInt(NC_ATTRIBUTE);
            header.writeInt(attributes.size());
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                writeName(header, attribute.getKey());
                header.writeInt(NC_CHAR);
                byte[] value = attribute.getValue().getBytes(StandardCharsets.UTF_8);
                header.writeInt(value.length);
                header.write(value);
                pad(header, value.length);
            }
        }

        private static void writeName(DataOutputStream header, String name) throws IOException {
            byte[] encoded = name.getBytes(StandardCharsets.UTF_8);
            header.writeInt(encoded.length);
            header.write(encoded);
            pad(header, encoded.length);
        }

        private static void pad(DataOutputStream header, int length) throws IOException {
            for (int i = length; i % 4 != 0; i++) {
                header.writeByte(0);
            }
        }

        private static byte[][] encodeLabels(List<String> labels) {
            byte[][] encoded = new byte[labels.size()][];
            for (int i = 0; i < labels.size(); i++) {
                encoded[i] = labels.get(i).getBytes(StandardCharsets.UTF_8);
            }
            return encoded;
        }
    }

    private static final class PendingVar {
        private final String name;
        private final int[] dimIds;
        private final Map<String, String> attributes;
        private final int type;
        private final byte[] chars;
        private final DenseArray values;
        private long begin;

        PendingVar(String name, int[] dimIds, Map<String, String> attributes, int type, byte[] chars,
                DenseArray values) {
            this.name = name;
            this.dimIds = dimIds;
            this.attributes = attributes;
            this.type = type;
            this.chars = chars;
            this.values = values;
        }

        long rawSize() {
            return chars != null ? chars.length : (long) values.size() * Double.BYTES;
        }

        long paddedSize() {
            return (rawSize() + 3) & ~3L;
        }
    }

    // ========================================================================
    // Reader
    // ========================================================================

    /**
     * Parsed NetCDF classic file held in memory.
     * <p>
     * <strong>Usage:</strong>
     * <pre>{@code
     * NetCdfCodec.Reader reader = NetCdfCodec.Reader.open(path);
     * DenseArray data = reader.readNumeric("data");
     * }</pre>
     */
    public static final class Reader {

        private final ByteBuffer buffer;
        private final List<Dim> dims = new ArrayList<>();
        private final Map<String, String> globalAttributes = new LinkedHashMap<>();
        private final Map<String, Var> vars = new LinkedHashMap<>();

        private Reader(ByteBuffer buffer) throws IOException {
            this.buffer = buffer;
            try {
                parseHeader();
            } catch (BufferUnderflowException | IllegalArgumentException e) {
                throw new IOException("Truncated or corrupt NetCDF header", e);
            }
        }

        /**
         * @param file NetCDF classic (CDF-1) or 64-bit offset (CDF-2) file
         * @throws IOException if the file cannot be read or is not a classic NetCDF file
         */
        public static Reader open(Path file) throws IOException {
            return new Reader(ByteBuffer.wrap(Files.readAllBytes(file)));
        }

        public static Reader of(byte[] content) throws IOException {
            return new Reader(ByteBuffer.wrap(content));
        }

        public List<String> variableNames() {
            return List.copyOf(vars.keySet());
        }

        public Map<String, String> globalAttributes() {
            return Collections.unmodifiableMap(globalAttributes);
        }

        public Optional<String> attribute(String variable, String name) throws IOException {
            return Optional.ofNullable(var(variable).attributes().get(name));
        }

        /**
         * @return dimension names of a variable, outermost first
         */
        public List<String> dimensionsOf(String variable) throws IOException {
            List<String> names = new ArrayList<>();
            for (int id : var(variable).dimIds()) {
                names.add(dims.get(id).name());
            }
            return names;
        }

        public int[] shapeOf(String variable) throws IOException {
            int[] ids = var(variable).dimIds();
            int[] shape = new int[ids.length];
            for (int i = 0; i < ids.length; i++) {
                shape[i] = dims.get(ids[i]).length();
            }
            return shape;
        }

        /**
         * Reads a numeric variable of any classic numeric type as doubles.
         *
         * @throws IOException if the variable is absent, is a char variable or uses a record dimension
         */
        public DenseArray readNumeric(String variable) throws IOException {
            Var var = var(variable);
            int[] shape = shapeOf(variable);
            checkFixedSize(variable, shape);
            DenseArray result = new DenseArray(shape);
            double[] target = result.data();
            ByteBuffer view = slice(var);
            for (int i = 0; i < target.length; i++) {
                target[i] = switch (var.type()) {
                    case NC_DOUBLE -> view.getDouble();
                    case NC_FLOAT -> view.getFloat();
                    case NC_INT -> view.getInt();
                    case NC_SHORT -> view.getShort();
                    case NC_BYTE -> view.get();
                    default -> throw new IOException("Variable " + variable + " is not numeric (type " + var.type() + ")");
                };
            }
            return result;
        }

        /**
         * Reads a two-dimensional char variable as one string per row, trailing NULs removed.
         */
        public List<String> readLabels(String variable) throws IOException {
            Var var = var(variable);
            int[] shape = shapeOf(variable);
            if (var.type() != NC_CHAR || shape.length != 2) {
                throw new IOException("Variable " + variable + " is not a two-dimensional char variable");
            }
            checkFixedSize(variable, shape);
            ByteBuffer view = slice(var);
            List<String> labels = new ArrayList<>(shape[0]);
            byte[] row = new byte[shape[1]];
            for (int i = 0; i < shape[0]; i++) {
                view.get(row);
                int length = row.length;
                while (length > 0 && row[length - 1] == 0) {
                    length--;
                }
                labels.add(new String(row, 0, length, StandardCharsets.UTF_8));
            }
            return labels;
        }

        private Var var(String name) throws IOException {
            Var var = vars.get(name);
            if (var == null) {
                throw new IOException("Variable '" + name + "' not found; file contains " + vars.keySet());
            }
            return var;
        }

        private ByteBuffer slice(Var var) throws IOException {
            if (var.begin() < 0 || var.begin() > buffer.limit()) {
                throw new IOException("Variable " + var.name() + " starts outside the file at offset " + var.begin());
            }
            ByteBuffer view = buffer.duplicate();
            view.position((int) var.begin());
            return view;
        }

        private void checkFixedSize(String variable, int[] shape) throws IOException {
            for (int length : shape) {
                if (length == 0) {
                    throw new IOException("Variable " + variable + " uses a record dimension, which is not supported");
                }
            }
        }

        private void parseHeader() throws IOException {
            byte[] magic = new byte[3];
            buffer.get(magic);
            if (!"CDF".equals(new String(magic, StandardCharsets.US_ASCII))) {
                throw new IOException("Not a NetCDF classic file (magic " + Arrays.toString(magic) + ")");
            }
            byte version = buffer.get();
            if (version != VERSION_CLASSIC && version != VERSION_64BIT_OFFSET) {
                throw new IOException("Unsupported NetCDF version " + version);
            }
            buffer.getInt(); // numrecs

            int dimCount = readListHeader(NC_DIMENSION);
            for (int i = 0; i < dimCount; i++) {
                dims.add(new Dim(readName(), buffer.getInt()));
            }
            globalAttributes.putAll(readAttributes());

            int varCount = readListHeader(NC_VARIABLE);
            for (int i = 0; i < varCount; i++) {
                String name = readName();
                int[] dimIds = new int[buffer.getInt()];
                for (int d = 0; d < dimIds.length; d++) {
                    dimIds[d] = buffer.getInt();
                    if (dimIds[d] < 0 || dimIds[d] >= dims.size()) {
                        throw new IOException("Variable " + name + " references unknown dimension " + dimIds[d]);
                    }
                }
                Map<String, String> attributes = readAttributes();
                int type = buffer.getInt();
                buffer.getInt(); // vsize
                long begin = version == VERSION_CLASSIC ? Integer.toUnsignedLong(buffer.getInt()) : buffer.getLong();
                vars.put(name, new Var(name, dimIds, attributes, type, begin));
            }
        }

        private int readListHeader(int expectedTag) throws IOException {
            int tag = buffer.getInt();
            int count = buffer.getInt();
            if (tag == 0 && count == 0) {
                return 0;
            }
            if (tag != expectedTag) {
                throw new IOException("Expected header tag " + expectedTag + " but found " + tag);
            }
            return count;
        }

        private Map<String, String> readAttributes() throws IOException {
            Map<String, String> attributes = new LinkedHashMap<>();
            int count = readListHeader(NC_ATTRIBUTE);
            for (int i = 0; i < count; i++) {
                String name = readName();
                int type = buffer.getInt();
                int length = buffer.getInt();
                int bytes = length * typeSize(type);
                byte[] value = new byte[bytes];
                buffer.get(value);
                skipPadding(bytes);
                // Only text attributes are retained
                if (type == NC_CHAR) {
                    attributes.put(name, new String(value, StandardCharsets.UTF_8));
                }
            }
            return attributes;
        }

        private String readName() {
            int length = buffer.getInt();
            byte[] name = new byte[length];
            buffer.get(name);
            skipPadding(length);
            return new String(name, StandardCharsets.UTF_8);
        }

        private void skipPadding(int length) {
            int remainder = length % 4;
            if (remainder != 0) {
                buffer.position(buffer.position() + 4 - remainder);
            }
        }

        private static int typeSize(int type) throws IOException {
            return switch (type) {
                case NC_BYTE, NC_CHAR -> 1;
                case NC_SHORT -> 2;
                case NC_INT, NC_FLOAT -> 4;
                case NC_DOUBLE -> 8;
                default -> throw new IOException("Unknown NetCDF type " + type);
            };
        }
    }
}
