package org.episim.api.model;

import java.lang.reflect.Array;
import java.util.Arrays;

/**
 * Row-major dense array of doubles with an explicit shape.
 * <p>
 * The last axis varies fastest, which is also the element order of NetCDF and HDF5 datasets,
 * so the backing array can be written or filled without reordering.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Instances are owned by a single run.
 */
public final class DenseArray {

    private final int[] shape;
    private final int[] strides;
    private final double[] data;

    /**
     * Creates a zero-filled array.
     *
     * @param shape extent of each axis, all non-negative
     */
    public DenseArray(int... shape) {
        this(new double[checkedSize(shape)], shape);
    }

    private DenseArray(double[] data, int[] shape) {
        this.shape = shape.clone();
        this.data = data;
        this.strides = new int[shape.length];
        int stride = 1;
        for (int axis = shape.length - 1; axis >= 0; axis--) {
            strides[axis] = stride;
            stride *= shape[axis];
        }
    }

    /**
     * Wraps an existing row-major buffer without copying.
     *
     * @param data  backing buffer, length must equal the product of {@code shape}
     * @param shape extent of each axis
     * @return a view over {@code data}
     */
    public static DenseArray wrap(double[] data, int... shape) {
        if (data.length != checkedSize(shape)) {
            throw new IllegalArgumentException("Buffer of length " + data.length
                    + " does not match shape " + Arrays.toString(shape));
        }
        return new DenseArray(data, shape);
    }

    /**
     * Converts a rectangular nested Java array ({@code double[][]...}, {@code float[][]...},
     * {@code int[][]...} or {@code long[][]...}) into a dense array.
     *
     * @param nested the nested array, as returned by HDF5 readers
     * @return a new dense array holding the same values
     */
    public static DenseArray fromNestedArray(Object nested) {
        if (nested == null || !nested.getClass().isArray()) {
            throw new IllegalArgumentException("Not an array: " + nested);
        }
        int rank = 0;
        Class<?> type = nested.getClass();
        while (type.isArray()) {
            rank++;
            type = type.getComponentType();
        }
        int[] shape = new int[rank];
        Object cursor = nested;
        for (int axis = 0; axis < rank; axis++) {
            shape[axis] = Array.getLength(cursor);
            if (shape[axis] == 0) {
                break;
            }
            if (axis < rank - 1) {
                cursor = Array.get(cursor, 0);
            }
        }
        DenseArray result = new DenseArray(shape);
        int[] position = {0};
        flatten(nested, 0, shape, result.data, position);
        return result;
    }

    private static void flatten(Object node, int axis, int[] shape, double[] target, int[] position) {
        int length = Array.getLength(node);
        if (length != shape[axis]) {
            throw new IllegalArgumentException("Ragged array at axis " + axis + ": " + length + " != " + shape[axis]);
        }
        if (axis == shape.length - 1) {
            for (int i = 0; i < length; i++) {
                target[position[0]++] = ((Number) Array.get(node, i)).doubleValue();
            }
            return;
        }
        for (int i = 0; i < length; i++) {
            flatten(Array.get(node, i), axis + 1, shape, target, position);
        }
    }

    /**
     * Copies the values into a nested {@code double} array of this array's rank.
     *
     * @return e.g. a {@code double[][][]} for a rank-3 array
     */
    public Object toNestedArray() {
        if (shape.length == 0) {
            throw new IllegalStateException("Rank-0 arrays have no nested representation");
        }
        return nest(0, 0);
    }

    private Object nest(int axis, int base) {
        if (axis == shape.length - 1) {
            return Arrays.copyOfRange(data, base, base + shape[axis]);
        }
        Class<?> componentType = Array.newInstance(double.class, new int[shape.length - axis - 1]).getClass();
        Object level = Array.newInstance(componentType, shape[axis]);
        for (int i = 0; i < shape[axis]; i++) {
            Array.set(level, i, nest(axis + 1, base + i * strides[axis]));
        }
        return level;
    }

    public int rank() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int dim(int axis) {
        return shape[axis];
    }

    public int size() {
        return data.length;
    }

    public boolean hasShape(int... expected) {
        return Arrays.equals(shape, expected);
    }

    /**
     * Returns the flat position of an element.
     *
     * @param index one index per axis
     * @return offset into {@link #data()}
     * @throws IndexOutOfBoundsException if the index does not address an element
     */
    public int offset(int... index) {
        if (index.length != shape.length) {
            throw new IndexOutOfBoundsException("Expected " + shape.length + " indices, got " + index.length);
        }
        int offset = 0;
        for (int axis = 0; axis < index.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException("Index " + index[axis] + " out of range for axis " + axis
                        + " with extent " + shape[axis]);
            }
            offset += index[axis] * strides[axis];
        }
        return offset;
    }

    public double get(int... index) {
        return data[offset(index)];
    }

    public void set(double value, int... index) {
        data[offset(index)] = value;
    }

    /**
     * Direct access to the row-major backing buffer.
     *
     * @return the live buffer; writes are visible through this array
     */
    public double[] data() {
        return data;
    }

    public DenseArray copy() {
        return new DenseArray(data.clone(), shape);
    }

    public double sum() {
        double total = 0.0;
        for (double value : data) {
            total += value;
        }
        return total;
    }

    @Override
    public String toString() {
        return "DenseArray" + Arrays.toString(shape);
    }

    private static int checkedSize(int[] shape) {
        long size = 1;
        for (int extent : shape) {
            if (extent < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
            size *= extent;
            if (size > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " exceeds addressable size");
            }
        }
        return (int) size;
    }
}
