package org.episim.api.exceptions;

import java.util.Arrays;

/**
 * Thrown when an initial-condition array does not have the shape the engine variant expects.
 */
public class InitialConditionShapeException extends EpiSimException {

    private final int[] expected;
    private final int[] actual;

    public InitialConditionShapeException(int[] expected, int[] actual) {
        super("Initial condition has shape " + Arrays.toString(actual) + " but " + Arrays.toString(expected)
                + " was expected (age groups, patches, [vaccination states,] compartments)");
        this.expected = expected.clone();
        this.actual = actual.clone();
    }

    public int[] getExpected() {
        return expected.clone();
    }

    public int[] getActual() {
        return actual.clone();
    }
}
