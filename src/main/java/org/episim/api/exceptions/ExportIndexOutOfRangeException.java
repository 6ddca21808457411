package org.episim.api.exceptions;

/**
 * Thrown when a snapshot is requested for a time step outside {@code [1, T]}.
 * <p>
 * Not fatal for a run: the runner reports it and completes the remaining outputs.
 */
public class ExportIndexOutOfRangeException extends EpiSimException {

    private final int requestedStep;
    private final int horizon;

    public ExportIndexOutOfRangeException(int requestedStep, int horizon) {
        super("Cannot export time step " + requestedStep + ": simulation horizon is " + horizon + " steps");
        this.requestedStep = requestedStep;
        this.horizon = horizon;
    }

    public int getRequestedStep() {
        return requestedStep;
    }

    public int getHorizon() {
        return horizon;
    }
}
