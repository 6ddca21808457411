package org.episim.api.model;

/**
 * Directed mobility flow between two distinct patches.
 *
 * @param origin      0-based index of the patch the flow leaves
 * @param destination 0-based index of the patch the flow reaches
 * @param weight      fraction of the origin's mobile population travelling along this edge
 */
public record MobilityEdge(int origin, int destination, double weight) {

    public MobilityEdge {
        if (origin < 0 || destination < 0) {
            throw new IllegalArgumentException("Patch indices must be non-negative: " + origin + " -> " + destination);
        }
    }

    public boolean isSelfLoop() {
        return origin == destination;
    }
}
