package org.episim.io;

/**
 * Initial infections per patch.
 *
 * @param patches 0-based patch indices
 * @param seeds   number of initially infected individuals in the patch at the same position
 */
public record SeedTable(int[] patches, double[] seeds) {

    public SeedTable {
        if (patches.length != seeds.length) {
            throw new IllegalArgumentException("Seed table columns differ in length: "
                    + patches.length + " != " + seeds.length);
        }
    }

    public int size() {
        return patches.length;
    }

    public double totalSeeds() {
        double total = 0.0;
        for (double seed : seeds) {
            total += seed;
        }
        return total;
    }
}
