package org.episim.pipeline;

import java.nio.file.Path;

/**
 * File system locations of one run.
 *
 * @param dataFolder       folder containing the input files named in {@code data}
 * @param instanceFolder   folder receiving the {@code output} subfolder
 * @param initialCondition explicit initial-condition file, or {@code null}
 */
public record RunPaths(Path dataFolder, Path instanceFolder, Path initialCondition) {

    public RunPaths(Path dataFolder, Path instanceFolder) {
        this(dataFolder, instanceFolder, null);
    }
}
