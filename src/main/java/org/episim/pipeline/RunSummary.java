package org.episim.pipeline;

import java.nio.file.Path;
import java.util.List;

import org.episim.api.exceptions.EpiSimException;

/**
 * Outcome of a completed run.
 *
 * @param outputFolder  folder the outputs were written to
 * @param writtenFiles  files written, in order
 * @param reportedErrors non-fatal failures, such as an out-of-range snapshot request
 */
public record RunSummary(Path outputFolder, List<Path> writtenFiles, List<EpiSimException> reportedErrors) {

    public RunSummary {
        writtenFiles = List.copyOf(writtenFiles);
        reportedErrors = List.copyOf(reportedErrors);
    }

    public boolean hasReportedErrors() {
        return !reportedErrors.isEmpty();
    }
}
