package com.stackdoc.core.pipeline;

import com.stackdoc.core.generator.ElementReport;
import com.stackdoc.core.renderer.GeneratedOutput;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one pipeline run.
 *
 * @param discovered number of element directories found
 * @param reports generated element reports, in discovery order
 * @param failures elements whose values document failed to load
 * @param skipped identifiers of elements without a values document
 * @param output files to write, reports first and the index last
 */
public record PipelineResult(
    int discovered,
    List<ElementReport> reports,
    List<ElementFailure> failures,
    List<String> skipped,
    GeneratedOutput output
) {
    /**
     * Compact constructor with validation.
     */
    public PipelineResult {
        reports = reports == null ? List.of() : List.copyOf(reports);
        failures = failures == null ? List.of() : List.copyOf(failures);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
        Objects.requireNonNull(output, "output must not be null");
    }

    /**
     * Process exit code of the run: {@code 1} if any element failed or nothing was discovered.
     *
     * @return exit code
     */
    public int exitCode() {
        return !failures.isEmpty() || discovered == 0 ? 1 : 0;
    }
}
