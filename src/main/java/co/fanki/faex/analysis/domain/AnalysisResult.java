package co.fanki.faex.analysis.domain;

import java.util.List;

/**
 * The outcome of one analysis run.
 *
 * @param endpoints the analyzed endpoints, files in path order and
 *        endpoints in source order within a file
 * @param errors one message per file that could not be analyzed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisResult(
        List<EndpointRecord> endpoints,
        List<String> errors
) {

    /** Copies the lists. */
    public AnalysisResult {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Checks whether any endpoint raises an undeclared exception.
     *
     * @return true if at least one endpoint has issues
     */
    public boolean hasIssues() {
        return endpoints.stream().anyMatch(EndpointRecord::hasIssues);
    }

    /**
     * Counts undeclared occurrences over all endpoints.
     *
     * @return the total number of undeclared occurrences
     */
    public int totalUndeclared() {
        return endpoints.stream()
                .mapToInt(e -> e.undeclared().size())
                .sum();
    }

    /**
     * Returns the endpoints with at least one undeclared occurrence.
     *
     * @return the endpoints with issues, in result order
     */
    public List<EndpointRecord> endpointsWithIssues() {
        return endpoints.stream()
                .filter(EndpointRecord::hasIssues)
                .toList();
    }

}
