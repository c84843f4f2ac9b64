package co.fanki.faex.analysis.application.report;

import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.analysis.domain.EndpointRecord;
import co.fanki.faex.analysis.domain.ExceptionOccurrence;
import co.fanki.faex.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON report with a summary, the endpoints and the file errors.
 *
 * <p>Only endpoints with undeclared exceptions are listed unless verbose,
 * in which case every endpoint is.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JsonReportFormatter implements ReportFormatter {

    private final ObjectMapper objectMapper;

    /**
     * Creates a new JsonReportFormatter.
     *
     * @param theObjectMapper the mapper used to build and write the tree
     */
    public JsonReportFormatter(final ObjectMapper theObjectMapper) {
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
    }

    /** {@inheritDoc} */
    @Override
    public String format(final AnalysisResult result, final boolean verbose) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(toTree(result, verbose));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot write JSON report", e);
        }
    }

    /**
     * Builds the report as a JSON tree.
     *
     * @param result the analysis result
     * @param verbose whether to list endpoints without issues too
     * @return the report tree
     */
    public ObjectNode toTree(final AnalysisResult result,
            final boolean verbose) {
        final ObjectNode root = objectMapper.createObjectNode();

        final ObjectNode summary = root.putObject("summary");
        summary.put("total_endpoints", result.endpoints().size());
        summary.put("endpoints_with_issues",
                result.endpointsWithIssues().size());
        summary.put("total_undeclared", result.totalUndeclared());

        final ArrayNode endpoints = root.putArray("endpoints");
        for (final EndpointRecord endpoint : result.endpoints()) {
            if (verbose || endpoint.hasIssues()) {
                endpoints.add(toNode(endpoint));
            }
        }

        final ArrayNode errors = root.putArray("errors");
        result.errors().forEach(errors::add);
        return root;
    }

    private ObjectNode toNode(final EndpointRecord endpoint) {
        final ObjectNode node = objectMapper.createObjectNode();
        node.put("file", endpoint.file().toString());
        node.put("line", endpoint.line());
        node.put("function", endpoint.functionName());
        node.put("method", endpoint.method());
        node.put("path", endpoint.path());

        final ArrayNode declared = node.putArray("declared_exceptions");
        endpoint.declaredExceptions().forEach(declared::add);

        final ArrayNode undeclared = node.putArray("undeclared_exceptions");
        for (final ExceptionOccurrence occurrence : endpoint.undeclared()) {
            final ObjectNode item = undeclared.addObject();
            item.put("class", occurrence.exceptionClass());
            item.put("file", occurrence.file().toString());
            item.put("line", occurrence.line());
            item.put("in_function", occurrence.inFunction());
        }
        return node;
    }

}
