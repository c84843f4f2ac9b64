package co.fanki.faex.analysis.application.report;

import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.analysis.domain.EndpointRecord;
import co.fanki.faex.analysis.domain.ExceptionOccurrence;
import picocli.CommandLine.Help.Ansi;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Suggests the {@code exceptions=[...]} declaration each endpoint with
 * issues should have.
 *
 * <p>The suggestion is the sorted union of what the endpoint declares and
 * what it raises. Declared names that are never raised are kept: removing
 * them is a judgement call the analysis cannot make.</p>
 *
 * <p>On an ANSI terminal the rendered suggestions are colored.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DeclarationSuggester {

    /** How suggestions are printed. */
    public enum Format {
        /** The suggested declaration and the names being added. */
        TEXT,
        /** A two line diff of the declaration. */
        DIFF
    }

    /**
     * A suggested declaration for one endpoint.
     *
     * @param endpoint the endpoint the suggestion is for
     * @param suggested the complete sorted declaration
     * @param adding the undeclared names, in discovery order, without
     *        duplicates
     */
    public record Suggestion(
            EndpointRecord endpoint,
            List<String> suggested,
            List<String> adding
    ) {

        /**
         * Converts the suggestion to the map returned by the REST and MCP
         * surfaces.
         *
         * @return file, line, function, suggested_exceptions and adding
         */
        public Map<String, Object> toMap() {
            final Map<String, Object> map = new LinkedHashMap<>();
            map.put("file", endpoint.file().toString());
            map.put("line", endpoint.line());
            map.put("function", endpoint.functionName());
            map.put("suggested_exceptions", suggested);
            map.put("adding", adding);
            return map;
        }
    }

    private final Highlighter highlighter;

    /** Creates a suggester rendering plain text. */
    public DeclarationSuggester() {
        this(Ansi.OFF);
    }

    /**
     * Creates a suggester rendering for the given ANSI mode.
     *
     * @param ansi the ANSI mode of the output
     */
    public DeclarationSuggester(final Ansi ansi) {
        this.highlighter = new Highlighter(ansi);
    }

    /**
     * Builds the suggestions for the endpoints with issues.
     *
     * @param result the analysis result
     * @return one suggestion per endpoint with issues, in result order
     */
    public List<Suggestion> suggest(final AnalysisResult result) {
        final List<Suggestion> suggestions = new ArrayList<>();
        for (final EndpointRecord endpoint : result.endpointsWithIssues()) {
            final Set<String> all = new TreeSet<>(
                    endpoint.declaredExceptions());
            for (final ExceptionOccurrence occurrence
                    : endpoint.detectedExceptions()) {
                all.add(occurrence.exceptionClass());
            }

            final Set<String> adding = new LinkedHashSet<>();
            for (final ExceptionOccurrence occurrence : endpoint.undeclared()) {
                adding.add(occurrence.exceptionClass());
            }

            suggestions.add(new Suggestion(endpoint, List.copyOf(all),
                    List.copyOf(adding)));
        }
        return suggestions;
    }

    /**
     * Renders the suggestions.
     *
     * @param result the analysis result
     * @param format the output format
     * @return the rendered suggestions, without trailing newline
     */
    public String render(final AnalysisResult result, final Format format) {
        final List<Suggestion> suggestions = suggest(result);
        if (suggestions.isEmpty()) {
            return highlighter.enabled()
                    ? highlighter.paint("green",
                            "✓ All exceptions are properly declared.")
                    : "All exceptions are properly declared.";
        }

        final List<String> lines = new ArrayList<>();
        for (final Suggestion suggestion : suggestions) {
            final EndpointRecord endpoint = suggestion.endpoint();
            if (!lines.isEmpty()) {
                lines.add("");
            }
            lines.add(highlighter.paint("cyan", endpoint.file() + ":"
                    + endpoint.line()) + " - "
                    + highlighter.paint("bold", endpoint.functionName()));

            if (format == Format.DIFF) {
                lines.add(highlighter.paint("red", "  - exceptions=["
                        + String.join(", ", endpoint.declaredExceptions())
                        + "]"));
                lines.add(highlighter.paint("green", "  + exceptions=["
                        + String.join(", ", suggestion.suggested()) + "]"));
            } else {
                lines.add(highlighter.paint("yellow", "  Suggested:"));
                lines.add("    exceptions=["
                        + String.join(", ", suggestion.suggested()) + "]");
                lines.add(highlighter.paint("faint", "  Adding: "
                        + String.join(", ", suggestion.adding())));
            }
        }
        return String.join("\n", lines);
    }

}
