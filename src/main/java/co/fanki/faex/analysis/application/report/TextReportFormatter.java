package co.fanki.faex.analysis.application.report;

import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.analysis.domain.EndpointRecord;
import co.fanki.faex.analysis.domain.ExceptionOccurrence;
import picocli.CommandLine.Help.Ansi;

import java.util.ArrayList;
import java.util.List;

/**
 * Text report listing the endpoints with undeclared exceptions.
 *
 * <pre>
 * app/users.py:42 - POST /users/{id}/action (perform_action)
 *   Undeclared exceptions:
 *     - ForbiddenException (raised in check_permission at app/users.py:27)
 *
 * Found 1 undeclared exception in 1 endpoint.
 * </pre>
 *
 * <p>When created for a terminal with ANSI support the report is colored,
 * uses bullets for the exceptions and closes with a summary line.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class TextReportFormatter implements ReportFormatter {

    private final Highlighter highlighter;

    /** Creates a formatter producing plain text. */
    public TextReportFormatter() {
        this(Ansi.OFF);
    }

    /**
     * Creates a formatter for the given ANSI mode.
     *
     * @param ansi the ANSI mode of the output
     */
    public TextReportFormatter(final Ansi ansi) {
        this.highlighter = new Highlighter(ansi);
    }

    /** {@inheritDoc} */
    @Override
    public String format(final AnalysisResult result, final boolean verbose) {
        if (result.endpoints().isEmpty()) {
            return highlighter.paint("yellow", "No FastAPI endpoints found.");
        }

        final List<EndpointRecord> withIssues = result.endpointsWithIssues();
        final List<String> lines = new ArrayList<>();

        if (withIssues.isEmpty()) {
            if (verbose) {
                lines.add(highlighter.paint("faint", "Analyzed "
                        + result.endpoints().size() + " endpoints."));
            }
            lines.add(highlighter.enabled()
                    ? highlighter.paint("green",
                            "✓ No undeclared exceptions found.")
                    : "No undeclared exceptions found.");
            return String.join("\n", lines);
        }

        final String bullet = highlighter.enabled() ? "•" : "-";
        for (final EndpointRecord endpoint : withIssues) {
            lines.add(header(endpoint, highlighter));
            lines.add(highlighter.paint("red", "  Undeclared exceptions:"));
            for (final ExceptionOccurrence occurrence : endpoint.undeclared()) {
                lines.add("    " + highlighter.paint("red", bullet) + " "
                        + occurrence.exceptionClass() + " "
                        + highlighter.paint("faint", occurrence.origin()));
            }
            if (verbose && !endpoint.declaredExceptions().isEmpty()) {
                lines.add(highlighter.paint("green",
                        "  Declared exceptions:"));
                for (final String declared : endpoint.declaredExceptions()) {
                    lines.add("    " + highlighter.paint("green", bullet)
                            + " " + declared);
                }
            }
            lines.add("");
        }

        final int total = result.totalUndeclared();
        final int count = withIssues.size();
        lines.add("");
        if (highlighter.enabled()) {
            lines.add(highlighter.paint("bold,red", "Summary:") + " " + total
                    + " undeclared exception(s) in " + count
                    + " endpoint(s)");
        } else {
            lines.add("Found " + total + " undeclared exception"
                    + plural(total) + " in " + count + " endpoint"
                    + plural(count) + ".");
        }

        return String.join("\n", lines);
    }

    /**
     * Renders the location line of an endpoint.
     *
     * @param endpoint the endpoint
     * @param highlighter the styles to apply
     * @return "file:line - METHOD path (function)", or "file:line -
     *         function" when the endpoint has no literal path
     */
    static String header(final EndpointRecord endpoint,
            final Highlighter highlighter) {
        final String location = highlighter.paint("cyan",
                endpoint.file().toString()) + ":"
                + highlighter.paint("yellow", String.valueOf(endpoint.line()));
        if (endpoint.path() == null || endpoint.path().isEmpty()) {
            return location + " - "
                    + highlighter.paint("bold", endpoint.functionName());
        }
        return location + " - " + highlighter.paint("bold", endpoint.method())
                + " " + endpoint.path() + " ("
                + highlighter.paint("faint", endpoint.functionName()) + ")";
    }

    private static String plural(final int count) {
        return count == 1 ? "" : "s";
    }

}
