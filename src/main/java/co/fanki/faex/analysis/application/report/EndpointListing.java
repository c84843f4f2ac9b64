package co.fanki.faex.analysis.application.report;

import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.analysis.domain.EndpointRecord;
import co.fanki.faex.analysis.domain.ExceptionOccurrence;
import picocli.CommandLine.Help.Ansi;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists every endpoint with its declared and detected exceptions.
 *
 * <p>Detected exceptions are marked with a check mark when declared and a
 * cross otherwise. Verbose mode adds the column of each raise and the
 * declared names that are never raised. On an ANSI terminal the marks and
 * labels are colored.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EndpointListing {

    private static final String DECLARED_MARK = "✓";

    private static final String UNDECLARED_MARK = "✗";

    private final Highlighter highlighter;

    /** Creates a listing producing plain text. */
    public EndpointListing() {
        this(Ansi.OFF);
    }

    /**
     * Creates a listing for the given ANSI mode.
     *
     * @param ansi the ANSI mode of the output
     */
    public EndpointListing(final Ansi ansi) {
        this.highlighter = new Highlighter(ansi);
    }

    /**
     * Renders the listing.
     *
     * @param result the analysis result
     * @param verbose whether to include columns and unused declarations
     * @return the listing, without trailing newline
     */
    public String render(final AnalysisResult result, final boolean verbose) {
        if (result.endpoints().isEmpty()) {
            return highlighter.paint("yellow", "No FastAPI endpoints found.");
        }

        final List<String> lines = new ArrayList<>();
        for (final EndpointRecord endpoint : result.endpoints()) {
            lines.add(TextReportFormatter.header(endpoint, highlighter));
            addDeclared(lines, endpoint);
            addDetected(lines, endpoint, verbose);
            if (verbose && !endpoint.unused().isEmpty()) {
                lines.add("  Unused declarations: "
                        + String.join(", ", endpoint.unused()));
            }
            lines.add("");
        }
        lines.add(highlighter.paint("faint",
                "Total endpoints: " + result.endpoints().size()));
        return String.join("\n", lines);
    }

    private void addDeclared(final List<String> lines,
            final EndpointRecord endpoint) {
        if (endpoint.declaredExceptions().isEmpty()) {
            lines.add(highlighter.paint("faint", "  Declared: (none)"));
            return;
        }
        lines.add(highlighter.paint("green", "  Declared:"));
        for (final String declared : endpoint.declaredExceptions()) {
            lines.add("    " + highlighter.paint("green", DECLARED_MARK)
                    + " " + declared);
        }
    }

    private void addDetected(final List<String> lines,
            final EndpointRecord endpoint, final boolean verbose) {
        if (endpoint.detectedExceptions().isEmpty()) {
            lines.add(highlighter.paint("faint", "  Detected: (none)"));
            return;
        }
        lines.add(highlighter.paint("blue", "  Detected:"));
        for (final ExceptionOccurrence occurrence
                : endpoint.detectedExceptions()) {
            final String mark = endpoint.declares(occurrence.exceptionClass())
                    ? highlighter.paint("green", DECLARED_MARK)
                    : highlighter.paint("red", UNDECLARED_MARK);
            final String position = verbose
                    ? "line " + occurrence.line() + ", column "
                            + occurrence.column()
                    : "line " + occurrence.line();
            if (occurrence.isDirect()) {
                lines.add("    " + mark + " " + occurrence.exceptionClass()
                        + " " + highlighter.paint("faint",
                                "(" + position + ")"));
            } else {
                lines.add("    " + mark + " " + occurrence.exceptionClass()
                        + " " + highlighter.paint("faint", "(in "
                                + occurrence.inFunction() + " at "
                                + position + ")"));
            }
        }
    }

}
