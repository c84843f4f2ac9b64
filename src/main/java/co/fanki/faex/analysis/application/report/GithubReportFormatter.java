package co.fanki.faex.analysis.application.report;

import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.analysis.domain.EndpointRecord;
import co.fanki.faex.analysis.domain.ExceptionOccurrence;

import java.util.ArrayList;
import java.util.List;

/**
 * GitHub Actions workflow commands, one {@code ::error} annotation per
 * undeclared exception, anchored at the endpoint definition.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GithubReportFormatter implements ReportFormatter {

    /** {@inheritDoc} */
    @Override
    public String format(final AnalysisResult result, final boolean verbose) {
        final List<String> lines = new ArrayList<>();

        for (final EndpointRecord endpoint : result.endpointsWithIssues()) {
            for (final ExceptionOccurrence occurrence : endpoint.undeclared()) {
                String message = "Undeclared exception '"
                        + occurrence.exceptionClass() + "'";
                if (!occurrence.isDirect()) {
                    message += " raised in " + occurrence.inFunction();
                }
                lines.add("::error file=" + endpoint.file() + ",line="
                        + endpoint.line() + ",title=Undeclared Exception::"
                        + message);
            }
        }
        return String.join("\n", lines);
    }

}
