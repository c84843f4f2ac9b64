package co.fanki.faex.analysis.application.report;

import co.fanki.faex.analysis.domain.AnalysisResult;

/**
 * Renders an {@link AnalysisResult} for output.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ReportFormatter {

    /**
     * Formats the result.
     *
     * @param result the analysis result
     * @param verbose whether to include details omitted by default
     * @return the report, possibly empty, without trailing newline
     */
    String format(AnalysisResult result, boolean verbose);

}
