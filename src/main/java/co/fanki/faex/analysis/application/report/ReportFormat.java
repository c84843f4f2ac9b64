package co.fanki.faex.analysis.application.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine.Help.Ansi;

/**
 * The report formats of the {@code check} command.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ReportFormat {

    /** Human readable text. */
    TEXT,

    /** Machine readable JSON. */
    JSON,

    /** GitHub Actions workflow annotations. */
    GITHUB;

    /**
     * Creates the formatter for this format.
     *
     * @param objectMapper the mapper used by the JSON format
     * @return a new formatter
     */
    public ReportFormatter formatter(final ObjectMapper objectMapper) {
        return formatter(objectMapper, Ansi.OFF);
    }

    /**
     * Creates the formatter for this format, writing to an output with the
     * given ANSI mode. Only the text format is colored.
     *
     * @param objectMapper the mapper used by the JSON format
     * @param ansi the ANSI mode of the output
     * @return a new formatter
     */
    public ReportFormatter formatter(final ObjectMapper objectMapper,
            final Ansi ansi) {
        return switch (this) {
            case TEXT -> new TextReportFormatter(ansi);
            case JSON -> new JsonReportFormatter(objectMapper);
            case GITHUB -> new GithubReportFormatter();
        };
    }

}
