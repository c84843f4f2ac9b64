package co.fanki.faex.cli;

import co.fanki.faex.analysis.application.AnalysisOptions;
import co.fanki.faex.analysis.application.report.ReportFormat;
import co.fanki.faex.analysis.domain.AnalysisResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * Checks for undeclared exceptions and fails when any is found.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Command(
        name = "check",
        mixinStandardHelpOptions = true,
        description = "Check for undeclared exceptions in FastAPI endpoints."
)
public class CheckCommand extends AnalysisCommand {

    @Option(names = "--ignore", paramLabel = "CLASS",
            description = "Exception class to ignore, repeatable.")
    private List<String> ignore;

    @Option(names = "--format", paramLabel = "FORMAT",
            defaultValue = "text",
            description = "Output format: ${COMPLETION-CANDIDATES}"
                    + " (default: ${DEFAULT-VALUE}).")
    private ReportFormat format;

    @Option(names = "--strict",
            description = "Fail on any undeclared exception. Always"
                    + " on; accepted for compatibility.")
    private boolean strict;

    @Option(names = "--config", paramLabel = "FILE",
            description = "Properties or YAML file with faex.analysis.*"
                    + " defaults.")
    private Path config;

    @Option(names = {"-v", "--verbose"},
            description = "Show detailed analysis.")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Only show errors.")
    private boolean quiet;

    @Override
    protected int run() {
        final AnalysisOptions base = config != null
                ? new ConfigFileLoader().load(config,
                        parent().analysisService().defaultOptions())
                : parent().analysisService().defaultOptions();

        final AnalysisResult result = analyze(base, ignore);

        if (!quiet) {
            for (final String error : result.errors()) {
                err().println("Warning: " + error);
            }
        }

        final String report = format.formatter(parent().objectMapper(),
                ansi()).format(result, verbose);
        if (!report.isEmpty() && !quiet) {
            out().println(report);
        }
        out().flush();

        return result.hasIssues() ? 1 : 0;
    }

}
