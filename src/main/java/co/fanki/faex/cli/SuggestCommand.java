package co.fanki.faex.cli;

import co.fanki.faex.analysis.application.report.DeclarationSuggester;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Prints the exceptions=[...] list each endpoint should declare.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Command(
        name = "suggest",
        mixinStandardHelpOptions = true,
        description = "Generate exception declarations for endpoints."
)
public class SuggestCommand extends AnalysisCommand {

    @Option(names = "--format", paramLabel = "FORMAT",
            defaultValue = "text",
            description = "Output format: ${COMPLETION-CANDIDATES}"
                    + " (default: ${DEFAULT-VALUE}).")
    private DeclarationSuggester.Format format;

    @Override
    protected int run() {
        out().println(new DeclarationSuggester(ansi()).render(analyze(),
                format));
        out().flush();
        return 0;
    }

}
