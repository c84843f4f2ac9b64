package co.fanki.faex.cli;

import co.fanki.faex.analysis.application.report.EndpointListing;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Lists every endpoint with its declared and detected exceptions.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Command(
        name = "list",
        mixinStandardHelpOptions = true,
        description = "List all detected exceptions in endpoints."
)
public class ListCommand extends AnalysisCommand {

    @Option(names = {"-v", "--verbose"},
            description = "Show detailed information.")
    private boolean verbose;

    @Override
    protected int run() {
        out().println(new EndpointListing(ansi()).render(analyze(),
                verbose));
        out().flush();
        return 0;
    }

}
