package co.fanki.faex.cli;

import co.fanki.faex.analysis.application.AnalysisOptions;
import co.fanki.faex.analysis.application.EndpointAnalysisService;
import co.fanki.faex.analysis.domain.SourceFileScanner;
import co.fanki.faex.analysis.domain.python.PythonSourceReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Entry point of the {@code faex} command line.
 *
 * <p>Runs without a Spring context: the analysis service is created
 * directly so that only the report reaches stdout.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Command(
        name = "faex",
        mixinStandardHelpOptions = true,
        version = "faex 0.1.0",
        description = "Validate the exceptions=[...] declarations of"
                + " FastAPI endpoints.",
        subcommands = {
            CheckCommand.class,
            ListCommand.class,
            SuggestCommand.class,
            CommandLine.HelpCommand.class
        }
)
public class FaexCommandLine implements Callable<Integer> {

    /** Exit code for usage errors and invalid arguments. */
    static final int USAGE_ERROR = CommandLine.ExitCode.USAGE;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final EndpointAnalysisService analysisService;

    @Spec
    private CommandSpec spec;

    /** Creates the command line with the default analysis service. */
    public FaexCommandLine() {
        this(new EndpointAnalysisService(new PythonSourceReader(),
                new SourceFileScanner(), AnalysisOptions.defaults()));
    }

    /**
     * Creates the command line around a given analysis service.
     *
     * @param theAnalysisService the service every subcommand runs
     */
    public FaexCommandLine(final EndpointAnalysisService theAnalysisService) {
        this.analysisService = theAnalysisService;
    }

    @Override
    public Integer call() {
        final CommandLine commandLine = spec.commandLine();
        commandLine.usage(commandLine.getOut());
        return 0;
    }

    /**
     * Runs the command line and exits with its exit code.
     *
     * @param args the command line arguments
     */
    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates a configured CommandLine with the default analysis service.
     *
     * @return the command line
     */
    public static CommandLine createCommandLine() {
        return createCommandLine(new FaexCommandLine());
    }

    /**
     * Creates a configured CommandLine around the given root command.
     *
     * @param root the root command
     * @return the command line
     */
    public static CommandLine createCommandLine(final FaexCommandLine root) {
        final CommandLine commandLine = new CommandLine(root);
        commandLine.setCommandName("faex");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    EndpointAnalysisService analysisService() {
        return analysisService;
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

}
