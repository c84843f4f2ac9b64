package co.fanki.faex.cli;

import co.fanki.faex.analysis.application.AnalysisOptions;
import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.shared.DomainException;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Collection;
import java.util.concurrent.Callable;

/**
 * Base of the subcommands that analyze a path.
 *
 * <p>Caller misuse reported by the analysis, such as a missing path or a
 * negative depth, is printed to stderr and ends the command with the
 * usage exit code.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
abstract class AnalysisCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "PATH",
            description = "Python file or directory to analyze.")
    private Path path;

    @Option(names = "--depth", paramLabel = "N",
            description = "Maximum call depth for transitive analysis"
                    + " (default: 3).")
    private Integer depth;

    @ParentCommand
    private FaexCommandLine parent;

    @Spec
    private CommandSpec spec;

    @Override
    public final Integer call() {
        try {
            return run();
        } catch (final DomainException e) {
            err().println("Error: " + e.getMessage());
            return FaexCommandLine.USAGE_ERROR;
        }
    }

    /**
     * Runs the command once its arguments are bound.
     *
     * @return the exit code
     */
    protected abstract int run();

    /**
     * Analyzes the path argument.
     *
     * @param base the options the command line arguments override
     * @param ignore the ignored names, or null to keep those of base
     * @return the analysis result
     */
    protected AnalysisResult analyze(final AnalysisOptions base,
            final Collection<String> ignore) {
        final AnalysisOptions options = base.override(depth, ignore);
        return parent.analysisService().analyze(path, options);
    }

    /**
     * Analyzes the path argument with the service defaults.
     *
     * @return the analysis result
     */
    protected AnalysisResult analyze() {
        return analyze(parent.analysisService().defaultOptions(), null);
    }

    protected FaexCommandLine parent() {
        return parent;
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /**
     * Returns the ANSI mode of the command line, by default enabled only
     * when stdout is a terminal.
     *
     * @return the ANSI mode
     */
    protected Ansi ansi() {
        return spec.commandLine().getColorScheme().ansi();
    }

}
