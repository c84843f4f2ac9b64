package co.fanki.faex.analysis.application;

import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.analysis.domain.DeclarationExtractor;
import co.fanki.faex.analysis.domain.EndpointRecord;
import co.fanki.faex.analysis.domain.ExceptionDetector;
import co.fanki.faex.analysis.domain.ExceptionOccurrence;
import co.fanki.faex.analysis.domain.RouteDeclaration;
import co.fanki.faex.analysis.domain.SourceFileScanner;
import co.fanki.faex.analysis.domain.SourceIndex;
import co.fanki.faex.analysis.domain.TransitiveAnalyzer;
import co.fanki.faex.analysis.domain.python.PythonAst;
import co.fanki.faex.analysis.domain.python.PythonAst.FunctionDef;
import co.fanki.faex.analysis.domain.python.PythonAst.Module;
import co.fanki.faex.analysis.domain.python.PythonSourceReader;
import co.fanki.faex.analysis.domain.python.SourceParseException;
import co.fanki.faex.shared.DomainException;
import co.fanki.faex.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the exception declarations of every endpoint under a path.
 *
 * <p>A run works in two phases. First every Python file is parsed once and
 * all of its functions are registered in a fresh {@link SourceIndex}, so a
 * helper resolves the same way no matter which file it is called from.
 * Then, file by file in path order, every function with a route decorator
 * is analyzed by a fresh {@link TransitiveAnalyzer} and turned into an
 * {@link EndpointRecord}.</p>
 *
 * <p>A file that cannot be read, decoded or parsed is skipped and reported
 * in {@link AnalysisResult#errors()}; it never aborts the run. Asking for a
 * path that does not exist, or for a negative depth, is a caller error and
 * raises a {@link DomainException}.</p>
 *
 * <p>Runs share no state, so the service can serve concurrent
 * requests.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class EndpointAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            EndpointAnalysisService.class);

    private final PythonSourceReader reader;
    private final SourceFileScanner scanner;
    private final DeclarationExtractor extractor = new DeclarationExtractor();
    private final ExceptionDetector detector = new ExceptionDetector();
    private final AnalysisOptions defaultOptions;

    /**
     * Creates a new EndpointAnalysisService from configuration.
     *
     * @param theMaxDepth the default call depth
     * @param theIgnore the exception class names ignored by default
     */
    @Autowired
    public EndpointAnalysisService(
            @Value("${faex.analysis.max-depth:3}") final int theMaxDepth,
            @Value("${faex.analysis.ignore:}") final List<String> theIgnore) {
        this(new PythonSourceReader(), new SourceFileScanner(),
                new AnalysisOptions(theMaxDepth, ignoreSet(theIgnore)));
    }

    /**
     * Creates a new EndpointAnalysisService with explicit collaborators.
     *
     * @param theReader the source reader
     * @param theScanner the file scanner
     * @param theDefaultOptions the options used by {@link #analyze(Path)}
     */
    public EndpointAnalysisService(final PythonSourceReader theReader,
            final SourceFileScanner theScanner,
            final AnalysisOptions theDefaultOptions) {
        this.reader = Preconditions.requireNonNull(theReader,
                "Reader is required");
        this.scanner = Preconditions.requireNonNull(theScanner,
                "Scanner is required");
        this.defaultOptions = Preconditions.requireNonNull(theDefaultOptions,
                "Default options are required");
    }

    /**
     * Returns the options configured for this service.
     *
     * @return the default options
     */
    public AnalysisOptions defaultOptions() {
        return defaultOptions;
    }

    /**
     * Analyzes a path with the configured default options.
     *
     * @param path a Python file or a directory
     * @return the analysis result
     */
    public AnalysisResult analyze(final Path path) {
        return analyze(path, defaultOptions);
    }

    /**
     * Analyzes a path.
     *
     * @param path a Python file or a directory
     * @param options the depth and ignore settings for this run
     * @return the analysis result
     * @throws DomainException with code {@code PATH_NOT_FOUND} if the path
     *         does not exist, or {@code PATH_NOT_READABLE} if a directory
     *         cannot be walked
     */
    public AnalysisResult analyze(final Path path,
            final AnalysisOptions options) {
        Preconditions.requireNonNull(options, "Options are required");
        Preconditions.requireExistingPath(path);

        LOG.info("Analyzing {} (max depth {}, {} ignored)", path,
                options.maxDepth(), options.ignore().size());

        final List<Path> files = discover(path);
        LOG.debug("Discovered {} source files", files.size());

        final SourceIndex index = new SourceIndex(reader);
        final Map<Path, Module> modules = new LinkedHashMap<>();
        final List<String> errors = new ArrayList<>();

        for (final Path file : files) {
            try {
                final Module module = reader.read(file);
                modules.put(file, module);
                index.register(file, module);
            } catch (final SourceParseException e) {
                final String error = e.label() + " in " + file + ": "
                        + e.getMessage();
                LOG.info(error);
                errors.add(error);
            }
        }

        LOG.debug("Indexed {} function names from {} files", index.size(),
                modules.size());

        final TransitiveAnalyzer analyzer = new TransitiveAnalyzer(index,
                detector, options.maxDepth());
        final List<EndpointRecord> endpoints = new ArrayList<>();

        for (final Map.Entry<Path, Module> entry : modules.entrySet()) {
            for (final FunctionDef function
                    : PythonAst.functions(entry.getValue())) {
                final Optional<RouteDeclaration> route =
                        extractor.extract(function);
                route.ifPresent(r -> endpoints.add(toEndpoint(entry.getKey(),
                        function, r, analyzer, options.ignore())));
            }
        }

        final AnalysisResult result = new AnalysisResult(endpoints, errors);
        LOG.info("Analyzed {} endpoints in {} files: {} undeclared in {}"
                + " endpoints, {} file errors", endpoints.size(),
                modules.size(), result.totalUndeclared(),
                result.endpointsWithIssues().size(), errors.size());
        return result;
    }

    private List<Path> discover(final Path path) {
        try {
            return scanner.scan(path);
        } catch (final IOException e) {
            throw new DomainException("Cannot read path " + path + ": "
                    + e.getMessage(), "PATH_NOT_READABLE");
        }
    }

    private EndpointRecord toEndpoint(final Path file,
            final FunctionDef function, final RouteDeclaration route,
            final TransitiveAnalyzer analyzer, final Set<String> ignore) {

        final List<ExceptionOccurrence> detected = analyzer
                .analyze(file, function).stream()
                .filter(o -> !ignore.contains(o.exceptionClass()))
                .toList();

        return new EndpointRecord(file, function.line(), function.name(),
                route.method().name(), route.path(),
                route.declaredExceptions(), detected);
    }

    private static Set<String> ignoreSet(final List<String> names) {
        final Set<String> ignore = new LinkedHashSet<>();
        if (names != null) {
            for (final String name : names) {
                if (name != null && !name.isBlank()) {
                    ignore.add(name.trim());
                }
            }
        }
        return ignore;
    }

}
