package co.fanki.faex.analysis.domain;

import co.fanki.faex.analysis.domain.python.PythonAst;
import co.fanki.faex.analysis.domain.python.PythonAst.FunctionDef;
import co.fanki.faex.analysis.domain.python.PythonAst.Module;
import co.fanki.faex.analysis.domain.python.PythonSourceReader;
import co.fanki.faex.analysis.domain.python.SourceParseException;
import co.fanki.faex.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves bare function names to their definitions across a source tree.
 *
 * <p>Every function of a registered file becomes resolvable by its bare
 * name, whether it is defined at module level, as a class method or nested
 * inside another function. Names are not qualified: when two files (or two
 * classes) define the same name, the definition registered last wins.</p>
 *
 * <p>An index belongs to a single analysis run and is not thread-safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceIndex {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceIndex.class);

    private final PythonSourceReader reader;

    private final Map<String, ResolvedFunction> functions = new HashMap<>();

    private final Set<Path> registeredFiles = new HashSet<>();

    /**
     * Creates an empty index.
     *
     * @param theReader the reader used by {@link #register(Path)}
     */
    public SourceIndex(final PythonSourceReader theReader) {
        this.reader = Preconditions.requireNonNull(theReader,
                "Reader is required");
    }

    /**
     * Parses a file and registers its functions.
     *
     * <p>Each path is handled at most once; later calls are no-ops. A file
     * that fails to parse registers nothing.</p>
     *
     * @param file the file to register
     */
    void register(final Path file) {
        Preconditions.requireNonNull(file, "File is required");
        if (!registeredFiles.add(file)) {
            return;
        }
        try {
            index(file, reader.read(file));
        } catch (final SourceParseException e) {
            LOG.debug("Skipping {} in index: {}", file, e.getMessage());
        }
    }

    /**
     * Registers the functions of an already parsed file.
     *
     * @param file the file the module was parsed from
     * @param module the parsed module
     */
    public void register(final Path file, final Module module) {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(module, "Module is required");
        if (registeredFiles.add(file)) {
            index(file, module);
        }
    }

    private void index(final Path file, final Module module) {
        int count = 0;
        for (final FunctionDef function : PythonAst.functions(module)) {
            functions.put(function.name(),
                    new ResolvedFunction(file, function));
            count++;
        }
        LOG.debug("Indexed {} functions from {}", count, file);
    }

    /**
     * Looks up a function by bare name.
     *
     * @param name the function name
     * @return the last registered definition, or empty
     */
    public Optional<ResolvedFunction> lookup(final String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Checks whether a file was already handed to this index.
     *
     * @param file the file to check
     * @return true if registered, including files that failed to parse
     */
    boolean isRegistered(final Path file) {
        return registeredFiles.contains(file);
    }

    /**
     * Returns the number of distinct resolvable names.
     *
     * @return the number of names
     */
    public int size() {
        return functions.size();
    }

}
