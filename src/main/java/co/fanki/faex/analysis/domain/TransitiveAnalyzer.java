package co.fanki.faex.analysis.domain;

import co.fanki.faex.analysis.domain.python.PythonAst;
import co.fanki.faex.analysis.domain.python.PythonAst.Attribute;
import co.fanki.faex.analysis.domain.python.PythonAst.Call;
import co.fanki.faex.analysis.domain.python.PythonAst.FunctionDef;
import co.fanki.faex.analysis.domain.python.PythonAst.Name;
import co.fanki.faex.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collects the exceptions that can reach a function body, following the
 * calls it makes down to a maximum depth.
 *
 * <p>The endpoint itself is depth 0. For every call in a body at depth
 * {@code d < maxDepth}, the callee is resolved by bare name through the
 * {@link SourceIndex} (for {@code obj.method()} only {@code method} is
 * used) and analyzed at depth {@code d + 1}. Everything found below a call
 * is attributed to the called name.</p>
 *
 * <p>A function is never entered twice along the same call path, which
 * stops recursion. Sibling calls do not see each other's path, so two
 * calls to the same helper from one body are both reported. Results are
 * memoized by callee name and depth for the lifetime of the analyzer; as
 * a consequence the first path that reaches a (name, depth) pair decides
 * what later paths see for it.</p>
 *
 * <p>An analyzer belongs to a single analysis run and is not
 * thread-safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class TransitiveAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            TransitiveAnalyzer.class);

    private final SourceIndex index;

    private final ExceptionDetector detector;

    private final int maxDepth;

    private final Map<CacheKey, List<ExceptionOccurrence>> cache =
            new HashMap<>();

    /**
     * Creates an analyzer over an index.
     *
     * @param theIndex the index used to resolve callees
     * @param theDetector the detector of direct raises
     * @param theMaxDepth the maximum call depth, 0 disables call following
     */
    public TransitiveAnalyzer(final SourceIndex theIndex,
            final ExceptionDetector theDetector, final int theMaxDepth) {
        this.index = Preconditions.requireNonNull(theIndex,
                "Index is required");
        this.detector = Preconditions.requireNonNull(theDetector,
                "Detector is required");
        this.maxDepth = Preconditions.requireNonNegative(theMaxDepth,
                "Maximum depth must not be negative");
    }

    /**
     * Analyzes an endpoint function.
     *
     * @param file the file defining the endpoint
     * @param endpoint the endpoint function
     * @return direct raises first (unattributed), then, per call in source
     *         order, the occurrences reachable through it
     */
    public List<ExceptionOccurrence> analyze(final Path file,
            final FunctionDef endpoint) {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(endpoint, "Endpoint is required");
        return analyzeFunction(file, endpoint, 0, new HashSet<>());
    }

    private List<ExceptionOccurrence> analyzeFunction(final Path file,
            final FunctionDef function, final int depth,
            final Set<String> visited) {

        if (!visited.add(function.name())) {
            return List.of();
        }

        final List<ExceptionOccurrence> occurrences = new ArrayList<>(
                detector.detect(file, function, null));

        if (depth >= maxDepth) {
            return occurrences;
        }

        for (final Call call : calls(function)) {
            final String callee = calleeName(call);
            if (callee == null || visited.contains(callee)) {
                continue;
            }
            occurrences.addAll(analyzeCallee(callee, depth + 1,
                    new HashSet<>(visited)));
        }
        return occurrences;
    }

    private List<ExceptionOccurrence> analyzeCallee(final String callee,
            final int depth, final Set<String> visited) {

        final CacheKey key = new CacheKey(callee, depth);
        final List<ExceptionOccurrence> cached = cache.get(key);
        if (cached != null) {
            return cached;
        }

        final Optional<ResolvedFunction> target = index.lookup(callee);
        if (target.isEmpty()) {
            return List.of();
        }

        final List<ExceptionOccurrence> attributed = analyzeFunction(
                target.get().file(), target.get().function(), depth, visited)
                .stream()
                .map(o -> o.attributedTo(callee))
                .toList();

        LOG.trace("{} at depth {} reaches {} raises", callee, depth,
                attributed.size());
        cache.put(key, attributed);
        return attributed;
    }

    private static List<Call> calls(final FunctionDef function) {
        final List<Call> calls = new ArrayList<>();
        PythonAst.walkBody(function.body(), node -> {
            if (node instanceof Call call) {
                calls.add(call);
            }
        });
        return calls;
    }

    private static String calleeName(final Call call) {
        if (call.func() instanceof Name name) {
            return name.id();
        }
        if (call.func() instanceof Attribute attribute) {
            return attribute.attr();
        }
        return null;
    }

    /** Memoization key: callee name and the depth it was analyzed at. */
    private record CacheKey(String name, int depth) {
    }

}
