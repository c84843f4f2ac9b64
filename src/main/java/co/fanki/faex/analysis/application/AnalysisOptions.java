package co.fanki.faex.analysis.application;

import co.fanki.faex.shared.DomainException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-run settings of an analysis.
 *
 * @param maxDepth how many call levels to follow below an endpoint; 0 only
 *        looks at the endpoint body
 * @param ignore exception class names to leave out of the results, matched
 *        exactly against the rendered name
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisOptions(int maxDepth, Set<String> ignore) {

    /** The default call depth. */
    public static final int DEFAULT_MAX_DEPTH = 3;

    /**
     * Validates the depth and copies the ignore set.
     *
     * @throws DomainException with code {@code INVALID_DEPTH} for a
     *         negative depth
     */
    public AnalysisOptions {
        if (maxDepth < 0) {
            throw new DomainException("Maximum depth must be zero or"
                    + " positive, got " + maxDepth, "INVALID_DEPTH");
        }
        ignore = ignore == null
                ? Set.of() : Set.copyOf(ignore);
    }

    /**
     * Options with the default depth and nothing ignored.
     *
     * @return the default options
     */
    public static AnalysisOptions defaults() {
        return new AnalysisOptions(DEFAULT_MAX_DEPTH, Set.of());
    }

    /**
     * Creates options from a possibly absent depth and ignore list, falling
     * back to this instance for what is missing.
     *
     * @param theMaxDepth the requested depth, or null
     * @param theIgnore the requested ignore names, or null
     * @return the merged options
     */
    public AnalysisOptions override(final Integer theMaxDepth,
            final Collection<String> theIgnore) {
        return new AnalysisOptions(
                theMaxDepth != null ? theMaxDepth : maxDepth,
                theIgnore != null ? new LinkedHashSet<>(theIgnore) : ignore);
    }

}
