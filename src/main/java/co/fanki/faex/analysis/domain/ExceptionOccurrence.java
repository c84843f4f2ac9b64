package co.fanki.faex.analysis.domain;

import co.fanki.faex.shared.Preconditions;

import java.nio.file.Path;

/**
 * A place where an exception class is raised.
 *
 * <p>Occurrences found directly in an endpoint body carry no enclosing
 * function. Occurrences found while following calls are attributed to the
 * function that was called from the level above, see
 * {@link #attributedTo(String)}.</p>
 *
 * @param file the file containing the {@code raise} statement
 * @param line the 1-based line of the {@code raise} statement
 * @param column the 0-based column of the {@code raise} keyword
 * @param exceptionClass the raised class name, possibly dotted
 * @param inFunction the function the raise was reached through, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExceptionOccurrence(
        Path file,
        int line,
        int column,
        String exceptionClass,
        String inFunction
) {

    /** Validates the required components. */
    public ExceptionOccurrence {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonBlank(exceptionClass,
                "Exception class is required");
    }

    /**
     * Returns a copy attributed to the given function.
     *
     * <p>An occurrence that is already attributed keeps its function, so
     * the name always points at the function holding the raise.</p>
     *
     * @param functionName the called function name
     * @return this occurrence if already attributed, otherwise a copy
     */
    public ExceptionOccurrence attributedTo(final String functionName) {
        if (inFunction != null) {
            return this;
        }
        return new ExceptionOccurrence(file, line, column, exceptionClass,
                functionName);
    }

    /**
     * Checks whether the raise was found directly in the endpoint body.
     *
     * @return true if no enclosing function is recorded
     */
    public boolean isDirect() {
        return inFunction == null;
    }

    /**
     * Describes where the exception is raised, as shown in reports.
     *
     * @return e.g. "(raised in load at app.py:12)"
     */
    public String origin() {
        if (inFunction != null) {
            return "(raised in " + inFunction + " at " + file + ":" + line
                    + ")";
        }
        return "(raised at line " + line + ")";
    }

}
