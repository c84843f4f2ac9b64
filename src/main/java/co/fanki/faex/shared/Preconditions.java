package co.fanki.faex.shared;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Utility class for argument validation and precondition checks.
 *
 * <p>Argument checks raise {@link IllegalArgumentException}; checks on
 * caller supplied input that the analysis cannot work with raise a
 * {@link DomainException} carrying an error code.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class, not instantiable
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a number is non-negative.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the non-negative number
     * @throws IllegalArgumentException if value is negative
     */
    public static int requireNonNegative(final int value, final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Converts a caller supplied path string into a path.
     *
     * @param path the path string, may be null
     * @return the path
     * @throws DomainException with code {@code PATH_REQUIRED} if the string
     *         is null or blank, or {@code INVALID_PATH} if it is not a valid
     *         path on this filesystem
     */
    public static Path requirePath(final String path) {
        if (path == null || path.isBlank()) {
            throw new DomainException("Path is required", "PATH_REQUIRED");
        }
        try {
            return Path.of(path);
        } catch (final InvalidPathException e) {
            throw new DomainException("Invalid path: " + e.getMessage(),
                    "INVALID_PATH");
        }
    }

    /**
     * Ensures that a path to analyze exists on the filesystem.
     *
     * @param path the path to check, may be null
     * @return the existing path
     * @throws DomainException with code {@code PATH_NOT_FOUND} if the path
     *         is null or does not exist
     */
    public static Path requireExistingPath(final Path path) {
        if (path == null || !Files.exists(path)) {
            throw new DomainException("Path does not exist: " + path,
                    "PATH_NOT_FOUND");
        }
        return path;
    }

}
