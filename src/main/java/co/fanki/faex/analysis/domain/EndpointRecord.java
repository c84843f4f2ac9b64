package co.fanki.faex.analysis.domain;

import co.fanki.faex.shared.Preconditions;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An analyzed HTTP endpoint: its route declaration and the exceptions that
 * can reach its body.
 *
 * <p>Comparison between declared and detected exceptions is an exact match
 * on the rendered class name: {@code errors.NotFound} and {@code NotFound}
 * are different names.</p>
 *
 * @param file the file defining the endpoint function
 * @param line the 1-based line of the {@code def}
 * @param functionName the endpoint function name
 * @param method the HTTP method, upper case, e.g. "GET"
 * @param path the literal route path, or null
 * @param declaredExceptions declared names in declaration order
 * @param detectedExceptions detected occurrences in discovery order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EndpointRecord(
        Path file,
        int line,
        String functionName,
        String method,
        String path,
        List<String> declaredExceptions,
        List<ExceptionOccurrence> detectedExceptions
) {

    /** Validates the required components and copies the lists. */
    public EndpointRecord {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonBlank(functionName,
                "Function name is required");
        Preconditions.requireNonBlank(method, "HTTP method is required");
        declaredExceptions = declaredExceptions == null
                ? List.of() : List.copyOf(declaredExceptions);
        detectedExceptions = detectedExceptions == null
                ? List.of() : List.copyOf(detectedExceptions);
    }

    /**
     * Detected occurrences whose class is not declared.
     *
     * @return the undeclared occurrences, in discovery order
     */
    public List<ExceptionOccurrence> undeclared() {
        final Set<String> declared = new HashSet<>(declaredExceptions);
        return detectedExceptions.stream()
                .filter(o -> !declared.contains(o.exceptionClass()))
                .toList();
    }

    /**
     * Declared names that no detected occurrence raises.
     *
     * @return the unused declarations, in declaration order
     */
    public List<String> unused() {
        final Set<String> detected = detectedExceptions.stream()
                .map(ExceptionOccurrence::exceptionClass)
                .collect(Collectors.toSet());
        return declaredExceptions.stream()
                .filter(name -> !detected.contains(name))
                .toList();
    }

    /**
     * Checks whether the endpoint raises anything it does not declare.
     *
     * @return true if there is at least one undeclared occurrence
     */
    public boolean hasIssues() {
        return !undeclared().isEmpty();
    }

    /**
     * Checks whether a class name is among the declared exceptions.
     *
     * @param exceptionClass the rendered class name
     * @return true if declared
     */
    public boolean declares(final String exceptionClass) {
        return declaredExceptions.contains(exceptionClass);
    }

}
