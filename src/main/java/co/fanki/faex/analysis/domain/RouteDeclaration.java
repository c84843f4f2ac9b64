package co.fanki.faex.analysis.domain;

import co.fanki.faex.shared.Preconditions;

import java.util.List;

/**
 * What a route decorator declares about its endpoint.
 *
 * @param method the HTTP method of the decorator
 * @param path the literal path argument, or null when absent or not literal
 * @param declaredExceptions the names listed in {@code exceptions=[...]}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RouteDeclaration(
        HttpMethod method,
        String path,
        List<String> declaredExceptions
) {

    /** Validates and copies the declared names. */
    public RouteDeclaration {
        Preconditions.requireNonNull(method, "HTTP method is required");
        declaredExceptions = declaredExceptions == null
                ? List.of() : List.copyOf(declaredExceptions);
    }

}
