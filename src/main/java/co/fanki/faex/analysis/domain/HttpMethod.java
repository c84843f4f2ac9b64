package co.fanki.faex.analysis.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP methods recognized as route decorators, e.g. {@code @router.get}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum HttpMethod {

    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    HEAD,
    OPTIONS,
    TRACE;

    /**
     * Resolves a decorator name to its HTTP method.
     *
     * <p>Only the lower case spelling used by FastAPI routers matches:
     * {@code get} is a route decorator, {@code GET} is not.</p>
     *
     * @param decoratorName the attribute or function name of the decorator
     * @return the method, or empty if the name is not a route decorator
     */
    public static Optional<HttpMethod> fromDecoratorName(
            final String decoratorName) {
        if (decoratorName == null) {
            return Optional.empty();
        }
        for (final HttpMethod method : values()) {
            if (method.name().toLowerCase(Locale.ROOT).equals(decoratorName)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

}
