package co.fanki.faex.analysis.domain;

import co.fanki.faex.analysis.domain.python.PythonAst.Attribute;
import co.fanki.faex.analysis.domain.python.PythonAst.Expression;
import co.fanki.faex.analysis.domain.python.PythonAst.Name;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Renders class references as dotted names.
 *
 * <p>{@code NotFound} renders as "NotFound" and {@code errors.http.NotFound}
 * as "errors.http.NotFound". When an attribute chain does not start at a
 * plain name, e.g. {@code factory().NotFound}, only the attribute parts are
 * kept: "NotFound".</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ClassNames {

    private ClassNames() {
    }

    /**
     * Renders a name or attribute chain.
     *
     * @param expression the expression to render, may be null
     * @return the dotted name, or empty for any other expression shape
     */
    public static Optional<String> render(final Expression expression) {
        if (expression instanceof Name name) {
            return Optional.of(name.id());
        }
        if (!(expression instanceof Attribute)) {
            return Optional.empty();
        }

        final Deque<String> parts = new ArrayDeque<>();
        Expression current = expression;
        while (current instanceof Attribute attribute) {
            parts.push(attribute.attr());
            current = attribute.value();
        }
        if (current instanceof Name root) {
            parts.push(root.id());
        }
        return Optional.of(String.join(".", parts));
    }

}
