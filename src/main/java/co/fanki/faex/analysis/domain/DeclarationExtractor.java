package co.fanki.faex.analysis.domain;

import co.fanki.faex.analysis.domain.python.PythonAst.Attribute;
import co.fanki.faex.analysis.domain.python.PythonAst.Call;
import co.fanki.faex.analysis.domain.python.PythonAst.Constant;
import co.fanki.faex.analysis.domain.python.PythonAst.Expression;
import co.fanki.faex.analysis.domain.python.PythonAst.FunctionDef;
import co.fanki.faex.analysis.domain.python.PythonAst.Keyword;
import co.fanki.faex.analysis.domain.python.PythonAst.ListDisplay;
import co.fanki.faex.analysis.domain.python.PythonAst.Name;
import co.fanki.faex.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the route declaration of an endpoint from its decorators.
 *
 * <p>A route decorator is a call whose callee is named after an HTTP
 * method, either as an attribute ({@code @router.get(...)},
 * {@code @app.post(...)}) or as a bare name ({@code @get(...)}). The
 * receiver is not checked. Only the first route decorator of a function is
 * used.</p>
 *
 * <pre>{@code
 * @router.get("/users/{id}", exceptions=[NotFound, errors.Forbidden])
 * async def get_user(id: int): ...
 * }</pre>
 *
 * <p>yields method GET, path "/users/{id}" and declared names "NotFound"
 * and "errors.Forbidden".</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DeclarationExtractor {

    private static final String EXCEPTIONS_KEYWORD = "exceptions";

    /**
     * Extracts the route declaration of a function.
     *
     * @param function the function definition
     * @return the declaration, or empty if no decorator is a route
     */
    public Optional<RouteDeclaration> extract(final FunctionDef function) {
        Preconditions.requireNonNull(function, "Function is required");

        for (final Expression decorator : function.decorators()) {
            if (!(decorator instanceof Call call)) {
                continue;
            }
            final Optional<HttpMethod> method = HttpMethod.fromDecoratorName(
                    calleeName(call.func()));
            if (method.isPresent()) {
                return Optional.of(new RouteDeclaration(method.get(),
                        literalPath(call), declaredExceptions(call)));
            }
        }
        return Optional.empty();
    }

    private static String calleeName(final Expression func) {
        if (func instanceof Attribute attribute) {
            return attribute.attr();
        }
        if (func instanceof Name name) {
            return name.id();
        }
        return null;
    }

    private static String literalPath(final Call call) {
        if (!call.args().isEmpty()
                && call.args().get(0) instanceof Constant constant) {
            return constant.asText();
        }
        return null;
    }

    private static List<String> declaredExceptions(final Call call) {
        for (final Keyword keyword : call.keywords()) {
            if (EXCEPTIONS_KEYWORD.equals(keyword.arg())) {
                return exceptionNames(keyword.value());
            }
        }
        return List.of();
    }

    private static List<String> exceptionNames(final Expression value) {
        final List<String> names = new ArrayList<>();
        if (value instanceof ListDisplay list) {
            for (final Expression element : list.elements()) {
                ClassNames.render(element).ifPresent(names::add);
            }
        }
        return names;
    }

}
