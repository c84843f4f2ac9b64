package co.fanki.faex.analysis.domain;

import co.fanki.faex.analysis.domain.python.PythonAst;
import co.fanki.faex.analysis.domain.python.PythonAst.Call;
import co.fanki.faex.analysis.domain.python.PythonAst.Expression;
import co.fanki.faex.analysis.domain.python.PythonAst.FunctionDef;
import co.fanki.faex.analysis.domain.python.PythonAst.Raise;
import co.fanki.faex.shared.Preconditions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the exceptions a function body raises directly.
 *
 * <p>The whole body is searched, including nested blocks, nested function
 * and class bodies and lambdas. {@code raise X()} and {@code raise X} both
 * report {@code X}; dotted references keep their qualifier. A bare
 * {@code raise} re-raises and reports nothing, as does a raise whose
 * operand is neither a call, a name nor an attribute chain.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ExceptionDetector {

    /**
     * Detects the direct raises of a function.
     *
     * @param file the file defining the function
     * @param function the function to search
     * @param enclosingFunction the name to attribute occurrences to, or null
     * @return one occurrence per raise, in source order
     */
    public List<ExceptionOccurrence> detect(final Path file,
            final FunctionDef function, final String enclosingFunction) {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(function, "Function is required");

        final List<ExceptionOccurrence> occurrences = new ArrayList<>();
        PythonAst.walkBody(function.body(), node -> {
            if (node instanceof Raise raise && !raise.isReRaise()) {
                raisedClass(raise.exception()).ifPresent(name ->
                        occurrences.add(new ExceptionOccurrence(file,
                                raise.line(), raise.column(), name,
                                enclosingFunction)));
            }
        });
        return occurrences;
    }

    private static Optional<String> raisedClass(final Expression exception) {
        if (exception instanceof Call call) {
            return ClassNames.render(call.func());
        }
        return ClassNames.render(exception);
    }

}
