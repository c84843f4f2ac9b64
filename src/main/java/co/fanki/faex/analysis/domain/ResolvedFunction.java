package co.fanki.faex.analysis.domain;

import co.fanki.faex.analysis.domain.python.PythonAst.FunctionDef;

import java.nio.file.Path;

/**
 * A function definition together with the file that defines it.
 *
 * @param file the defining file
 * @param function the parsed definition
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ResolvedFunction(Path file, FunctionDef function) {
}
