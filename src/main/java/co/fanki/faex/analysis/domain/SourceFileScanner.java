package co.fanki.faex.analysis.domain;

import co.fanki.faex.shared.Preconditions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers the Python files to analyze under a path.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceFileScanner {

    private static final String PYTHON_EXTENSION = ".py";

    /**
     * Lists the files to analyze.
     *
     * <p>A regular file is returned on its own whatever its extension. A
     * directory is walked recursively for {@code *.py} files, returned
     * sorted by path so that runs are reproducible.</p>
     *
     * @param root an existing file or directory
     * @return the files to analyze
     * @throws IOException if the directory cannot be walked
     */
    public List<Path> scan(final Path root) throws IOException {
        Preconditions.requireNonNull(root, "Root path is required");

        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        if (!Files.isDirectory(root)) {
            return List.of();
        }

        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString()
                            .endsWith(PYTHON_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

}
