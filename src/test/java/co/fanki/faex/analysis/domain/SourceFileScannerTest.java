package co.fanki.faex.analysis.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link SourceFileScanner}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceFileScannerTest {

    private final SourceFileScanner scanner = new SourceFileScanner();

    @Test
    void whenScanning_givenDirectory_shouldReturnPythonFilesSorted(
            @TempDir final Path root) throws IOException {
        final Path routers = Files.createDirectories(root.resolve("routers"));
        Files.writeString(routers.resolve("users.py"), "");
        Files.writeString(root.resolve("main.py"), "");
        Files.writeString(root.resolve("README.md"), "");
        Files.writeString(routers.resolve("auth.py"), "");

        final List<Path> files = scanner.scan(root);

        assertEquals(List.of(root.resolve("main.py"),
                routers.resolve("auth.py"), routers.resolve("users.py")),
                files);
    }

    @Test
    void whenScanning_givenSingleFile_shouldReturnItWhateverTheExtension(
            @TempDir final Path root) throws IOException {
        final Path file = Files.writeString(root.resolve("routes.txt"), "");

        assertEquals(List.of(file), scanner.scan(file));
    }

}
