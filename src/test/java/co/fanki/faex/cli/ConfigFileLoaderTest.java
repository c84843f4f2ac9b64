package co.fanki.faex.cli;

import co.fanki.faex.analysis.application.AnalysisOptions;
import co.fanki.faex.shared.DomainException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link ConfigFileLoader}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ConfigFileLoaderTest {

    private final ConfigFileLoader loader = new ConfigFileLoader();

    @Test
    void whenLoading_givenPropertiesFile_shouldReadDepthAndIgnoreList(
            @TempDir final Path dir) throws IOException {
        final Path file = dir.resolve("faex.properties");
        Files.writeString(file, """
                faex.analysis.max-depth=5
                faex.analysis.ignore=HTTPException, ValidationError
                """);

        final AnalysisOptions options = loader.load(file,
                AnalysisOptions.defaults());

        assertEquals(5, options.maxDepth());
        assertEquals(Set.of("HTTPException", "ValidationError"),
                options.ignore());
    }

    @Test
    void whenLoading_givenYamlList_shouldReadIgnoreNames(
            @TempDir final Path dir) throws IOException {
        final Path file = dir.resolve("faex.yml");
        Files.writeString(file, """
                faex:
                  analysis:
                    ignore:
                      - HTTPException
                      - app.errors.Teapot
                """);

        final AnalysisOptions options = loader.load(file,
                new AnalysisOptions(2, Set.of()));

        assertEquals(2, options.maxDepth());
        assertEquals(Set.of("HTTPException", "app.errors.Teapot"),
                options.ignore());
    }

    @Test
    void whenLoading_givenFileWithoutKnownKeys_shouldKeepDefaults(
            @TempDir final Path dir) throws IOException {
        final Path file = dir.resolve("other.yaml");
        Files.writeString(file, "server:\n  port: 9000\n");
        final AnalysisOptions defaults = new AnalysisOptions(1,
                Set.of("A"));

        assertEquals(defaults, loader.load(file, defaults));
    }

    @Test
    void whenLoading_givenNonNumericDepth_shouldThrowInvalidConfig(
            @TempDir final Path dir) throws IOException {
        final Path file = dir.resolve("faex.properties");
        Files.writeString(file, "faex.analysis.max-depth=deep\n");

        final DomainException e = assertThrows(DomainException.class,
                () -> loader.load(file, AnalysisOptions.defaults()));

        assertEquals("INVALID_CONFIG", e.getErrorCode());
    }

    @Test
    void whenLoading_givenMissingFile_shouldThrowPathNotFound(
            @TempDir final Path dir) {
        final DomainException e = assertThrows(DomainException.class,
                () -> loader.load(dir.resolve("nope.yml"),
                        AnalysisOptions.defaults()));

        assertEquals("PATH_NOT_FOUND", e.getErrorCode());
    }

}
