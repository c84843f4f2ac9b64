package co.fanki.faex.analysis.application;

import co.fanki.faex.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisOptions}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisOptionsTest {

    @Test
    void whenCreatingDefaults_shouldUseDepthThreeAndIgnoreNothing() {
        final AnalysisOptions options = AnalysisOptions.defaults();

        assertEquals(3, options.maxDepth());
        assertTrue(options.ignore().isEmpty());
    }

    @Test
    void whenCreating_givenNegativeDepth_shouldThrowInvalidDepth() {
        final DomainException e = assertThrows(DomainException.class,
                () -> new AnalysisOptions(-1, Set.of()));

        assertEquals("INVALID_DEPTH", e.getErrorCode());
    }

    @Test
    void whenOverriding_givenOnlyDepth_shouldKeepIgnoreSet() {
        final AnalysisOptions base = new AnalysisOptions(3,
                Set.of("HTTPException"));

        final AnalysisOptions merged = base.override(1, null);

        assertEquals(1, merged.maxDepth());
        assertEquals(Set.of("HTTPException"), merged.ignore());
    }

    @Test
    void whenOverriding_givenOnlyIgnore_shouldKeepDepth() {
        final AnalysisOptions merged = AnalysisOptions.defaults()
                .override(null, List.of("A", "B"));

        assertEquals(3, merged.maxDepth());
        assertEquals(Set.of("A", "B"), merged.ignore());
    }

}
