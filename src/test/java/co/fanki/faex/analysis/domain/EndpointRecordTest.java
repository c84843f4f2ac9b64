package co.fanki.faex.analysis.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link EndpointRecord}, {@link ExceptionOccurrence} and
 * {@link AnalysisResult}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class EndpointRecordTest {

    private static final Path FILE = Path.of("app/routes.py");

    @Test
    void whenDeriving_givenDeclaredAAndRaisedB_shouldReportBUndeclaredAUnused() {
        final EndpointRecord endpoint = endpoint(List.of("A"),
                List.of(occurrence("B", null)));

        assertEquals(List.of("B"), endpoint.undeclared().stream()
                .map(ExceptionOccurrence::exceptionClass).toList());
        assertEquals(List.of("A"), endpoint.unused());
        assertTrue(endpoint.hasIssues());
    }

    @Test
    void whenDeriving_givenEverythingDeclared_shouldHaveNoIssues() {
        final EndpointRecord endpoint = endpoint(List.of("A", "B", "C"),
                List.of(occurrence("B", "load"), occurrence("A", null)));

        assertTrue(endpoint.undeclared().isEmpty());
        assertEquals(List.of("C"), endpoint.unused());
        assertFalse(endpoint.hasIssues());
        assertTrue(endpoint.declares("A"));
        assertFalse(endpoint.declares("D"));
    }

    @Test
    void whenDeriving_givenRepeatedUndeclaredClass_shouldKeepEveryOccurrence() {
        final EndpointRecord endpoint = endpoint(List.of(),
                List.of(occurrence("X", null), occurrence("X", "helper")));

        assertEquals(2, endpoint.undeclared().size());
    }

    @Test
    void whenCreating_givenBlankFunctionName_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new EndpointRecord(FILE, 1, " ", "GET", null,
                        List.of(), List.of()));
    }

    @Test
    void whenAttributing_givenUnattributedOccurrence_shouldReturnCopy() {
        final ExceptionOccurrence direct = occurrence("A", null);

        final ExceptionOccurrence attributed = direct.attributedTo("check");

        assertEquals("check", attributed.inFunction());
        assertTrue(direct.isDirect());
        assertFalse(attributed.isDirect());
    }

    @Test
    void whenAttributing_givenAttributedOccurrence_shouldKeepItsFunction() {
        final ExceptionOccurrence inner = occurrence("A", "inner");

        assertSame(inner, inner.attributedTo("outer"));
    }

    @Test
    void whenDescribing_givenDirectAndTransitiveOccurrences_shouldNameTheirOrigin() {
        assertEquals("(raised at line 7)",
                occurrence("A", null).origin());
        assertEquals("(raised in load at " + FILE + ":7)",
                occurrence("A", "load").origin());
    }

    @Test
    void whenSummarizing_givenMixedEndpoints_shouldCountUndeclared() {
        final EndpointRecord clean = endpoint(List.of("A"),
                List.of(occurrence("A", null)));
        final EndpointRecord dirty = endpoint(List.of(),
                List.of(occurrence("A", null), occurrence("B", "x")));

        final AnalysisResult result = new AnalysisResult(
                List.of(clean, dirty), List.of("Syntax error in x.py: boom"));

        assertTrue(result.hasIssues());
        assertEquals(2, result.totalUndeclared());
        assertEquals(List.of(dirty), result.endpointsWithIssues());
        assertFalse(new AnalysisResult(List.of(clean), null).hasIssues());
    }

    private static EndpointRecord endpoint(final List<String> declared,
            final List<ExceptionOccurrence> detected) {
        return new EndpointRecord(FILE, 3, "handler", "POST", "/items",
                declared, detected);
    }

    private static ExceptionOccurrence occurrence(final String name,
            final String inFunction) {
        return new ExceptionOccurrence(FILE, 7, 8, name, inFunction);
    }

}
