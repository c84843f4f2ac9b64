package co.fanki.faex.analysis.application.report;

import co.fanki.faex.analysis.application.report.DeclarationSuggester.Format;
import co.fanki.faex.analysis.application.report.DeclarationSuggester.Suggestion;
import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.analysis.domain.EndpointRecord;
import co.fanki.faex.analysis.domain.ExceptionOccurrence;
import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DeclarationSuggester}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DeclarationSuggesterTest {

    private final DeclarationSuggester suggester = new DeclarationSuggester();

    @Test
    void whenSuggesting_givenEndpointsWithIssues_shouldSortTheUnion() {
        final List<Suggestion> suggestions = suggester.suggest(
                ReportFixtures.withIssues());

        assertEquals(2, suggestions.size());
        assertEquals(List.of("Conflict", "Forbidden", "Unauthorized"),
                suggestions.get(0).suggested());
        assertEquals(List.of("Conflict", "Forbidden"),
                suggestions.get(0).adding());
    }

    @Test
    void whenSuggesting_givenRepeatedUndeclaredClass_shouldAddItOnce() {
        final EndpointRecord endpoint = new EndpointRecord(
                ReportFixtures.ROUTES, 1, "f", "GET", "/", List.of(),
                List.of(new ExceptionOccurrence(ReportFixtures.ROUTES, 2, 4,
                                "X", null),
                        new ExceptionOccurrence(ReportFixtures.ROUTES, 3, 4,
                                "X", null)));

        final Suggestion suggestion = suggester.suggest(new AnalysisResult(
                List.of(endpoint), List.of())).get(0);

        assertEquals(List.of("X"), suggestion.adding());
    }

    @Test
    void whenRendering_givenTextFormat_shouldShowSuggestedAndAdding() {
        assertEquals(String.join("\n",
                "app/routes.py:20 - cancel_order",
                "  Suggested:",
                "    exceptions=[Conflict, Forbidden, Unauthorized]",
                "  Adding: Conflict, Forbidden",
                "",
                "app/routes.py:30 - purge",
                "  Suggested:",
                "    exceptions=[Gone]",
                "  Adding: Gone"),
                suggester.render(ReportFixtures.withIssues(), Format.TEXT));
    }

    @Test
    void whenRendering_givenDiffFormat_shouldShowOldAndNewDeclaration() {
        final String diff = suggester.render(new AnalysisResult(
                List.of(ReportFixtures.dirty()), List.of()), Format.DIFF);

        assertEquals(String.join("\n",
                "app/routes.py:20 - cancel_order",
                "  - exceptions=[Unauthorized]",
                "  + exceptions=[Conflict, Forbidden, Unauthorized]"), diff);
    }

    @Test
    void whenConvertingToMap_givenSuggestion_shouldUseTheWireKeys() {
        final Map<String, Object> map = suggester.suggest(
                ReportFixtures.withIssues()).get(0).toMap();

        assertEquals(List.of("file", "line", "function",
                "suggested_exceptions", "adding"), List.copyOf(map.keySet()));
        assertEquals("app/routes.py", map.get("file"));
        assertEquals(20, map.get("line"));
        assertEquals("cancel_order", map.get("function"));
        assertEquals(List.of("Conflict", "Forbidden", "Unauthorized"),
                map.get("suggested_exceptions"));
        assertEquals(List.of("Conflict", "Forbidden"), map.get("adding"));
    }

    @Test
    void whenRendering_givenAnsiTerminal_shouldColorButKeepTheLayout() {
        final String colored = new DeclarationSuggester(Ansi.ON).render(
                ReportFixtures.withIssues(), Format.DIFF);

        assertTrue(colored.contains("\u001B["));
        assertEquals(suggester.render(ReportFixtures.withIssues(),
                Format.DIFF), ReportFixtures.stripAnsi(colored));
    }

    @Test
    void whenRendering_givenNothingToAdd_shouldSaySo() {
        assertEquals("All exceptions are properly declared.",
                suggester.render(ReportFixtures.withoutIssues(),
                        Format.DIFF));
    }

}
