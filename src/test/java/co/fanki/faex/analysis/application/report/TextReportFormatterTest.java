package co.fanki.faex.analysis.application.report;

import co.fanki.faex.analysis.domain.AnalysisResult;
import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TextReportFormatter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TextReportFormatterTest {

    private final TextReportFormatter formatter = new TextReportFormatter();

    @Test
    void whenFormatting_givenEndpointsWithIssues_shouldListThemWithSummary() {
        final String report = formatter.format(ReportFixtures.withIssues(),
                false);

        assertEquals(String.join("\n",
                "app/routes.py:20 - POST /orders/{id}/cancel (cancel_order)",
                "  Undeclared exceptions:",
                "    - Conflict (raised at line 23)",
                "    - Forbidden (raised in check_permission at"
                        + " app/services.py:5)",
                "",
                "app/routes.py:30 - purge",
                "  Undeclared exceptions:",
                "    - Gone (raised at line 31)",
                "",
                "",
                "Found 3 undeclared exceptions in 2 endpoints."), report);
    }

    @Test
    void whenFormatting_givenVerbose_shouldAlsoListDeclaredExceptions() {
        final String report = formatter.format(new AnalysisResult(
                List.of(ReportFixtures.dirty()), List.of()), true);

        assertTrue(report.contains("  Declared exceptions:\n"
                + "    - Unauthorized"));
        assertTrue(report.endsWith(
                "Found 2 undeclared exceptions in 1 endpoint."));
    }

    @Test
    void whenFormatting_givenSingleUndeclared_shouldUseSingular() {
        final String report = formatter.format(new AnalysisResult(
                List.of(ReportFixtures.pathless()), List.of()), false);

        assertTrue(report.endsWith(
                "Found 1 undeclared exception in 1 endpoint."));
    }

    @Test
    void whenFormatting_givenNoIssues_shouldSaySo() {
        assertEquals("No undeclared exceptions found.",
                formatter.format(ReportFixtures.withoutIssues(), false));
        assertEquals("Analyzed 1 endpoints.\nNo undeclared exceptions found.",
                formatter.format(ReportFixtures.withoutIssues(), true));
    }

    @Test
    void whenFormatting_givenAnsiTerminal_shouldColorAndSummarize() {
        final String report = new TextReportFormatter(Ansi.ON)
                .format(ReportFixtures.withIssues(), false);

        assertTrue(report.contains("\u001B["));
        assertEquals(String.join("\n",
                "app/routes.py:20 - POST /orders/{id}/cancel (cancel_order)",
                "  Undeclared exceptions:",
                "    • Conflict (raised at line 23)",
                "    • Forbidden (raised in check_permission at"
                        + " app/services.py:5)",
                "",
                "app/routes.py:30 - purge",
                "  Undeclared exceptions:",
                "    • Gone (raised at line 31)",
                "",
                "",
                "Summary: 3 undeclared exception(s) in 2 endpoint(s)"),
                ReportFixtures.stripAnsi(report));
    }

    @Test
    void whenFormatting_givenAnsiTerminalAndNoIssues_shouldShowCheckMark() {
        final String report = new TextReportFormatter(Ansi.ON)
                .format(ReportFixtures.withoutIssues(), false);

        assertEquals("✓ No undeclared exceptions found.",
                ReportFixtures.stripAnsi(report));
    }

    @Test
    void whenFormatting_givenAnsiOff_shouldEmitNoEscapes() {
        final String report = new TextReportFormatter(Ansi.OFF)
                .format(ReportFixtures.withIssues(), true);

        assertFalse(report.contains("\u001B["));
    }

    @Test
    void whenFormatting_givenNoEndpoints_shouldSaySo() {
        assertEquals("No FastAPI endpoints found.",
                formatter.format(ReportFixtures.empty(), true));
    }

}
