package co.fanki.faex.analysis.application.report;

import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link EndpointListing}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class EndpointListingTest {

    private final EndpointListing listing = new EndpointListing();

    @Test
    void whenRendering_givenEndpoints_shouldMarkDeclaredAndUndeclared() {
        final String text = listing.render(ReportFixtures.withIssues(), false);

        assertTrue(text.startsWith(String.join("\n",
                "app/routes.py:10 - GET /orders/{id} (get_order)",
                "  Declared:",
                "    ✓ Unauthorized",
                "    ✓ OrderNotFound",
                "  Detected:",
                "    ✓ Unauthorized (line 12)",
                "")));
        assertTrue(text.contains(
                "    ✗ Forbidden (in check_permission at line 5)\n"));
        assertTrue(text.contains("app/routes.py:30 - purge\n"
                + "  Declared: (none)\n"));
        assertTrue(text.endsWith("\nTotal endpoints: 3"));
    }

    @Test
    void whenRendering_givenVerbose_shouldShowColumnsAndUnused() {
        final String text = listing.render(ReportFixtures.withIssues(), true);

        assertTrue(text.contains("    ✓ Unauthorized (line 12, column 8)"));
        assertTrue(text.contains("  Unused declarations: OrderNotFound"));
    }

    @Test
    void whenRendering_givenAnsiTerminal_shouldColorButKeepTheLayout() {
        final String colored = new EndpointListing(Ansi.ON)
                .render(ReportFixtures.withIssues(), false);

        assertTrue(colored.contains("\u001B["));
        assertEquals(listing.render(ReportFixtures.withIssues(), false),
                ReportFixtures.stripAnsi(colored));
    }

    @Test
    void whenRendering_givenNoEndpoints_shouldSaySo() {
        assertEquals("No FastAPI endpoints found.",
                listing.render(ReportFixtures.empty(), false));
    }

}
