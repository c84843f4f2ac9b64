package co.fanki.faex.analysis.application.report;

import co.fanki.faex.shared.Preconditions;
import picocli.CommandLine.Help.Ansi;

/**
 * Applies terminal styles to report fragments.
 *
 * <p>Styles use the picocli markup names, e.g. {@code "bold,red"}. When the
 * ANSI mode is disabled fragments are returned untouched, so reports
 * written to files, REST or MCP clients stay plain text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class Highlighter {

    private final Ansi ansi;

    /**
     * Creates a highlighter.
     *
     * @param theAnsi the ANSI mode, usually the one of the command line
     */
    Highlighter(final Ansi theAnsi) {
        this.ansi = Preconditions.requireNonNull(theAnsi,
                "Ansi mode is required");
    }

    /**
     * Whether styles are emitted.
     *
     * @return true when writing to a terminal that supports them
     */
    boolean enabled() {
        return ansi.enabled();
    }

    /**
     * Styles a fragment.
     *
     * @param styles comma separated picocli style names
     * @param text the fragment
     * @return the styled fragment, or the fragment itself when disabled
     */
    String paint(final String styles, final String text) {
        if (!ansi.enabled() || text.isEmpty()) {
            return text;
        }
        return ansi.string("@|" + styles + " " + text + "|@");
    }

}
