package net.seitter.sqlshell.completion;

import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/**
 * Turns matched suggestions into highlighted completions.
 */
public class CompletionRenderer {
    private static final AttributedStyle MATCH_STYLE =
            AttributedStyle.BOLD.foreground(AttributedStyle.RED);

    /**
     * Renders a suggestion whose label matched the typed word.
     *
     * @param suggestion The matched suggestion
     * @param wordLength The length of the typed word
     * @return The rendered completion
     */
    public RenderedCompletion render(Suggestion suggestion, int wordLength) {
        String label = suggestion.getLabel();
        return new RenderedCompletion(label, -wordLength, highlight(label, wordLength),
                suggestion.getDisplayMeta(), suggestion.getKind());
    }

    /**
     * Highlights the first {@code matchLength} characters of a label.
     * Control characters are written in caret notation so that they cannot be
     * interpreted by the terminal.
     *
     * @param label The label to display
     * @param matchLength The number of leading characters to emphasize
     * @return The highlighted label
     */
    public static AttributedString highlight(String label, int matchLength) {
        int split = Math.min(Math.max(matchLength, 0), label.length());

        AttributedStringBuilder builder = new AttributedStringBuilder();
        builder.style(MATCH_STYLE);
        builder.append(escape(label.substring(0, split)));
        builder.style(AttributedStyle.DEFAULT);
        builder.append(escape(label.substring(split)));
        return builder.toAttributedString();
    }

    static String escape(String text) {
        StringBuilder escaped = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isISOControl(c)) {
                if (escaped != null) {
                    escaped.append(c);
                }
                continue;
            }
            if (escaped == null) {
                escaped = new StringBuilder(text.length() + 8).append(text, 0, i);
            }
            if (c < 0x20 || c == 0x7F) {
                escaped.append('^').append((char) (c ^ 0x40));
            } else {
                escaped.append(String.format("\\u%04X", (int) c));
            }
        }
        return escaped == null ? text : escaped.toString();
    }
}
